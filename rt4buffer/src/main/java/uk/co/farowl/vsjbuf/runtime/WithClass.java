// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.runtime;

/**
 * An instance of a class implementing {@code WithClass} reports an
 * explicit Python type, generally exposed as a {@code __class__}
 * attribute. Java classes that are the crafted representations of
 * Python types implement this interface.
 */
public interface WithClass {
    /**
     * Return the actual Python type of the object.
     *
     * @return the actual type of the object
     */
    PyType getType();
}
