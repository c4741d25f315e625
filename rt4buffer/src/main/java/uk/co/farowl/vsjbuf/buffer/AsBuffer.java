// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.buffer;

import uk.co.farowl.vsjbuf.runtime.PyBaseException;

/**
 * The {@code as_buffer} slot of a Python type. A type that is able to
 * provide a buffer view of its instances registers an implementation
 * when it is created, and {@link PyBuffer#fromObject(Object)} finds it
 * by a search along the MRO of the object's type.
 */
@FunctionalInterface
public interface AsBuffer {

    /**
     * Export a buffer view of the given object, which is an instance of
     * the type (or a sub-type of the type) that registered this slot.
     *
     * @param obj to export
     * @return a new export of {@code obj}
     * @throws PyBaseException if the object cannot export now
     */
    PyBuffer getBuffer(Object obj) throws PyBaseException;
}
