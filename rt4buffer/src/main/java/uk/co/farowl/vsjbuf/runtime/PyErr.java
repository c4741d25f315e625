// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.runtime;

/**
 * Convenience methods for creating and manipulating Python exceptions.
 */
// Compare CPython errors.c
public class PyErr {

    private PyErr() {} // no instances

    /**
     * Create a Python exception for the caller to throw, specifying the
     * type of exception, a format string and arguments to compose the
     * message (as in Java {@code String.format}, not quite as in the
     * CPython API). The first argument is usually one of the type
     * constants found in {@link PyExc}.
     *
     * @param excType exception type
     * @param formatStr format string (Java conventions)
     * @param vals to substitute in the format string
     * @return an exception to throw
     */
    // Compare CPython PyErr_Format in errors.c
    public static PyBaseException format(PyType excType,
            String formatStr, Object... vals) {
        String msg = vals.length == 0 ? formatStr
                : String.format(formatStr, vals);
        return new PyBaseException(excType, msg);
    }
}
