// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.runtime;

/**
 * Helpers that compose the standard messages of errors raised when an
 * object is not of a kind an operation requires.
 */
// Compare CPython Objects/abstract.c
public class Abstract {

    private Abstract() {} // only static methods here

    private static final String IS_REQUIRED_NOT =
            "%.200s is required, not '%.100s'";

    /**
     * Create a {@code TypeError} with a message along the lines "T is
     * required, not X" involving any descriptive phrase T and the type
     * X of {@code o}, e.g. "<u>a bytes-like object</u> is required, not
     * '<u>str</u>'".
     *
     * @param t expected kind of thing
     * @param o actual object involved
     * @return exception to throw
     */
    public static PyBaseException requiredTypeError(String t,
            Object o) {
        return PyErr.format(PyExc.TypeError, IS_REQUIRED_NOT, t,
                PyType.of(o).getName());
    }

    /**
     * Create an {@code IndexError} with a message along the lines "N
     * index out of range", where N is usually a type name.
     *
     * @param name of type or thing indexed
     * @return exception to throw
     */
    public static PyBaseException indexOutOfRange(String name) {
        return PyErr.format(PyExc.IndexError, "%.50s index out of range",
                name);
    }

    /**
     * Check that an index {@code i} is in <i>[0,length)</i>. If the
     * original index is negative, treat it as end-relative by first
     * adding {@code length}.
     *
     * @param i to check is valid index
     * @param length of the sequence indexed
     * @return range-checked {@code i}, or -1 if out of range
     */
    public static int adjustIndex(int i, int length) {
        if (i < 0) {
            i += length;
            return i >= 0 ? i : -1;
        }
        return i < length ? i : -1;
    }
}
