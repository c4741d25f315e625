// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.function.Executable;

/**
 * A base class for unit tests that defines some common convenience
 * functions for which the need recurs.
 */
public class UnitTestSupport {

    /**
     * Make an array of bytes from {@code int}s, treated as unsigned.
     *
     * @param v values of the bytes
     * @return the array
     */
    public static byte[] bytes(int... v) {
        byte[] b = new byte[v.length];
        for (int i = 0; i < v.length; i++) { b[i] = (byte)v[i]; }
        return b;
    }

    /**
     * Make an array of {@code n} bytes with values {@code 0..n-1}.
     *
     * @param n length of array
     * @return the array
     */
    public static byte[] range(int n) {
        byte[] b = new byte[n];
        for (int i = 0; i < n; i++) { b[i] = (byte)i; }
        return b;
    }

    /**
     * Assert that the executable throws a Python exception of the given
     * type (exactly), and return it for further checks.
     *
     * @param type expected Python type of the exception
     * @param action to execute
     * @return the exception thrown
     */
    public static PyBaseException assertRaises(PyType type,
            Executable action) {
        PyBaseException e = assertThrows(PyBaseException.class, action);
        assertEquals(type, e.getType(), () -> "raised " + e);
        return e;
    }

    /**
     * Assert that the executable throws a Python exception of the given
     * type (exactly) with the given message.
     *
     * @param type expected Python type of the exception
     * @param msg expected message
     * @param action to execute
     */
    public static void assertRaises(PyType type, String msg,
            Executable action) {
        PyBaseException e = assertRaises(type, action);
        assertEquals(msg, e.getMessage());
    }
}
