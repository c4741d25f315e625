// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.runtime;

/**
 * Python type objects for exceptions. The built-in Python exception
 * types form a hierarchy, but are all represented in Java by
 * {@link PyBaseException}. When it becomes necessary to create (or
 * raise) an exception, code will usually refer to one of the type
 * objects here, as in
 * {@code PyErr.format(PyExc.TypeError, "...")}.
 */
// Compare CPython exceptions.c
/*
 * We choose the class name, and type object names somewhat against
 * convention, so that a reference to the type object looks like its
 * name in the CPython codebase. E.g. PyExc.TypeError looks like
 * PyExc_TypeError.
 */
public class PyExc {
    private PyExc() {}

    /** {@code BaseException} is the base type of all exceptions. */
    public static final PyType BaseException = PyBaseException.TYPE;
    /** Exception extends {@link #BaseException}. */
    public static final PyType Exception = PyBaseException.Exception;
    /** {@code TypeError} extends {@link #Exception}. */
    public static final PyType TypeError = PyBaseException.TypeError;
    /** {@code ValueError} extends {@link #Exception}. */
    public static final PyType ValueError = PyBaseException.ValueError;
    /** {@code LookupError} extends {@link #Exception}. */
    public static final PyType LookupError =
            PyBaseException.LookupError;
    /** {@code IndexError} extends {@link #LookupError}. */
    public static final PyType IndexError = PyBaseException.IndexError;
    /** {@code BufferError} extends {@link #Exception}. */
    public static final PyType BufferError =
            PyBaseException.BufferError;
    /** {@code ArithmeticError} extends {@link #Exception}. */
    public static final PyType ArithmeticError =
            PyBaseException.ArithmeticError;
    /** {@code OverflowError} extends {@link #ArithmeticError}. */
    public static final PyType OverflowError =
            PyBaseException.OverflowError;
}
