// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.runtime;

/**
 * The Python {@code BaseException} and the common Python exceptions
 * raised by the buffer runtime (for example {@code TypeError}) are
 * represented by instances of this Java class. The Python type of the
 * exception is represented as a field (see {@link #getType()}).
 * <p>
 * A Java {@code try-catch} construct intended to catch Python
 * exceptions should catch {@code PyBaseException}. If it is intended to
 * catch only specific kinds of Python exception it must examine the
 * type and re-throw the unwanted exceptions.
 */
// Compare CPython PyBaseExceptionObject in pyerrors.c
public class PyBaseException extends RuntimeException
        implements WithClass {
    private static final long serialVersionUID = 1L;

    /** The type object of Python {@code BaseException} exceptions. */
    public static final PyType TYPE =
            PyType.fromSpec(new PyType.Spec("BaseException"));

    /** Python type of the exception. */
    private final PyType type;

    /**
     * Constructor specifying Python type and the message.
     *
     * @param type Python type of the exception
     * @param msg the message (already formatted)
     */
    public PyBaseException(PyType type, String msg) {
        super(msg);
        this.type = type;
    }

    @Override
    public PyType getType() { return type; }

    @Override
    public String toString() {
        String msg = getMessage();
        return msg == null || msg.isEmpty() ? type.getName()
                : type.getName() + ": " + msg;
    }

    /*
     * Type objects for the exceptions the buffer runtime raises, all
     * represented in Java by PyBaseException.
     */

    /** {@code Exception} extends {@code BaseException}. */
    protected static final PyType Exception =
            extendsException(TYPE, "Exception");
    /** {@code TypeError} extends {@link #Exception}. */
    protected static final PyType TypeError =
            extendsException(Exception, "TypeError");
    /** {@code ValueError} extends {@link #Exception}. */
    protected static final PyType ValueError =
            extendsException(Exception, "ValueError");
    /** {@code LookupError} extends {@link #Exception}. */
    protected static final PyType LookupError =
            extendsException(Exception, "LookupError");
    /** {@code IndexError} extends {@link #LookupError}. */
    protected static final PyType IndexError =
            extendsException(LookupError, "IndexError");
    /** {@code BufferError} extends {@link #Exception}. */
    protected static final PyType BufferError =
            extendsException(Exception, "BufferError");
    /** {@code ArithmeticError} extends {@link #Exception}. */
    protected static final PyType ArithmeticError =
            extendsException(Exception, "ArithmeticError");
    /** {@code OverflowError} extends {@link #ArithmeticError}. */
    protected static final PyType OverflowError =
            extendsException(ArithmeticError, "OverflowError");

    private static PyType extendsException(PyType excBase,
            String excName) {
        return PyType.fromSpec(new PyType.Spec(excName).base(excBase));
    }
}
