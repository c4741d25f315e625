// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.runtime;

import java.util.Arrays;

import uk.co.farowl.vsjbuf.buffer.BorrowedBytes;
import uk.co.farowl.vsjbuf.buffer.BufferDescriptor;
import uk.co.farowl.vsjbuf.buffer.BufferMethods;
import uk.co.farowl.vsjbuf.buffer.PyBuffer;
import uk.co.farowl.vsjbuf.stringlib.ByteArrayBuilder;
import uk.co.farowl.vsjbuf.support.InterpreterError;

/**
 * The Python {@code bytes} object. The content is immutable, so it
 * needs no lock, and exports need not be counted: every export is
 * read-only.
 */
public class PyBytes implements WithClass {

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec( //
            new PyType.Spec("bytes").buffer(PyBytes::asBuffer));

    private static final byte[] EMPTY_BYTE_ARRAY = new byte[] {};

    /** The empty {@code bytes}. */
    public static final PyBytes EMPTY = new PyBytes(EMPTY_BYTE_ARRAY);

    /** Operations for {@code PyBuffer}s on a {@code PyBytes}. */
    private static final BufferMethods METHODS = new BufferMethods( //
            buffer -> BorrowedBytes.of(buffer.objAs(PyBytes.class).value),
            buffer -> {
                throw new InterpreterError("bytes object is immutable");
            }, BufferMethods.NO_OP, BufferMethods.NO_OP);

    /** The Python type of this instance. */
    private final PyType type;

    /** The elements of the {@code bytes}. */
    final byte[] value;

    /**
     * Construct an instance of {@code PyBytes} or a sub-class, from a
     * given array of bytes, with the option to re-use that array as the
     * implementation. If the actual array is is re-used the caller must
     * give up ownership and never modify it after the call.
     *
     * @param type sub-type for which this is being created
     * @param iPromiseNotToModify if {@code true}, the array becomes the
     *     implementation array, otherwise the constructor takes a copy.
     * @param value the array of the bytes to contain
     */
    private PyBytes(PyType type, boolean iPromiseNotToModify,
            byte[] value) {
        this.type = type;
        if (value.length == 0)
            this.value = EMPTY_BYTE_ARRAY;
        else if (iPromiseNotToModify)
            this.value = value;
        else
            this.value = Arrays.copyOf(value, value.length);
    }

    /**
     * As {@link #PyBytes(byte[])} for Python sub-class specifying
     * {@link #type}.
     *
     * @param type sub-type for which this is being created
     * @param value of the bytes
     */
    protected PyBytes(PyType type, byte[] value) {
        this(type, false, value);
    }

    /**
     * Construct a Python {@code bytes} object from bytes treated as
     * unsigned.
     *
     * @param value of the bytes
     */
    public PyBytes(byte[] value) { this(TYPE, false, value); }

    /**
     * Construct a Python {@code bytes} object from Java {@code int}s
     * treated as unsigned.
     *
     * @param value of the bytes
     */
    public PyBytes(int... value) {
        this(TYPE, true, fromInts(value));
    }

    private static byte[] fromInts(int[] value) {
        byte[] b = new byte[value.length];
        for (int i = 0; i < value.length; i++) {
            b[i] = (byte)(value[i] & 0xff);
        }
        return b;
    }

    /**
     * Wrap an array that the caller gives up, without copying it.
     *
     * @param value the bytes (not to be modified after the call)
     * @return a {@code bytes} using {@code value} as its storage
     */
    static PyBytes wrap(byte[] value) {
        return new PyBytes(TYPE, true, value);
    }

    /**
     * Construct a {@code bytes} holding the content of any bytes-like
     * object, as in Python {@code bytes(obj)}.
     *
     * @param obj bytes-like object
     * @return a {@code bytes} with the same content
     * @throws PyBaseException ({@code TypeError}) if {@code obj} is not
     *     bytes-like
     */
    public static PyBytes fromObject(Object obj) throws PyBaseException {
        if (obj instanceof PyBytes && ((PyBytes)obj).type == TYPE) {
            return (PyBytes)obj;
        }
        try (PyBuffer buffer = PyBuffer.fromObject(obj)) {
            return wrap(buffer.toByteArray());
        }
    }

    /**
     * Concatenate the content of two bytes-like objects, as
     * {@code bytes.__add__} does when the left operand is a
     * {@code bytes}.
     *
     * @param v left operand
     * @param w right operand
     * @return a {@code bytes} holding {@code v} then {@code w}
     * @throws PyBaseException ({@code TypeError}) if either is not
     *     bytes-like
     */
    // Compare CPython bytes_concat in bytesobject.c
    public static PyBytes concat(Object v, Object w)
            throws PyBaseException {
        try (PyBuffer va = PyBuffer.fromObject(v);
                PyBuffer wb = PyBuffer.fromObject(w)) {
            int n = va.getDescriptor().getLen(),
                    m = wb.getDescriptor().getLen();
            if (n + m < 0) {
                throw PyErr.format(PyExc.OverflowError,
                        "concatenated bytes is too long");
            }
            ByteArrayBuilder b = new ByteArrayBuilder(n + m);
            va.appendTo(b);
            wb.appendTo(b);
            return wrap(b.take());
        }
    }

    /**
     * Export a read-only view of the whole content.
     *
     * @return the export
     */
    public PyBuffer getBuffer() {
        return new PyBuffer(this,
                BufferDescriptor.simple(value.length, true), METHODS);
    }

    private static PyBuffer asBuffer(Object self) {
        return ((PyBytes)self).getBuffer();
    }

    @Override
    public PyType getType() { return type; }

    /** @return number of bytes */
    public int size() { return value.length; }

    /**
     * Return the byte at index {@code i} (which may be end-relative) as
     * an unsigned value.
     *
     * @param i index
     * @return the byte value
     * @throws PyBaseException ({@code IndexError}) if out of range
     */
    public int get(int i) throws PyBaseException {
        int k = Abstract.adjustIndex(i, value.length);
        if (k < 0) { throw Abstract.indexOutOfRange("bytes"); }
        return 0xff & value[k];
    }

    /** @return a copy of the content */
    public byte[] asByteArray() {
        return Arrays.copyOf(value, value.length);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof PyBytes) {
            return Arrays.equals(value, ((PyBytes)obj).value);
        } else if (obj instanceof PyMemoryView) {
            return obj.equals(this);
        }
        return false;
    }

    @Override
    public int hashCode() { return Arrays.hashCode(value); }

    @Override
    public String toString() { return repr("b'", value, value.length, "'"); }

    /**
     * Produce a representation of bytes in the style of Python
     * {@code bytes.__repr__}.
     *
     * @param prefix to the quoted content
     * @param v the bytes
     * @param n number of bytes to show
     * @param suffix to the quoted content
     * @return the representation
     */
    static String repr(String prefix, byte[] v, int n, String suffix) {
        StringBuilder sb = new StringBuilder(prefix);
        for (int i = 0; i < n; i++) {
            int c = 0xff & v[i];
            switch (c) {
                case '\t':
                    sb.append("\\t");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\\':
                case '\'':
                    sb.append('\\').append((char)c);
                    break;
                default:
                    if (c < ' ' || c >= 0x7f) {
                        sb.append(String.format("\\x%02x", c));
                    } else {
                        sb.append((char)c);
                    }
            }
        }
        return sb.append(suffix).toString();
    }
}
