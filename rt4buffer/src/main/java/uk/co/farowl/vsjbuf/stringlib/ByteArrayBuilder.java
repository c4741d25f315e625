// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.stringlib;

import java.util.Objects;

/**
 * An elastic buffer of byte values, somewhat like the
 * {@code java.lang.StringBuilder}, but for arrays of bytes. The client
 * appends data and may finally take the built array, often without
 * copying the data.
 * <p>
 * This is the growable destination into which
 * {@code PyBuffer.appendTo} writes the logical content of a buffer.
 */
public final class ByteArrayBuilder {

    /** Smallest allocation when the builder first grows. */
    static final int MINSIZE = 16;
    static final byte[] EMPTY_BYTE_ARRAY = new byte[0];
    private byte[] value;
    private int len = 0;

    /**
     * Create an empty buffer of a defined initial capacity.
     *
     * @param capacity initially
     */
    public ByteArrayBuilder(int capacity) {
        value = capacity == 0 ? EMPTY_BYTE_ARRAY : new byte[capacity];
    }

    /** Create an empty buffer of a default initial capacity. */
    public ByteArrayBuilder() {
        value = EMPTY_BYTE_ARRAY;
    }

    /**
     * Append one byte, given as the low 8 bits of an {@code int}.
     *
     * @param v the value
     * @return this builder
     */
    public ByteArrayBuilder append(int v) {
        ensure(1);
        value[len++] = (byte)v;
        return this;
    }

    /**
     * Append {@code n} bytes from an array, starting at {@code off}.
     *
     * @param b source array
     * @param off index of first byte in {@code b}
     * @param n number of bytes to append
     * @return this builder
     */
    public ByteArrayBuilder append(byte[] b, int off, int n) {
        Objects.checkFromIndexSize(off, n, b.length);
        ensure(n);
        System.arraycopy(b, off, value, len, n);
        len += n;
        return this;
    }

    /**
     * Append all the bytes of an array.
     *
     * @param b source array
     * @return this builder
     */
    public ByteArrayBuilder append(byte[] b) {
        return append(b, 0, b.length);
    }

    /**
     * The number of bytes appended since creation or the last
     * {@link #take()}.
     *
     * @return the length
     */
    public int length() { return len; }

    /**
     * Ensure there is room for another {@code n} elements.
     *
     * @param n to make space for
     */
    private void ensure(int n) {
        int needed = len + n;
        if (needed > value.length) {
            if (needed < 0) {
                throw new OutOfMemoryError("byte array too large");
            }
            int newSize = Math.max(value.length * 2, MINSIZE);
            if (newSize < needed) { newSize = needed; }
            byte[] newValue = new byte[newSize];
            System.arraycopy(value, 0, newValue, 0, len);
            value = newValue;
        }
    }

    /**
     * Return the accumulated bytes and reset the builder to empty.
     *
     * @return the content of the builder
     */
    public byte[] take() {
        byte[] v;
        if (len == value.length) {
            // The array is exactly filled: use it without copy.
            v = value;
            value = EMPTY_BYTE_ARRAY;
        } else {
            // The array is partly filled: copy it and re-use it.
            v = new byte[len];
            System.arraycopy(value, 0, v, 0, len);
        }
        len = 0;
        return v;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(len * 3 + 2).append('[');
        for (int i = 0; i < len; i++) {
            if (i > 0) { sb.append(", "); }
            sb.append(0xff & value[i]);
        }
        return sb.append(']').toString();
    }
}
