// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.runtime;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.vsjbuf.buffer.BorrowedBytes;
import uk.co.farowl.vsjbuf.buffer.BorrowedBytesMut;
import uk.co.farowl.vsjbuf.buffer.BufferDescriptor;
import uk.co.farowl.vsjbuf.buffer.BufferMethods;
import uk.co.farowl.vsjbuf.buffer.BufferResizeGuard;
import uk.co.farowl.vsjbuf.buffer.PyBuffer;

/**
 * The Python {@code bytearray} object: a mutable, re-sizable sequence
 * of bytes. The storage is guarded by a read-write lock, so that any
 * number of threads may read it together through their exports, while
 * a write, or a change of length, excludes all others.
 * <p>
 * A {@code bytearray} counts its open exports, and every operation that
 * changes its length first obtains a {@link Resizable} permit through
 * {@link #tryResizable()}, which fails with a {@code BufferError} while
 * exports are open. Changing the value of an element does not change
 * the length and is always allowed.
 */
public class PyByteArray
        implements WithClass, BufferResizeGuard<PyByteArray.Resizable> {

    /** Logger for exports and re-sizing. */
    static final Logger logger =
            LoggerFactory.getLogger(PyByteArray.class);

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec( //
            new PyType.Spec("bytearray").buffer(PyByteArray::asBuffer));

    private static final byte[] EMPTY_BYTE_ARRAY = new byte[] {};

    /** Smallest allocation when the storage first grows. */
    private static final int MINSIZE = 16;

    /** Operations for {@code PyBuffer}s on a {@code PyByteArray}. */
    private static final BufferMethods METHODS = new BufferMethods( //
            buffer -> buffer.objAs(PyByteArray.class).borrow(),
            buffer -> buffer.objAs(PyByteArray.class).borrowMut(),
            buffer -> buffer.objAs(PyByteArray.class).release(),
            buffer -> buffer.objAs(PyByteArray.class).retain());

    /** The Python type of this instance. */
    private final PyType type;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /** The storage, of which {@link #size} bytes are in use. */
    private byte[] storage;

    /** Number of bytes in use. */
    private int size;

    /** Number of open exports. */
    private final AtomicInteger exports = new AtomicInteger();

    /**
     * As {@link #PyByteArray(byte[])} for Python sub-class specifying
     * {@link #type}.
     *
     * @param type sub-type for which this is being created
     * @param value initial content (copied)
     */
    protected PyByteArray(PyType type, byte[] value) {
        this.type = type;
        this.storage = value.length == 0 ? EMPTY_BYTE_ARRAY
                : Arrays.copyOf(value, value.length);
        this.size = value.length;
    }

    /**
     * Construct a {@code bytearray} holding a copy of the given bytes.
     *
     * @param value initial content
     */
    public PyByteArray(byte[] value) { this(TYPE, value); }

    /** Construct an empty {@code bytearray}. */
    public PyByteArray() { this(TYPE, EMPTY_BYTE_ARRAY); }

    /**
     * Construct a {@code bytearray} holding the content of any
     * bytes-like object, as in Python {@code bytearray(obj)}.
     *
     * @param obj bytes-like object
     * @return a {@code bytearray} with the same content
     * @throws PyBaseException ({@code TypeError}) if {@code obj} is not
     *     bytes-like
     */
    public static PyByteArray fromObject(Object obj)
            throws PyBaseException {
        try (PyBuffer buffer = PyBuffer.fromObject(obj)) {
            return new PyByteArray(buffer.toByteArray());
        }
    }

    @Override
    public PyType getType() { return type; }

    // Buffer protocol ------------------------------------------------

    /**
     * Export a writable view of the whole content. The
     * {@code bytearray} cannot change length until the export is
     * closed.
     *
     * @return the export
     */
    public PyBuffer getBuffer() {
        Lock r = lock.readLock();
        r.lock();
        try {
            return new PyBuffer(this, BufferDescriptor.simple(size, false),
                    METHODS);
        } finally {
            r.unlock();
        }
    }

    private static PyBuffer asBuffer(Object self) {
        return ((PyByteArray)self).getBuffer();
    }

    /** @return the number of open exports */
    public int getExports() { return exports.get(); }

    private void retain() {
        int n = exports.incrementAndGet();
        logger.atTrace().setMessage("retain bytearray@{}: {} exports")
                .addArgument(() -> Integer
                        .toHexString(System.identityHashCode(this)))
                .addArgument(n).log();
    }

    private void release() {
        int n = exports.decrementAndGet();
        logger.atTrace().setMessage("release bytearray@{}: {} exports")
                .addArgument(() -> Integer
                        .toHexString(System.identityHashCode(this)))
                .addArgument(n).log();
    }

    private BorrowedBytes borrow() {
        Lock r = lock.readLock();
        r.lock();
        return BorrowedBytes.locked(r, storage, size);
    }

    private BorrowedBytesMut borrowMut() {
        Lock w = lock.writeLock();
        w.lock();
        return BorrowedBytesMut.locked(w, storage, size);
    }

    @Override
    public Resizable tryResizableOpt() {
        /*
         * A thread borrowing through an export holds the read lock,
         * which it cannot upgrade. Refuse before waiting for the write
         * lock, then check again once it is held.
         */
        if (exports.get() == 0) {
            Lock w = lock.writeLock();
            w.lock();
            if (exports.get() == 0) { return new Resizable(w); }
            w.unlock();
        }
        logger.atDebug()
                .setMessage("bytearray@{} not re-sized: {} exports")
                .addArgument(() -> Integer
                        .toHexString(System.identityHashCode(this)))
                .addArgument(exports::get).log();
        return null;
    }

    /**
     * Permission to change the length of this {@code bytearray},
     * granted while it has no exports. The permit holds the write lock
     * on the storage until closed.
     */
    public final class Resizable implements AutoCloseable {

        private Lock held;

        private Resizable(Lock held) { this.held = held; }

        /**
         * Append bytes to the content.
         *
         * @param b source array
         * @param off index of first byte in {@code b}
         * @param n number of bytes to append
         */
        public void append(byte[] b, int off, int n) {
            ensure(n);
            System.arraycopy(b, off, storage, size, n);
            size += n;
        }

        /**
         * Set the length of the content, truncating it or extending it
         * with zeros.
         *
         * @param n new length
         */
        public void setLength(int n) {
            if (n > size) {
                ensure(n - size);
                Arrays.fill(storage, size, n, (byte)0);
            }
            size = n;
        }

        /** @return current length of the content */
        public int length() { return size; }

        private void ensure(int n) {
            int needed = size + n;
            if (needed < 0) {
                throw PyErr.format(PyExc.OverflowError,
                        "bytearray is too long");
            } else if (needed > storage.length) {
                int newSize = Math.max(storage.length * 2, MINSIZE);
                if (newSize < needed) { newSize = needed; }
                storage = Arrays.copyOf(storage, newSize);
            }
        }

        /** Give up the permit, releasing the write lock. */
        @Override
        public void close() {
            if (held != null) {
                held.unlock();
                held = null;
            }
        }
    }

    // Python API -----------------------------------------------------

    /** @return number of bytes */
    public int size() {
        Lock r = lock.readLock();
        r.lock();
        try {
            return size;
        } finally {
            r.unlock();
        }
    }

    /**
     * Return the byte at index {@code i} (which may be end-relative) as
     * an unsigned value.
     *
     * @param i index
     * @return the byte value
     * @throws PyBaseException ({@code IndexError}) if out of range
     */
    public int get(int i) throws PyBaseException {
        Lock r = lock.readLock();
        r.lock();
        try {
            int k = Abstract.adjustIndex(i, size);
            if (k < 0) { throw Abstract.indexOutOfRange("bytearray"); }
            return 0xff & storage[k];
        } finally {
            r.unlock();
        }
    }

    /**
     * Assign the byte at index {@code i} (which may be end-relative).
     * This does not change the length, and is allowed while there are
     * exports.
     *
     * @param i index
     * @param v new value in {@code range(256)}
     * @throws PyBaseException ({@code IndexError}) if out of range, or
     *     ({@code ValueError}) if {@code v} is not a byte
     */
    public void set(int i, int v) throws PyBaseException {
        checkByte(v);
        Lock w = lock.writeLock();
        w.lock();
        try {
            int k = Abstract.adjustIndex(i, size);
            if (k < 0) {
                throw Abstract.indexOutOfRange("bytearray assignment");
            }
            storage[k] = (byte)v;
        } finally {
            w.unlock();
        }
    }

    /**
     * Append one byte, as {@code bytearray.append}.
     *
     * @param v value in {@code range(256)}
     * @throws PyBaseException ({@code ValueError}) if {@code v} is not a
     *     byte, or ({@code BufferError}) if there are exports
     */
    public void append(int v) throws PyBaseException {
        checkByte(v);
        byte[] b = {(byte)v};
        try (Resizable r = tryResizable()) {
            r.append(b, 0, 1);
        }
    }

    /**
     * Append the content of any bytes-like object, as
     * {@code bytearray.extend}. The argument may be this
     * {@code bytearray} itself.
     *
     * @param obj bytes-like object
     * @throws PyBaseException ({@code TypeError}) if {@code obj} is not
     *     bytes-like, or ({@code BufferError}) if there are exports
     */
    public void extend(Object obj) throws PyBaseException {
        byte[] b;
        // Collect first: the export must end before we re-size.
        try (PyBuffer buffer = PyBuffer.fromObject(obj)) {
            b = buffer.toByteArray();
        }
        try (Resizable r = tryResizable()) {
            r.append(b, 0, b.length);
        }
    }

    /**
     * Remove and return the last byte, as {@code bytearray.pop}.
     *
     * @return the byte removed
     * @throws PyBaseException ({@code IndexError}) if empty, or
     *     ({@code BufferError}) if there are exports
     */
    public int pop() throws PyBaseException {
        try (Resizable r = tryResizable()) {
            int n = r.length();
            if (n == 0) {
                throw PyErr.format(PyExc.IndexError,
                        "pop from empty bytearray");
            }
            int v = 0xff & storage[n - 1];
            r.setLength(n - 1);
            return v;
        }
    }

    /**
     * Set the length, truncating or padding with zeros.
     *
     * @param n new length
     * @throws PyBaseException ({@code ValueError}) if {@code n<0}, or
     *     ({@code BufferError}) if there are exports
     */
    public void resize(int n) throws PyBaseException {
        if (n < 0) {
            throw PyErr.format(PyExc.ValueError,
                    "Can only resize to positive sizes, got %d", n);
        }
        try (Resizable r = tryResizable()) {
            r.setLength(n);
        }
    }

    /**
     * Remove all content, as {@code bytearray.clear}.
     *
     * @throws PyBaseException ({@code BufferError}) if there are
     *     exports
     */
    public void clear() throws PyBaseException { resize(0); }

    /** @return a copy of the content */
    public byte[] asByteArray() {
        Lock r = lock.readLock();
        r.lock();
        try {
            return Arrays.copyOf(storage, size);
        } finally {
            r.unlock();
        }
    }

    private static void checkByte(int v) {
        if (v < 0 || v > 255) {
            throw PyErr.format(PyExc.ValueError,
                    "byte must be in range(0, 256)");
        }
    }

    @Override
    public String toString() {
        Lock r = lock.readLock();
        r.lock();
        try {
            return PyBytes.repr("bytearray(b'", storage, size, "')");
        } finally {
            r.unlock();
        }
    }
}
