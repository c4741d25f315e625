// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.buffer;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.locks.Lock;

/**
 * Read access to the storage of a buffer provider, valid until
 * {@link #close()}. When the provider guards its storage with a lock,
 * the lock is held from the moment the provider creates the
 * {@code BorrowedBytes} until it is closed, so it should be used in a
 * {@code try}-with-resources construct:<pre>
 * try (BorrowedBytes b = buffer.objBytes()) {
 *     // Read b
 * }</pre>
 * Positions given to the methods are relative to {@link #offset()}
 * in the {@link #storage()} array, so that positions computed from a
 * {@link BufferDescriptor} may be used directly.
 */
public class BorrowedBytes implements AutoCloseable {

    /** The storage array of the provider. */
    protected final byte[] storage;
    /** Index in {@link #storage} of position zero. */
    protected final int offset;
    /** Number of bytes available from {@link #offset}. */
    protected final int length;
    /** Lock to release on close or {@code null}. */
    private Lock lock;

    /**
     * Create a view on a slice of the given array, which the caller
     * has locked (if {@code lock} is not null).
     *
     * @param lock held by the caller and released on close, or null
     * @param storage of the provider
     * @param offset of the borrowed bytes in {@code storage}
     * @param length of the borrowed bytes
     */
    protected BorrowedBytes(Lock lock, byte[] storage, int offset,
            int length) {
        Objects.checkFromIndexSize(offset, length, storage.length);
        this.lock = lock;
        this.storage = storage;
        this.offset = offset;
        this.length = length;
    }

    /**
     * Borrow an array needing no lock (because it is immutable or
     * private to the caller).
     *
     * @param storage to borrow
     * @return a view of the whole array
     */
    public static BorrowedBytes of(byte[] storage) {
        return new BorrowedBytes(null, storage, 0, storage.length);
    }

    /**
     * Borrow the first {@code length} bytes of an array guarded by a
     * lock, which the caller has already acquired. The lock is released
     * when the view is closed.
     *
     * @param lock acquired by the caller
     * @param storage to borrow
     * @param length of the part borrowed
     * @return a view of the array
     */
    public static BorrowedBytes locked(Lock lock, byte[] storage,
            int length) {
        return new BorrowedBytes(lock, storage, 0, length);
    }

    /** @return the storage array (not a copy) */
    public byte[] storage() { return storage; }

    /** @return index in {@link #storage()} of position zero */
    public int offset() { return offset; }

    /** @return number of bytes available */
    public int length() { return length; }

    /**
     * Return the byte at the given position, as an unsigned value.
     *
     * @param pos position in the view
     * @return the byte at {@code pos}
     */
    public int get(int pos) {
        Objects.checkIndex(pos, length);
        return 0xff & storage[offset + pos];
    }

    /**
     * Copy {@code n} bytes, starting at the given position, to an
     * array.
     *
     * @param pos position in the view of the first byte
     * @param dest array to receive the bytes
     * @param destPos index in {@code dest} of the first byte
     * @param n number of bytes to copy
     */
    public void copyTo(int pos, byte[] dest, int destPos, int n) {
        Objects.checkFromIndexSize(pos, n, length);
        System.arraycopy(storage, offset + pos, dest, destPos, n);
    }

    /** @return a copy of the bytes available */
    public byte[] toArray() {
        return Arrays.copyOfRange(storage, offset, offset + length);
    }

    /**
     * Create a view of part of this one. The lock (if any) passes to
     * the new view, and this view is closed without releasing it.
     *
     * @param pos position in this view where the new one starts
     * @param n length of the new view
     * @return the new view
     */
    public BorrowedBytes narrow(int pos, int n) {
        Objects.checkFromIndexSize(pos, n, length);
        return new BorrowedBytes(handOver(), storage, offset + pos, n);
    }

    /**
     * Pass the lock to a successor view, closing this one without
     * releasing it.
     *
     * @return the lock or {@code null}
     */
    protected final Lock handOver() {
        Lock l = lock;
        lock = null;
        return l;
    }

    /**
     * Release the lock on the provider's storage (if any). It is safe to
     * close a view more than once.
     */
    @Override
    public void close() {
        Lock l = handOver();
        if (l != null) { l.unlock(); }
    }

    @Override
    public String toString() {
        return String.format("%s[%d:%d]", getClass().getSimpleName(),
                offset, offset + length);
    }
}
