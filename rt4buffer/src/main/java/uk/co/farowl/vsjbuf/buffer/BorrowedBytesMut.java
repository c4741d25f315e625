// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.buffer;

import java.util.Objects;
import java.util.concurrent.locks.Lock;

/**
 * Read-write access to the storage of a buffer provider, valid until
 * {@link #close()}. A provider that guards its storage with a lock
 * holds it exclusively for the life of a {@code BorrowedBytesMut}.
 */
public class BorrowedBytesMut extends BorrowedBytes {

    /**
     * Create a writable view on a slice of the given array, which the
     * caller has locked (if {@code lock} is not null).
     *
     * @param lock held by the caller and released on close, or null
     * @param storage of the provider
     * @param offset of the borrowed bytes in {@code storage}
     * @param length of the borrowed bytes
     */
    protected BorrowedBytesMut(Lock lock, byte[] storage, int offset,
            int length) {
        super(lock, storage, offset, length);
    }

    /**
     * Borrow the first {@code length} bytes of an array guarded by a
     * lock, which the caller has already acquired for writing. The lock
     * is released when the view is closed.
     *
     * @param lock acquired by the caller
     * @param storage to borrow
     * @param length of the part borrowed
     * @return a writable view of the array
     */
    public static BorrowedBytesMut locked(Lock lock, byte[] storage,
            int length) {
        return new BorrowedBytesMut(lock, storage, 0, length);
    }

    /**
     * Borrow an array for writing that needs no lock, because it is
     * private to the caller.
     *
     * @param storage to borrow
     * @return a writable view of the whole array
     */
    public static BorrowedBytesMut of(byte[] storage) {
        return new BorrowedBytesMut(null, storage, 0, storage.length);
    }

    /**
     * Set the byte at the given position from the low 8 bits of an
     * {@code int}.
     *
     * @param pos position in the view
     * @param v value to store
     */
    public void set(int pos, int v) {
        Objects.checkIndex(pos, length);
        storage[offset + pos] = (byte)v;
    }

    /**
     * Copy {@code n} bytes from an array into the view, starting at
     * the given position.
     *
     * @param pos position in the view of the first byte written
     * @param src array supplying the bytes
     * @param srcPos index in {@code src} of the first byte
     * @param n number of bytes to copy
     */
    public void copyFrom(int pos, byte[] src, int srcPos, int n) {
        Objects.checkFromIndexSize(pos, n, length);
        System.arraycopy(src, srcPos, storage, offset + pos, n);
    }

    @Override
    public BorrowedBytesMut narrow(int pos, int n) {
        Objects.checkFromIndexSize(pos, n, length);
        return new BorrowedBytesMut(handOver(), storage, offset + pos, n);
    }
}
