// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.buffer;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import uk.co.farowl.vsjbuf.runtime.PyType;
import uk.co.farowl.vsjbuf.runtime.WithClass;

/**
 * A minimal buffer provider: an array of bytes guarded by a mutual
 * exclusion lock. Each borrow of the storage holds the lock until the
 * borrowed view is closed. {@code VecBuffer} does not count its
 * exports (retain and release do nothing) and does not offer a resize
 * guard: the array is only ever replaced whole, by {@link #take()}.
 * <p>
 * The Python type {@code vec_buffer} has no {@code as_buffer} slot:
 * exports are created in Java by {@link #intoPyBuffer(boolean)} and
 * {@link #intoPyBufferWithDescriptor(BufferDescriptor)}.
 */
public final class VecBuffer implements WithClass {

    /** The type of Python object this class implements. */
    public static final PyType TYPE =
            PyType.fromSpec(new PyType.Spec("vec_buffer"));

    private static final byte[] EMPTY_BYTE_ARRAY = new byte[0];

    /** Operations for {@code PyBuffer}s on a {@code VecBuffer}. */
    static final BufferMethods METHODS = new BufferMethods( //
            buffer -> buffer.objAs(VecBuffer.class).borrow(), //
            buffer -> buffer.objAs(VecBuffer.class).borrowMut(), //
            BufferMethods.NO_OP, BufferMethods.NO_OP);

    private final Lock lock = new ReentrantLock();

    /** The storage (guarded by {@link #lock}). */
    private byte[] data;

    /**
     * Create a {@code VecBuffer} holding the given array. The array
     * becomes the storage of the {@code VecBuffer}: the caller must not
     * modify it afterwards.
     *
     * @param data the initial content
     */
    public VecBuffer(byte[] data) { this.data = data; }

    @Override
    public PyType getType() { return TYPE; }

    /**
     * Replace the content with an empty array and return the previous
     * content, without copying it.
     *
     * @return the previous content
     */
    public byte[] take() {
        lock.lock();
        try {
            byte[] v = data;
            data = EMPTY_BYTE_ARRAY;
            return v;
        } finally {
            lock.unlock();
        }
    }

    /** @return the current length of the content */
    public int length() {
        lock.lock();
        try {
            return data.length;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Export the whole content as unsigned bytes.
     *
     * @param readonly whether the export is read-only
     * @return the export
     */
    public PyBuffer intoPyBuffer(boolean readonly) {
        return new PyBuffer(this,
                BufferDescriptor.simple(length(), readonly), METHODS);
    }

    /**
     * Export the content with the given layout.
     *
     * @param desc layout of the view
     * @return the export
     */
    public PyBuffer intoPyBufferWithDescriptor(BufferDescriptor desc) {
        return new PyBuffer(this, desc, METHODS);
    }

    private BorrowedBytes borrow() {
        lock.lock();
        return BorrowedBytes.locked(lock, data, data.length);
    }

    private BorrowedBytesMut borrowMut() {
        lock.lock();
        return BorrowedBytesMut.locked(lock, data, data.length);
    }

    @Override
    public String toString() {
        return String.format("<vec_buffer of %d bytes>", length());
    }
}
