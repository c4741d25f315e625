// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.buffer;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import uk.co.farowl.vsjbuf.runtime.Abstract;
import uk.co.farowl.vsjbuf.runtime.PyBaseException;
import uk.co.farowl.vsjbuf.runtime.PyType;
import uk.co.farowl.vsjbuf.stringlib.ByteArrayBuilder;
import uk.co.farowl.vsjbuf.support.InterpreterError;

/**
 * An export of the storage of a provider object, described by a
 * {@link BufferDescriptor}, and reached through the provider's
 * {@link BufferMethods}. Construction counts as one export of the
 * provider ({@code retain} is called) and {@link #close()} ends it
 * ({@code release} is called) exactly once. A {@code PyBuffer} should
 * therefore be used in a {@code try}-with-resources construct:<pre>
 * try (PyBuffer buffer = PyBuffer.fromObject(obj)) {
 *     buffer.appendTo(sink);
 * }</pre>
 * Any number of {@code PyBuffer}s may be open on one provider at once.
 * The provider object is held by (strong) reference, so it lives at
 * least as long as the export.
 * <p>
 * The contiguous fast paths and the segment-by-segment slow paths of
 * the copying methods produce the same bytes in the same (row-major)
 * order: only performance differs.
 */
// Compare CPython Py_buffer and PyBuffer_* in abstract.c
public final class PyBuffer implements AutoCloseable {

    /** The provider. */
    private final Object obj;
    /** Layout of the view. */
    private final BufferDescriptor desc;
    /** Operations for the provider's class. */
    private final BufferMethods methods;
    /** Set when the export has been released (or detached). */
    private final AtomicBoolean released = new AtomicBoolean();

    /**
     * Create an export of the given provider, validating the
     * descriptor, and account for it by calling {@code retain} on the
     * provider.
     *
     * @param obj the provider
     * @param desc layout of the view
     * @param methods operations for the provider's class
     */
    public PyBuffer(Object obj, BufferDescriptor desc,
            BufferMethods methods) {
        this(obj, desc.validate(), methods, false);
        methods.retain.accept(this);
    }

    /**
     * Create a {@code PyBuffer} that adopts an export already accounted
     * for (used in {@link Detached#reattach()}).
     */
    private PyBuffer(Object obj, BufferDescriptor desc,
            BufferMethods methods, boolean adopt) {
        this.obj = obj;
        this.desc = desc;
        this.methods = methods;
    }

    /**
     * Obtain a buffer view of any object whose Python type (or one of
     * its bases) provides one.
     *
     * @param obj to export
     * @return a new export of {@code obj}
     * @throws PyBaseException ({@code TypeError}) if {@code obj} is not
     *     bytes-like
     */
    // Compare CPython PyObject_GetBuffer in abstract.c
    public static PyBuffer fromObject(Object obj) throws PyBaseException {
        AsBuffer as = PyType.of(obj).lookupAsBuffer();
        if (as != null) { return as.getBuffer(obj); }
        throw Abstract.requiredTypeError("a bytes-like object", obj);
    }

    /**
     * Wrap an array in a new {@link VecBuffer} and export it read-only.
     * The array becomes the storage of the {@code VecBuffer}: the caller
     * must not modify it afterwards.
     *
     * @param bytes to export
     * @return a read-only export of {@code bytes}
     */
    public static PyBuffer fromByteVector(byte[] bytes) {
        return new VecBuffer(bytes).intoPyBuffer(true);
    }

    /**
     * Create another export of the same provider, with a different
     * layout (for example a slice of this one). The new export is
     * counted separately and must be closed separately.
     *
     * @param newDesc layout of the new view
     * @return the new export
     */
    public PyBuffer derive(BufferDescriptor newDesc) {
        return new PyBuffer(obj, newDesc, methods);
    }

    /** @return the provider */
    public Object getObj() { return obj; }

    /** @return the layout of the view */
    public BufferDescriptor getDescriptor() { return desc; }

    /**
     * Return the provider as an instance of its Java class.
     *
     * @param <T> Java class of the provider
     * @param klass Java class of the provider
     * @return the provider
     * @throws InterpreterError if the provider is not a {@code klass}
     */
    public <T> T objAs(Class<T> klass) throws InterpreterError {
        try {
            return klass.cast(obj);
        } catch (ClassCastException cce) {
            throw new InterpreterError(cce,
                    "buffer provider is %s not %s",
                    obj.getClass().getTypeName(), klass.getTypeName());
        }
    }

    /**
     * Borrow the whole storage of the provider for reading. Positions
     * computed from the descriptor are relative to the start of this.
     *
     * @return the storage, borrowed until closed
     */
    public BorrowedBytes objBytes() { return methods.objBytes.apply(this); }

    /**
     * Borrow the whole storage of the provider for writing. The caller
     * must first have checked that the view is not read-only.
     *
     * @return the storage, borrowed until closed
     */
    public BorrowedBytesMut objBytesMut() {
        return methods.objBytesMut.apply(this);
    }

    /**
     * If the view is contiguous, borrow exactly the bytes it covers for
     * reading, otherwise return {@code null}, and the caller should fall
     * back to a traversal by segments.
     *
     * @return the bytes of the view, borrowed until closed, or
     *     {@code null}
     */
    public BorrowedBytes asContiguous() {
        return desc.isContiguous() ? contiguousUnchecked() : null;
    }

    /**
     * If the view is writable and contiguous, borrow exactly the bytes
     * it covers for writing, otherwise return {@code null}.
     *
     * @return the bytes of the view, borrowed until closed, or
     *     {@code null}
     */
    public BorrowedBytesMut asContiguousMut() {
        return !desc.isReadonly() && desc.isContiguous()
                ? contiguousMutUnchecked() : null;
    }

    /**
     * Borrow the bytes the view covers for reading, without checking
     * that the view is contiguous. The caller guarantees that it is.
     *
     * @return the bytes of the view, borrowed until closed
     */
    public BorrowedBytes contiguousUnchecked() {
        BorrowedBytes all = objBytes();
        try {
            return all.narrow(contiguousStart(), desc.getLen());
        } finally {
            // No-op unless narrow failed to take over the lock.
            all.close();
        }
    }

    /**
     * Borrow the bytes the view covers for writing, without checking
     * that the view is writable and contiguous. The caller guarantees
     * that it is.
     *
     * @return the bytes of the view, borrowed until closed
     */
    public BorrowedBytesMut contiguousMutUnchecked() {
        BorrowedBytesMut all = objBytesMut();
        try {
            return all.narrow(contiguousStart(), desc.getLen());
        } finally {
            all.close();
        }
    }

    /** Position of the first byte of a contiguous view. */
    private int contiguousStart() {
        return desc.getLen() == 0 ? 0
                : desc.fastPosition(new int[desc.getNdim()]);
    }

    /**
     * Append the content of the view, in row-major order, to the sink.
     *
     * @param sink to receive the content
     */
    public void appendTo(ByteArrayBuilder sink) {
        try (BorrowedBytes bytes = asContiguous()) {
            if (bytes != null) {
                sink.append(bytes.storage(), bytes.offset(),
                        bytes.length());
                return;
            }
        }
        try (BorrowedBytes bytes = objBytes()) {
            byte[] storage = bytes.storage();
            int offset = bytes.offset();
            desc.forEachSegment(true, (start, end) -> sink
                    .append(storage, offset + start, end - start));
        }
    }

    /**
     * Apply a function to the content of the view, borrowed directly
     * if the view is contiguous, or collected into a temporary array if
     * it is not.
     *
     * @param <R> type of result
     * @param f to apply to the content
     * @return the result of {@code f}
     */
    public <R> R contiguousOrCollect(Function<BorrowedBytes, R> f) {
        try (BorrowedBytes bytes = asContiguous()) {
            if (bytes != null) { return f.apply(bytes); }
        }
        ByteArrayBuilder collected = new ByteArrayBuilder(desc.getLen());
        appendTo(collected);
        try (BorrowedBytes bytes = BorrowedBytes.of(collected.take())) {
            return f.apply(bytes);
        }
    }

    /** @return a new array holding the content of the view */
    public byte[] toByteArray() {
        return contiguousOrCollect(BorrowedBytes::toArray);
    }

    /**
     * Write the content of the view to a stream.
     *
     * @param out to receive the content
     * @throws IOException from {@code out}
     */
    public void writeTo(OutputStream out) throws IOException {
        try (BorrowedBytes bytes = asContiguous()) {
            if (bytes != null) {
                out.write(bytes.storage(), bytes.offset(), bytes.length());
                return;
            }
        }
        out.write(toByteArray());
    }

    /**
     * Compare the content of this view with another, item by item in
     * row-major order. The views are equal if they have the same shape
     * and format and equal content, whatever their strides.
     *
     * @param other to compare with this
     * @return whether the content is equal
     */
    public boolean contentEquals(PyBuffer other) {
        BufferDescriptor od = other.desc;
        if (!desc.sameShape(od) || desc.getItemsize() != od.getItemsize()
                || !desc.getFormat().equals(od.getFormat())) {
            return false;
        }
        try (BorrowedBytes a = objBytes(); BorrowedBytes b = other.objBytes()) {
            byte[] as = a.storage(), bs = b.storage();
            int ao = a.offset(), bo = b.offset();
            boolean[] mismatch = {false};
            desc.zipEq(od, true, (aStart, aEnd, bStart, bEnd) -> {
                mismatch[0] = !Arrays.equals(as, ao + aStart, ao + aEnd, bs,
                        bo + bStart, bo + bEnd);
                return mismatch[0];
            });
            return !mismatch[0];
        }
    }

    /** @return whether this export has been released or detached */
    public boolean isReleased() { return released.get(); }

    /**
     * End the export, calling {@code release} on the provider, unless
     * it has already been released or {@linkplain #detach() detached}.
     */
    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            methods.release.accept(this);
        }
    }

    /**
     * Take responsibility for ending this export away from this
     * {@code PyBuffer}, which is then closed without calling
     * {@code release}. The returned {@link Detached} holds the provider
     * and descriptor and must eventually be
     * {@linkplain Detached#release() released} or
     * {@linkplain Detached#reattach() re-attached}, exactly once.
     * <p>
     * This is for moving an export into another owner without counting
     * it twice. A {@code Detached} that is dropped without either call
     * leaves the provider's export count too high (so it can never be
     * re-sized), but does not endanger memory: the provider stays
     * reachable as long as anything refers to it.
     *
     * @return the detached export
     * @throws InterpreterError if this export is already released
     */
    public Detached detach() throws InterpreterError {
        if (!released.compareAndSet(false, true)) {
            throw new InterpreterError("detach of released buffer");
        }
        return new Detached(obj, desc, methods);
    }

    @Override
    public String toString() {
        return String.format("PyBuffer(%s of '%s'%s)", desc,
                PyType.of(obj).getName(),
                released.get() ? ", released" : "");
    }

    /**
     * An export held outside any {@link PyBuffer}, the result of
     * {@link PyBuffer#detach()}. Exactly one of {@link #release()} and
     * {@link #reattach()} must be called.
     */
    public static final class Detached {

        private final Object obj;
        private final BufferDescriptor desc;
        private final BufferMethods methods;
        private final AtomicBoolean done = new AtomicBoolean();

        private Detached(Object obj, BufferDescriptor desc,
                BufferMethods methods) {
            this.obj = obj;
            this.desc = desc;
            this.methods = methods;
        }

        /** @return the provider */
        public Object getObj() { return obj; }

        /** @return the layout of the view */
        public BufferDescriptor getDescriptor() { return desc; }

        /**
         * End the export, calling {@code release} on the provider.
         *
         * @throws InterpreterError if already released or re-attached
         */
        public void release() throws InterpreterError {
            claim();
            // The PyBuffer is only a carrier for the provider here.
            methods.release.accept(new PyBuffer(obj, desc, methods, true));
        }

        /**
         * Make the export a {@link PyBuffer} again, without a further
         * {@code retain}. The new {@code PyBuffer} is responsible for
         * ending the export.
         *
         * @return the export as a {@code PyBuffer}
         * @throws InterpreterError if already released or re-attached
         */
        public PyBuffer reattach() throws InterpreterError {
            claim();
            return new PyBuffer(obj, desc, methods, true);
        }

        private void claim() {
            if (!done.compareAndSet(false, true)) {
                throw new InterpreterError(
                        "detached buffer released twice");
            }
        }
    }
}
