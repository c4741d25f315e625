// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.runtime;

import java.util.Arrays;

import uk.co.farowl.vsjbuf.buffer.BorrowedBytes;
import uk.co.farowl.vsjbuf.buffer.BorrowedBytesMut;
import uk.co.farowl.vsjbuf.buffer.BufferDescriptor;
import uk.co.farowl.vsjbuf.buffer.BufferDescriptor.Dim;
import uk.co.farowl.vsjbuf.buffer.PyBuffer;

/**
 * The Python {@code memoryview} object: a Python-visible export of a
 * bytes-like object. A {@code memoryview} holds its export open from
 * creation until {@link #release()}, so that (for example) a
 * {@code bytearray} cannot change length while a {@code memoryview} of
 * it is in use.
 * <p>
 * Items are not interpreted beyond the unsigned byte format
 * {@code "B"}: an item of any other format is returned as a
 * {@code bytes} of its raw content.
 */
// Compare CPython memoryobject.c
public class PyMemoryView implements WithClass, AutoCloseable {

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec( //
            new PyType.Spec("memoryview").buffer(PyMemoryView::asBuffer));

    /** The export this view holds. */
    private final PyBuffer buffer;

    /**
     * Create a {@code memoryview} taking ownership of an export.
     *
     * @param buffer to hold
     */
    private PyMemoryView(PyBuffer buffer) { this.buffer = buffer; }

    /**
     * Create a {@code memoryview} of any bytes-like object, as in
     * Python {@code memoryview(obj)}.
     *
     * @param obj bytes-like object
     * @return a view of {@code obj}
     * @throws PyBaseException ({@code TypeError}) if {@code obj} is not
     *     bytes-like
     */
    public static PyMemoryView fromObject(Object obj)
            throws PyBaseException {
        return new PyMemoryView(PyBuffer.fromObject(obj));
    }

    /**
     * Create a {@code memoryview} that takes over an export already
     * made.
     *
     * @param buffer the export, which the view will release
     * @return a view of {@code obj}
     */
    public static PyMemoryView fromBuffer(PyBuffer buffer) {
        return new PyMemoryView(buffer);
    }

    private static PyBuffer asBuffer(Object self) {
        PyMemoryView mv = (PyMemoryView)self;
        return mv.buffer.derive(mv.desc());
    }

    @Override
    public PyType getType() { return TYPE; }

    // Attributes -----------------------------------------------------

    /** @return the object exported */
    public Object obj() { return checkReleased().getObj(); }

    /** @return number of dimensions */
    public int ndim() { return desc().getNdim(); }

    /** @return extent of each dimension */
    public int[] shape() { return desc().getShape(); }

    /** @return stride of each dimension */
    public int[] strides() { return desc().getStrides(); }

    /** @return sub-offset of each dimension */
    public int[] suboffsets() { return desc().getSuboffsets(); }

    /** @return bytes per item */
    public int itemsize() { return desc().getItemsize(); }

    /** @return format of an item (struct module conventions) */
    public String format() { return desc().getFormat(); }

    /** @return total bytes in the view */
    public int nbytes() { return desc().getLen(); }

    /** @return whether the view may not be written */
    public boolean readonly() { return desc().isReadonly(); }

    /** @return whether the view is C-contiguous */
    public boolean cContiguous() { return desc().isContiguous(); }

    /** @return whether the view has been released */
    public boolean isReleased() { return buffer.isReleased(); }

    // Item access ----------------------------------------------------

    /**
     * Return the item at the given indices, one per dimension, each
     * possibly end-relative.
     *
     * @param indices of the item
     * @return an {@code int} if the format is {@code "B"}, otherwise a
     *     {@code bytes} of the item's content
     * @throws PyBaseException ({@code IndexError}) if an index is out of
     *     range, or ({@code TypeError}) if the number of indices is
     *     wrong
     */
    public Object getItem(int... indices) throws PyBaseException {
        BufferDescriptor desc = desc();
        int pos = desc.position(checkIndexCount(desc, indices));
        int itemsize = desc.getItemsize();
        try (BorrowedBytes b = buffer.objBytes()) {
            if (isByteFormat(desc)) {
                return b.get(pos);
            } else {
                byte[] item = new byte[itemsize];
                b.copyTo(pos, item, 0, itemsize);
                return PyBytes.wrap(item);
            }
        }
    }

    /**
     * Assign the item at the given indices, one per dimension, each
     * possibly end-relative. Only format {@code "B"} is supported.
     *
     * @param value to assign in {@code range(256)}
     * @param indices of the item
     * @throws PyBaseException ({@code TypeError}) if the view is
     *     read-only or not of bytes, ({@code ValueError}) if the value
     *     is not a byte, or ({@code IndexError}) if an index is out of
     *     range
     */
    public void setItem(int value, int... indices) throws PyBaseException {
        BufferDescriptor desc = writableDesc();
        if (!isByteFormat(desc)) {
            throw PyErr.format(PyExc.TypeError,
                    "memoryview: unsupported format %s", desc.getFormat());
        } else if (value < 0 || value > 255) {
            throw PyErr.format(PyExc.ValueError,
                    "memoryview: invalid value for format '%s'",
                    desc.getFormat());
        }
        int pos = desc.position(checkIndexCount(desc, indices));
        try (BorrowedBytesMut b = buffer.objBytesMut()) {
            b.set(pos, value);
        }
    }

    // Derived views --------------------------------------------------

    /**
     * Return a view of a slice of the first dimension, with the
     * semantics of a Python slice {@code [start:stop:step]}. The new
     * view is a separate export of the same object.
     *
     * @param start of slice or {@code null}
     * @param stop of slice or {@code null}
     * @param step of slice or {@code null}
     * @return the new view
     * @throws PyBaseException ({@code ValueError}) if {@code step==0}
     */
    public PyMemoryView getSlice(Integer start, Integer stop,
            Integer step) throws PyBaseException {
        return new PyMemoryView(
                buffer.derive(sliceDesc(desc(), start, stop, step)));
    }

    /**
     * Assign the content of a bytes-like object to a slice of the first
     * dimension ({@code [start:stop:step]}). The source must have the
     * same shape and format as the slice, but may have any layout.
     *
     * @param start of slice or {@code null}
     * @param stop of slice or {@code null}
     * @param step of slice or {@code null}
     * @param value bytes-like source
     * @throws PyBaseException ({@code TypeError}) if the view is
     *     read-only or {@code value} not bytes-like, or
     *     ({@code ValueError}) if the structures differ
     */
    public void setSlice(Integer start, Integer stop, Integer step,
            Object value) throws PyBaseException {
        BufferDescriptor dest =
                sliceDesc(writableDesc(), start, stop, step);
        byte[] src;
        BufferDescriptor srcDesc;
        // Collect the source first: it may be our own object.
        try (PyBuffer vb = PyBuffer.fromObject(value)) {
            BufferDescriptor vd = vb.getDescriptor();
            if (!vd.sameShape(dest) || vd.getItemsize() != dest.getItemsize()
                    || !vd.getFormat().equals(dest.getFormat())) {
                throw PyErr.format(PyExc.ValueError,
                        "memoryview assignment: lvalue and rvalue "
                                + "have different structures");
            }
            src = vb.toByteArray();
            srcDesc = BufferDescriptor.rowMajor(true, vd.getItemsize(),
                    vd.getFormat(), vd.getShape(), 0);
        }
        try (BorrowedBytesMut b = buffer.objBytesMut()) {
            dest.zipEq(srcDesc, true, (dStart, dEnd, sStart, sEnd) -> {
                b.copyFrom(dStart, src, sStart, dEnd - dStart);
                return false;
            });
        }
    }

    /**
     * Return a view of the same bytes with a new shape, as
     * {@code memoryview.cast} does when the format is unchanged. This
     * view must be C-contiguous.
     *
     * @param shape of the new view
     * @return the new view
     * @throws PyBaseException ({@code TypeError}) if this view is not
     *     C-contiguous or the new shape has a different size
     */
    public PyMemoryView castShape(int... shape) throws PyBaseException {
        BufferDescriptor desc = desc();
        if (!desc.isContiguous()) {
            throw PyErr.format(PyExc.TypeError,
                    "memoryview: casts are restricted to C-contiguous views");
        } else if (shape.length == 0) {
            throw PyErr.format(PyExc.TypeError,
                    "memoryview: zero-dimensional casts are not supported");
        }
        long n = desc.getItemsize();
        for (int s : shape) { n *= s; }
        if (n != desc.getLen()) {
            throw PyErr.format(PyExc.TypeError,
                    "memoryview: product(shape) * itemsize != buffer size");
        }
        int offset = desc.getLen() == 0 ? 0
                : desc.fastPosition(new int[desc.getNdim()]);
        return new PyMemoryView(buffer.derive(
                BufferDescriptor.rowMajor(desc.isReadonly(),
                        desc.getItemsize(), desc.getFormat(), shape,
                        offset)));
    }

    /**
     * Return a read-only view of the same bytes.
     *
     * @return the new view
     */
    public PyMemoryView toReadonly() {
        return new PyMemoryView(buffer.derive(desc().withReadonly(true)));
    }

    // Conversion -----------------------------------------------------

    /** @return the content of the view in row-major order */
    public PyBytes tobytes() {
        checkReleased();
        return PyBytes.wrap(buffer.toByteArray());
    }

    /** Release the export, after which the view may not be used. */
    public void release() { buffer.close(); }

    @Override
    public void close() { release(); }

    /**
     * Equality by content with another {@code memoryview} or with a
     * {@code bytes}: the same shape and format, and equal items at each
     * index. {@link PyBytes#equals(Object)} defers to this method, so
     * the relation is symmetric. A {@code bytearray} is mutable and
     * compares by identity, so no view equals one. A released view is
     * only equal to itself.
     */
    @Override
    public boolean equals(Object other) {
        if (other == this) {
            return true;
        } else if (isReleased()
                || !(other instanceof PyMemoryView
                        || other instanceof PyBytes)
                || (other instanceof PyMemoryView
                        && ((PyMemoryView)other).isReleased())) {
            return false;
        }
        try (PyBuffer ob = PyBuffer.fromObject(other)) {
            return buffer.contentEquals(ob);
        }
    }

    /**
     * Hash of the content, equal to that of a {@code bytes} with the
     * same content. Only a read-only view may be hashed, and only while
     * the object it views does not change.
     *
     * @throws PyBaseException ({@code ValueError}) if the view is
     *     writable
     */
    @Override
    public int hashCode() throws PyBaseException {
        if (isReleased()) {
            return System.identityHashCode(this);
        } else if (!buffer.getDescriptor().isReadonly()) {
            throw PyErr.format(PyExc.ValueError,
                    "cannot hash writable memoryview object");
        }
        return Arrays.hashCode(buffer.toByteArray());
    }

    @Override
    public String toString() {
        String id = Integer.toHexString(System.identityHashCode(this));
        return isReleased() ? "<released memory at 0x" + id + ">"
                : "<memory at 0x" + id + ">";
    }

    // Plumbing -------------------------------------------------------

    private PyBuffer checkReleased() throws PyBaseException {
        if (buffer.isReleased()) {
            throw PyErr.format(PyExc.ValueError,
                    "operation forbidden on released memoryview object");
        }
        return buffer;
    }

    private BufferDescriptor desc() throws PyBaseException {
        return checkReleased().getDescriptor();
    }

    /** Descriptor, checked not read-only (the API boundary check). */
    private BufferDescriptor writableDesc() throws PyBaseException {
        BufferDescriptor desc = desc();
        if (desc.isReadonly()) {
            throw PyErr.format(PyExc.TypeError,
                    "cannot modify read-only memory");
        }
        return desc;
    }

    private static boolean isByteFormat(BufferDescriptor desc) {
        return desc.getItemsize() == 1
                && BufferDescriptor.BYTE_FORMAT.equals(desc.getFormat());
    }

    private static int[] checkIndexCount(BufferDescriptor desc,
            int[] indices) {
        if (indices.length != desc.getNdim()) {
            throw PyErr.format(PyExc.TypeError,
                    "memoryview: expected %d indices, got %d",
                    desc.getNdim(), indices.length);
        }
        return indices;
    }

    /**
     * Descriptor of the slice {@code [start:stop:step]} of the first
     * dimension of a view. The start of the slice is folded into the
     * sub-offset of that dimension.
     */
    private static BufferDescriptor sliceDesc(BufferDescriptor desc,
            Integer start, Integer stop, Integer step) {
        Dim d0 = desc.getDim(0);
        int[] s = sliceIndices(d0.shape(), start, stop, step);
        int first = s[0], st = s[2], count = s[3];
        Dim[] dims = desc.getDims().toArray(new Dim[0]);
        dims[0] = new Dim(count, d0.stride() * st,
                count == 0 ? d0.suboffset()
                        : d0.suboffset() + first * d0.stride());
        int rowBytes = desc.getItemsize();
        for (int k = 1; k < dims.length; k++) {
            rowBytes *= dims[k].shape();
        }
        return new BufferDescriptor(count * rowBytes, desc.isReadonly(),
                desc.getItemsize(), desc.getFormat(), dims);
    }

    /**
     * Compute {@code [start, stop, step, count]} of a slice of a
     * sequence of the given length, as Python
     * {@code slice.indices(length)} does, adding the count of items
     * selected.
     *
     * @param length of the sequence
     * @param start of slice or {@code null}
     * @param stop of slice or {@code null}
     * @param step of slice or {@code null}
     * @return {@code [start, stop, step, count]}
     */
    // Compare CPython PySlice_AdjustIndices in sliceobject.c
    static int[] sliceIndices(int length, Integer start, Integer stop,
            Integer step) {
        int st = step == null ? 1 : step;
        if (st == 0) {
            throw PyErr.format(PyExc.ValueError,
                    "slice step cannot be zero");
        }
        int lower = st < 0 ? -1 : 0;
        int upper = st < 0 ? length - 1 : length;
        int a = adjust(start, st < 0 ? upper : lower, length, lower, upper);
        int b = adjust(stop, st < 0 ? lower : upper, length, lower, upper);
        int count;
        if (st > 0) {
            count = b > a ? (b - a - 1) / st + 1 : 0;
        } else {
            count = a > b ? (a - b - 1) / (-st) + 1 : 0;
        }
        return new int[] {a, b, st, count};
    }

    private static int adjust(Integer i, int dflt, int length, int lower,
            int upper) {
        if (i == null) { return dflt; }
        int v = i;
        if (v < 0) {
            v += length;
            return v < lower ? lower : v;
        }
        return v > upper ? upper : v;
    }
}
