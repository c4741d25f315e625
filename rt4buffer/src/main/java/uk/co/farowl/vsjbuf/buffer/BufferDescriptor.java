// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.buffer;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import uk.co.farowl.vsjbuf.runtime.PyBaseException;
import uk.co.farowl.vsjbuf.runtime.PyErr;
import uk.co.farowl.vsjbuf.runtime.PyExc;
import uk.co.farowl.vsjbuf.support.InterpreterError;

/**
 * The layout of a buffer view: its length in bytes, whether it may be
 * written, the size and format of each item, and for each dimension
 * (outermost first) the extent, stride and sub-offset, as a
 * {@link Dim}. The byte at logical index {@code (i0, i1, ...)} is found
 * at <pre>
 * &Sigma; i<sub>k</sub> * stride<sub>k</sub> + suboffset<sub>k</sub>
 * </pre> in the storage of the provider (see
 * {@link #fastPosition(int...)}).
 * <p>
 * A {@code BufferDescriptor} is immutable. Transformations (a slice,
 * a change of shape) create a new descriptor. A provider creates the
 * descriptor when it exports a view, and {@link PyBuffer} checks it
 * with {@link #validate()}.
 * <p>
 * The format is an opaque label following the conventions of the
 * Python {@code struct} module (for example {@code "B"} for unsigned
 * byte). It is stored and forwarded, never interpreted here.
 */
// Compare CPython Py_buffer in object.h
public final class BufferDescriptor {

    /**
     * Name of the system property that forces descriptor validation on
     * when assertions are not enabled.
     */
    public static final String CHECK_PROPERTY =
            "uk.co.farowl.vsjbuf.checkDescriptors";

    /**
     * Whether {@link #validate()} checks the invariants. Descriptor
     * producers are trusted unless this is {@code true}.
     */
    static final boolean CHECKED =
            truthy(CHECK_PROPERTY) || assertionsEnabled();

    /** The format of an unsigned byte. */
    public static final String BYTE_FORMAT = "B";

    /** Extent, stride and sub-offset of one dimension. */
    public static record Dim(int shape, int stride, int suboffset) {}

    /** Total number of bytes covered: product(shape) * itemsize. */
    private final int len;
    private final boolean readonly;
    private final int itemsize;
    private final String format;
    /** One entry per dimension, outermost first. */
    private final Dim[] dims;

    /**
     * Construct a descriptor from its parts. It is not checked until
     * {@link #validate()} is called.
     *
     * @param len total length in bytes
     * @param readonly whether writing is forbidden
     * @param itemsize bytes per item
     * @param format of an item (struct module conventions)
     * @param dims dimensions, outermost first
     */
    public BufferDescriptor(int len, boolean readonly, int itemsize,
            String format, Dim... dims) {
        this.len = len;
        this.readonly = readonly;
        this.itemsize = itemsize;
        this.format = format;
        this.dims = dims.clone();
    }

    /**
     * Construct a descriptor from its parts, the dimensions given as a
     * list.
     *
     * @param len total length in bytes
     * @param readonly whether writing is forbidden
     * @param itemsize bytes per item
     * @param format of an item (struct module conventions)
     * @param dims dimensions, outermost first
     */
    public BufferDescriptor(int len, boolean readonly, int itemsize,
            String format, List<Dim> dims) {
        this(len, readonly, itemsize, format, dims.toArray(new Dim[0]));
    }

    /**
     * A one-dimensional descriptor of unsigned bytes.
     *
     * @param bytesLen length in bytes
     * @param readonly whether writing is forbidden
     * @return the descriptor
     */
    public static BufferDescriptor simple(int bytesLen,
            boolean readonly) {
        return new BufferDescriptor(bytesLen, readonly, 1, BYTE_FORMAT,
                new Dim(bytesLen, 1, 0));
    }

    /**
     * A one-dimensional descriptor of items of the given size and
     * format, packed end to end.
     *
     * @param bytesLen length in bytes
     * @param readonly whether writing is forbidden
     * @param itemsize bytes per item
     * @param format of an item (struct module conventions)
     * @return the descriptor
     */
    public static BufferDescriptor format(int bytesLen, boolean readonly,
            int itemsize, String format) {
        return new BufferDescriptor(bytesLen, readonly, itemsize, format,
                new Dim(bytesLen / itemsize, itemsize, 0));
    }

    /**
     * A descriptor of items packed end to end in row-major order, with
     * the given shape, starting at {@code offset} in the provider's
     * storage. The offset becomes the sub-offset of the outermost
     * dimension.
     *
     * @param readonly whether writing is forbidden
     * @param itemsize bytes per item
     * @param format of an item (struct module conventions)
     * @param shape extent of each dimension, outermost first
     * @param offset position of the first item
     * @return the descriptor
     */
    public static BufferDescriptor rowMajor(boolean readonly,
            int itemsize, String format, int[] shape, int offset) {
        int n = shape.length;
        Dim[] dims = new Dim[n];
        int len = itemsize, stride = itemsize;
        for (int k = n - 1; k >= 0; --k) {
            dims[k] = new Dim(shape[k], stride, k == 0 ? offset : 0);
            len *= shape[k];
            // A zero extent must not make an outer stride zero.
            stride *= Math.max(shape[k], 1);
        }
        return new BufferDescriptor(len, readonly, itemsize, format,
                dims);
    }

    /**
     * Check the invariants of the descriptor, if checking is enabled:
     * the item size is not zero, there is at least one dimension, no
     * stride is zero, no sub-offset is negative, and the product of the
     * shape and the item size is the length.
     *
     * @return {@code this}
     * @throws InterpreterError if an invariant does not hold
     */
    public BufferDescriptor validate() throws InterpreterError {
        if (CHECKED) {
            if (itemsize == 0) { throw malformed("itemsize is zero"); }
            if (dims.length == 0) { throw malformed("ndim is zero"); }
            long shapeProduct = 1;
            for (int k = 0; k < dims.length; k++) {
                Dim d = dims[k];
                shapeProduct *= d.shape;
                if (d.shape < 0) {
                    throw malformed("negative shape in dimension %d", k);
                } else if (d.stride == 0) {
                    throw malformed("zero stride in dimension %d", k);
                } else if (d.suboffset < 0) {
                    throw malformed("negative suboffset in dimension %d",
                            k);
                }
            }
            if (shapeProduct * itemsize != len) {
                throw malformed("product(shape) * itemsize = %d != len",
                        shapeProduct * itemsize);
            }
        }
        return this;
    }

    private InterpreterError malformed(String fmt, Object... args) {
        return new InterpreterError("malformed buffer descriptor %s: %s",
                this, String.format(fmt, args));
    }

    /** @return total length in bytes */
    public int getLen() { return len; }

    /** @return whether the view may not be written */
    public boolean isReadonly() { return readonly; }

    /** @return bytes per item */
    public int getItemsize() { return itemsize; }

    /** @return format of an item (struct module conventions) */
    public String getFormat() { return format; }

    /** @return number of dimensions */
    public int getNdim() { return dims.length; }

    /**
     * Return the description of dimension {@code k}.
     *
     * @param k index of dimension (0 is outermost)
     * @return the dimension
     */
    public Dim getDim(int k) { return dims[k]; }

    /** @return the dimensions, outermost first */
    public List<Dim> getDims() {
        return Collections.unmodifiableList(Arrays.asList(dims));
    }

    /** @return the extent of each dimension */
    public int[] getShape() {
        return Arrays.stream(dims).mapToInt(Dim::shape).toArray();
    }

    /** @return the stride of each dimension */
    public int[] getStrides() {
        return Arrays.stream(dims).mapToInt(Dim::stride).toArray();
    }

    /** @return the sub-offset of each dimension */
    public int[] getSuboffsets() {
        return Arrays.stream(dims).mapToInt(Dim::suboffset).toArray();
    }

    /**
     * Return a descriptor identical to this one except (perhaps) in
     * whether it may be written.
     *
     * @param readonly whether writing is forbidden
     * @return the descriptor
     */
    public BufferDescriptor withReadonly(boolean readonly) {
        if (readonly == this.readonly) { return this; }
        return new BufferDescriptor(len, readonly, itemsize, format,
                dims);
    }

    /**
     * Whether the items are laid out end to end in row-major order
     * (the last index varying fastest). Dimensions of extent one do not
     * count against contiguity, and an empty buffer is contiguous.
     * Column-major layouts are not recognised.
     *
     * @return whether the view is C-contiguous
     */
    public boolean isContiguous() {
        if (len == 0) { return true; }
        long sd = itemsize;
        for (int k = dims.length - 1; k >= 0; --k) {
            Dim d = dims[k];
            if (d.shape > 1 && d.stride != sd) { return false; }
            sd *= d.shape;
        }
        return true;
    }

    /**
     * Whether the innermost dimension has its items end to end, from
     * the start of each row. When this is so, a traversal may treat
     * each row as one segment.
     *
     * @return whether the last dimension is contiguous
     */
    boolean isLastDimContiguous() {
        Dim d = dims[dims.length - 1];
        return d.suboffset == 0 && d.stride == itemsize;
    }

    /** @return whether some dimension has extent zero */
    public boolean isZeroInShape() {
        for (Dim d : dims) { if (d.shape == 0) { return true; } }
        return false;
    }

    /**
     * Position in the provider's storage of the item at the given
     * indices, which the caller guarantees are in range. There must be
     * one index per dimension.
     *
     * @param indices one per dimension
     * @return byte position of the item
     */
    public int fastPosition(int... indices) {
        checkIndexCount(indices);
        int pos = 0;
        for (int k = 0; k < dims.length; k++) {
            Dim d = dims[k];
            pos += indices[k] * d.stride + d.suboffset;
        }
        return pos;
    }

    /**
     * Position in the provider's storage of the item at the given
     * indices. A negative index counts from the end of its dimension.
     * There must be one index per dimension.
     *
     * @param indices one per dimension
     * @return byte position of the item
     * @throws PyBaseException ({@code IndexError}) if an index is out
     *     of range after wrap-around
     */
    public int position(int... indices) throws PyBaseException {
        checkIndexCount(indices);
        int pos = 0;
        for (int k = 0; k < dims.length; k++) {
            Dim d = dims[k];
            int i = indices[k];
            if (i < 0) { i += d.shape; }
            if (i < 0 || i >= d.shape) {
                throw PyErr.format(PyExc.IndexError,
                        "index %d out of bounds on dimension %d",
                        indices[k], k + 1);
            }
            pos += i * d.stride + d.suboffset;
        }
        return pos;
    }

    private void checkIndexCount(int[] indices) {
        if (indices.length != dims.length) {
            throw new InterpreterError("%d indices given for %d dimensions",
                    indices.length, dims.length);
        }
    }

    /**
     * Enumerate the segments of the view in row-major order, calling
     * the visitor once for each. If {@code tryContiguous} and the
     * innermost dimension is contiguous, each row is one segment,
     * otherwise each item is a segment.
     *
     * @param tryContiguous whether to fuse items in a row if possible
     * @param visitor to call with each segment
     */
    public void forEachSegment(boolean tryContiguous,
            SegmentVisitor visitor) {
        SegmentTraversal.forEachSegment(this, tryContiguous, visitor);
    }

    /**
     * Traverse this view and another of the same shape together, in
     * row-major order, calling the visitor with the segments of each at
     * matching logical positions. The item size and strides of the two
     * may differ. The traversal ends early if the visitor returns
     * {@code true}.
     *
     * @param other view of the same shape as this one
     * @param tryContiguous whether to fuse items in a row if possible
     * @param visitor to call with each pair of segments
     */
    public void zipEq(BufferDescriptor other, boolean tryContiguous,
            SegmentPairVisitor visitor) {
        SegmentTraversal.zipEq(this, other, tryContiguous, visitor);
    }

    /**
     * Whether this descriptor and another have the same number of
     * dimensions and the same extent in each.
     *
     * @param other to compare
     * @return whether the shapes are the same
     */
    public boolean sameShape(BufferDescriptor other) {
        if (dims.length != other.dims.length) { return false; }
        for (int k = 0; k < dims.length; k++) {
            if (dims[k].shape != other.dims[k].shape) { return false; }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (obj instanceof BufferDescriptor) {
            BufferDescriptor o = (BufferDescriptor)obj;
            return len == o.len && readonly == o.readonly
                    && itemsize == o.itemsize
                    && format.equals(o.format)
                    && Arrays.equals(dims, o.dims);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * len + itemsize) + Arrays.hashCode(dims);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("BufferDescriptor(len=")
                .append(len).append(", readonly=").append(readonly)
                .append(", itemsize=").append(itemsize)
                .append(", format='").append(format).append("', dims=[");
        for (int k = 0; k < dims.length; k++) {
            Dim d = dims[k];
            if (k > 0) { sb.append(", "); }
            sb.append('(').append(d.shape).append(", ").append(d.stride)
                    .append(", ").append(d.suboffset).append(')');
        }
        return sb.append("])").toString();
    }

    /** Property is defined and nothing like "false". */
    private static boolean truthy(String property) {
        property = System.getProperty(property, "false").toLowerCase();
        return !"false".equals(property);
    }

    private static boolean assertionsEnabled() {
        return BufferDescriptor.class.desiredAssertionStatus();
    }
}
