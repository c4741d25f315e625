// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.buffer;

import uk.co.farowl.vsjbuf.buffer.BufferDescriptor.Dim;
import uk.co.farowl.vsjbuf.support.InterpreterError;

/**
 * The traversal algorithms behind
 * {@link BufferDescriptor#forEachSegment(boolean, SegmentVisitor)} and
 * {@link BufferDescriptor#zipEq(BufferDescriptor, boolean, SegmentPairVisitor)}.
 * Each walks the dimensions recursively, outermost first, so segments
 * are always reported in row-major order.
 * <p>
 * How the inner dimensions are reported is decided once, before the
 * recursion begins, by the choice of {@link Mode}. In
 * {@link Mode#PER_ELEMENT} mode every item is a segment. In
 * {@link Mode#FUSED} mode, which requires the innermost dimension to be
 * contiguous, the recursion stops at the outermost dimension from which
 * the items lie end to end (the <i>fusion level</i>), and each block
 * below that level is one segment. A fully contiguous view is then a
 * single segment.
 */
final class SegmentTraversal {

    /** How the dimensions from the fusion level inwards are reported. */
    enum Mode {
        /** Each block from the fusion level inwards is one segment. */
        FUSED {

            @Override
            void block(Side s, int index, SegmentVisitor f) {
                int start = index + s.blockOffset;
                f.visit(start, start + s.blockLen);
            }

            @Override
            boolean blocks(Side a, int aIndex, Side b, int bIndex,
                    SegmentPairVisitor f) {
                int aStart = aIndex + a.blockOffset;
                int bStart = bIndex + b.blockOffset;
                return f.visit(aStart, aStart + a.blockLen, bStart,
                        bStart + b.blockLen);
            }
        },

        /** Each item is a segment. The fusion level is the last. */
        PER_ELEMENT {

            @Override
            void block(Side s, int index, SegmentVisitor f) {
                Dim d = s.last;
                for (int i = 0; i < d.shape(); i++) {
                    int pos = index + d.suboffset();
                    f.visit(pos, pos + s.itemsize);
                    index += d.stride();
                }
            }

            @Override
            boolean blocks(Side a, int aIndex, Side b, int bIndex,
                    SegmentPairVisitor f) {
                Dim da = a.last, db = b.last;
                for (int i = 0; i < da.shape(); i++) {
                    int aPos = aIndex + da.suboffset();
                    int bPos = bIndex + db.suboffset();
                    if (f.visit(aPos, aPos + a.itemsize, bPos,
                            bPos + b.itemsize)) {
                        return true;
                    }
                    aIndex += da.stride();
                    bIndex += db.stride();
                }
                return false;
            }
        };

        /**
         * Report the block of one view at the fusion level.
         *
         * @param s the view
         * @param index position reached by the outer dimensions
         * @param f to call with each segment
         */
        abstract void block(Side s, int index, SegmentVisitor f);

        /**
         * Report the blocks of two views at the fusion level together.
         *
         * @param a the first view
         * @param aIndex position reached in {@code a}
         * @param b the second view
         * @param bIndex position reached in {@code b}
         * @param f to call with each pair of segments
         * @return {@code true} if {@code f} asked to stop
         */
        abstract boolean blocks(Side a, int aIndex, Side b, int bIndex,
                SegmentPairVisitor f);
    }

    /**
     * One view prepared for traversal to a given fusion level. The
     * block offset and length are only meaningful in
     * {@link Mode#FUSED} mode.
     */
    private static final class Side {
        final Dim[] dims;
        final Dim last;
        final int itemsize;
        /** Sum of sub-offsets from the fusion level inwards. */
        final int blockOffset;
        /** Bytes in one block at the fusion level. */
        final int blockLen;

        Side(BufferDescriptor desc, int level) {
            this.dims = desc.getDims().toArray(new Dim[0]);
            this.last = dims[dims.length - 1];
            this.itemsize = desc.getItemsize();
            int offset = 0, n = itemsize;
            for (int k = level; k < dims.length; k++) {
                offset += dims[k].suboffset();
                n *= dims[k].shape();
            }
            this.blockOffset = offset;
            this.blockLen = n;
        }
    }

    private SegmentTraversal() {} // no instances

    /**
     * Implementation of
     * {@link BufferDescriptor#forEachSegment(boolean, SegmentVisitor)}.
     *
     * @param desc the view
     * @param tryContiguous whether to fuse items if possible
     * @param f to call with each segment
     */
    static void forEachSegment(BufferDescriptor desc,
            boolean tryContiguous, SegmentVisitor f) {
        int n = desc.getNdim();
        if (n == 0) {
            // A scalar is one item at the start of storage.
            f.visit(0, desc.getItemsize());
        } else if (!desc.isZeroInShape()) {
            if (tryContiguous && desc.isLastDimContiguous()) {
                int level = fusionLevel(desc);
                walk(Mode.FUSED, new Side(desc, level), level, 0, 0, f);
            } else {
                walk(Mode.PER_ELEMENT, new Side(desc, n - 1), n - 1, 0, 0,
                        f);
            }
        }
    }

    private static void walk(Mode mode, Side s, int level, int index,
            int dim, SegmentVisitor f) {
        if (dim == level) {
            mode.block(s, index, f);
        } else {
            Dim d = s.dims[dim];
            for (int i = 0; i < d.shape(); i++) {
                walk(mode, s, level, index + d.suboffset(), dim + 1, f);
                index += d.stride();
            }
        }
    }

    /**
     * Implementation of
     * {@link BufferDescriptor#zipEq(BufferDescriptor, boolean, SegmentPairVisitor)}.
     * Items are fused only when the innermost dimension is contiguous in
     * both views, and then only from the deeper of their two fusion
     * levels, so that the segments reported always correspond.
     *
     * @param a the first view
     * @param b the second view, of the same shape
     * @param tryContiguous whether to fuse items if possible
     * @param f to call with each pair of segments
     */
    static void zipEq(BufferDescriptor a, BufferDescriptor b,
            boolean tryContiguous, SegmentPairVisitor f) {
        if (BufferDescriptor.CHECKED && !a.sameShape(b)) {
            throw new InterpreterError("zipEq of %s with %s", a, b);
        }
        int n = a.getNdim();
        if (n == 0) {
            f.visit(0, a.getItemsize(), 0, b.getItemsize());
        } else if (!a.isZeroInShape()) {
            if (tryContiguous && a.isLastDimContiguous()
                    && b.isLastDimContiguous()) {
                int level = Math.max(fusionLevel(a), fusionLevel(b));
                walk2(Mode.FUSED, new Side(a, level), 0,
                        new Side(b, level), 0, level, 0, f);
            } else {
                walk2(Mode.PER_ELEMENT, new Side(a, n - 1), 0,
                        new Side(b, n - 1), 0, n - 1, 0, f);
            }
        }
    }

    private static boolean walk2(Mode mode, Side a, int aIndex, Side b,
            int bIndex, int level, int dim, SegmentPairVisitor f) {
        if (dim == level) {
            return mode.blocks(a, aIndex, b, bIndex, f);
        } else {
            Dim da = a.dims[dim], db = b.dims[dim];
            for (int i = 0; i < da.shape(); i++) {
                if (walk2(mode, a, aIndex + da.suboffset(), b,
                        bIndex + db.suboffset(), level, dim + 1, f)) {
                    return true;
                }
                aIndex += da.stride();
                bIndex += db.stride();
            }
            return false;
        }
    }

    /**
     * The outermost dimension from which the items of a view lie end to
     * end, given that the innermost dimension is contiguous.
     * Dimensions of extent one never prevent fusion.
     *
     * @param desc the view
     * @return index of the outermost fusible dimension
     */
    static int fusionLevel(BufferDescriptor desc) {
        int k = desc.getNdim() - 1;
        long sd = (long)desc.getItemsize() * desc.getDim(k).shape();
        while (k > 0) {
            Dim d = desc.getDim(k - 1);
            if (d.shape() > 1 && d.stride() != sd) { break; }
            sd *= d.shape();
            k -= 1;
        }
        return k;
    }
}
