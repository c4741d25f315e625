// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.buffer;

/**
 * Receives matching segments of two buffers of the same shape, in
 * row-major order, during
 * {@link BufferDescriptor#zipEq(BufferDescriptor, boolean, SegmentPairVisitor)}.
 */
@FunctionalInterface
public interface SegmentPairVisitor {

    /**
     * Visit the bytes {@code [aStart, aEnd)} of the first buffer and
     * the bytes {@code [bStart, bEnd)} at the same logical position in
     * the second. Returning {@code true} ends the traversal.
     *
     * @param aStart index of the first byte in the first buffer
     * @param aEnd index one beyond the last byte in the first buffer
     * @param bStart index of the first byte in the second buffer
     * @param bEnd index one beyond the last byte in the second buffer
     * @return {@code true} to stop, {@code false} to continue
     */
    boolean visit(int aStart, int aEnd, int bStart, int bEnd);
}
