// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.buffer;

/**
 * Receives the segments of a buffer, in row-major order, during
 * {@link BufferDescriptor#forEachSegment(boolean, SegmentVisitor)}.
 */
@FunctionalInterface
public interface SegmentVisitor {

    /**
     * Visit the bytes {@code [start, end)} of the provider's storage.
     *
     * @param start index of the first byte
     * @param end index one beyond the last byte
     */
    void visit(int start, int end);
}
