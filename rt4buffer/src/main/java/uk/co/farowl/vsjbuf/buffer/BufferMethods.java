// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.buffer;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The four operations through which a {@link PyBuffer} reaches its
 * provider. A provider class defines one {@code BufferMethods} as a
 * static constant and passes it to every {@code PyBuffer} it creates,
 * so the traversal and copying code in {@code PyBuffer} need know
 * nothing of the provider's Java class.
 * <p>
 * Each operation receives the {@code PyBuffer} making the call, from
 * which it may recover the provider with
 * {@link PyBuffer#objAs(Class)}.
 */
public final class BufferMethods {

    /** An export action that does nothing. */
    public static final Consumer<PyBuffer> NO_OP = buffer -> {};

    /** Borrow the provider's storage for reading. */
    final Function<PyBuffer, BorrowedBytes> objBytes;
    /** Borrow the provider's storage for writing. */
    final Function<PyBuffer, BorrowedBytesMut> objBytesMut;
    /** Account for the end of an export. */
    final Consumer<PyBuffer> release;
    /** Account for the start of an export. */
    final Consumer<PyBuffer> retain;

    /**
     * Create the table of buffer operations for a provider class.
     *
     * @param objBytes borrows storage for reading
     * @param objBytesMut borrows storage for writing
     * @param release called exactly once when an export ends
     * @param retain called exactly once when an export begins
     */
    public BufferMethods(Function<PyBuffer, BorrowedBytes> objBytes,
            Function<PyBuffer, BorrowedBytesMut> objBytesMut,
            Consumer<PyBuffer> release, Consumer<PyBuffer> retain) {
        this.objBytes = objBytes;
        this.objBytesMut = objBytesMut;
        this.release = release;
        this.retain = retain;
    }

    @Override
    public String toString() {
        return String.format(
                "BufferMethods(obj_bytes=%s, obj_bytes_mut=%s, "
                        + "release=%s, retain=%s)",
                id(objBytes), id(objBytesMut), id(release), id(retain));
    }

    private static String id(Object f) {
        return Integer.toHexString(System.identityHashCode(f));
    }
}
