// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.buffer;

import uk.co.farowl.vsjbuf.runtime.PyBaseException;
import uk.co.farowl.vsjbuf.runtime.PyErr;
import uk.co.farowl.vsjbuf.runtime.PyExc;

/**
 * A capability of buffer providers whose storage may change length. A
 * change of length would invalidate every open export, so the provider
 * must obtain a <i>permit</i> before making one, and a permit is only
 * granted while the provider has no exports. The permit is
 * {@link AutoCloseable}, and the change should be made within the scope
 * of a {@code try}-with-resources construct:<pre>
 * try (Resizable r = obj.tryResizable()) {
 *     r.append(...);
 * }</pre>
 *
 * @param <R> type of the permit
 */
public interface BufferResizeGuard<R extends AutoCloseable> {

    /** Message of the error when exports prevent a re-size. */
    String CANNOT_RESIZE =
            "Existing exports of data: object cannot be re-sized";

    /**
     * Return a permit to change length if the provider has no exports
     * at this time, or {@code null} if it has.
     *
     * @return a permit or {@code null}
     */
    R tryResizableOpt();

    /**
     * Return a permit to change length if the provider has no exports
     * at this time, or throw a Python {@code BufferError}.
     *
     * @return a permit
     * @throws PyBaseException ({@code BufferError}) if there are
     *     exports
     */
    default R tryResizable() throws PyBaseException {
        R permit = tryResizableOpt();
        if (permit == null) {
            throw PyErr.format(PyExc.BufferError, CANNOT_RESIZE);
        }
        return permit;
    }
}
