// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
/**
 * The generic buffer protocol. A provider object (such as a
 * {@code bytes} or {@code bytearray}) describes the layout of its
 * storage with a {@link BufferDescriptor}, and exports it as a
 * {@link PyBuffer}, which binds the descriptor to the provider and to
 * a table of {@link BufferMethods} for the provider's Java class.
 * Consumers read and write through the {@code PyBuffer} without
 * committing to a single memory layout: when the view is not
 * contiguous, the content is reached segment by segment in row-major
 * order.
 * <p>
 * A {@code PyBuffer} is an <i>export</i>. Providers that may change
 * length count their exports, and implement {@link BufferResizeGuard}
 * so that they refuse to re-size while any export is open.
 * <p>
 * Descriptor validation is active when Java assertions are enabled for
 * this package, or when the system property
 * {@value BufferDescriptor#CHECK_PROPERTY} is set to anything but
 * {@code false}.
 */
package uk.co.farowl.vsjbuf.buffer;
