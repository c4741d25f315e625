// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
/**
 * The Python objects of the buffer runtime: a reduced type object
 * ({@link PyType}) with the {@code as_buffer} slot, the exceptions the
 * protocol raises, and the built-in buffer providers and consumers
 * {@code bytes}, {@code bytearray} and {@code memoryview}.
 */
package uk.co.farowl.vsjbuf.runtime;
