// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.buffer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static uk.co.farowl.vsjbuf.runtime.UnitTestSupport.assertRaises;
import static uk.co.farowl.vsjbuf.runtime.UnitTestSupport.bytes;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import uk.co.farowl.vsjbuf.buffer.BufferDescriptor.Dim;
import uk.co.farowl.vsjbuf.runtime.PyExc;
import uk.co.farowl.vsjbuf.runtime.PyType;

/** Test the minimal provider {@link VecBuffer}. */
@DisplayName("A VecBuffer")
class VecBufferTest {

    @Test
    @DisplayName("gives up its array to take()")
    void take() {
        byte[] data = bytes(1, 2, 3);
        VecBuffer v = new VecBuffer(data);
        assertEquals(3, v.length());
        assertSame(data, v.take());
        assertEquals(0, v.length());
        assertEquals(0, v.take().length);
    }

    @Test
    @DisplayName("exports items of any size")
    void wideItems() {
        VecBuffer v = new VecBuffer(bytes(1, 0, 0, 0, 2, 0, 0, 0));
        BufferDescriptor d = BufferDescriptor.format(8, true, 4, "i");
        try (PyBuffer b = v.intoPyBufferWithDescriptor(d)) {
            assertEquals(2, b.getDescriptor().getShape()[0]);
            assertEquals(4, b.getDescriptor().position(-1));
            assertArrayEquals(bytes(1, 0, 0, 0, 2, 0, 0, 0),
                    b.toByteArray());
        }
    }

    @Test
    @DisplayName("exports a reversed view")
    void reversed() {
        VecBuffer v = new VecBuffer(bytes(1, 2, 3, 4));
        BufferDescriptor d =
                new BufferDescriptor(4, true, 1, "B", new Dim(4, -1, 3));
        try (PyBuffer b = v.intoPyBufferWithDescriptor(d)) {
            assertArrayEquals(bytes(4, 3, 2, 1), b.toByteArray());
        }
    }

    @Test
    @DisplayName("is not bytes-like to PyBuffer.fromObject()")
    void notBytesLike() {
        VecBuffer v = new VecBuffer(bytes(1));
        assertEquals("vec_buffer", v.getType().getName());
        assertEquals(v.getType(), PyType.of(v));
        assertRaises(PyExc.TypeError,
                "a bytes-like object is required, not 'vec_buffer'",
                () -> PyBuffer.fromObject(v));
    }

    @Test
    @DisplayName("excludes other threads while storage is borrowed")
    void exclusive() throws InterruptedException {
        VecBuffer v = new VecBuffer(bytes(1, 2, 3));
        CountDownLatch done = new CountDownLatch(1);
        Thread other = new Thread(() -> {
            v.length();
            done.countDown();
        });
        try (PyBuffer b = v.intoPyBuffer(true)) {
            BorrowedBytes bytes = b.objBytes();
            other.start();
            assertFalse(done.await(100, TimeUnit.MILLISECONDS));
            bytes.close();
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        other.join();
    }
}
