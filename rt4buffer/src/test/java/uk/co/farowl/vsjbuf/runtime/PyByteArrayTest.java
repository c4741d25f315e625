// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.runtime;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static uk.co.farowl.vsjbuf.runtime.UnitTestSupport.assertRaises;
import static uk.co.farowl.vsjbuf.runtime.UnitTestSupport.bytes;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import uk.co.farowl.vsjbuf.buffer.BorrowedBytes;
import uk.co.farowl.vsjbuf.buffer.BorrowedBytesMut;
import uk.co.farowl.vsjbuf.buffer.BufferResizeGuard;
import uk.co.farowl.vsjbuf.buffer.PyBuffer;

/**
 * Test {@link PyByteArray}, in particular that it refuses to change
 * length while it has exports.
 */
@DisplayName("The bytearray object")
class PyByteArrayTest {

    @Nested
    @DisplayName("as a sequence")
    class Sequence {

        PyByteArray ba;

        @BeforeEach
        void setup() { ba = new PyByteArray(bytes(1, 2, 3)); }

        @Test
        @DisplayName("gets and sets items from either end")
        void getSet() {
            assertEquals(3, ba.get(-1));
            ba.set(-3, 255);
            assertEquals(255, ba.get(0));
            assertRaises(PyExc.IndexError, "bytearray index out of range",
                    () -> ba.get(3));
            assertRaises(PyExc.IndexError,
                    "bytearray assignment index out of range",
                    () -> ba.set(-4, 0));
            assertRaises(PyExc.ValueError, "byte must be in range(0, 256)",
                    () -> ba.set(0, 256));
        }

        @Test
        @DisplayName("appends and pops")
        void appendPop() {
            ba.append(4);
            assertArrayEquals(bytes(1, 2, 3, 4), ba.asByteArray());
            assertEquals(4, ba.pop());
            assertEquals(3, ba.pop());
            assertEquals(2, ba.size());
            assertRaises(PyExc.ValueError, () -> ba.append(-1));
            ba.clear();
            assertEquals(0, ba.size());
            assertRaises(PyExc.IndexError, "pop from empty bytearray",
                    () -> ba.pop());
        }

        @Test
        @DisplayName("grows by many appends")
        void manyAppends() {
            for (int i = 0; i < 100; i++) { ba.append(i); }
            assertEquals(103, ba.size());
            assertEquals(99, ba.get(-1));
        }

        @Test
        @DisplayName("extends with any bytes-like object")
        void extend() {
            ba.extend(new PyBytes(4, 5));
            ba.extend(ba);
            assertArrayEquals(bytes(1, 2, 3, 4, 5, 1, 2, 3, 4, 5),
                    ba.asByteArray());
            assertRaises(PyExc.TypeError,
                    "a bytes-like object is required, not 'str'",
                    () -> ba.extend("abc"));
            assertEquals(0, ba.getExports());
        }

        @Test
        @DisplayName("resizes with zero fill")
        void resize() {
            ba.resize(5);
            assertArrayEquals(bytes(1, 2, 3, 0, 0), ba.asByteArray());
            ba.resize(1);
            ba.resize(2);
            assertArrayEquals(bytes(1, 0), ba.asByteArray());
            assertRaises(PyExc.ValueError, () -> ba.resize(-1));
        }

        @Test
        @DisplayName("has a Python repr")
        void repr() {
            assertEquals("bytearray(b'\\x01\\x02\\x03')", ba.toString());
        }
    }

    @Nested
    @DisplayName("with an export open")
    class Exported {

        PyByteArray ba;
        PyBuffer export;

        @BeforeEach
        void setup() {
            ba = new PyByteArray(bytes(1, 2, 3));
            export = PyBuffer.fromObject(ba);
        }

        @Test
        @DisplayName("counts the export")
        void counted() {
            assertEquals(1, ba.getExports());
            assertFalse(export.getDescriptor().isReadonly());
            export.close();
            assertEquals(0, ba.getExports());
        }

        @Test
        @DisplayName("grants no permit to re-size")
        void noPermit() {
            assertNull(ba.tryResizableOpt());
            export.close();
            try (PyByteArray.Resizable r = ba.tryResizableOpt()) {
                assertNotNull(r);
                r.append(bytes(9), 0, 1);
            }
            assertEquals(4, ba.size());
        }

        @Test
        @DisplayName("raises BufferError on any change of length")
        void bufferError() {
            String msg = BufferResizeGuard.CANNOT_RESIZE;
            assertEquals("Existing exports of data: object cannot be "
                    + "re-sized", msg);
            assertRaises(PyExc.BufferError, msg, () -> ba.append(4));
            assertRaises(PyExc.BufferError, msg,
                    () -> ba.extend(new PyBytes(4)));
            assertRaises(PyExc.BufferError, msg, () -> ba.pop());
            assertRaises(PyExc.BufferError, msg, () -> ba.resize(0));
            assertRaises(PyExc.BufferError, msg, () -> ba.clear());
            assertArrayEquals(bytes(1, 2, 3), ba.asByteArray());
            export.close();
            ba.append(4);
            assertEquals(4, ba.size());
        }

        @Test
        @DisplayName("refuses to re-size while the export is borrowed")
        void whileBorrowed() {
            // The borrow holds the read lock in this thread.
            assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
                try (BorrowedBytes b = export.objBytes()) {
                    assertNull(ba.tryResizableOpt());
                    assertRaises(PyExc.BufferError,
                            BufferResizeGuard.CANNOT_RESIZE,
                            () -> ba.append(4));
                    assertEquals(3, b.length());
                }
                export.contiguousOrCollect(b -> assertRaises(
                        PyExc.BufferError, () -> ba.pop()));
            });
            assertArrayEquals(bytes(1, 2, 3), ba.asByteArray());
            export.close();
        }

        @Test
        @DisplayName("still allows items to be set")
        void setItem() {
            ba.set(1, 20);
            assertArrayEquals(bytes(1, 20, 3), export.toByteArray());
            try (BorrowedBytesMut b = export.objBytesMut()) {
                b.set(2, 30);
            }
            assertEquals(30, ba.get(2));
            export.close();
        }

        @Test
        @DisplayName("still counts it when detached")
        void detached() {
            PyBuffer.Detached d = export.detach();
            assertEquals(1, ba.getExports());
            assertNull(ba.tryResizableOpt());
            export = d.reattach();
            assertEquals(1, ba.getExports());
            export.detach().release();
            assertEquals(0, ba.getExports());
            ba.append(4);
        }
    }

    @Test
    @DisplayName("copies any bytes-like object in fromObject()")
    void fromObject() {
        PyByteArray a = new PyByteArray(bytes(5, 6));
        PyByteArray b = PyByteArray.fromObject(a);
        b.append(7);
        assertEquals(2, a.size());
        assertArrayEquals(bytes(5, 6, 7), b.asByteArray());
        assertEquals(0, a.getExports());
    }
}
