// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.stringlib;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Test {@link ByteArrayBuilder}, the sink of buffer traversals. */
@DisplayName("A ByteArrayBuilder")
class ByteArrayBuilderTest {

    @Test
    @DisplayName("grows from empty")
    void growsFromEmpty() {
        ByteArrayBuilder b = new ByteArrayBuilder();
        for (int i = 0; i < 100; i++) { b.append(i); }
        assertEquals(100, b.length());
        byte[] r = b.take();
        assertEquals(100, r.length);
        assertEquals(99, r[99]);
        assertEquals(0, b.length());
    }

    @Test
    @DisplayName("grows by more than double for a big append")
    void bigAppend() {
        ByteArrayBuilder b = new ByteArrayBuilder(1);
        b.append(7);
        b.append(new byte[1000]);
        assertEquals(1001, b.length());
        assertEquals(7, b.take()[0]);
    }

    @Test
    @DisplayName("appends part of an array")
    void appendPart() {
        byte[] src = {1, 2, 3, 4, 5};
        ByteArrayBuilder b = new ByteArrayBuilder(3);
        b.append(src, 1, 3);
        assertArrayEquals(new byte[] {2, 3, 4}, b.take());
        assertThrows(IndexOutOfBoundsException.class,
                () -> b.append(src, 3, 3));
    }

    @Test
    @DisplayName("may be re-used after take()")
    void reuse() {
        ByteArrayBuilder b = new ByteArrayBuilder(8);
        b.append(1).append(2);
        assertArrayEquals(new byte[] {1, 2}, b.take());
        b.append(0x1ff);
        assertEquals("[255]", b.toString());
        assertArrayEquals(new byte[] {(byte)0xff}, b.take());
    }
}
