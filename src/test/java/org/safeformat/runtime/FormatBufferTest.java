package org.safeformat.runtime;

import org.junit.jupiter.api.Test;
import org.safeformat.Configuration;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class FormatBufferTest {

    @Test
    void testStartsEmptyWithInlineCapacity() {
        FormatBuffer buffer = new FormatBuffer();
        assertEquals(0, buffer.size());
        assertEquals(Configuration.inlineBufferSize, buffer.capacity());
    }

    @Test
    void testReserveIsNoOpWhenCapacitySuffices() {
        FormatBuffer buffer = new FormatBuffer(100);
        buffer.reserve(50);
        assertEquals(100, buffer.capacity());
    }

    @Test
    void testGrowthIsGeometric() {
        FormatBuffer buffer = new FormatBuffer(100);
        buffer.reserve(101);
        assertEquals(150, buffer.capacity());
        buffer.reserve(1000);
        assertEquals(1000, buffer.capacity());
    }

    @Test
    void testGrowthPreservesContent() {
        FormatBuffer buffer = new FormatBuffer(4);
        buffer.append("abc");
        String tail = "x".repeat(600);
        buffer.append(tail);
        assertEquals("abc" + tail, buffer.toString());
        assertEquals(603, buffer.size());
    }

    @Test
    void testPushGrowsWhenFull() {
        FormatBuffer buffer = new FormatBuffer(2);
        buffer.push((byte) 'a');
        buffer.push((byte) 'b');
        buffer.push((byte) 'c');
        assertEquals("abc", buffer.toString());
        assertEquals(3, buffer.capacity());
    }

    @Test
    void testShrinkingKeepsUnderlyingBytes() {
        FormatBuffer buffer = new FormatBuffer();
        buffer.append("abc");
        buffer.resize(1);
        assertEquals("a", buffer.toString());
        buffer.resize(3);
        assertEquals((byte) 'c', buffer.get(2));
    }

    @Test
    void testExtendReturnsOffsetOfNewArea() {
        FormatBuffer buffer = new FormatBuffer();
        buffer.append("ab");
        int offset = buffer.extend(3);
        assertEquals(2, offset);
        assertEquals(5, buffer.size());
        buffer.fill(offset, offset + 3, (byte) '-');
        assertEquals("ab---", buffer.toString());
    }

    @Test
    void testFillAppendsCopies() {
        FormatBuffer buffer = new FormatBuffer();
        buffer.append("x");
        buffer.fill((byte) ' ', 3);
        buffer.fill((byte) ' ', 0);
        assertEquals("x   ", buffer.toString());
    }

    @Test
    void testTerminateDoesNotCountTheZeroByte() {
        FormatBuffer buffer = new FormatBuffer(2);
        buffer.append("ab");
        buffer.terminate();
        assertEquals(2, buffer.size());

        ByteBuffer view = buffer.terminatedView();
        assertTrue(view.isReadOnly());
        assertEquals(3, view.remaining());
        assertEquals((byte) 'a', view.get(0));
        assertEquals((byte) 0, view.get(2));
    }

    @Test
    void testIndexOutsideLogicalLengthIsRejected() {
        FormatBuffer buffer = new FormatBuffer();
        buffer.append("ab");
        assertThrows(IndexOutOfBoundsException.class, () -> buffer.get(2));
        assertThrows(IndexOutOfBoundsException.class, () -> buffer.set(-1, (byte) 0));
    }

    @Test
    void testAppendEncodesUtf8() {
        FormatBuffer buffer = new FormatBuffer();
        buffer.append("é");
        assertArrayEquals("é".getBytes(StandardCharsets.UTF_8), buffer.toByteArray());
        assertEquals(2, buffer.size());
    }

    @Test
    void testClearResetsLength() {
        FormatBuffer buffer = new FormatBuffer();
        buffer.append("abc");
        buffer.clear();
        assertEquals(0, buffer.size());
        assertEquals("", buffer.toString());
    }
}
