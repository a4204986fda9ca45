package org.safeformat.runtime;

import org.safeformat.Configuration;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A growable byte buffer holding formatted output.
 * <p>
 * The buffer starts with {@link Configuration#inlineBufferSize} bytes of
 * storage and grows geometrically: a request that does not fit allocates
 * {@code max(requested, capacity + capacity / 2)} bytes and copies the bytes
 * below the current length. Offsets obtained before a growing call stay valid
 * as offsets, but any {@link ByteBuffer} view taken earlier no longer reflects
 * new storage and must be taken again.
 * <p>
 * The class is not thread safe and mutable.
 */
public final class FormatBuffer {

    private byte[] data;
    private int size;

    public FormatBuffer() {
        this(Configuration.inlineBufferSize);
    }

    public FormatBuffer(int initialCapacity) {
        if (initialCapacity < 1) {
            throw new IllegalArgumentException("initial capacity must be positive: " + initialCapacity);
        }
        this.data = new byte[initialCapacity];
    }

    /**
     * Returns the logical length of this buffer.
     */
    public int size() {
        return size;
    }

    /**
     * Returns the number of bytes the buffer can hold without reallocating.
     */
    public int capacity() {
        return data.length;
    }

    /**
     * Ensures the capacity is at least {@code capacity}; does nothing otherwise.
     *
     * @param capacity the minimum capacity
     */
    public void reserve(int capacity) {
        if (capacity > data.length) {
            grow(capacity);
        }
    }

    /**
     * Sets the logical length. Growing exposes bytes the caller must write
     * before reading; shrinking keeps the bytes but makes them logically absent.
     *
     * @param newSize the new logical length
     */
    public void resize(int newSize) {
        if (newSize < 0) {
            throw new IllegalArgumentException("negative size: " + newSize);
        }
        if (newSize > data.length) {
            grow(newSize);
        }
        size = newSize;
    }

    public void clear() {
        size = 0;
    }

    /**
     * Extends the logical length by {@code n} bytes and returns the offset of
     * the first new byte.
     *
     * @param n number of bytes to add
     * @return offset of the newly exposed area
     */
    public int extend(int n) {
        int offset = size;
        resize(Math.addExact(size, n));
        return offset;
    }

    public void push(byte value) {
        if (size == data.length) {
            grow(size + 1);
        }
        data[size++] = value;
    }

    /**
     * Appends the bytes {@code source[from, to)}.
     */
    public void append(byte[] source, int from, int to) {
        int count = to - from;
        if (count <= 0) {
            return;
        }
        int offset = extend(count);
        System.arraycopy(source, from, data, offset, count);
    }

    public void append(byte[] source) {
        append(source, 0, source.length);
    }

    /**
     * Appends the UTF-8 encoding of {@code text}.
     */
    public void append(CharSequence text) {
        append(text.toString().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Appends {@code count} copies of {@code fill}.
     */
    public void fill(byte fill, int count) {
        if (count <= 0) {
            return;
        }
        int offset = extend(count);
        Arrays.fill(data, offset, offset + count, fill);
    }

    public byte get(int index) {
        checkIndex(index);
        return data[index];
    }

    public void set(int index, byte value) {
        checkIndex(index);
        data[index] = value;
    }

    /**
     * Fills {@code [from, to)} with {@code fill}; the range must be inside the logical length.
     */
    public void fill(int from, int to, byte fill) {
        if (from < to) {
            checkIndex(from);
            checkIndex(to - 1);
            Arrays.fill(data, from, to, fill);
        }
    }

    /**
     * Writes a zero byte just past the logical length without counting it.
     * The byte is part of the storage but not of the content.
     */
    public void terminate() {
        push((byte) 0);
        resize(size - 1);
    }

    /**
     * Returns a read-only view of the storage covering {@code [0, size + 1)}.
     * The caller must call {@link #terminate()} first for the last byte to be zero.
     */
    public ByteBuffer terminatedView() {
        reserve(size + 1);
        return ByteBuffer.wrap(data, 0, size + 1).slice().asReadOnlyBuffer();
    }

    /**
     * Writes the content to {@code out} without copying it.
     */
    public void writeTo(OutputStream out) throws IOException {
        out.write(data, 0, size);
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(data, size);
    }

    @Override
    public String toString() {
        return new String(data, 0, size, StandardCharsets.UTF_8);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index " + index + " out of bounds for length " + size);
        }
    }

    private void grow(int requested) {
        int newCapacity = Math.max(requested, data.length + data.length / 2);
        data = Arrays.copyOf(data, newCapacity);
    }
}
