package org.safeformat.runtime;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * An immutable format argument tagged with its {@link ArgumentType}.
 * <p>
 * Arguments are created through the static factories. {@link #of(Object)}
 * picks the kind from the runtime class of a value; the other factories
 * select a kind explicitly, which is the only way to get the unsigned and
 * pointer kinds since Java has no unsigned integers or raw pointers.
 * <p>
 * Two capture rules keep formatting type-safe:
 * <ul>
 *   <li>a {@code char} above {@code 0x7F} is rejected, it must be converted to an integer first;</li>
 *   <li>arrays are rejected, except through {@link #ofBytes(byte[], int)}; use
 *       {@link #pointerTo(Object)} to format an object's identity.</li>
 * </ul>
 */
public final class FormatArgument {

    private static final byte[] NO_BYTES = new byte[0];

    private final ArgumentType type;
    private final long longValue;
    private final double doubleValue;
    private final BigDecimal decimalValue;
    private final byte[] textValue;
    private final int textLength;
    private final Binding custom;

    // Renders a custom value; the value and its renderer are bound at capture time
    @FunctionalInterface
    private interface Binding {
        void render(int width, FormatBuffer out);
    }

    private FormatArgument(ArgumentType type, long longValue, double doubleValue, BigDecimal decimalValue,
                           byte[] textValue, int textLength, Binding custom) {
        this.type = type;
        this.longValue = longValue;
        this.doubleValue = doubleValue;
        this.decimalValue = decimalValue;
        this.textValue = textValue;
        this.textLength = textLength;
        this.custom = custom;
    }

    private static FormatArgument integral(ArgumentType type, long value) {
        return new FormatArgument(type, value, 0, null, NO_BYTES, 0, null);
    }

    public static FormatArgument ofInt(int value) {
        return integral(ArgumentType.SIGNED_INTEGER, value);
    }

    /**
     * Captures the 32-bit pattern of {@code value} as an unsigned integer.
     */
    public static FormatArgument ofUnsigned(int value) {
        return integral(ArgumentType.UNSIGNED_INTEGER, Integer.toUnsignedLong(value));
    }

    public static FormatArgument ofLong(long value) {
        return integral(ArgumentType.WIDE_SIGNED_INTEGER, value);
    }

    /**
     * Captures the 64-bit pattern of {@code value} as an unsigned integer.
     */
    public static FormatArgument ofUnsignedLong(long value) {
        return integral(ArgumentType.WIDE_UNSIGNED_INTEGER, value);
    }

    public static FormatArgument ofDouble(double value) {
        return new FormatArgument(ArgumentType.FLOATING_POINT, 0, value, null, NO_BYTES, 0, null);
    }

    public static FormatArgument ofExtended(BigDecimal value) {
        Objects.requireNonNull(value, "value");
        return new FormatArgument(ArgumentType.EXTENDED_FLOATING_POINT, 0, 0, value, NO_BYTES, 0, null);
    }

    /**
     * Captures a single-byte character.
     *
     * @throws IllegalArgumentException if {@code value} does not fit in one byte of output
     */
    public static FormatArgument ofChar(char value) {
        if (value > 0x7F) {
            throw new IllegalArgumentException(String.format(
                    "wide character U+%04X cannot be formatted as char; convert it to an integer type first",
                    (int) value));
        }
        return integral(ArgumentType.CHARACTER, value);
    }

    /**
     * Captures the UTF-8 encoding of {@code value} with its exact length.
     */
    public static FormatArgument ofText(CharSequence value) {
        Objects.requireNonNull(value, "value");
        byte[] bytes = value.toString().getBytes(StandardCharsets.UTF_8);
        return new FormatArgument(ArgumentType.TEXT, 0, 0, null, bytes, bytes.length, null);
    }

    /**
     * Captures the first {@code length} bytes of {@code data} as text. A length of zero
     * means "up to the first zero byte", or the whole array when it has none.
     * The array is not copied and must not change before the session is finalized.
     */
    public static FormatArgument ofBytes(byte[] data, int length) {
        Objects.requireNonNull(data, "data");
        if (length < 0 || length > data.length) {
            throw new IllegalArgumentException("length " + length + " out of range for " + data.length + " bytes");
        }
        return new FormatArgument(ArgumentType.TEXT, 0, 0, null, data, length, null);
    }

    public static FormatArgument ofPointer(long address) {
        return integral(ArgumentType.POINTER, address);
    }

    /**
     * Captures the identity of {@code value} as an opaque pointer.
     */
    public static FormatArgument pointerTo(Object value) {
        return ofPointer(Integer.toUnsignedLong(System.identityHashCode(value)));
    }

    public static <T> FormatArgument ofCustom(T value, CustomRenderer<? super T> renderer) {
        Objects.requireNonNull(renderer, "renderer");
        return new FormatArgument(ArgumentType.CUSTOM, 0, 0, null, NO_BYTES, 0,
                (width, out) -> renderer.render(value, width, out));
    }

    /**
     * Captures {@code value} with the kind implied by its runtime class.
     * Values of other classes are captured as custom arguments rendered with
     * {@link CustomRenderer#STRING_VALUE}.
     *
     * @throws IllegalArgumentException if {@code value} is an array or a wide {@link Character}
     */
    public static FormatArgument of(Object value) {
        if (value instanceof FormatArgument argument) {
            return argument;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ofInt(((Number) value).intValue());
        }
        if (value instanceof Long l) {
            return ofLong(l);
        }
        if (value instanceof Double || value instanceof Float) {
            return ofDouble(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal decimal) {
            return ofExtended(decimal);
        }
        if (value instanceof Character c) {
            return ofChar(c);
        }
        if (value instanceof CharSequence text) {
            return ofText(text);
        }
        if (value != null && value.getClass().isArray()) {
            throw new IllegalArgumentException("cannot format an array of type "
                    + value.getClass().getComponentType().getName()
                    + "; use FormatArgument.pointerTo to format its identity");
        }
        return ofCustom(value, CustomRenderer.STRING_VALUE);
    }

    public ArgumentType getType() {
        return type;
    }

    /**
     * Returns the stored bits of an integer, character or pointer argument.
     * Unsigned 32-bit values are zero-extended.
     */
    public long getLong() {
        return longValue;
    }

    public double getDouble() {
        return doubleValue;
    }

    public BigDecimal getDecimal() {
        return decimalValue;
    }

    public byte[] getTextBytes() {
        return textValue;
    }

    /**
     * Returns the number of text bytes to render, resolving a zero length against the content.
     */
    public int getTextLength() {
        if (textLength == 0 && textValue.length > 0) {
            int length = 0;
            while (length < textValue.length && textValue[length] != 0) {
                length++;
            }
            return length;
        }
        return textLength;
    }

    /**
     * Invokes the bound renderer of a custom argument.
     */
    public void renderCustom(int width, FormatBuffer out) {
        if (custom == null) {
            throw new IllegalStateException("not a custom argument: " + type);
        }
        custom.render(width, out);
    }

    @Override
    public String toString() {
        return "FormatArgument{" + type + "}";
    }
}
