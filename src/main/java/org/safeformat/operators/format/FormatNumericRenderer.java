package org.safeformat.operators.format;

import org.safeformat.Configuration;
import org.safeformat.runtime.ArgumentType;
import org.safeformat.runtime.FormatArgument;
import org.safeformat.runtime.FormatBuffer;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Handles numeric rendering for format placeholders.
 *
 * <p>This class contains the logic for rendering numeric values:
 * <ul>
 *   <li>Integers (decimal, octal, hexadecimal), written directly into the output buffer</li>
 *   <li>Floating-point numbers (fixed, exponential, general), converted by {@link String#format}</li>
 *   <li>Special values (nan, inf)</li>
 * </ul>
 */
public class FormatNumericRenderer {

    private static final byte[] LOWER_DIGITS = "0123456789abcdef".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] UPPER_DIGITS = "0123456789ABCDEF".getBytes(StandardCharsets.US_ASCII);

    /**
     * Render an integer argument.
     *
     * <p>Decimal output carries a sign: '-' for negative signed values, '+' when
     * the plus flag is set. Hexadecimal and octal output render the unsigned bit
     * pattern of the argument's width and never carry a sign.
     *
     * @param out  The output buffer
     * @param arg  An argument of one of the integer kinds
     * @param spec The parsed placeholder
     */
    public void formatInteger(FormatBuffer out, FormatArgument arg, FormatSpecifier spec) {
        ArgumentType kind = arg.getType();
        long bits = arg.getLong();
        char type = spec.conversionChar;
        switch (type) {
            case 0, 'd' -> {
                boolean negative = !kind.isUnsigned() && bits < 0;
                char sign = negative ? '-' : (spec.plusFlag ? '+' : 0);
                writeInteger(out, negative ? -bits : bits, sign, spec.zeroFlag, false, spec.width, 'd');
            }
            case 'x', 'X', 'o' -> {
                long pattern = kind == ArgumentType.SIGNED_INTEGER ? bits & 0xFFFFFFFFL : bits;
                writeInteger(out, pattern, (char) 0, spec.zeroFlag, spec.hexPrefixFlag, spec.width, type);
            }
            default -> throw FormatValueRenderer.unknownType(spec, kind);
        }
    }

    /**
     * Render a pointer as lowercase hexadecimal with a {@code 0x} prefix.
     *
     * @param out     The output buffer
     * @param address The pointer bits, read as unsigned
     * @param width   Minimum total width including the prefix
     */
    public void formatPointer(FormatBuffer out, long address, int width) {
        writeInteger(out, address, (char) 0, false, true, width, 'x');
    }

    /**
     * Write an unsigned magnitude right-aligned in a span of {@code max(width, natural size)} bytes.
     *
     * <p>Digits are written right to left, then the prefix and the sign. With zero
     * fill the sign and prefix take the leftmost columns and zeros follow them;
     * with space fill they sit directly before the digits.
     */
    private void writeInteger(FormatBuffer out, long magnitude, char sign, boolean zeroFill,
                              boolean prefix, int width, char type) {
        boolean writePrefix = prefix && (type == 'x' || type == 'X');
        int size = digitCount(magnitude, type);
        if (sign != 0) size++;
        if (writePrefix) size += 2;
        width = Math.max(width, size);

        int start = out.extend(width);
        int p = start + width - 1;
        long n = magnitude;
        switch (type) {
            case 'x', 'X' -> {
                byte[] digits = type == 'x' ? LOWER_DIGITS : UPPER_DIGITS;
                do {
                    out.set(p--, digits[(int) (n & 0xf)]);
                } while ((n >>>= 4) != 0);
            }
            case 'o' -> {
                do {
                    out.set(p--, (byte) ('0' + (n & 7)));
                } while ((n >>>= 3) != 0);
            }
            default -> {
                do {
                    out.set(p--, (byte) ('0' + Long.remainderUnsigned(n, 10)));
                } while ((n = Long.divideUnsigned(n, 10)) != 0);
            }
        }

        if (writePrefix) {
            if (zeroFill) {
                out.set(start++, (byte) '0');
                out.set(start++, (byte) type);
            } else {
                out.set(p--, (byte) type);
                out.set(p--, (byte) '0');
            }
        }
        if (sign != 0) {
            if (zeroFill) {
                out.set(start++, (byte) sign);
            } else {
                out.set(p--, (byte) sign);
            }
        }
        out.fill(start, p + 1, (byte) (zeroFill ? '0' : ' '));
    }

    private static int digitCount(long n, char type) {
        int count = 0;
        switch (type) {
            case 'x', 'X' -> {
                do {
                    count++;
                } while ((n >>>= 4) != 0);
            }
            case 'o' -> {
                do {
                    count++;
                } while ((n >>>= 3) != 0);
            }
            default -> {
                do {
                    count++;
                } while ((n = Long.divideUnsigned(n, 10)) != 0);
            }
        }
        return count;
    }

    /**
     * Render a floating-point argument.
     *
     * <p>A {@link BigDecimal} argument keeps its full precision through the
     * conversion, and a double is converted from its exact binary value. Without a type code the general notation is used; without a
     * precision, {@link Configuration#defaultFloatPrecision} digits.
     *
     * @param out  The output buffer
     * @param arg  A floating-point argument
     * @param spec The parsed placeholder
     */
    public void formatFloatingPoint(FormatBuffer out, FormatArgument arg, FormatSpecifier spec) {
        char conversion = spec.conversionChar;
        switch (conversion) {
            case 0 -> conversion = 'g';
            case 'e', 'E', 'f', 'F', 'g', 'G' -> {
            }
            default -> throw FormatValueRenderer.unknownType(spec, arg.getType());
        }
        int precision = spec.precision >= 0 ? spec.precision : Configuration.defaultFloatPrecision;

        String result;
        if (arg.getType() == ArgumentType.FLOATING_POINT && !Double.isFinite(arg.getDouble())) {
            result = formatSpecialValue(arg.getDouble(), spec.plusFlag, spec.width, Character.isUpperCase(conversion));
        } else {
            Object value = arg.getType() == ArgumentType.EXTENDED_FLOATING_POINT
                    ? arg.getDecimal()
                    : exactValue(arg.getDouble());
            result = convert(value, spec.plusFlag, precision, conversion);
            result = FormatPaddingHelper.applyWidth(result, spec.width, spec.zeroFlag);
        }
        writeConverted(out, result);
    }

    /**
     * Format special floating-point values (nan, inf).
     *
     * <p>Special values are padded with spaces even when zero padding is requested.
     */
    String formatSpecialValue(double value, boolean plus, int width, boolean upperCase) {
        String result = Double.isNaN(value) ? "nan" : "inf";
        if (value < 0) {
            result = "-" + result;
        } else if (plus) {
            result = "+" + result;
        }
        if (upperCase) {
            result = result.toUpperCase(Locale.ROOT);
        }
        return FormatPaddingHelper.applyWidth(result, width, false);
    }

    private String convert(Object value, boolean plus, int precision, char conversion) {
        // java.util.Formatter has no %F; finite values render the same with %f
        char javaConversion = conversion == 'F' ? 'f' : conversion;
        StringBuilder format = new StringBuilder("%");
        if (plus) format.append('+');
        format.append('.').append(precision).append(javaConversion);

        if (value instanceof BigDecimal decimal && (conversion == 'g' || conversion == 'G')) {
            // Notation is chosen from the rounded value: 999999.5 becomes 1e+06
            value = decimal.round(new MathContext(Math.max(precision, 1), RoundingMode.HALF_UP));
        }
        String result = widenExponent(String.format(Locale.ROOT, format.toString(), value));
        if (conversion == 'g' || conversion == 'G') {
            result = removeTrailingZeros(result);
        }
        return result;
    }

    /**
     * Returns the exact binary value of a double, so the conversion works from all
     * of its digits rather than the shortest decimal that reads back the same.
     * Zero stays a double to keep the sign of negative zero.
     */
    private static Object exactValue(double value) {
        return value == 0.0 ? (Object) value : new BigDecimal(value);
    }

    /**
     * Pad a one-digit exponent to two digits: {@code 1.5e+4} becomes {@code 1.5e+04}.
     */
    static String widenExponent(String result) {
        int exponent = Math.max(result.indexOf('e'), result.indexOf('E'));
        if (exponent == -1 || result.length() - exponent != 3) {
            return result;
        }
        return result.substring(0, exponent + 2) + '0' + result.substring(exponent + 2);
    }

    /**
     * Remove trailing zeros from the fraction of a %g result, and the decimal
     * point when no fraction remains. Applies to the mantissa of exponential
     * notation as well.
     */
    static String removeTrailingZeros(String result) {
        int exponent = result.indexOf('e');
        if (exponent == -1) exponent = result.indexOf('E');
        String mantissa = exponent == -1 ? result : result.substring(0, exponent);
        String suffix = exponent == -1 ? "" : result.substring(exponent);

        if (mantissa.indexOf('.') != -1) {
            mantissa = mantissa.replaceAll("0+$", "");
            mantissa = mantissa.replaceAll("\\.$", "");
        }
        return mantissa + suffix;
    }

    /**
     * Append converted text, reserving exactly the space it needs when it does not fit.
     */
    private void writeConverted(FormatBuffer out, String text) {
        byte[] bytes = text.getBytes(StandardCharsets.US_ASCII);
        int needed = out.size() + bytes.length;
        if (needed > out.capacity()) {
            out.reserve(needed);
        }
        out.append(bytes);
    }
}
