package org.safeformat.operators.format;

import org.safeformat.runtime.FormatBuffer;

/**
 * Helper class for padding operations.
 *
 * This class provides utilities for applying width and zero-padding to
 * rendered values, either as strings or directly in the output buffer.
 */
public class FormatPaddingHelper {

    private static final byte SPACE = ' ';

    /**
     * Apply width formatting to a numeric string.
     *
     * @param str     The string to format
     * @param width   The desired width
     * @param zeroPad Whether to pad with zeros after the sign instead of leading spaces
     * @return The padded string
     */
    public static String applyWidth(String str, int width, boolean zeroPad) {
        if (width <= 0 || str.length() >= width) {
            return str;
        }
        return zeroPad ? applyZeroPadding(str, width) : padLeft(str, width, ' ');
    }

    /**
     * Pad a string on the left with a specified character.
     */
    public static String padLeft(String str, int width, char padChar) {
        if (str.length() >= width) return str;
        return String.valueOf(padChar).repeat(width - str.length()) + str;
    }

    /**
     * Apply zero padding to a formatted number.
     *
     * Zero padding goes after the sign but before the digits.
     * For example: -42 with width 6 becomes -00042
     *
     * @param str   The formatted string
     * @param width The desired width
     * @return The zero-padded string
     */
    public static String applyZeroPadding(String str, int width) {
        if (str.length() >= width) return str;

        String sign = "";
        String number = str;
        if (str.startsWith("-") || str.startsWith("+")) {
            sign = str.substring(0, 1);
            number = str.substring(1);
        }
        return sign + "0".repeat(width - str.length()) + number;
    }

    /**
     * Pads the output written since {@code start} with trailing spaces up to {@code width} bytes.
     *
     * @param out   The output buffer
     * @param start Offset where the padded value begins
     * @param width The desired width
     */
    public static void padRight(FormatBuffer out, int start, int width) {
        int written = out.size() - start;
        if (width > written) {
            out.fill(SPACE, width - written);
        }
    }
}
