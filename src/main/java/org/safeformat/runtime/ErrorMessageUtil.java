package org.safeformat.runtime;

import java.nio.charset.StandardCharsets;

/**
 * Utility class for generating error messages with context from a template.
 */
public final class ErrorMessageUtil {

    // Number of template bytes quoted on each side of the error position
    private static final int CONTEXT_BYTES = 8;

    private ErrorMessageUtil() {
    }

    /**
     * Quotes the specified string for inclusion in an error message.
     * Escapes special characters such as newlines, tabs, and backslashes.
     *
     * @param str the string to quote
     * @return the quoted and escaped string
     */
    static String errorMessageQuote(String str) {
        StringBuilder escaped = new StringBuilder();
        for (char c : str.toCharArray()) {
            switch (c) {
                case '\n':
                    escaped.append("\\n");
                    break;
                case '\t':
                    escaped.append("\\t");
                    break;
                case '\\':
                    escaped.append("\\\\");
                    break;
                case '\"':
                    escaped.append("\\\"");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return "\"" + escaped + "\"";
    }

    /**
     * Generates an error message with the template text around the error position.
     *
     * @param template the template that failed to render
     * @param error    the error raised while rendering it
     * @return the message, followed by the offset and a quoted excerpt when the position is known
     */
    public static String errorMessage(String template, FormatError error) {
        int position = error.getPosition();
        if (position < 0) {
            return error.getMessage();
        }
        byte[] bytes = template.getBytes(StandardCharsets.UTF_8);
        int at = Math.min(position, bytes.length);
        int from = Math.max(0, at - CONTEXT_BYTES);
        int to = Math.min(bytes.length, at + CONTEXT_BYTES);
        // Keep whole UTF-8 sequences: drop a partial one at the start, complete one at the end
        while (from < at && isContinuationByte(bytes[from])) {
            from++;
        }
        while (to < bytes.length && isContinuationByte(bytes[to])) {
            to++;
        }
        String near = new String(bytes, from, to - from, StandardCharsets.UTF_8);
        return error.getMessage() + " at offset " + position + ", near " + errorMessageQuote(near);
    }

    private static boolean isContinuationByte(byte b) {
        return (b & 0xC0) == 0x80;
    }
}
