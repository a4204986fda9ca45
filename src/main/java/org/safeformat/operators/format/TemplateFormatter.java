package org.safeformat.operators.format;

import org.safeformat.runtime.ArgumentList;
import org.safeformat.runtime.ArgumentType;
import org.safeformat.runtime.FormatBuffer;
import org.safeformat.runtime.FormatError;

import java.nio.charset.StandardCharsets;

/**
 * Renders a template against a frozen argument list.
 * <p>
 * The template is scanned left to right in one pass. Literal runs are copied
 * to the output and doubled braces collapse to a single brace. Any other opening
 * brace starts a placeholder that is parsed, validated against the kind of the
 * argument it references, and rendered before scanning resumes.
 * <p>
 * The first problem aborts the call with a {@link FormatError}. When it is found
 * inside a placeholder, a lookahead decides the message: if the placeholder is
 * closed further on, the specific message is reported, otherwise the
 * unmatched brace message takes precedence.
 */
public class TemplateFormatter {

    private final FormatValueRenderer renderer = new FormatValueRenderer();

    public void format(String template, ArgumentList arguments, FormatBuffer out) {
        format(template.getBytes(StandardCharsets.UTF_8), arguments, out);
    }

    /**
     * Renders a UTF-8 template, appending to {@code out} and leaving a zero
     * byte after the output that is not counted in its size.
     *
     * @param template  The template bytes
     * @param arguments The arguments, already frozen
     * @param out       The output buffer
     * @throws FormatError if the template does not match the arguments
     */
    public void format(byte[] template, ArgumentList arguments, FormatBuffer out) {
        Parser parser = new Parser(template);
        int start = 0;  // start of the pending literal run

        while (!parser.isAtEnd()) {
            int c = parser.current();
            parser.advance();
            if (c != '{' && c != '}') {
                continue;
            }
            if (parser.current() == c) {
                // Doubled brace: keep the first, drop the second
                out.append(template, start, parser.pos);
                parser.advance();
                start = parser.pos;
                continue;
            }
            if (c == '}') {
                throw new FormatError("unmatched '}' in format", parser.pos - 1);
            }

            int literalEnd = parser.pos - 1;
            FormatSpecifier spec = parser.parsePlaceholder(arguments);
            out.append(template, start, literalEnd);
            renderer.render(out, arguments.get(spec.argumentIndex), spec);
            start = parser.pos;
        }
        out.append(template, start, template.length);
        out.terminate();
    }

    private static class Parser {
        private final byte[] input;
        private int pos = 0;

        Parser(byte[] input) {
            this.input = input;
        }

        boolean isAtEnd() {
            return pos >= input.length;
        }

        int current() {
            return isAtEnd() ? -1 : input[pos] & 0xFF;
        }

        void advance() {
            if (!isAtEnd()) pos++;
        }

        boolean match(char expected) {
            if (current() == expected) {
                advance();
                return true;
            }
            return false;
        }

        boolean atDigit() {
            int c = current();
            return c >= '0' && c <= '9';
        }

        /**
         * Parses a placeholder after its opening brace, through the closing brace.
         */
        FormatSpecifier parsePlaceholder(ArgumentList arguments) {
            FormatSpecifier spec = new FormatSpecifier();
            spec.startPos = pos - 1;

            // 1. Argument index
            if (!atDigit()) {
                throw reportError("missing argument index in format string");
            }
            spec.argumentIndex = parseNumber();
            if (spec.argumentIndex >= arguments.size()) {
                throw reportError("argument index is out of range in format");
            }
            ArgumentType type = arguments.get(spec.argumentIndex).getType();

            if (match(':')) {
                // 2. Flags
                if (match('+')) {
                    if (!type.isNumeric()) {
                        throw reportError("format specifier '+' requires numeric argument");
                    }
                    if (type.isUnsigned()) {
                        throw reportError("format specifier '+' requires signed argument");
                    }
                    spec.plusFlag = true;
                }
                if (match('#')) {
                    if (!type.isInteger()) {
                        throw reportError("format specifier '#' requires integer argument");
                    }
                    spec.hexPrefixFlag = true;
                }
                if (match('0')) {
                    if (!type.isNumeric()) {
                        throw reportError("format specifier '0' requires numeric argument");
                    }
                    spec.zeroFlag = true;
                }

                // 3. Width
                if (atDigit()) {
                    spec.width = parseNumber();
                }

                // 4. Precision
                if (match('.')) {
                    if (!atDigit()) {
                        throw reportError("missing precision in format");
                    }
                    spec.precision = parseNumber();
                    if (!type.isFloatingPoint()) {
                        throw reportError("precision specifier requires floating-point argument");
                    }
                }

                // 5. Type code, checked against the argument kind when rendering
                if (!isAtEnd() && current() != '}') {
                    spec.conversionChar = (char) current();
                    advance();
                }
            }

            if (!match('}')) {
                throw new FormatError("unmatched '{' in format", pos);
            }
            return spec;
        }

        /**
         * Parses an unsigned decimal that must not exceed {@link Integer#MAX_VALUE}.
         * The current character must be a digit.
         */
        int parseNumber() {
            long value = 0;
            do {
                value = value * 10 + (current() - '0');
                advance();
                if (value > Integer.MAX_VALUE) {
                    throw reportError("number is too big in format");
                }
            } while (atDigit());
            return (int) value;
        }

        /**
         * Chooses the error for a problem found inside a placeholder: {@code message}
         * if the placeholder is closed later in the template, otherwise the
         * unmatched brace error. Only runs on the error path.
         */
        FormatError reportError(String message) {
            int openBraces = 1;
            for (int i = pos; i < input.length; i++) {
                if (input[i] == '{') {
                    ++openBraces;
                } else if (input[i] == '}') {
                    if (--openBraces == 0) {
                        return new FormatError(message, pos);
                    }
                }
            }
            return new FormatError("unmatched '{' in format", pos);
        }
    }
}
