package org.safeformat.operators.format;

import com.ibm.icu.lang.UCharacter;
import org.safeformat.Format;
import org.safeformat.runtime.ArgumentType;
import org.safeformat.runtime.FormatArgument;
import org.safeformat.runtime.FormatBuffer;
import org.safeformat.runtime.FormatError;

/**
 * Main renderer for placeholder values.
 *
 * This class dispatches on the argument kind. It delegates integer, pointer and
 * floating-point rendering to FormatNumericRenderer and handles character, text
 * and custom values directly.
 *
 * <p>Accepted type codes per kind:
 * <ul>
 *   <li>integers - d, x, X, o (decimal when absent)</li>
 *   <li>floating point - e, E, f, F, g, G (g when absent)</li>
 *   <li>char - c</li>
 *   <li>string - s</li>
 *   <li>pointer - p</li>
 *   <li>object - none</li>
 * </ul>
 *
 * @see FormatNumericRenderer for numeric conversions
 */
public class FormatValueRenderer {

    /** Renderer instance for numeric conversions */
    private final FormatNumericRenderer numericRenderer = new FormatNumericRenderer();

    /**
     * Render an argument according to the given placeholder.
     *
     * @param out  The output buffer
     * @param arg  The argument referenced by the placeholder
     * @param spec The parsed placeholder
     * @throws FormatError if the type code does not apply to the argument kind
     */
    public void render(FormatBuffer out, FormatArgument arg, FormatSpecifier spec) {
        ArgumentType kind = arg.getType();
        switch (kind) {
            case SIGNED_INTEGER, UNSIGNED_INTEGER, WIDE_SIGNED_INTEGER, WIDE_UNSIGNED_INTEGER ->
                    numericRenderer.formatInteger(out, arg, spec);
            case FLOATING_POINT, EXTENDED_FLOATING_POINT -> numericRenderer.formatFloatingPoint(out, arg, spec);
            case CHARACTER -> {
                checkType(spec, 'c', kind);
                int start = out.size();
                out.push((byte) arg.getLong());
                FormatPaddingHelper.padRight(out, start, spec.width);
            }
            case TEXT -> {
                checkType(spec, 's', kind);
                int start = out.size();
                out.append(arg.getTextBytes(), 0, arg.getTextLength());
                FormatPaddingHelper.padRight(out, start, spec.width);
            }
            case POINTER -> {
                checkType(spec, 'p', kind);
                numericRenderer.formatPointer(out, arg.getLong(), spec.width);
            }
            case CUSTOM -> {
                if (spec.hasConversion()) {
                    throw unknownType(spec, kind);
                }
                int start = out.size();
                arg.renderCustom(spec.width, out);
                FormatPaddingHelper.padRight(out, start, spec.width);
            }
        }
    }

    private static void checkType(FormatSpecifier spec, char accepted, ArgumentType kind) {
        if (spec.hasConversion() && spec.conversionChar != accepted) {
            throw unknownType(spec, kind);
        }
    }

    /**
     * Build the error for a type code the argument kind does not accept.
     * Printable codes are quoted as is, others as a {@code \xNN} escape.
     *
     * @param spec The placeholder carrying the offending type code
     * @param kind The kind of the referenced argument
     * @return The error to throw
     */
    static FormatError unknownType(FormatSpecifier spec, ArgumentType kind) {
        char code = spec.conversionChar;
        if (code < 0x80 && UCharacter.isPrintable(code)) {
            return new FormatError(Format.format("unknown format code '{0}' for {1}")
                    .insert(String.valueOf(code))
                    .insert(kind.displayName())
                    .text(), spec.startPos);
        }
        return new FormatError(Format.format("unknown format code '\\x{0:02x}' for {1}")
                .insert(FormatArgument.ofUnsigned(code))
                .insert(kind.displayName())
                .text(), spec.startPos);
    }
}
