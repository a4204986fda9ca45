package org.safeformat.runtime;

import java.io.Serial;

/**
 * FormatError is raised when a template cannot be rendered against its arguments:
 * unbalanced braces, an argument index out of range, numeric overflow in an index
 * or width, a flag that does not apply to the argument kind, or an unknown
 * format code.
 * <p>
 * The error is raised at the first problem found and aborts the formatting call.
 * The output buffer content at that point is unspecified.
 */
public class FormatError extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    // Byte offset into the UTF-8 template where the problem was detected, -1 if unknown
    private final int position;

    public FormatError(String message) {
        this(message, -1);
    }

    public FormatError(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Returns the byte offset into the template where the error was detected,
     * or -1 if the error is not tied to a template position.
     */
    public int getPosition() {
        return position;
    }
}
