package org.safeformat;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;

/**
 * An action run once a session has rendered its template.
 */
@FunctionalInterface
public interface FormatAction {

    /**
     * Does nothing; the caller reads the result from the session.
     */
    FormatAction IGNORE = formatter -> {
    };

    /**
     * Writes the rendered bytes to {@code out} and flushes it.
     *
     * @param out the stream to write to
     * @return the action
     */
    static FormatAction write(OutputStream out) {
        return formatter -> {
            try {
                formatter.writeTo(out);
                out.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("failed to write formatted output", e);
            }
        };
    }

    void accept(Formatter formatter);
}
