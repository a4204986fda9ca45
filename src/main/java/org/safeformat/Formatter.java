package org.safeformat;

import org.safeformat.operators.format.TemplateFormatter;
import org.safeformat.runtime.ArgumentList;
import org.safeformat.runtime.FormatArgument;
import org.safeformat.runtime.FormatBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Formatter renders templates into a growable output buffer.
 * <p>
 * Each call to {@link #format(String)} opens a session; its output is appended
 * to the same buffer, so one formatter can assemble text from several calls:
 * <pre>
 *   Formatter out = new Formatter();
 *   out.format("Current point:\n").close();
 *   out.format("({0:+f}, {1:+f})").insert(-3.14).insert(3.14).close();
 *   out.text();   // "Current point:\n(-3.140000, +3.140000)"
 * </pre>
 * Only one session may be pending at a time. A formatter is not thread safe.
 */
public class Formatter {
    private static final Logger log = LoggerFactory.getLogger(Formatter.class);

    private final FormatBuffer buffer = new FormatBuffer();
    private final ArgumentList arguments = new ArgumentList();
    private final TemplateFormatter templateFormatter = new TemplateFormatter();

    // Template of the pending session, null when none is pending
    private String template;

    public Formatter() {
        buffer.terminate();
    }

    /**
     * Starts formatting {@code template}. Arguments are supplied through the
     * returned session, and the template is rendered when the session is finalized.
     *
     * @param template the format template
     * @return the session collecting the arguments
     * @throws IllegalStateException if a previous session has not been finalized
     */
    public FormatSession format(String template) {
        return format(template, FormatAction.IGNORE);
    }

    FormatSession format(String template, FormatAction action) {
        Objects.requireNonNull(template, "template");
        if (this.template != null) {
            throw new IllegalStateException("previous format session has not been finalized");
        }
        this.template = template;
        arguments.clear();
        return new FormatSession(this, action);
    }

    void add(FormatArgument argument) {
        if (template == null) {
            throw new IllegalStateException("no format session is pending");
        }
        arguments.add(argument);
    }

    /**
     * Renders the pending template. On failure, including an exception thrown by a
     * custom renderer, the output is rolled back to where this call started.
     */
    void render() {
        String pending = template;
        template = null;
        arguments.freeze();
        int before = buffer.size();
        try {
            templateFormatter.format(pending, arguments, buffer);
        } catch (RuntimeException e) {
            buffer.resize(before);
            buffer.terminate();
            throw e;
        } finally {
            log.trace("Rendered template with {} argument(s), {} byte(s) of output",
                    arguments.size(), buffer.size() - before);
            arguments.clear();
        }
    }

    /**
     * Returns the number of bytes of output.
     */
    public int size() {
        return buffer.size();
    }

    /**
     * Returns a copy of the output bytes.
     */
    public byte[] data() {
        return buffer.toByteArray();
    }

    /**
     * Returns a read-only view of the output followed by a zero byte.
     */
    public ByteBuffer view() {
        return buffer.terminatedView();
    }

    /**
     * Returns the output decoded as UTF-8.
     */
    public String text() {
        return buffer.toString();
    }

    public void writeTo(OutputStream out) throws IOException {
        buffer.writeTo(out);
    }

    /**
     * Discards the output.
     *
     * @throws IllegalStateException if a session is pending
     */
    public void clear() {
        if (template != null) {
            throw new IllegalStateException("cannot clear while a format session is pending");
        }
        buffer.clear();
        buffer.terminate();
    }
}
