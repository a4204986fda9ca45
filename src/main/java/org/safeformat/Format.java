package org.safeformat;

import java.io.OutputStream;

/**
 * Entry points for one-off formatting calls.
 * <pre>
 *   String s = Format.format("Elapsed time: {0:.2f} seconds").insert(1.23).text();
 *   Format.print("{0} files{1}").insert(3).insert('\n').close();
 * </pre>
 *
 * <p>Template syntax: {@code {index[:[+][#][0][width][.precision][type]]}}, with
 * doubled braces for literal braces.
 */
public final class Format {

    private Format() {
    }

    /**
     * Starts formatting {@code template} into a new buffer.
     */
    public static FormatSession format(String template) {
        return new Formatter().format(template);
    }

    /**
     * Starts formatting {@code template}; on finalization the output is written to standard output.
     */
    public static FormatSession print(String template) {
        return print(template, System.out);
    }

    /**
     * Starts formatting {@code template}; on finalization the output is written to {@code out}.
     */
    public static FormatSession print(String template, OutputStream out) {
        return new Formatter().format(template, FormatAction.write(out));
    }
}
