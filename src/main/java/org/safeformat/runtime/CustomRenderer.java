package org.safeformat.runtime;

/**
 * Renders a value of a user-defined type into a format buffer.
 * <p>
 * The renderer appends the value's text; the caller pads the result with
 * trailing spaces when it is shorter than the requested width.
 *
 * @param <T> type of the rendered value
 */
@FunctionalInterface
public interface CustomRenderer<T> {

    /**
     * Renderer used when an object is captured without one.
     */
    CustomRenderer<Object> STRING_VALUE = (value, width, out) -> out.append(String.valueOf(value));

    /**
     * Appends the text of {@code value} to {@code out}.
     *
     * @param value the captured value
     * @param width the requested width, 0 if none
     * @param out   the buffer to append to
     */
    void render(T value, int width, FormatBuffer out);
}
