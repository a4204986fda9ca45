package org.safeformat;

import org.safeformat.runtime.FormatArgument;
import org.safeformat.runtime.FormatError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.ByteBuffer;

/**
 * One formatting call: a template waiting for its arguments.
 * <p>
 * Arguments are inserted left to right; the n-th insertion is argument
 * {@code {n}} of the template. The first call to {@link #text()}, {@link #view()},
 * {@link #size()} or {@link #close()} finalizes the session: the template is
 * rendered and the session's action runs. Both happen exactly once, however
 * many finalizing calls follow. A session can be used with try-with-resources
 * so the action runs when the block exits:
 * <pre>
 *   try (FormatSession s = Format.print("{0} of {1} done")) {
 *       s.insert(done).insert(total);
 *   }
 * </pre>
 */
public final class FormatSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FormatSession.class);

    private enum State {
        OPEN,
        RENDERED,
        FAILED,
        HANDED_OFF
    }

    private final Formatter formatter;
    private final FormatAction action;
    private State state = State.OPEN;
    private RuntimeException failure;

    FormatSession(Formatter formatter, FormatAction action) {
        this.formatter = formatter;
        this.action = action;
    }

    public FormatSession insert(int value) {
        return insert(FormatArgument.ofInt(value));
    }

    public FormatSession insert(long value) {
        return insert(FormatArgument.ofLong(value));
    }

    public FormatSession insert(double value) {
        return insert(FormatArgument.ofDouble(value));
    }

    public FormatSession insert(float value) {
        return insert(FormatArgument.ofDouble(value));
    }

    /**
     * @throws IllegalArgumentException if {@code value} is above {@code 0x7F}
     */
    public FormatSession insert(char value) {
        return insert(FormatArgument.ofChar(value));
    }

    public FormatSession insert(CharSequence value) {
        return insert(FormatArgument.ofText(value));
    }

    public FormatSession insert(BigDecimal value) {
        return insert(FormatArgument.ofExtended(value));
    }

    /**
     * Inserts a value with the kind implied by its runtime class.
     *
     * @see FormatArgument#of(Object)
     */
    public FormatSession insert(Object value) {
        return insert(FormatArgument.of(value));
    }

    public FormatSession insert(FormatArgument argument) {
        checkOpen();
        formatter.add(argument);
        return this;
    }

    /**
     * Moves the pending render to a new session handle. This handle is disarmed:
     * any later call on it throws {@link IllegalStateException}.
     *
     * @return the handle that now owns the render
     */
    public FormatSession handOff() {
        checkOpen();
        state = State.HANDED_OFF;
        log.debug("Format session handed off to a new owner");
        return new FormatSession(formatter, action);
    }

    /**
     * Renders the template if needed and returns the formatter's whole output.
     *
     * @throws FormatError if the template does not match the arguments
     */
    public String text() {
        finish();
        return formatter.text();
    }

    /**
     * Renders the template if needed and returns a read-only view of the output
     * followed by a zero byte.
     *
     * @throws FormatError if the template does not match the arguments
     */
    public ByteBuffer view() {
        finish();
        return formatter.view();
    }

    /**
     * Renders the template if needed and returns the output size in bytes.
     */
    public int size() {
        finish();
        return formatter.size();
    }

    public boolean isFinished() {
        return state == State.RENDERED || state == State.FAILED;
    }

    /**
     * Finalizes the session.
     *
     * @throws FormatError if the template does not match the arguments
     * @throws RuntimeException if a custom renderer fails; later calls rethrow it
     */
    @Override
    public void close() {
        finish();
    }

    private void checkOpen() {
        if (state == State.HANDED_OFF) {
            throw new IllegalStateException("format session was handed off to another owner");
        }
        if (state != State.OPEN) {
            throw new IllegalStateException("format session has already been finalized");
        }
    }

    private void finish() {
        switch (state) {
            case RENDERED:
                return;
            case FAILED:
                throw failure;
            case HANDED_OFF:
                throw new IllegalStateException("format session was handed off to another owner");
            default:
                break;
        }
        try {
            formatter.render();
        } catch (RuntimeException e) {
            state = State.FAILED;
            failure = e;
            throw e;
        }
        state = State.RENDERED;
        if (action != FormatAction.IGNORE) {
            log.debug("Running finalization action on {} byte(s) of output", formatter.size());
        }
        action.accept(formatter);
    }
}
