package org.safeformat.runtime;

/**
 * The dynamic kind of a captured format argument.
 * <p>
 * Numeric kinds come first; {@link #isNumeric()} relies on that order.
 */
public enum ArgumentType {
    SIGNED_INTEGER("integer"),
    UNSIGNED_INTEGER("integer"),
    WIDE_SIGNED_INTEGER("integer"),
    WIDE_UNSIGNED_INTEGER("integer"),
    FLOATING_POINT("double"),
    EXTENDED_FLOATING_POINT("double"),
    CHARACTER("char"),
    TEXT("string"),
    POINTER("pointer"),
    CUSTOM("object");

    private static final ArgumentType LAST_NUMERIC_TYPE = EXTENDED_FLOATING_POINT;

    private final String displayName;

    ArgumentType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Name used in diagnostics, e.g. "unknown format code 'q' for integer".
     */
    public String displayName() {
        return displayName;
    }

    public boolean isNumeric() {
        return compareTo(LAST_NUMERIC_TYPE) <= 0;
    }

    public boolean isInteger() {
        return compareTo(WIDE_UNSIGNED_INTEGER) <= 0;
    }

    public boolean isUnsigned() {
        return this == UNSIGNED_INTEGER || this == WIDE_UNSIGNED_INTEGER;
    }

    public boolean isFloatingPoint() {
        return this == FLOATING_POINT || this == EXTENDED_FLOATING_POINT;
    }
}
