package org.safeformat;

/**
 * Central configuration class for the formatting engine.
 * Contains constants that control buffer sizing and rendering defaults.
 * <p>
 * The inline sizes are performance settings only: output and argument
 * lists larger than them are handled transparently by spilling to
 * heap-backed storage.
 */
public final class Configuration {

    // Library version information
    public static final String version = "1.0.0";

    // Initial capacity of a formatter's output buffer, in bytes
    public static final int inlineBufferSize = 500;

    // Number of arguments a session stores before spilling to a growable list
    public static final int inlineArgumentCount = 10;

    // Precision used for floating-point conversions when none is given
    public static final int defaultFloatPrecision = 6;

    // Prevent instantiation
    private Configuration() {
    }
}
