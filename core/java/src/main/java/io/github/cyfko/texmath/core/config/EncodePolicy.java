package io.github.cyfko.texmath.core.config;

import java.util.Objects;

/**
 * Configuration for turning encode results into text.
 *
 * @param nonStrictMode what to do with results the encoder could only approximate
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EncodePolicy(NonStrictMode nonStrictMode) {

    public EncodePolicy {
        Objects.requireNonNull(nonStrictMode, "nonStrictMode");
    }

    /**
     * Default configuration: unsupported constructs are replaced by their fallback and logged.
     *
     * @return default configuration
     */
    public static EncodePolicy defaults() {
        return new EncodePolicy(NonStrictMode.WARN);
    }

    /**
     * Strict configuration: unsupported constructs fail the encoding.
     *
     * @return strict configuration
     */
    public static EncodePolicy strict() {
        return new EncodePolicy(NonStrictMode.ERROR);
    }
}
