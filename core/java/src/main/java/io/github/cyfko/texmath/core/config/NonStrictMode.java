package io.github.cyfko.texmath.core.config;

/**
 * Strategy applied when an encode result reports a construct the encoder cannot
 * reproduce faithfully.
 */
public enum NonStrictMode {
    /**
     * Silently substitute the result's fallback fragment.
     */
    IGNORE,
    /**
     * Substitute the fallback fragment and log a warning.
     */
    WARN,
    /**
     * Throw a {@link io.github.cyfko.texmath.core.exception.TexEncodeException}.
     */
    ERROR
}
