package io.github.cyfko.texmath.core.encoder;

import io.github.cyfko.texmath.core.config.EncodePolicy;
import io.github.cyfko.texmath.core.exception.TexEncodeException;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * A node the encoder does not support.
 * <p>
 * Stringifying substitutes {@code fragment}, logging a warning under
 * {@link io.github.cyfko.texmath.core.config.NonStrictMode#WARN}, or fails under
 * {@link io.github.cyfko.texmath.core.config.NonStrictMode#ERROR}.
 * </p>
 *
 * @param errorCode short machine-readable code
 * @param message   human-readable explanation
 * @param fragment  TeX text substituted for the node
 */
public record NonStrictEncodeResult(String errorCode, String message, String fragment) implements EncodeResult {

    private static final Logger log = Logger.getLogger(NonStrictEncodeResult.class.getName());

    public NonStrictEncodeResult {
        Objects.requireNonNull(errorCode, "errorCode");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(fragment, "fragment");
    }

    @Override
    public String stringify(EncodePolicy policy) {
        return switch (policy.nonStrictMode()) {
            case IGNORE -> fragment;
            case WARN -> {
                log.warning(() -> String.format("Encoding approximated (%s): %s", errorCode, message));
                yield fragment;
            }
            case ERROR -> throw new TexEncodeException(errorCode, message);
        };
    }

    @Override
    public boolean isSupported() {
        return false;
    }
}
