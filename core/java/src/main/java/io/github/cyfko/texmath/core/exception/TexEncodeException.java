package io.github.cyfko.texmath.core.exception;

/**
 * Exception thrown when a node cannot be encoded back to TeX and the active
 * {@link io.github.cyfko.texmath.core.config.EncodePolicy} asks for strict behaviour.
 * <p>
 * Under the default policy an unsupported node yields a
 * {@link io.github.cyfko.texmath.core.encoder.NonStrictEncodeResult} instead; this
 * exception only surfaces from {@code stringify} under
 * {@link io.github.cyfko.texmath.core.config.NonStrictMode#ERROR}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TexEncodeException extends RuntimeException {

    private final String errorCode;

    /**
     * Creates a new TexEncodeException.
     *
     * @param errorCode short machine-readable code, e.g. {@code "unsupported matrix kind"}
     * @param message   human-readable explanation
     */
    public TexEncodeException(String errorCode, String message) {
        super(errorCode + ": " + message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
