package io.github.cyfko.texmath.core.encoder;

import io.github.cyfko.texmath.core.config.EncodePolicy;

/**
 * Outcome of encoding a node to TeX.
 * <p>
 * Either a {@link StaticEncodeResult} carrying the text, or a {@link NonStrictEncodeResult}
 * describing a construct the encoder does not support. Turning a result into text is deferred
 * to {@link #stringify(EncodePolicy)} so that callers decide how unsupported constructs are treated.
 * </p>
 *
 * <pre>{@code
 * EncodeResult result = encoder.encode(node);
 * if (result instanceof NonStrictEncodeResult unsupported) {
 *     log.warning(unsupported.message());
 * }
 * String tex = result.stringify(EncodePolicy.defaults());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface EncodeResult {

    /**
     * Produces the TeX text of this result.
     *
     * @param policy how to treat unsupported constructs
     * @return the TeX text
     * @throws io.github.cyfko.texmath.core.exception.TexEncodeException if the result is not
     *         supported and the policy is strict
     */
    String stringify(EncodePolicy policy);

    /**
     * @return {@code true} if the result reproduces its node exactly
     */
    boolean isSupported();
}
