package io.github.cyfko.texmath.core.api;

import io.github.cyfko.texmath.core.ast.Node;
import io.github.cyfko.texmath.core.encoder.EncodeResult;

/**
 * Interface for turning syntax-tree nodes back into TeX source.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface MathEncoder {

    /**
     * Encodes a node and its descendants.
     *
     * @param node the node to encode
     * @return the encoded text, or a non-strict result for unsupported constructs
     */
    EncodeResult encode(Node node);

    /**
     * Encodes a node and stringifies the result with this encoder's policy.
     *
     * @param node the node to encode
     * @return the TeX text
     */
    String encodeToString(Node node);
}
