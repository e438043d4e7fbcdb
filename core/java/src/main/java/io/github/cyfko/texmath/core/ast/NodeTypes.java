package io.github.cyfko.texmath.core.ast;

import io.github.cyfko.texmath.core.exception.TexSyntaxException;

/**
 * Node type assertions used where the grammar requires a specific node shape.
 */
public final class NodeTypes {

    private NodeTypes() {}

    /**
     * Casts {@code node} to {@code type}.
     *
     * @throws TexSyntaxException if {@code node} is {@code null} or of another type
     */
    public static <T extends Node> T assertNodeType(Class<T> type, Node node) {
        if (!type.isInstance(node)) {
            throw new TexSyntaxException(String.format(
                "Expected node of type %s, but got %s",
                type.getSimpleName(), node == null ? "nothing" : node.getClass().getSimpleName()
            ));
        }
        return type.cast(node);
    }
}
