package io.github.cyfko.texmath.core.ast;

/**
 * Node of the math syntax tree.
 * <p>
 * Nodes are immutable values; structural equality is record equality.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface Node {
}
