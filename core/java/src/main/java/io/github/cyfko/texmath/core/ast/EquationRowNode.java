package io.github.cyfko.texmath.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * An ordered run of nodes forming one line of math. Every parsed expression, brace group,
 * matrix cell and arrow label is a row.
 *
 * @param children the nodes of the row
 */
public record EquationRowNode(List<Node> children) implements Node {

    public EquationRowNode {
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    public static EquationRowNode empty() {
        return new EquationRowNode(List.of());
    }

    /**
     * Wraps {@code nodes} in a row.
     *
     * @param nodes the row content
     * @return a new row
     */
    public static EquationRowNode wrap(List<? extends Node> nodes) {
        return new EquationRowNode(List.copyOf(nodes));
    }

    public static EquationRowNode of(Node... nodes) {
        return new EquationRowNode(List.of(nodes));
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }
}
