package io.github.cyfko.texmath.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Nodes rendered with an overridden {@link MathStyle}.
 *
 * @param style    the style in effect for {@code children}
 * @param children the styled nodes
 */
public record StyleNode(MathStyle style, List<Node> children) implements Node {

    public StyleNode {
        Objects.requireNonNull(style, "style");
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }
}
