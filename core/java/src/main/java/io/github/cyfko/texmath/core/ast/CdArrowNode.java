package io.github.cyfko.texmath.core.ast;

import java.util.Objects;

/**
 * An arrow cell of a commutative diagram.
 * <p>
 * Horizontal arrows carry their labels above and below, vertical arrows on the left and on the
 * right. An absent label is {@code null}.
 * </p>
 *
 * @param kind        arrow kind
 * @param firstLabel  label above (horizontal) or left (vertical)
 * @param secondLabel label below (horizontal) or right (vertical)
 */
public record CdArrowNode(ArrowKind kind, EquationRowNode firstLabel, EquationRowNode secondLabel) implements Node {

    public CdArrowNode {
        Objects.requireNonNull(kind, "kind");
    }

    public static CdArrowNode unlabeled(ArrowKind kind) {
        return new CdArrowNode(kind, null, null);
    }

    public boolean isVertical() {
        return kind.isVertical();
    }

    public boolean hasLabels() {
        return firstLabel != null || secondLabel != null;
    }
}
