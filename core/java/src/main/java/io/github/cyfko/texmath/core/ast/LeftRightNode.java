package io.github.cyfko.texmath.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Content enclosed by a pair of stretchy delimiters ({@code \left( ... \right)}).
 *
 * @param leftDelim  opening delimiter as TeX text, e.g. {@code "("} or {@code "\\{"}
 * @param rightDelim closing delimiter as TeX text
 * @param body       enclosed rows
 */
public record LeftRightNode(String leftDelim, String rightDelim, List<EquationRowNode> body) implements Node {

    public LeftRightNode {
        Objects.requireNonNull(leftDelim, "leftDelim");
        Objects.requireNonNull(rightDelim, "rightDelim");
        body = List.copyOf(Objects.requireNonNull(body, "body"));
    }
}
