package io.github.cyfko.texmath.core.ast;

/**
 * Row break ({@code \\} or {@code \cr}) with an optional extra vertical gap.
 *
 * @param size the gap given as {@code \\[size]}, or {@code null}
 */
public record CrNode(Measurement size) implements Node {
}
