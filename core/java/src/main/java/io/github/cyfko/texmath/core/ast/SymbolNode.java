package io.github.cyfko.texmath.core.ast;

import java.util.Objects;

/**
 * A single character or a control sequence without structural meaning to the core,
 * e.g. {@code a}, {@code +}, {@code @} or {@code \alpha}.
 *
 * @param symbol source text of the symbol
 */
public record SymbolNode(String symbol) implements Node {

    public SymbolNode {
        Objects.requireNonNull(symbol, "symbol");
    }
}
