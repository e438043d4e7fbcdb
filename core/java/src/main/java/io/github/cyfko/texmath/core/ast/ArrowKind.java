package io.github.cyfko.texmath.core.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Arrow vocabulary of the {@code CD} environment, keyed by the character following {@code @}.
 */
public enum ArrowKind {
    RIGHT('>', false, true),
    LEFT('<', false, true),
    UP('A', true, true),
    DOWN('V', true, true),
    EQUALS('=', false, false),
    VERTICAL_EQUALS('|', true, false),
    EMPTY('.', false, false);

    private final char symbol;
    private final boolean vertical;
    private final boolean labeled;

    ArrowKind(char symbol, boolean vertical, boolean labeled) {
        this.symbol = symbol;
        this.vertical = vertical;
        this.labeled = labeled;
    }

    public char symbol() {
        return symbol;
    }

    /**
     * @return {@code true} for arrows placed in connector rows
     */
    public boolean isVertical() {
        return vertical;
    }

    /**
     * @return {@code true} if the arrow is written {@code @x label x label x}
     */
    public boolean takesLabels() {
        return labeled;
    }

    public static Optional<ArrowKind> fromSymbol(String text) {
        if (text == null || text.length() != 1) {
            return Optional.empty();
        }
        char c = text.charAt(0);
        return Arrays.stream(values()).filter(kind -> kind.symbol == c).findFirst();
    }
}
