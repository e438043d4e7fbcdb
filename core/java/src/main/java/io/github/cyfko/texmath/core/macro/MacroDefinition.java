package io.github.cyfko.texmath.core.macro;

import io.github.cyfko.texmath.core.parsing.Lexer;
import io.github.cyfko.texmath.core.parsing.Token;

import java.util.List;
import java.util.Objects;

/**
 * Replacement rule for a control sequence: a token list with up to nine {@code #n} parameters.
 *
 * <pre>{@code
 * // \\ behaves like \cr inside an array body
 * MacroDefinition cr = MacroDefinition.fromString("\\cr");
 *
 * // \pair{a}{b} expands to (a,b)
 * MacroDefinition pair = MacroDefinition.fromString("(#1,#2)", 2);
 * }</pre>
 *
 * @param tokens  replacement tokens in reading order
 * @param numArgs number of arguments consumed at each use
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record MacroDefinition(List<Token> tokens, int numArgs) {

    public MacroDefinition {
        Objects.requireNonNull(tokens, "tokens");
        if (numArgs < 0 || numArgs > 9) {
            throw new IllegalArgumentException("numArgs must be between 0 and 9, got: " + numArgs);
        }
        tokens = List.copyOf(tokens);
    }

    /**
     * Creates a parameterless definition from TeX source.
     *
     * @param replacement the replacement text
     * @return the definition
     */
    public static MacroDefinition fromString(String replacement) {
        return fromString(replacement, 0);
    }

    /**
     * Creates a definition from TeX source.
     *
     * @param replacement the replacement text, may reference {@code #1}..{@code #numArgs}
     * @param numArgs     number of arguments
     * @return the definition
     */
    public static MacroDefinition fromString(String replacement, int numArgs) {
        return new MacroDefinition(Lexer.tokenize(replacement), numArgs);
    }
}
