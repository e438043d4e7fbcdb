package io.github.cyfko.texmath.core.parsing;

import java.util.Objects;

/**
 * Atomic lexical unit produced by the {@link Lexer}.
 *
 * @param kind     lexical category
 * @param text     source text of the token ({@code "EOF"} for the sentinel)
 * @param position offset in the source text, or {@code -1} for tokens synthesized from macro bodies
 */
public record Token(TokenKind kind, String text, int position) {

    public static final String EOF_TEXT = "EOF";

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    /**
     * Returns a copy of this token detached from any source position.
     *
     * @return the same token with position {@code -1}
     */
    public Token synthesized() {
        return position < 0 ? this : new Token(kind, text, -1);
    }

    public boolean isEof() {
        return kind == TokenKind.EOF;
    }

    @Override
    public String toString() {
        return String.format("Token[%s, '%s', %d]", kind, text, position);
    }
}
