package io.github.cyfko.texmath.core.parsing;

/**
 * Lexical category of a {@link Token}.
 */
public enum TokenKind {
    /** {@code \name} or {@code \x} for a single non-letter {@code x}. */
    CONTROL_SEQUENCE,
    /** Any single character that is not a group delimiter or whitespace. */
    CHARACTER,
    /** A run of whitespace, normalised to one space. */
    WHITESPACE,
    /** {@code {} */
    BEGIN_GROUP,
    /** {@code }} */
    END_GROUP,
    /** End-of-input sentinel. */
    EOF
}
