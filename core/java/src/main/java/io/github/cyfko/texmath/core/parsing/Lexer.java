package io.github.cyfko.texmath.core.parsing;

import io.github.cyfko.texmath.core.exception.TexSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits raw TeX source into {@link Token}s.
 * <p>
 * Lexing rules:
 * </p>
 * <ul>
 *   <li>{@code \} followed by ASCII letters is a control word; whitespace after it is skipped</li>
 *   <li>{@code \} followed by any other character is a control symbol ({@code \\}, {@code \{}, ...)</li>
 *   <li>a run of whitespace becomes one {@link TokenKind#WHITESPACE} token</li>
 *   <li>{@code %} starts a comment that runs to the end of the line</li>
 *   <li>once the input is exhausted {@link TokenKind#EOF} is returned on every call</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Lexer {

    private final String input;
    private int pos;

    public Lexer(String input) {
        this.input = input == null ? "" : input;
    }

    /**
     * Lexes the whole of {@code source}, excluding the final EOF. Positions are discarded
     * since the result is used as a macro body.
     *
     * @param source the text to lex
     * @return the tokens of {@code source}
     */
    public static List<Token> tokenize(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = new ArrayList<>();
        for (Token token = lexer.lex(); !token.isEof(); token = lexer.lex()) {
            tokens.add(token.synthesized());
        }
        return tokens;
    }

    /**
     * Returns the next token of the input.
     *
     * @return the next token, {@link TokenKind#EOF} at end of input
     * @throws TexSyntaxException on a trailing lone backslash
     */
    public Token lex() {
        skipComments();
        if (pos >= input.length()) {
            return new Token(TokenKind.EOF, Token.EOF_TEXT, input.length());
        }

        int start = pos;
        char c = input.charAt(pos);

        if (Character.isWhitespace(c)) {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
            return new Token(TokenKind.WHITESPACE, " ", start);
        }

        switch (c) {
            case '\\' -> {
                return lexControlSequence(start);
            }
            case '{' -> {
                pos++;
                return new Token(TokenKind.BEGIN_GROUP, "{", start);
            }
            case '}' -> {
                pos++;
                return new Token(TokenKind.END_GROUP, "}", start);
            }
            default -> {
                int end = pos + Character.charCount(input.codePointAt(pos));
                pos = end;
                return new Token(TokenKind.CHARACTER, input.substring(start, end), start);
            }
        }
    }

    private Token lexControlSequence(int start) {
        pos++;
        if (pos >= input.length()) {
            throw new TexSyntaxException("Unexpected end of input after '\\'",
                new Token(TokenKind.CHARACTER, "\\", start));
        }

        if (isAsciiLetter(input.charAt(pos))) {
            while (pos < input.length() && isAsciiLetter(input.charAt(pos))) {
                pos++;
            }
            String name = input.substring(start, pos);
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
            return new Token(TokenKind.CONTROL_SEQUENCE, name, start);
        }

        pos += Character.charCount(input.codePointAt(pos));
        return new Token(TokenKind.CONTROL_SEQUENCE, input.substring(start, pos), start);
    }

    private void skipComments() {
        while (pos < input.length() && input.charAt(pos) == '%') {
            int newline = input.indexOf('\n', pos);
            pos = newline < 0 ? input.length() : newline + 1;
        }
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
