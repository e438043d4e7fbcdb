package io.github.cyfko.texmath.core.parsing;

import io.github.cyfko.texmath.core.exception.TexSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Lexer Tests")
class LexerTest {

    private static List<Token> lexAll(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = new ArrayList<>();
        for (Token token = lexer.lex(); !token.isEof(); token = lexer.lex()) {
            tokens.add(token);
        }
        return tokens;
    }

    @Nested
    @DisplayName("Control sequences")
    class ControlSequences {

        @Test
        @DisplayName("Control word swallows the whitespace that follows it")
        void controlWordSkipsTrailingSpaces() {
            List<Token> tokens = lexAll("\\alpha  b");

            assertEquals(List.of(
                new Token(TokenKind.CONTROL_SEQUENCE, "\\alpha", 0),
                new Token(TokenKind.CHARACTER, "b", 8)
            ), tokens);
        }

        @Test
        @DisplayName("Backslash followed by a non-letter is a one-character control symbol")
        void controlSymbol() {
            List<Token> tokens = lexAll("\\\\\\{a");

            assertEquals(3, tokens.size());
            assertEquals("\\\\", tokens.get(0).text());
            assertEquals("\\{", tokens.get(1).text());
            assertEquals(TokenKind.CONTROL_SEQUENCE, tokens.get(1).kind());
            assertEquals("a", tokens.get(2).text());
        }

        @Test
        @DisplayName("Lone trailing backslash is rejected")
        void trailingBackslash() {
            TexSyntaxException exception = assertThrows(TexSyntaxException.class, () -> lexAll("a\\"));

            assertTrue(exception.getMessage().contains("Unexpected end of input after '\\'"));
            assertEquals(1, exception.getToken().position());
        }
    }

    @Nested
    @DisplayName("Characters, groups and whitespace")
    class Characters {

        @Test
        @DisplayName("A run of whitespace becomes a single token")
        void whitespaceRun() {
            List<Token> tokens = lexAll("a \t\n b");

            assertEquals(3, tokens.size());
            assertEquals(new Token(TokenKind.WHITESPACE, " ", 1), tokens.get(1));
            assertEquals(5, tokens.get(2).position());
        }

        @Test
        @DisplayName("Braces are group tokens")
        void braces() {
            List<Token> tokens = lexAll("{x}");

            assertEquals(TokenKind.BEGIN_GROUP, tokens.get(0).kind());
            assertEquals(TokenKind.CHARACTER, tokens.get(1).kind());
            assertEquals(TokenKind.END_GROUP, tokens.get(2).kind());
        }

        @Test
        @DisplayName("Comments run to the end of the line")
        void comments() {
            List<String> texts = lexAll("a % ignored & \\foo\nb").stream().map(Token::text).toList();

            assertEquals(List.of("a", " ", "b"), texts);
        }

        @Test
        @DisplayName("EOF is returned repeatedly once input is exhausted")
        void eofIsSticky() {
            Lexer lexer = new Lexer("x");
            lexer.lex();

            Token first = lexer.lex();
            Token second = lexer.lex();

            assertTrue(first.isEof());
            assertTrue(second.isEof());
            assertEquals(Token.EOF_TEXT, second.text());
            assertEquals(1, second.position());
        }
    }

    @Test
    @DisplayName("tokenize() drops EOF and source positions")
    void tokenizeForMacroBodies() {
        List<Token> tokens = Lexer.tokenize("\\cr x");

        assertEquals(List.of(
            new Token(TokenKind.CONTROL_SEQUENCE, "\\cr", -1),
            new Token(TokenKind.CHARACTER, "x", -1)
        ), tokens);
    }
}
