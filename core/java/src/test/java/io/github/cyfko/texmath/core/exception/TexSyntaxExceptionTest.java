package io.github.cyfko.texmath.core.exception;

import io.github.cyfko.texmath.core.parsing.Token;
import io.github.cyfko.texmath.core.parsing.TokenKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TexSyntaxException Tests")
class TexSyntaxExceptionTest {

    @Test
    @DisplayName("Should append token text and position to the message")
    void messageWithToken() {
        Token token = new Token(TokenKind.CHARACTER, "}", 7);

        TexSyntaxException exception = new TexSyntaxException("Expected 'EOF'", token);

        assertEquals("Expected 'EOF' at position 7: '}'", exception.getMessage());
        assertSame(token, exception.getToken());
    }

    @Test
    @DisplayName("Should omit the position of synthesized tokens")
    void messageWithSynthesizedToken() {
        TexSyntaxException exception = new TexSyntaxException("Bad", new Token(TokenKind.CONTROL_SEQUENCE, "\\cr", -1));

        assertEquals("Bad: '\\cr'", exception.getMessage());
    }

    @Test
    @DisplayName("Should keep the plain message without a token")
    void messageOnly() {
        TexSyntaxException exception = new TexSyntaxException("Unknown column alignment: x");

        assertEquals("Unknown column alignment: x", exception.getMessage());
        assertNull(exception.getToken());
        assertInstanceOf(RuntimeException.class, exception);
    }

    @Test
    @DisplayName("Should preserve the cause")
    void withCause() {
        NumberFormatException cause = new NumberFormatException("abc");

        TexSyntaxException exception = new TexSyntaxException("Invalid \\arraystretch: abc", cause);

        assertSame(cause, exception.getCause());
        assertNull(exception.getToken());
    }

    @Test
    @DisplayName("Encode exception exposes its error code")
    void encodeErrorCode() {
        TexEncodeException exception = new TexEncodeException("unsupported matrix kind", "only CD");

        assertEquals("unsupported matrix kind", exception.getErrorCode());
        assertEquals("unsupported matrix kind: only CD", exception.getMessage());
    }
}
