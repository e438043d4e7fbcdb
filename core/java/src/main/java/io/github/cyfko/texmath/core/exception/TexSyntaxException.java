package io.github.cyfko.texmath.core.exception;

import io.github.cyfko.texmath.core.parsing.Token;

/**
 * Exception thrown when TeX math markup contains a syntax error.
 * <p>
 * This is the single error channel for structural failures detected while lexing,
 * expanding or parsing: an unexpected token where a specific delimiter was required,
 * a missing arrow terminator in a {@code CD} body, a malformed column specification,
 * an invalid numeric parameter such as {@code \arraystretch}, or too many columns
 * in a single-column environment.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("\\begin{array}{x} a \\end{array}");
 * // → "Unknown column alignment: x"
 *
 * parser.parse("\\begin{CD} A @>f> B \\end{CD}");
 * // → "Missing a > character to complete a CD arrow."
 *
 * parser.parse("\\begin{matrix} a \\end{pmatrix}");
 * // → "Mismatch: \begin{matrix} matched by \end{pmatrix} at position 19: '\end'"
 * }</pre>
 *
 * <p>When the offending token is known it is kept on the exception and its text and
 * source offset are appended to the message.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TexSyntaxException extends RuntimeException {

    private final transient Token token;

    /**
     * Constructor with an explanatory error message.
     *
     * @param message the message describing the cause of the exception
     */
    public TexSyntaxException(String message) {
        this(message, (Token) null);
    }

    /**
     * Constructor with an explanatory message and the token where the error was detected.
     *
     * @param message the message describing the cause of the exception
     * @param token   the offending token, may be {@code null}
     */
    public TexSyntaxException(String message, Token token) {
        super(describe(message, token));
        this.token = token;
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the cause of the exception
     * @param cause   the original cause of this exception
     */
    public TexSyntaxException(String message, Throwable cause) {
        super(message, cause);
        this.token = null;
    }

    /**
     * Returns the token at which the error was detected.
     *
     * @return the offending token, or {@code null} if unknown
     */
    public Token getToken() {
        return token;
    }

    private static String describe(String message, Token token) {
        if (token == null || message == null) {
            return message;
        }
        if (token.position() < 0) {
            return message + ": '" + token.text() + "'";
        }
        return message + " at position " + token.position() + ": '" + token.text() + "'";
    }
}
