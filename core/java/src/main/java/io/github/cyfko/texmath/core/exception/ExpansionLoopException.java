package io.github.cyfko.texmath.core.exception;

/**
 * Exception thrown when macro expansion exceeds the configured expansion budget.
 * <p>
 * Runaway self-reference such as {@code \def\a{\a}\a} never yields a non-macro token,
 * so the expander counts every expansion performed during one parse and gives up
 * once {@link io.github.cyfko.texmath.core.config.ParserPolicy#maxExpand()} is exceeded.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ExpansionLoopException extends RuntimeException {

    /**
     * Creates a new ExpansionLoopException.
     *
     * @param message explanation including the exceeded limit
     */
    public ExpansionLoopException(String message) {
        super(message);
    }
}
