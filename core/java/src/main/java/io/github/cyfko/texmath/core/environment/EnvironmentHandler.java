package io.github.cyfko.texmath.core.environment;

import io.github.cyfko.texmath.core.ast.Node;
import io.github.cyfko.texmath.core.parsing.TexParser;

/**
 * Parses the body of a {@code \begin{name} ... \end{name}} environment.
 * <p>
 * The handler is invoked after the environment's required arguments have been read. It must
 * consume the body up to, but not including, the closing {@code \end}; the parser checks the
 * closing name itself.
 * </p>
 */
@FunctionalInterface
public interface EnvironmentHandler {

    /**
     * @param parser  parser positioned at the start of the body
     * @param context resolved environment name, mode and arguments
     * @return the node representing the whole environment
     */
    Node handle(TexParser parser, EnvContext context);
}
