package io.github.cyfko.texmath.core.environment;

import io.github.cyfko.texmath.core.ast.Node;
import io.github.cyfko.texmath.core.parsing.Mode;

import java.util.List;
import java.util.Objects;

/**
 * Invocation context handed to an {@link EnvironmentHandler}.
 *
 * @param envName name used in {@code \begin}, lets aliases share one handler
 * @param mode    mode of the enclosing expression
 * @param args    the required arguments, in order
 */
public record EnvContext(String envName, Mode mode, List<Node> args) {

    public EnvContext {
        Objects.requireNonNull(envName, "envName");
        Objects.requireNonNull(mode, "mode");
        args = List.copyOf(Objects.requireNonNull(args, "args"));
    }
}
