package io.github.cyfko.texmath.core.environment;

import java.util.Objects;

/**
 * Registration entry of an environment.
 *
 * @param numArgs number of required arguments read before the body
 * @param handler body parser
 */
public record EnvSpec(int numArgs, EnvironmentHandler handler) {

    public EnvSpec {
        if (numArgs < 0) {
            throw new IllegalArgumentException("numArgs must not be negative, got: " + numArgs);
        }
        Objects.requireNonNull(handler, "handler");
    }
}
