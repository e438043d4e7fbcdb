package io.github.cyfko.texmath.core.parsing;

/**
 * Parsing mode. Whitespace is insignificant in {@link #MATH} and kept as a symbol in {@link #TEXT}.
 */
public enum Mode {
    MATH,
    TEXT
}
