package io.github.cyfko.texmath.core.ast;

/**
 * Style of a vertical column separator or a horizontal rule between rows.
 */
public enum MatrixSeparatorStyle {
    NONE,
    SOLID,
    DASHED
}
