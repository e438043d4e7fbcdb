package io.github.cyfko.texmath.core.ast;

public enum MatrixColumnAlign {
    LEFT,
    CENTER,
    RIGHT
}
