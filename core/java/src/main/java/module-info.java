module io.github.cyfko.texmath.core {
    requires java.logging;

    exports io.github.cyfko.texmath.core.api;
    exports io.github.cyfko.texmath.core.ast;
    exports io.github.cyfko.texmath.core.config;
    exports io.github.cyfko.texmath.core.encoder;
    exports io.github.cyfko.texmath.core.environment;
    exports io.github.cyfko.texmath.core.exception;
    exports io.github.cyfko.texmath.core.impl;
    exports io.github.cyfko.texmath.core.macro;
    exports io.github.cyfko.texmath.core.parsing;
}
