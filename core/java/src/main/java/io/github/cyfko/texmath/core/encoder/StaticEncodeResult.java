package io.github.cyfko.texmath.core.encoder;

import io.github.cyfko.texmath.core.config.EncodePolicy;

import java.util.Objects;

/**
 * Successfully encoded TeX text.
 *
 * @param text the TeX source
 */
public record StaticEncodeResult(String text) implements EncodeResult {

    public StaticEncodeResult {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String stringify(EncodePolicy policy) {
        return text;
    }

    @Override
    public boolean isSupported() {
        return true;
    }
}
