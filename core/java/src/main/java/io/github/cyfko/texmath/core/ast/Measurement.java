package io.github.cyfko.texmath.core.ast;

import io.github.cyfko.texmath.core.exception.TexSyntaxException;
import io.github.cyfko.texmath.core.parsing.Token;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A TeX dimension such as {@code 2pt} or {@code -0.5em}.
 *
 * @param value numeric value
 * @param unit  two-letter TeX unit
 */
public record Measurement(double value, String unit) {

    public static final Measurement ZERO = new Measurement(0, "pt");

    private static final Pattern SIZE = Pattern.compile("^\\s*([-+]?)\\s*(\\d+(?:\\.\\d*)?|\\.\\d+)\\s*([a-z]{2})\\s*$");

    private static final Set<String> UNITS = Set.of(
        "pt", "mm", "cm", "in", "bp", "pc", "dd", "cc", "nd", "nc", "sp", "px", "ex", "em", "mu"
    );

    public Measurement {
        Objects.requireNonNull(unit, "unit");
    }

    /**
     * Parses a size written in TeX syntax.
     *
     * @param text   the size text, e.g. {@code "1.5 em"}
     * @param origin token reported on failure
     * @return the measurement
     * @throws TexSyntaxException if {@code text} is not a number followed by a known unit
     */
    public static Measurement parse(String text, Token origin) {
        Matcher matcher = SIZE.matcher(text);
        if (!matcher.matches()) {
            throw new TexSyntaxException("Invalid size: '" + text + "'", origin);
        }
        String unit = matcher.group(3);
        if (!UNITS.contains(unit)) {
            throw new TexSyntaxException("Invalid unit: '" + unit + "'", origin);
        }
        double value = Double.parseDouble(matcher.group(2));
        return new Measurement("-".equals(matcher.group(1)) ? -value : value, unit);
    }

    @Override
    public String toString() {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return (long) value + unit;
        }
        return value + unit;
    }
}
