package io.github.cyfko.texmath.core.api;

import io.github.cyfko.texmath.core.ast.EquationRowNode;
import io.github.cyfko.texmath.core.exception.ExpansionLoopException;
import io.github.cyfko.texmath.core.exception.TexSyntaxException;

/**
 * Interface for parsing TeX math markup into a syntax tree.
 * <p>
 * Every call works on a fresh macro namespace: definitions made by one input never leak into
 * the next.
 * </p>
 *
 * <p><strong>Valid Input Examples:</strong></p>
 * <pre>{@code
 * parser.parse("a + b");
 * parser.parse("\\begin{pmatrix} a & b \\\\ c & d \\end{pmatrix}");
 * parser.parse("\\begin{array}{c|cc} a & b & c \\end{array}");
 * parser.parse("\\begin{CD} A @>f>> B \\end{CD}");
 * }</pre>
 *
 * <p><strong>Invalid Input Examples:</strong></p>
 * <pre>{@code
 * parser.parse("{a");                                  // Unclosed group
 * parser.parse("\\begin{array}{q} a \\end{array}");     // Unknown column alignment
 * parser.parse("\\def\\a{\\a}\\a");                     // Expansion loop
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface MathParser {

    /**
     * Parses TeX math markup.
     *
     * @param tex the source text, must not be {@code null}
     * @return the row holding the parsed nodes
     * @throws TexSyntaxException     if the input is malformed or exceeds the configured length
     * @throws ExpansionLoopException if macro expansion does not terminate within the configured budget
     */
    EquationRowNode parse(String tex) throws TexSyntaxException, ExpansionLoopException;
}
