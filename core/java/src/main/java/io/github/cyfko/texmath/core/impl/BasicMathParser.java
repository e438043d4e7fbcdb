package io.github.cyfko.texmath.core.impl;

import io.github.cyfko.texmath.core.api.MathParser;
import io.github.cyfko.texmath.core.ast.EquationRowNode;
import io.github.cyfko.texmath.core.config.ParserPolicy;
import io.github.cyfko.texmath.core.exception.ExpansionLoopException;
import io.github.cyfko.texmath.core.exception.TexSyntaxException;
import io.github.cyfko.texmath.core.macro.MacroDefinition;
import io.github.cyfko.texmath.core.macro.MacroTable;
import io.github.cyfko.texmath.core.parsing.TexParser;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Default {@link MathParser} implementation.
 * <p>
 * Each call to {@link #parse(String)} builds a fresh {@link MacroTable} on top of the seed
 * macros given at construction and runs a {@link TexParser} over the input. Definitions made
 * with {@code \def} or {@code \gdef} never outlive the call, so one instance can be shared
 * across threads.
 * </p>
 *
 * <h2>DoS Protection (Complexity Limits)</h2>
 * <p>
 * The parser enforces the limits of its {@link ParserPolicy}:
 * </p>
 * <ul>
 *   <li><strong>Expression Length</strong>: Rejects sources exceeding the configured character size</li>
 *   <li><strong>Expansion Budget</strong>: Aborts macro expansion once the configured count is exceeded</li>
 * </ul>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * // Default configuration
 * MathParser parser = new BasicMathParser();
 * EquationRowNode tree = parser.parse("\\begin{pmatrix} a & b \\end{pmatrix}");
 *
 * // Strict configuration (for untrusted input)
 * MathParser strictParser = new BasicMathParser(ParserPolicy.strict());
 *
 * // Seeded macros
 * MathParser seeded = new BasicMathParser(ParserPolicy.defaults(), Map.of("\\R", "\\mathbb{R}"));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicMathParser implements MathParser {

    private static final Logger log = Logger.getLogger(BasicMathParser.class.getName());

    private final ParserPolicy parserPolicy;
    private final Map<String, MacroDefinition> seedMacros;

    /**
     * Default constructor using {@link ParserPolicy#defaults()} and no seed macros.
     */
    public BasicMathParser() {
        this(ParserPolicy.defaults());
    }

    /**
     * Constructor with custom limits and no seed macros.
     *
     * @param parserPolicy the parser configuration
     * @throws IllegalArgumentException if the policy is null
     */
    public BasicMathParser(ParserPolicy parserPolicy) {
        this(parserPolicy, Map.of());
    }

    /**
     * Constructor with custom limits and macros visible to every parse.
     *
     * @param parserPolicy the parser configuration
     * @param seedMacros   parameterless macros, keyed by control sequence (e.g. {@code "\\R"}),
     *                     valued by their replacement text
     * @throws IllegalArgumentException if the policy or the macro map is null
     */
    public BasicMathParser(ParserPolicy parserPolicy, Map<String, String> seedMacros) {
        if (parserPolicy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        if (seedMacros == null) {
            throw new IllegalArgumentException("Seed macros are required, use an empty map for none");
        }

        Map<String, MacroDefinition> definitions = new HashMap<>();
        seedMacros.forEach((name, replacement) -> definitions.put(name, MacroDefinition.fromString(replacement)));

        this.parserPolicy = parserPolicy;
        this.seedMacros = Map.copyOf(definitions);
    }

    public ParserPolicy getParserPolicy() {
        return parserPolicy;
    }

    /**
     * Parses TeX math markup into a row node.
     *
     * @param tex the source text
     * @return the parsed row
     * @throws TexSyntaxException     if the source is {@code null}, too long or malformed
     * @throws ExpansionLoopException if macro expansion exceeds the policy budget
     */
    @Override
    public EquationRowNode parse(String tex) throws TexSyntaxException, ExpansionLoopException {
        if (tex == null) {
            throw new TexSyntaxException("TeX source cannot be null");
        }
        if (tex.length() > parserPolicy.maxExpressionLength()) {
            throw new TexSyntaxException(String.format(
                "Expression too long (%d characters, max: %d). Policy applied: %s",
                tex.length(), parserPolicy.maxExpressionLength(), parserPolicy.policyName()
            ));
        }

        long start = System.nanoTime();
        EquationRowNode result = new TexParser(tex, new MacroTable(seedMacros), parserPolicy).parse();
        long durationMs = (System.nanoTime() - start) / 1_000_000;

        log.fine(() -> String.format(
            "Parsed %d characters into %d top-level nodes in %d ms",
            tex.length(), result.children().size(), durationMs
        ));
        return result;
    }
}
