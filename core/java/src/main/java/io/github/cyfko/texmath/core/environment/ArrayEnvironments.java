package io.github.cyfko.texmath.core.environment;

import io.github.cyfko.texmath.core.ast.CrNode;
import io.github.cyfko.texmath.core.ast.EquationRowNode;
import io.github.cyfko.texmath.core.ast.LeftRightNode;
import io.github.cyfko.texmath.core.ast.MathStyle;
import io.github.cyfko.texmath.core.ast.MatrixColumnAlign;
import io.github.cyfko.texmath.core.ast.MatrixNode;
import io.github.cyfko.texmath.core.ast.MatrixSeparatorStyle;
import io.github.cyfko.texmath.core.ast.Measurement;
import io.github.cyfko.texmath.core.ast.Node;
import io.github.cyfko.texmath.core.ast.NodeTypes;
import io.github.cyfko.texmath.core.ast.StyleNode;
import io.github.cyfko.texmath.core.ast.SymbolNode;
import io.github.cyfko.texmath.core.exception.TexSyntaxException;
import io.github.cyfko.texmath.core.macro.MacroDefinition;
import io.github.cyfko.texmath.core.macro.MacroExpander;
import io.github.cyfko.texmath.core.parsing.TexParser;
import io.github.cyfko.texmath.core.parsing.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Tabular environments: {@code array}, {@code darray}, the matrix family, {@code smallmatrix}
 * and {@code subarray}.
 * <p>
 * All of them share {@link #parseArray(TexParser, ArrayOptions)}, which reads a body whose rows
 * are separated by {@code \\} and whose columns are separated by {@code &}.
 * </p>
 *
 * <h2>Environments</h2>
 * <ul>
 *   <li>{@code array}, {@code darray}: one column-spec argument such as {@code {c|cc}};
 *       {@code darray} cells are display style</li>
 *   <li>{@code matrix}, {@code pmatrix}, {@code bmatrix}, {@code Bmatrix}, {@code vmatrix},
 *       {@code Vmatrix}: no argument; all but {@code matrix} are wrapped in delimiters</li>
 *   <li>{@code smallmatrix}: script style, half row stretch, compact</li>
 *   <li>{@code subarray}: one column, aligned {@code l} or {@code c}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ArrayEnvironments {

    static final String ROW_BREAK = "\\\\";
    static final String CELL_BREAK = "\\cr";
    static final String ARRAY_STRETCH = "\\arraystretch";

    static final Map<String, EnvSpec> ENTRIES = Map.ofEntries(
        Map.entry("array", new EnvSpec(1, ArrayEnvironments::arrayHandler)),
        Map.entry("darray", new EnvSpec(1, ArrayEnvironments::arrayHandler)),
        Map.entry("matrix", new EnvSpec(0, ArrayEnvironments::matrixHandler)),
        Map.entry("pmatrix", new EnvSpec(0, ArrayEnvironments::matrixHandler)),
        Map.entry("bmatrix", new EnvSpec(0, ArrayEnvironments::matrixHandler)),
        Map.entry("Bmatrix", new EnvSpec(0, ArrayEnvironments::matrixHandler)),
        Map.entry("vmatrix", new EnvSpec(0, ArrayEnvironments::matrixHandler)),
        Map.entry("Vmatrix", new EnvSpec(0, ArrayEnvironments::matrixHandler)),
        Map.entry("smallmatrix", new EnvSpec(0, ArrayEnvironments::smallMatrixHandler)),
        Map.entry("subarray", new EnvSpec(1, ArrayEnvironments::subArrayHandler))
    );

    // unsigned plain decimal
    private static final Pattern DECIMAL = Pattern.compile("\\d+(\\.\\d*)?|\\.\\d+");

    private static final Map<String, List<String>> DELIMITERS = Map.of(
        "pmatrix", List.of("(", ")"),
        "bmatrix", List.of("[", "]"),
        "Bmatrix", List.of("\\{", "\\}"),
        "vmatrix", List.of("|", "|"),
        "Vmatrix", List.of("\\Vert", "\\Vert")
    );

    private ArrayEnvironments() {}

    /**
     * Layout options of {@link #parseArray(TexParser, ArrayOptions)}.
     *
     * @param hskipBeforeAndAfter pad the outer edges
     * @param arrayStretch        fixed stretch, or {@code null} to read {@code \arraystretch}
     * @param separators          vertical separators from the column spec
     * @param colAligns           column alignments from the column spec
     * @param style               style forced on every cell, or {@code null}
     * @param isSmall             compact layout
     */
    public record ArrayOptions(
        boolean hskipBeforeAndAfter,
        Double arrayStretch,
        List<MatrixSeparatorStyle> separators,
        List<MatrixColumnAlign> colAligns,
        MathStyle style,
        boolean isSmall
    ) {
        public ArrayOptions {
            separators = List.copyOf(separators);
            colAligns = List.copyOf(colAligns);
        }

        public static ArrayOptions of(boolean hskipBeforeAndAfter, MathStyle style) {
            return new ArrayOptions(hskipBeforeAndAfter, null, List.of(), List.of(), style, false);
        }
    }

    /**
     * Parses an array body up to, but not including, {@code \end}.
     * <p>
     * {@code \\} is mapped to {@code \cr} for the duration of the body so that cells can be read
     * with {@code \cr} as stop token. Every cell is parsed in its own macro scope. Both scopes are
     * closed before returning, whether parsing succeeds or not.
     * </p>
     *
     * @param parser  parser positioned at the start of the body
     * @param options layout options
     * @return the grid
     * @throws TexSyntaxException on a malformed body or an invalid {@code \arraystretch}
     */
    public static MatrixNode parseArray(TexParser parser, ArrayOptions options) {
        MacroExpander expander = parser.macroExpander();

        List<EquationRowNode> row = new ArrayList<>();
        List<List<EquationRowNode>> body = new ArrayList<>();
        body.add(row);
        List<Measurement> rowGaps = new ArrayList<>();
        List<MatrixSeparatorStyle> hLinesBeforeRow = new ArrayList<>();
        double arrayStretch;

        expander.beginGroup();
        try {
            expander.macros().define(ROW_BREAK, MacroDefinition.fromString(CELL_BREAK));
            arrayStretch = options.arrayStretch() != null ? options.arrayStretch() : currentArrayStretch(expander);

            expander.beginGroup();
            try {
                hLinesBeforeRow.add(lastRule(getHLines(parser)));

                while (true) {
                    List<Node> cellBody = parser.parseExpression(false, CELL_BREAK);
                    expander.endGroup();
                    expander.beginGroup();

                    row.add(options.style() == null
                        ? EquationRowNode.wrap(cellBody)
                        : EquationRowNode.of(new StyleNode(options.style(), cellBody)));

                    Token next = parser.fetch();
                    if ("&".equals(next.text())) {
                        parser.consume();
                    } else if ("\\end".equals(next.text())) {
                        // a row break right before \end does not open a row
                        if (row.size() == 1 && cellBody.isEmpty()) {
                            body.remove(body.size() - 1);
                        }
                        if (hLinesBeforeRow.size() < body.size() + 1) {
                            hLinesBeforeRow.add(MatrixSeparatorStyle.NONE);
                        }
                        break;
                    } else if (CELL_BREAK.equals(next.text())) {
                        CrNode cr = NodeTypes.assertNodeType(CrNode.class, parser.parseFunction());
                        rowGaps.add(cr.size() == null ? Measurement.ZERO : cr.size());

                        hLinesBeforeRow.add(lastRule(getHLines(parser)));

                        row = new ArrayList<>();
                        body.add(row);
                    } else {
                        throw new TexSyntaxException("Expected & or \\\\ or \\cr or \\end", next);
                    }
                }
            } finally {
                expander.endGroup();
            }
        } finally {
            expander.endGroup();
        }

        return MatrixNode.builder()
            .body(body)
            .vLines(options.separators())
            .columnAligns(options.colAligns())
            .rowSpacings(rowGaps)
            .arrayStretch(arrayStretch)
            .hLines(hLinesBeforeRow)
            .hskipBeforeAndAfter(options.hskipBeforeAndAfter())
            .isSmall(options.isSmall())
            .build();
    }

    /**
     * Reads the {@code \hline} and {@code \hdashline} commands at the current position.
     *
     * @return one entry per rule, in order
     */
    static List<MatrixSeparatorStyle> getHLines(TexParser parser) {
        List<MatrixSeparatorStyle> hlineInfo = new ArrayList<>();
        parser.consumeSpaces();
        String next = parser.fetch().text();
        while ("\\hline".equals(next) || "\\hdashline".equals(next)) {
            parser.consume();
            hlineInfo.add("\\hdashline".equals(next) ? MatrixSeparatorStyle.DASHED : MatrixSeparatorStyle.SOLID);
            parser.consumeSpaces();
            next = parser.fetch().text();
        }
        return hlineInfo;
    }

    /**
     * Parses an {@code array} column specification.
     * <p>
     * Each of {@code l}, {@code c}, {@code r} adds a column. {@code |} (solid) and {@code :}
     * (dashed) add a separator when they follow a letter or open the spec; repeated marks collapse
     * into the first. The separator list always ends up with one entry more than the alignment list.
     * </p>
     *
     * @param spec      the argument node: a symbol or a row of symbols
     * @param colAligns receives the alignments
     * @param separators receives the separators
     * @throws TexSyntaxException on any other character
     */
    static void parseColumnSpec(Node spec, List<MatrixColumnAlign> colAligns, List<MatrixSeparatorStyle> separators) {
        boolean alignSpecified = true;
        boolean lastIsSeparator = false;

        for (Node node : columnSpecNodes(spec)) {
            String ca = NodeTypes.assertNodeType(SymbolNode.class, node).symbol();
            switch (ca) {
                case "l", "c", "r" -> {
                    colAligns.add(switch (ca) {
                        case "l" -> MatrixColumnAlign.LEFT;
                        case "r" -> MatrixColumnAlign.RIGHT;
                        default -> MatrixColumnAlign.CENTER;
                    });
                    if (alignSpecified) {
                        separators.add(MatrixSeparatorStyle.NONE);
                    }
                    alignSpecified = true;
                    lastIsSeparator = false;
                }
                case "|", ":" -> {
                    if (alignSpecified) {
                        separators.add("|".equals(ca) ? MatrixSeparatorStyle.SOLID : MatrixSeparatorStyle.DASHED);
                    }
                    alignSpecified = false;
                    lastIsSeparator = true;
                }
                default -> throw new TexSyntaxException("Unknown column alignment: " + ca);
            }
        }
        if (!lastIsSeparator) {
            separators.add(MatrixSeparatorStyle.NONE);
        }
    }

    private static List<Node> columnSpecNodes(Node spec) {
        if (spec instanceof SymbolNode) {
            return List.of(spec);
        }
        return NodeTypes.assertNodeType(EquationRowNode.class, spec).children();
    }

    private static double currentArrayStretch(MacroExpander expander) {
        String stretch = expander.expandMacroAsText(ARRAY_STRETCH);
        if (stretch == null) {
            return 1.0;
        }
        String literal = stretch.trim();
        if (!DECIMAL.matcher(literal).matches()) {
            throw new TexSyntaxException("Invalid \\arraystretch: " + stretch);
        }
        double value = Double.parseDouble(literal);
        if (!Double.isFinite(value)) {
            throw new TexSyntaxException("Invalid \\arraystretch: " + stretch);
        }
        return value;
    }

    private static MatrixSeparatorStyle lastRule(List<MatrixSeparatorStyle> rules) {
        return rules.isEmpty() ? MatrixSeparatorStyle.NONE : rules.get(rules.size() - 1);
    }

    /**
     * {@code darray} cells are display style, every other alias uses text style.
     */
    private static MathStyle cellStyle(String envName) {
        return envName.startsWith("d") ? MathStyle.DISPLAY : MathStyle.TEXT;
    }

    private static Node arrayHandler(TexParser parser, EnvContext context) {
        List<MatrixColumnAlign> aligns = new ArrayList<>();
        List<MatrixSeparatorStyle> separators = new ArrayList<>();
        parseColumnSpec(context.args().get(0), aligns, separators);

        return parseArray(parser, new ArrayOptions(
            true, null, separators, aligns, cellStyle(context.envName()), false
        ));
    }

    private static Node matrixHandler(TexParser parser, EnvContext context) {
        MatrixNode res = parseArray(parser, ArrayOptions.of(false, cellStyle(context.envName())));
        List<String> delimiters = DELIMITERS.get(context.envName());
        if (delimiters == null) {
            return res;
        }
        return new LeftRightNode(delimiters.get(0), delimiters.get(1), List.of(EquationRowNode.of(res)));
    }

    private static Node smallMatrixHandler(TexParser parser, EnvContext context) {
        return parseArray(parser, new ArrayOptions(
            false, 0.5, List.of(), List.of(), MathStyle.SCRIPT, true
        ));
    }

    private static Node subArrayHandler(TexParser parser, EnvContext context) {
        List<MatrixColumnAlign> aligns = new ArrayList<>();
        for (Node node : columnSpecNodes(context.args().get(0))) {
            String ca = NodeTypes.assertNodeType(SymbolNode.class, node).symbol();
            switch (ca) {
                case "l" -> aligns.add(MatrixColumnAlign.LEFT);
                case "c" -> aligns.add(MatrixColumnAlign.CENTER);
                default -> throw new TexSyntaxException("Unknown column alignment: " + ca);
            }
        }
        if (aligns.size() > 1) {
            throw new TexSyntaxException("{subarray} can contain only one column");
        }

        MatrixNode res = parseArray(parser, new ArrayOptions(
            false, 0.5, List.of(), aligns, MathStyle.SCRIPT, false
        ));
        if (res.columnCount() > 1) {
            throw new TexSyntaxException("{subarray} can contain only one column");
        }
        return res;
    }
}
