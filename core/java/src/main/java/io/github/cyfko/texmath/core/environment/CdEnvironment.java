package io.github.cyfko.texmath.core.environment;

import io.github.cyfko.texmath.core.ast.ArrowKind;
import io.github.cyfko.texmath.core.ast.CdArrowNode;
import io.github.cyfko.texmath.core.ast.EquationRowNode;
import io.github.cyfko.texmath.core.ast.MatrixNode;
import io.github.cyfko.texmath.core.ast.Node;
import io.github.cyfko.texmath.core.ast.SymbolNode;
import io.github.cyfko.texmath.core.exception.TexSyntaxException;
import io.github.cyfko.texmath.core.macro.MacroDefinition;
import io.github.cyfko.texmath.core.macro.MacroExpander;
import io.github.cyfko.texmath.core.parsing.TexParser;
import io.github.cyfko.texmath.core.parsing.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The {@code CD} (commutative diagram) environment.
 * <p>
 * Cells are implicit: everything between two arrows of a row is one cell. Rows alternate between
 * content rows ({@code cell, arrow, cell, ..., cell}) and connector rows holding the vertical
 * arrows. An arrow starts with {@code @} followed by its kind character:
 * </p>
 * <ul>
 *   <li>{@code @>a>b>}, {@code @<a<b<}: horizontal arrows, labels above and below</li>
 *   <li>{@code @AaAbA}, {@code @VaVbV}: vertical arrows, labels left and right</li>
 *   <li>{@code @=}, {@code @|}, {@code @.}: equals signs and the empty connector, no labels</li>
 * </ul>
 * <p>
 * Rows end at {@code \\}, {@code \cr} or {@code &}.
 * </p>
 *
 * <pre>{@code
 * \begin{CD}
 *   A @>f>> B \\
 *   @VgVV   @VVhV \\
 *   C @>>k> D
 * \end{CD}
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class CdEnvironment {

    static final Map<String, EnvSpec> ENTRIES = Map.of(
        "CD", new EnvSpec(0, CdEnvironment::cdHandler)
    );

    private static final String ARROW_START = "@";
    private static final String ROW_BREAK = "\\\\";

    private CdEnvironment() {}

    private static Node cdHandler(TexParser parser, EnvContext context) {
        return parseCD(parser);
    }

    /**
     * Parses a diagram body up to, but not including, {@code \end}.
     *
     * @param parser parser positioned at the start of the body
     * @return the diagram grid, flagged {@link MatrixNode#isCD()}
     * @throws TexSyntaxException on a malformed arrow or row terminator
     */
    public static MatrixNode parseCD(TexParser parser) {
        List<List<Node>> parsedRows = readRows(parser);

        List<List<EquationRowNode>> body = new ArrayList<>(parsedRows.size());
        for (int i = 0; i < parsedRows.size(); i++) {
            body.add(foldRow(parsedRows.get(i), i % 2 == 0));
        }

        return MatrixNode.builder()
            .body(body)
            .isCD(true)
            .build();
    }

    /**
     * Reads the body as flat node lists, one per row, with {@code \cr} mapped to {@code \\\relax}.
     */
    private static List<List<Node>> readRows(TexParser parser) {
        MacroExpander expander = parser.macroExpander();
        List<List<Node>> parsedRows = new ArrayList<>();

        expander.beginGroup();
        try {
            expander.macros().define("\\cr", MacroDefinition.fromString("\\\\\\relax"));
            expander.beginGroup();
            try {
                while (true) {
                    parsedRows.add(parser.parseExpression(false, ROW_BREAK));
                    expander.endGroup();
                    expander.beginGroup();

                    Token next = parser.fetch();
                    if (ROW_BREAK.equals(next.text()) || "&".equals(next.text())) {
                        parser.consume();
                    } else if ("\\end".equals(next.text())) {
                        if (parsedRows.get(parsedRows.size() - 1).isEmpty()) {
                            // final row ended in \\
                            parsedRows.remove(parsedRows.size() - 1);
                        }
                        break;
                    } else {
                        throw new TexSyntaxException("Expected \\\\ or \\cr or \\end", next);
                    }
                }
            } finally {
                expander.endGroup();
            }
        } finally {
            expander.endGroup();
        }
        return parsedRows;
    }

    /**
     * Splits one flat row into content cells and arrow cells.
     * <p>
     * Content rows keep the cell following the last arrow. Connector rows drop the empty cell
     * collected in front of their first arrow and whatever follows their last arrow.
     * </p>
     */
    private static List<EquationRowNode> foldRow(List<Node> rowNodes, boolean contentRow) {
        List<EquationRowNode> row = new ArrayList<>();
        List<Node> cell = new ArrayList<>();

        for (int j = 0; j < rowNodes.size(); j++) {
            if (!isStartOfArrow(rowNodes.get(j))) {
                cell.add(rowNodes.get(j));
                continue;
            }
            row.add(EquationRowNode.wrap(cell));

            j++;
            if (j >= rowNodes.size()) {
                throw new TexSyntaxException("Missing arrow terminator: expected one of \"<>AV=|.\" after @");
            }
            Node kindNode = rowNodes.get(j);
            String arrowChar = symbolOf(kindNode);
            ArrowKind kind = ArrowKind.fromSymbol(arrowChar)
                .orElseThrow(() -> new TexSyntaxException("Unknown arrow kind: expected one of \"<>AV=|.\" after @, got "
                    + (arrowChar == null ? kindNode.getClass().getSimpleName() : "'" + arrowChar + "'")));

            List<List<Node>> labels = List.of(new ArrayList<>(), new ArrayList<>());
            if (kind.takesLabels()) {
                for (List<Node> label : labels) {
                    boolean inLabel = true;
                    for (int k = j + 1; k < rowNodes.size(); k++) {
                        if (arrowChar.equals(symbolOf(rowNodes.get(k)))) {
                            inLabel = false;
                            j = k;
                            break;
                        }
                        if (isStartOfArrow(rowNodes.get(k))) {
                            throw missingTerminator(arrowChar);
                        }
                        label.add(rowNodes.get(k));
                    }
                    if (inLabel) {
                        throw missingTerminator(arrowChar);
                    }
                }
            }

            row.add(EquationRowNode.of(new CdArrowNode(kind, labelOf(labels.get(0)), labelOf(labels.get(1)))));
            cell = new ArrayList<>();
        }
        if (contentRow) {
            row.add(EquationRowNode.wrap(cell));
        } else if (!row.isEmpty()) {
            row.remove(0);
        }
        return row;
    }

    private static boolean isStartOfArrow(Node node) {
        return ARROW_START.equals(symbolOf(node));
    }

    private static String symbolOf(Node node) {
        return node instanceof SymbolNode symbol ? symbol.symbol() : null;
    }

    private static EquationRowNode labelOf(List<Node> nodes) {
        return nodes.isEmpty() ? null : EquationRowNode.wrap(nodes);
    }

    private static TexSyntaxException missingTerminator(String arrowChar) {
        return new TexSyntaxException("Missing a " + arrowChar + " character to complete a CD arrow.");
    }
}
