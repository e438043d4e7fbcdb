package io.github.cyfko.texmath.core.encoder;

import io.github.cyfko.texmath.core.api.MathEncoder;
import io.github.cyfko.texmath.core.ast.CdArrowNode;
import io.github.cyfko.texmath.core.ast.EquationRowNode;
import io.github.cyfko.texmath.core.ast.MatrixNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Reconstructs {@code \begin{CD} ... \end{CD}} source from a diagram grid.
 * <p>
 * Even rows alternate content cells and horizontal arrows, odd rows hold vertical arrows in their
 * even columns. Labels are encoded through the supplied {@link MathEncoder}. Only the undecorated
 * rightward and downward arrow forms are emitted: {@code @>a>b>} and {@code @VaVbV}, or
 * {@code @>>>} and {@code @VVV} for cells that are not recognised as arrows.
 * </p>
 * <p>
 * Grids without the diagram flag yield a {@link NonStrictEncodeResult} with code
 * {@value #UNSUPPORTED_MATRIX}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MatrixEncoder {

    public static final String UNSUPPORTED_MATRIX = "unsupported matrix kind";

    private MatrixEncoder() {}

    /**
     * Encodes a diagram grid.
     *
     * @param node    the grid to encode, never mutated
     * @param encoder encoder used for cell contents and labels
     * @return the diagram source, or a non-strict result if {@code node} is not a diagram
     */
    public static EncodeResult encode(MatrixNode node, MathEncoder encoder) {
        if (!node.isCD()) {
            return new NonStrictEncodeResult(
                UNSUPPORTED_MATRIX,
                "only the following type of matrix is supported: CD",
                "."
            );
        }

        List<String> results = new ArrayList<>();
        List<List<EquationRowNode>> body = node.body();
        for (int rowIndex = 0; rowIndex < body.size(); rowIndex++) {
            List<EquationRowNode> row = withoutTrailingAbsentCells(body.get(rowIndex));
            // the last row is often left empty
            if (rowIndex == body.size() - 1 && row.isEmpty()) {
                break;
            }

            for (int colIndex = 0; colIndex < row.size(); colIndex++) {
                EquationRowNode cell = row.get(colIndex);
                if (rowIndex % 2 == 0) {
                    if (colIndex % 2 == 0) {
                        if (cell != null) {
                            results.add(encoder.encodeToString(cell));
                        }
                    } else {
                        results.add(horizontalArrow(cell, encoder));
                    }
                } else if (colIndex % 2 == 0) {
                    results.add(verticalArrow(cell, encoder));
                }
            }
            results.add("\\\\");
        }
        results.removeIf(String::isEmpty);
        return new StaticEncodeResult("\\begin{CD} " + String.join(" ", results) + " \\end{CD}");
    }

    private static String horizontalArrow(EquationRowNode cell, MathEncoder encoder) {
        CdArrowNode arrow = arrowOf(cell);
        if (arrow == null || arrow.isVertical()) {
            return "@>>>";
        }
        return TexEncoder.join(List.of("@>", label(arrow.firstLabel(), encoder), ">", label(arrow.secondLabel(), encoder), ">"));
    }

    private static String verticalArrow(EquationRowNode cell, MathEncoder encoder) {
        CdArrowNode arrow = arrowOf(cell);
        if (arrow == null || !arrow.isVertical()) {
            return "@VVV";
        }
        return TexEncoder.join(List.of("@V", label(arrow.firstLabel(), encoder), "V", label(arrow.secondLabel(), encoder), "V"));
    }

    /**
     * Returns the arrow of a cell consisting of exactly one {@link CdArrowNode}.
     */
    private static CdArrowNode arrowOf(EquationRowNode cell) {
        if (cell == null || cell.children().size() != 1) {
            return null;
        }
        return cell.children().get(0) instanceof CdArrowNode arrow ? arrow : null;
    }

    private static String label(EquationRowNode label, MathEncoder encoder) {
        return label == null ? "" : encoder.encodeToString(label);
    }

    private static List<EquationRowNode> withoutTrailingAbsentCells(List<EquationRowNode> row) {
        int end = row.size();
        while (end > 0 && row.get(end - 1) == null) {
            end--;
        }
        return row.subList(0, end);
    }
}
