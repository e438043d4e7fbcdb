package io.github.cyfko.texmath.core.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Grid node shared by arrays, matrices and commutative diagrams.
 * <p>
 * The canonical constructor normalises the metadata so that consumers can index it directly:
 * </p>
 * <ul>
 *   <li>the column count is the widest of the rows, {@code columnAligns} and {@code vLines - 1}</li>
 *   <li>every row is padded with absent ({@code null}) cells up to the column count</li>
 *   <li>{@code columnAligns} is padded with {@link MatrixColumnAlign#CENTER}</li>
 *   <li>{@code vLines} is padded to {@code columns + 1} and {@code hLines} to {@code rows + 1}
 *       entries with {@link MatrixSeparatorStyle#NONE}</li>
 *   <li>{@code rowSpacings} is padded to one gap per row with {@link Measurement#ZERO}</li>
 * </ul>
 *
 * <pre>{@code
 * MatrixNode grid = MatrixNode.builder()
 *     .body(rows)
 *     .columnAligns(List.of(MatrixColumnAlign.CENTER))
 *     .hskipBeforeAndAfter(true)
 *     .build();
 * }</pre>
 *
 * @param body                row-major cells, {@code null} for an absent cell
 * @param columnAligns        alignment of each column
 * @param vLines              vertical separators, one before each column and one after the last
 * @param rowSpacings         extra vertical gap after each row
 * @param hLines              horizontal rules, one before each row and one after the last
 * @param arrayStretch        row height stretch factor ({@code \arraystretch})
 * @param hskipBeforeAndAfter whether padding is added at the outer left and right edges
 * @param isSmall             compact layout ({@code smallmatrix})
 * @param isCD                the grid is a commutative diagram
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record MatrixNode(
    List<List<EquationRowNode>> body,
    List<MatrixColumnAlign> columnAligns,
    List<MatrixSeparatorStyle> vLines,
    List<Measurement> rowSpacings,
    List<MatrixSeparatorStyle> hLines,
    double arrayStretch,
    boolean hskipBeforeAndAfter,
    boolean isSmall,
    boolean isCD
) implements Node {

    public MatrixNode {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(columnAligns, "columnAligns");
        Objects.requireNonNull(vLines, "vLines");
        Objects.requireNonNull(rowSpacings, "rowSpacings");
        Objects.requireNonNull(hLines, "hLines");

        int cols = Math.max(columnAligns.size(), vLines.size() - 1);
        for (List<EquationRowNode> row : body) {
            cols = Math.max(cols, row.size());
        }
        int rows = body.size();

        List<List<EquationRowNode>> rowsCopy = new ArrayList<>(rows);
        for (List<EquationRowNode> row : body) {
            rowsCopy.add(Collections.unmodifiableList(padded(row, cols, null)));
        }
        body = Collections.unmodifiableList(rowsCopy);
        columnAligns = List.copyOf(padded(columnAligns, cols, MatrixColumnAlign.CENTER));
        vLines = List.copyOf(padded(vLines, cols + 1, MatrixSeparatorStyle.NONE));
        rowSpacings = List.copyOf(padded(rowSpacings, rows, Measurement.ZERO));
        hLines = List.copyOf(padded(hLines, rows + 1, MatrixSeparatorStyle.NONE));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int rowCount() {
        return body.size();
    }

    public int columnCount() {
        return columnAligns.size();
    }

    private static <T> List<T> padded(List<? extends T> source, int length, T fill) {
        List<T> result = new ArrayList<>(Math.max(length, source.size()));
        result.addAll(source);
        while (result.size() < length) {
            result.add(fill);
        }
        return result;
    }

    /**
     * Builder for {@link MatrixNode}. Unset lists default to empty and are filled in by normalisation.
     */
    public static final class Builder {
        private List<List<EquationRowNode>> body = List.of();
        private List<MatrixColumnAlign> columnAligns = List.of();
        private List<MatrixSeparatorStyle> vLines = List.of();
        private List<Measurement> rowSpacings = List.of();
        private List<MatrixSeparatorStyle> hLines = List.of();
        private double arrayStretch = 1.0;
        private boolean hskipBeforeAndAfter;
        private boolean isSmall;
        private boolean isCD;

        private Builder() {}

        public Builder body(List<List<EquationRowNode>> body) {
            this.body = Objects.requireNonNull(body, "body");
            return this;
        }

        public Builder columnAligns(List<MatrixColumnAlign> columnAligns) {
            this.columnAligns = Objects.requireNonNull(columnAligns, "columnAligns");
            return this;
        }

        public Builder vLines(List<MatrixSeparatorStyle> vLines) {
            this.vLines = Objects.requireNonNull(vLines, "vLines");
            return this;
        }

        public Builder rowSpacings(List<Measurement> rowSpacings) {
            this.rowSpacings = Objects.requireNonNull(rowSpacings, "rowSpacings");
            return this;
        }

        public Builder hLines(List<MatrixSeparatorStyle> hLines) {
            this.hLines = Objects.requireNonNull(hLines, "hLines");
            return this;
        }

        public Builder arrayStretch(double arrayStretch) { this.arrayStretch = arrayStretch; return this; }
        public Builder hskipBeforeAndAfter(boolean hskip) { this.hskipBeforeAndAfter = hskip; return this; }
        public Builder isSmall(boolean isSmall) { this.isSmall = isSmall; return this; }
        public Builder isCD(boolean isCD) { this.isCD = isCD; return this; }

        public MatrixNode build() {
            return new MatrixNode(body, columnAligns, vLines, rowSpacings, hLines,
                arrayStretch, hskipBeforeAndAfter, isSmall, isCD);
        }
    }
}
