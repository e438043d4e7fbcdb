package io.github.cyfko.texmath.core.ast;

import io.github.cyfko.texmath.core.exception.TexSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Syntax Tree Tests")
class MatrixNodeTest {

    private static EquationRowNode cell(String symbol) {
        return EquationRowNode.of(new SymbolNode(symbol));
    }

    @Nested
    @DisplayName("MatrixNode normalisation")
    class Normalisation {

        @Test
        @DisplayName("Rows and metadata are padded to the widest row")
        void padding() {
            MatrixNode matrix = MatrixNode.builder()
                .body(List.of(List.of(cell("a")), List.of(cell("b"), cell("c"))))
                .build();

            assertEquals(2, matrix.columnCount());
            assertEquals(2, matrix.rowCount());
            assertEquals(List.of(cell("a"), null), matrix.body().get(0));
            assertEquals(List.of(MatrixColumnAlign.CENTER, MatrixColumnAlign.CENTER), matrix.columnAligns());
            assertEquals(3, matrix.vLines().size());
            assertEquals(3, matrix.hLines().size());
            assertEquals(List.of(Measurement.ZERO, Measurement.ZERO), matrix.rowSpacings());
        }

        @Test
        @DisplayName("Column spec wider than the body widens every row")
        void specWiderThanBody() {
            MatrixNode matrix = MatrixNode.builder()
                .body(List.of(List.of(cell("a"))))
                .vLines(List.of(MatrixSeparatorStyle.SOLID, MatrixSeparatorStyle.NONE, MatrixSeparatorStyle.NONE, MatrixSeparatorStyle.SOLID))
                .build();

            assertEquals(3, matrix.columnCount());
            assertEquals(3, matrix.body().get(0).size());
        }

        @Test
        @DisplayName("Normalised lists are read-only")
        void immutability() {
            MatrixNode matrix = MatrixNode.builder().body(List.of(List.of(cell("a")))).build();

            assertThrows(UnsupportedOperationException.class, () -> matrix.body().get(0).set(0, cell("b")));
            assertThrows(UnsupportedOperationException.class, () -> matrix.columnAligns().add(MatrixColumnAlign.LEFT));
        }
    }

    @Nested
    @DisplayName("Measurement")
    class Measurements {

        @ParameterizedTest(name = "{0}")
        @CsvSource({"2pt, 2.0, pt", "' 1.5 em ', 1.5, em", "-.5mu, -0.5, mu", "+3cm, 3.0, cm"})
        @DisplayName("Parses a number followed by a unit")
        void parse(String text, double value, String unit) {
            assertEquals(new Measurement(value, unit), Measurement.parse(text, null));
        }

        @ParameterizedTest(name = "[{index}] \"{0}\"")
        @ValueSource(strings = {"", "pt", "2", "2 p t", "2xx"})
        @DisplayName("Rejects malformed sizes")
        void rejectsMalformed(String text) {
            assertThrows(TexSyntaxException.class, () -> Measurement.parse(text, null));
        }

        @Test
        @DisplayName("Whole values print without a fraction")
        void printing() {
            assertEquals("2pt", new Measurement(2, "pt").toString());
            assertEquals("-1.5em", new Measurement(-1.5, "em").toString());
        }
    }

    @Test
    @DisplayName("Node type assertion names both types")
    void assertNodeType() {
        TexSyntaxException exception = assertThrows(TexSyntaxException.class,
            () -> NodeTypes.assertNodeType(SymbolNode.class, EquationRowNode.empty()));

        assertEquals("Expected node of type SymbolNode, but got EquationRowNode", exception.getMessage());
        assertEquals(new SymbolNode("x"), NodeTypes.assertNodeType(SymbolNode.class, new SymbolNode("x")));
    }

    @Test
    @DisplayName("Arrow kinds are looked up by their character")
    void arrowKinds() {
        assertEquals(ArrowKind.DOWN, ArrowKind.fromSymbol("V").orElseThrow());
        assertTrue(ArrowKind.fromSymbol("v").isEmpty());
        assertTrue(ArrowKind.fromSymbol(">>").isEmpty());
        assertTrue(ArrowKind.UP.isVertical());
        assertFalse(ArrowKind.EQUALS.takesLabels());
    }
}
