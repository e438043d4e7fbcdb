package io.github.cyfko.texmath.core.macro;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MacroTable Tests")
class MacroTableTest {

    private static final MacroDefinition A = MacroDefinition.fromString("a");
    private static final MacroDefinition B = MacroDefinition.fromString("b");
    private static final MacroDefinition C = MacroDefinition.fromString("c");

    private MacroTable macros;

    @BeforeEach
    void setUp() {
        macros = new MacroTable();
    }

    @Nested
    @DisplayName("Local definitions")
    class LocalDefinitions {

        @Test
        @DisplayName("Definition made inside a group disappears when the group ends")
        void definitionRolledBack() {
            macros.beginGroup();
            macros.define("\\x", A);
            assertEquals(A, macros.lookup("\\x"));

            macros.endGroup();

            assertNull(macros.lookup("\\x"));
            assertFalse(macros.isDefined("\\x"));
        }

        @Test
        @DisplayName("Nested redefinitions are restored one scope at a time")
        void nestedRedefinitions() {
            macros.define("\\x", A);
            macros.beginGroup();
            macros.define("\\x", B);
            macros.beginGroup();
            macros.define("\\x", C);
            macros.define("\\x", B);

            macros.endGroup();
            assertEquals(B, macros.lookup("\\x"));

            macros.endGroup();
            assertEquals(A, macros.lookup("\\x"));
        }

        @Test
        @DisplayName("Defining null hides the name until the scope ends")
        void undefineLocally() {
            macros.define("\\x", A);
            macros.beginGroup();
            macros.define("\\x", null);
            assertNull(macros.lookup("\\x"));

            macros.endGroup();

            assertEquals(A, macros.lookup("\\x"));
        }
    }

    @Nested
    @DisplayName("Global definitions")
    class GlobalDefinitions {

        @Test
        @DisplayName("Global definition survives every enclosing scope")
        void globalSurvives() {
            macros.beginGroup();
            macros.define("\\x", A);
            macros.beginGroup();
            macros.defineGlobal("\\x", B);

            macros.endAllGroups();

            assertEquals(B, macros.lookup("\\x"));
            assertEquals(0, macros.depth());
        }

        @Test
        @DisplayName("Local redefinition after a global one reverts to the global value")
        void localAfterGlobal() {
            macros.beginGroup();
            macros.defineGlobal("\\x", A);
            macros.define("\\x", B);

            macros.endGroup();

            assertEquals(A, macros.lookup("\\x"));
        }
    }

    @Test
    @DisplayName("Built-ins are visible and can be shadowed locally")
    void builtinsFallThrough() {
        MacroTable seeded = new MacroTable(Map.of("\\R", A));
        assertEquals(A, seeded.lookup("\\R"));

        seeded.beginGroup();
        seeded.define("\\R", B);
        assertEquals(B, seeded.lookup("\\R"));
        seeded.endGroup();

        assertEquals(A, seeded.lookup("\\R"));
    }

    @Test
    @DisplayName("Ending the global scope fails")
    void unbalancedEndGroup() {
        macros.beginGroup();
        macros.endGroup();

        IllegalStateException exception = assertThrows(IllegalStateException.class, macros::endGroup);
        assertTrue(exception.getMessage().contains("Unbalanced namespace destruction"));
    }

    @Test
    @DisplayName("Definitions accept at most nine parameters")
    void parameterCountBounds() {
        assertThrows(IllegalArgumentException.class, () -> MacroDefinition.fromString("x", 10));
        assertThrows(IllegalArgumentException.class, () -> MacroDefinition.fromString("x", -1));
        assertEquals(9, MacroDefinition.fromString("#9", 9).numArgs());
    }
}
