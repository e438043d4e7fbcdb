package io.github.cyfko.texmath.core.environment;

import io.github.cyfko.texmath.core.ast.EquationRowNode;
import io.github.cyfko.texmath.core.ast.Node;
import io.github.cyfko.texmath.core.ast.SymbolNode;
import io.github.cyfko.texmath.core.exception.TexSyntaxException;
import io.github.cyfko.texmath.core.parsing.Mode;
import io.github.cyfko.texmath.core.parsing.TexParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("EnvironmentRegistry Tests")
class EnvironmentRegistryTest {

    private static final String CUSTOM = "testbox";

    @Mock
    private EnvironmentHandler handler;

    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(handler.handle(any(), any())).thenReturn(new SymbolNode("boxed"));
    }

    @AfterEach
    void tearDown() throws Exception {
        EnvironmentRegistry.unregister(CUSTOM);
        mocks.close();
    }

    @Nested
    @DisplayName("Built-in environments")
    class BuiltIns {

        @Test
        @DisplayName("All tabular environments and CD are registered")
        void builtinsRegistered() {
            Set<String> names = EnvironmentRegistry.getRegisteredEnvironments();

            assertTrue(names.containsAll(Set.of(
                "array", "darray", "matrix", "pmatrix", "bmatrix", "Bmatrix", "vmatrix", "Vmatrix",
                "smallmatrix", "subarray", "CD"
            )));
        }

        @Test
        @DisplayName("Argument counts match the environment signatures")
        void argumentCounts() {
            assertEquals(1, EnvironmentRegistry.lookup("array").orElseThrow().numArgs());
            assertEquals(1, EnvironmentRegistry.lookup("subarray").orElseThrow().numArgs());
            assertEquals(0, EnvironmentRegistry.lookup("pmatrix").orElseThrow().numArgs());
            assertEquals(0, EnvironmentRegistry.lookup("CD").orElseThrow().numArgs());
        }

        @Test
        @DisplayName("Lookup is case-sensitive")
        void caseSensitive() {
            assertTrue(EnvironmentRegistry.lookup("cd").isEmpty());
            assertTrue(EnvironmentRegistry.lookup(null).isEmpty());
        }

        @Test
        @DisplayName("Built-ins cannot be unregistered")
        void builtinsProtected() {
            assertThrows(IllegalArgumentException.class, () -> EnvironmentRegistry.unregister("matrix"));
            assertTrue(EnvironmentRegistry.lookup("matrix").isPresent());
        }
    }

    @Nested
    @DisplayName("Custom environments")
    class Custom {

        @Test
        @DisplayName("Registered handler is invoked with name, mode and arguments")
        void handlerInvoked() {
            EnvironmentRegistry.register(CUSTOM, new EnvSpec(1, handler));

            List<Node> nodes = new TexParser("\\begin{testbox}{x}\\end{testbox}").parse().children();

            assertEquals(List.of(new SymbolNode("boxed")), nodes);
            ArgumentCaptor<EnvContext> context = ArgumentCaptor.forClass(EnvContext.class);
            verify(handler, times(1)).handle(any(TexParser.class), context.capture());
            assertEquals(CUSTOM, context.getValue().envName());
            assertEquals(Mode.MATH, context.getValue().mode());
            assertEquals(List.of(EquationRowNode.of(new SymbolNode("x"))), context.getValue().args());
        }

        @Test
        @DisplayName("Handler leaving body tokens unconsumed makes \\end fail")
        void unconsumedBody() {
            EnvironmentRegistry.register(CUSTOM, new EnvSpec(0, handler));

            TexSyntaxException exception = assertThrows(TexSyntaxException.class,
                () -> new TexParser("\\begin{testbox}y\\end{testbox}").parse());

            assertTrue(exception.getMessage().startsWith("Expected '\\end' to close environment 'testbox'"));
        }

        @Test
        @DisplayName("Duplicate registration fails")
        void duplicate() {
            EnvironmentRegistry.register(CUSTOM, new EnvSpec(0, handler));

            assertThrows(IllegalArgumentException.class,
                () -> EnvironmentRegistry.register(CUSTOM, new EnvSpec(0, handler)));
            assertThrows(IllegalArgumentException.class,
                () -> EnvironmentRegistry.register("pmatrix", new EnvSpec(0, handler)));
        }

        @Test
        @DisplayName("Blank names and negative argument counts are rejected")
        void invalidRegistration() {
            assertThrows(IllegalArgumentException.class, () -> EnvironmentRegistry.register(" ", new EnvSpec(0, handler)));
            assertThrows(IllegalArgumentException.class, () -> new EnvSpec(-1, handler));
        }

        @Test
        @DisplayName("Unregistering removes the environment")
        void unregister() {
            EnvironmentRegistry.register(CUSTOM, new EnvSpec(0, handler));

            assertTrue(EnvironmentRegistry.unregister(CUSTOM));
            assertFalse(EnvironmentRegistry.unregister(CUSTOM));
            assertTrue(EnvironmentRegistry.lookup(CUSTOM).isEmpty());
            verifyNoInteractions(handler);
        }
    }
}
