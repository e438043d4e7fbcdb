package io.github.cyfko.texmath.core.macro;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Macro namespace with TeX grouping semantics.
 * <p>
 * Definitions live in a single current map. Every scope opened by {@link #beginGroup()} keeps an
 * undo log holding, for each name first touched while it was innermost, the value that name had
 * before (or {@code null} when it was undefined). {@link #endGroup()} replays that log, so a
 * redefinition made inside {@code {...}} or an environment body is rolled back exactly when the
 * scope ends.
 * </p>
 * <p>
 * Lookups fall through to an immutable built-in layer supplied at construction.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * MacroTable macros = new MacroTable();
 * macros.beginGroup();
 * macros.define("\\\\", MacroDefinition.fromString("\\cr"));
 * // ... parse array body ...
 * macros.endGroup();  // \\ is undefined again
 * }</pre>
 *
 * <p>Not thread-safe: one table belongs to one parse.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MacroTable {

    private final Map<String, MacroDefinition> builtins;
    private final Map<String, MacroDefinition> current = new HashMap<>();
    private final Deque<Map<String, MacroDefinition>> undoStack = new ArrayDeque<>();

    public MacroTable() {
        this(Map.of());
    }

    /**
     * @param builtins definitions visible at every depth unless shadowed
     */
    public MacroTable(Map<String, MacroDefinition> builtins) {
        this.builtins = Map.copyOf(Objects.requireNonNull(builtins, "builtins"));
    }

    /**
     * Opens a new innermost scope.
     */
    public void beginGroup() {
        undoStack.push(new HashMap<>());
    }

    /**
     * Closes the innermost scope, restoring every name it changed.
     *
     * @throws IllegalStateException if no scope is open
     */
    public void endGroup() {
        if (undoStack.isEmpty()) {
            throw new IllegalStateException("Unbalanced namespace destruction: attempt to pop global namespace");
        }
        Map<String, MacroDefinition> undo = undoStack.pop();
        for (Map.Entry<String, MacroDefinition> entry : undo.entrySet()) {
            if (entry.getValue() == null) {
                current.remove(entry.getKey());
            } else {
                current.put(entry.getKey(), entry.getValue());
            }
        }
    }

    /**
     * Closes every open scope.
     */
    public void endAllGroups() {
        while (!undoStack.isEmpty()) {
            endGroup();
        }
    }

    /**
     * @return number of open scopes
     */
    public int depth() {
        return undoStack.size();
    }

    public boolean isDefined(String name) {
        return current.containsKey(name) || builtins.containsKey(name);
    }

    /**
     * Looks up the nearest definition of {@code name}.
     *
     * @param name control sequence or character
     * @return the definition, or {@code null} if undefined
     */
    public MacroDefinition lookup(String name) {
        MacroDefinition definition = current.get(name);
        return definition != null ? definition : builtins.get(name);
    }

    /**
     * Defines {@code name} in the innermost scope.
     *
     * @param name       control sequence or character
     * @param definition the rule, {@code null} to drop the current definition until the scope ends
     */
    public void define(String name, MacroDefinition definition) {
        Map<String, MacroDefinition> top = undoStack.peek();
        if (top != null && !top.containsKey(name)) {
            top.put(name, current.get(name));
        }
        put(name, definition);
    }

    /**
     * Defines {@code name} so that it survives every enclosing scope ({@code \gdef}).
     *
     * @param name       control sequence or character
     * @param definition the rule
     */
    public void defineGlobal(String name, MacroDefinition definition) {
        for (Map<String, MacroDefinition> undo : undoStack) {
            undo.remove(name);
        }
        Map<String, MacroDefinition> top = undoStack.peek();
        if (top != null) {
            // popping the innermost scope must leave the global value in place
            top.put(name, definition);
        }
        put(name, definition);
    }

    private void put(String name, MacroDefinition definition) {
        if (definition == null) {
            current.remove(name);
        } else {
            current.put(name, definition);
        }
    }
}
