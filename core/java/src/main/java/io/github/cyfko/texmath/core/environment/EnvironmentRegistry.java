package io.github.cyfko.texmath.core.environment;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry mapping environment names to their {@link EnvSpec}.
 * <p>
 * The registry is pre-populated with the tabular environments of {@link ArrayEnvironments}
 * and the {@code CD} environment of {@link CdEnvironment}. Further environments can be
 * registered at configuration time.
 * </p>
 *
 * <p><strong>Concurrency:</strong> Internal storage uses a {@link ConcurrentHashMap}, so
 * registration and lookup are safe from any thread.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * // Register an environment reading one argument
 * EnvironmentRegistry.register("mytable", new EnvSpec(1, myHandler));
 *
 * // Lookup during parsing
 * Optional<EnvSpec> spec = EnvironmentRegistry.lookup("pmatrix");
 *
 * // Remove it again
 * EnvironmentRegistry.unregister("mytable");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EnvironmentRegistry {
    private static final Map<String, EnvSpec> ENVIRONMENTS = new ConcurrentHashMap<>();
    private static final Set<String> BUILTINS;

    static {
        ArrayEnvironments.ENTRIES.forEach(EnvironmentRegistry::register);
        CdEnvironment.ENTRIES.forEach(EnvironmentRegistry::register);
        BUILTINS = Set.copyOf(ENVIRONMENTS.keySet());
    }

    private EnvironmentRegistry() {
        // Prevent external instantiation
    }

    /**
     * Registers an environment.
     *
     * @param name environment name as written in {@code \begin{...}}
     * @param spec argument count and handler
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public static void register(String name, EnvSpec spec) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Environment name is required");
        }
        var previous = ENVIRONMENTS.putIfAbsent(name, Objects.requireNonNull(spec, "spec"));
        if (previous != null) {
            throw new IllegalArgumentException("Environment [" + name + "] is already registered.");
        }
    }

    /**
     * Removes a previously registered environment. Built-in environments cannot be removed.
     *
     * @param name environment name
     * @return {@code true} if an environment was removed
     * @throws IllegalArgumentException if {@code name} is a built-in environment
     */
    public static boolean unregister(String name) {
        if (BUILTINS.contains(name)) {
            throw new IllegalArgumentException("Built-in environment [" + name + "] cannot be unregistered.");
        }
        return ENVIRONMENTS.remove(name) != null;
    }

    /**
     * Looks up an environment. Names are case-sensitive ({@code bmatrix} and {@code Bmatrix} differ).
     *
     * @param name environment name
     * @return the spec, or empty if unknown
     */
    public static Optional<EnvSpec> lookup(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(ENVIRONMENTS.get(name));
    }

    /**
     * @return a snapshot of all registered environment names
     */
    public static Set<String> getRegisteredEnvironments() {
        return Set.copyOf(ENVIRONMENTS.keySet());
    }
}
