package io.github.cyfko.texmath.core.config;

/**
 * Configuration for parser limits.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpand</strong>: Maximum number of macro expansions performed during one parse (default: 1000)</li>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of the source text (default: 10000)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * ParserPolicy policy = ParserPolicy.defaults();
 *
 * // Strict (for untrusted input)
 * ParserPolicy policy = ParserPolicy.strict();
 *
 * // Relaxed (for large macro-heavy documents)
 * ParserPolicy policy = ParserPolicy.relaxed();
 *
 * // Custom
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxExpand(200)
 *     .build();
 * }</pre>
 *
 * @param policyName          name of the policy, reported in limit errors
 * @param maxExpand           maximum number of macro expansions per parse
 * @param maxExpressionLength maximum character length of the source text
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParserPolicy(
    String policyName,
    int maxExpand,
    int maxExpressionLength
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpand <= 0) {
            throw new IllegalArgumentException("maxExpand must be positive, got: " + maxExpand);
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Expansions: 1000</li>
     *   <li>Max Expression Length: 10000 characters</li>
     * </ul>
     *
     * @return default configuration
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 1000, 10000);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Expansions: 500</li>
     *   <li>Max Expression Length: 2000 characters</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 500, 2000);
    }

    /**
     * Relaxed configuration for trusted, macro-heavy sources.
     * <ul>
     *   <li>Max Expansions: 10000</li>
     *   <li>Max Expression Length: 100000 characters</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 100000);
    }

    /**
     * Creates a custom configuration. Builder parameters start from the default values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpand = 1000;
        private int _maxExpressionLength = 10000;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxExpand, _maxExpressionLength);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpand(int maxExpand) { this._maxExpand = maxExpand; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
