package io.github.cyfko.roaql.core.config;

/**
 * Complexity limits applied by the query parser for DoS protection.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: maximum character length of one expression (default: 4000)</li>
 *   <li><strong>maxNestingDepth</strong>: maximum nesting of compound operators (default: 16)</li>
 *   <li><strong>maxSortExpressions</strong>: maximum number of sort keys per request (default: 16)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * ParserPolicy policy = ParserPolicy.defaults();
 *
 * // Strict (for public APIs with untrusted input)
 * ParserPolicy policy = ParserPolicy.strict();
 *
 * // Relaxed (for internal trusted systems)
 * ParserPolicy policy = ParserPolicy.relaxed();
 *
 * // Custom
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxExpressionLength(10000)
 *     .maxNestingDepth(4)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in limit violations
 * @param maxExpressionLength maximum character length of an expression
 * @param maxNestingDepth     maximum nesting depth of compound operators, the top-level expression being depth 0
 * @param maxSortExpressions  maximum number of sort expressions parsed in one call
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParserPolicy(
    String policyName,
    int maxExpressionLength,
    int maxNestingDepth,
    int maxSortExpressions
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
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxNestingDepth < 0) {
            throw new IllegalArgumentException("maxNestingDepth cannot be negative, got: " + maxNestingDepth);
        }
        if (maxSortExpressions <= 0) {
            throw new IllegalArgumentException("maxSortExpressions must be positive, got: " + maxSortExpressions);
        }
    }

    /**
     * Default configuration, suitable for most production use cases.
     *
     * @return default configuration
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 4000, 16, 16);
    }

    /**
     * Strict configuration for public APIs and untrusted input.
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 1000, 4, 5);
    }

    /**
     * Relaxed configuration for internal trusted systems.
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 20000, 64, 64);
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
        private int _maxExpressionLength = 4000;
        private int _maxNestingDepth = 16;
        private int _maxSortExpressions = 16;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxExpressionLength, _maxNestingDepth, _maxSortExpressions);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder maxSortExpressions(int maxSortExpressions) { this._maxSortExpressions = maxSortExpressions; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
