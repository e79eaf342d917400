package io.github.cyfko.truthtable.core.config;

/**
 * Limits and options applied by the truth table engine to every request.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of the expression (default: 5000)</li>
 *   <li><strong>maxVariables</strong>: Maximum number of distinct variables (default: 16, i.e. 65536 rows)</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum depth of parentheses and stacked negations (default: 100)</li>
 *   <li><strong>asciiAliases</strong>: Accept {@code ! & | -> <-> ^} besides the canonical symbols (default: true)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * EnginePolicy policy = EnginePolicy.defaults();
 *
 * // Strict (for public endpoints with untrusted input)
 * EnginePolicy policy = EnginePolicy.strict();
 *
 * // Relaxed (for trusted batch usage)
 * EnginePolicy policy = EnginePolicy.relaxed();
 *
 * // Custom
 * EnginePolicy policy = EnginePolicy.builder()
 *     .maxVariables(10)
 *     .asciiAliases(false)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in limit violation messages
 * @param maxExpressionLength maximum character length of the trimmed expression, at most
 *                            {@link #MAX_SUPPORTED_EXPRESSION_LENGTH}
 * @param maxVariables        maximum number of distinct variables, at most {@link #MAX_SUPPORTED_VARIABLES}
 * @param maxNestingDepth     maximum depth of parentheses and stacked negations, at most
 *                            {@link #MAX_SUPPORTED_NESTING_DEPTH}
 * @param asciiAliases        whether ASCII operator aliases are recognized
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EnginePolicy(
    String policyName,
    int maxExpressionLength,
    int maxVariables,
    int maxNestingDepth,
    boolean asciiAliases
) {

    /**
     * Hard ceiling on {@link #maxVariables()}; 2<sup>20</sup> rows is the largest table any policy may request.
     */
    public static final int MAX_SUPPORTED_VARIABLES = 20;

    /**
     * Hard ceiling on {@link #maxExpressionLength()}. Binary chains parse into left-deep trees walked
     * recursively, so the length also bounds the tree height.
     */
    public static final int MAX_SUPPORTED_EXPRESSION_LENGTH = 10_000;

    /**
     * Hard ceiling on {@link #maxNestingDepth()}. The parser recurses through every precedence level
     * for each parenthesis.
     */
    public static final int MAX_SUPPORTED_NESTING_DEPTH = 500;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public EnginePolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0 || maxExpressionLength > MAX_SUPPORTED_EXPRESSION_LENGTH) {
            throw new IllegalArgumentException(String.format(
                    "maxExpressionLength must be between 1 and %d, got: %d",
                    MAX_SUPPORTED_EXPRESSION_LENGTH, maxExpressionLength));
        }
        if (maxVariables <= 0 || maxVariables > MAX_SUPPORTED_VARIABLES) {
            throw new IllegalArgumentException(String.format(
                    "maxVariables must be between 1 and %d, got: %d", MAX_SUPPORTED_VARIABLES, maxVariables));
        }
        if (maxNestingDepth <= 0 || maxNestingDepth > MAX_SUPPORTED_NESTING_DEPTH) {
            throw new IllegalArgumentException(String.format(
                    "maxNestingDepth must be between 1 and %d, got: %d", MAX_SUPPORTED_NESTING_DEPTH, maxNestingDepth));
        }
    }

    /**
     * Default configuration for balanced protection and usability.
     * <ul>
     *   <li>Max Expression Length: 5000 characters</li>
     *   <li>Max Variables: 16</li>
     *   <li>Max Nesting Depth: 100</li>
     *   <li>ASCII aliases: ENABLED</li>
     * </ul>
     *
     * @return default configuration
     */
    public static EnginePolicy defaults() {
        return new EnginePolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 16, 100, true);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Variables: 8</li>
     *   <li>Max Nesting Depth: 32</li>
     *   <li>ASCII aliases: DISABLED (canonical symbols only)</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static EnginePolicy strict() {
        return new EnginePolicy(PolicyName.STRICT_POLICY.name(), 1000, 8, 32, false);
    }

    /**
     * Relaxed configuration for trusted callers.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Max Variables: 20</li>
     *   <li>Max Nesting Depth: 256</li>
     *   <li>ASCII aliases: ENABLED</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static EnginePolicy relaxed() {
        return new EnginePolicy(PolicyName.RELAXED_POLICY.name(), 10000, 20, 256, true);
    }

    /**
     * Creates a custom configuration.
     * <p>
     * Builder parameters are initialized exactly as in {@link #defaults()}.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxVariables = 16;
        private int _maxNestingDepth = 100;
        private boolean _asciiAliases = true;

        private Builder() {}

        public EnginePolicy build() {
            return new EnginePolicy(_policyName, _maxExpressionLength, _maxVariables, _maxNestingDepth, _asciiAliases);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxVariables(int maxVariables) { this._maxVariables = maxVariables; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder asciiAliases(boolean asciiAliases) { this._asciiAliases = asciiAliases; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
