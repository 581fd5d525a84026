package io.github.cyfko.drlparser.core.config;

/**
 * Hard bounds applied by the parser to guarantee termination on pathological input.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxNestingDepth</strong>: deepest multi-line pattern level, and deepest {@code and}/{@code or}
 *       group level, represented in the tree (default: 10)</li>
 *   <li><strong>maxParenScanDepth</strong>: parenthesis depth at which a pattern scan gives up (default: 20)</li>
 *   <li><strong>maxPatternLines</strong>: lines one pattern scan may consume (default: 50)</li>
 *   <li><strong>maxResyncLookahead</strong>: lines a recovery scan may skip (default: 20)</li>
 *   <li><strong>maxErrors</strong>: diagnostics a consumer should display (default: 100). Never applied by the parser.</li>
 *   <li><strong>maxDocumentLength</strong>: characters accepted before parsing is refused (default: 5,000,000)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for editor use)
 * ParserPolicy policy = ParserPolicy.defaults();
 *
 * // Strict (untrusted input, tighter bounds)
 * ParserPolicy policy = ParserPolicy.strict();
 *
 * // Relaxed (batch tooling over trusted sources)
 * ParserPolicy policy = ParserPolicy.relaxed();
 *
 * // Custom
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxNestingDepth(4)
 *     .build();
 * }</pre>
 *
 * @param policyName         label identifying the preset or custom configuration; parsing ignores it
 * @param maxNestingDepth    deepest pattern and logical group level kept in the tree
 * @param maxParenScanDepth  parenthesis depth cap of one pattern scan
 * @param maxPatternLines    line cap of one pattern scan
 * @param maxResyncLookahead line cap of one recovery scan
 * @param maxErrors          advisory diagnostic cap for consumers
 * @param maxDocumentLength  input size guard, in characters
 * @since 1.0
 */
public record ParserPolicy(
        String policyName,
        int maxNestingDepth,
        int maxParenScanDepth,
        int maxPatternLines,
        int maxResyncLookahead,
        int maxErrors,
        int maxDocumentLength
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any bound is invalid
     */
    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        requirePositive("maxNestingDepth", maxNestingDepth);
        requirePositive("maxParenScanDepth", maxParenScanDepth);
        requirePositive("maxPatternLines", maxPatternLines);
        requirePositive("maxResyncLookahead", maxResyncLookahead);
        requirePositive("maxErrors", maxErrors);
        requirePositive("maxDocumentLength", maxDocumentLength);
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
    }

    /**
     * Default bounds, suitable for interactive editing.
     *
     * @return default configuration
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 10, 20, 50, 20, 100, 5_000_000);
    }

    /**
     * Tighter bounds for untrusted input.
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 5, 10, 25, 10, 50, 1_000_000);
    }

    /**
     * Wider bounds for batch tooling over trusted rule bases.
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 20, 40, 200, 40, 500, 20_000_000);
    }

    /**
     * Creates a custom configuration. Builder values start from {@link #defaults()}.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxNestingDepth = 10;
        private int _maxParenScanDepth = 20;
        private int _maxPatternLines = 50;
        private int _maxResyncLookahead = 20;
        private int _maxErrors = 100;
        private int _maxDocumentLength = 5_000_000;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxNestingDepth, _maxParenScanDepth, _maxPatternLines,
                    _maxResyncLookahead, _maxErrors, _maxDocumentLength);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder maxParenScanDepth(int maxParenScanDepth) { this._maxParenScanDepth = maxParenScanDepth; return this; }
        public Builder maxPatternLines(int maxPatternLines) { this._maxPatternLines = maxPatternLines; return this; }
        public Builder maxResyncLookahead(int maxResyncLookahead) { this._maxResyncLookahead = maxResyncLookahead; return this; }
        public Builder maxErrors(int maxErrors) { this._maxErrors = maxErrors; return this; }
        public Builder maxDocumentLength(int maxDocumentLength) { this._maxDocumentLength = maxDocumentLength; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
