package io.github.cyfko.drlparser.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One condition of a {@code when} block or query body, or one part of a decomposed pattern body.
 * <p>
 * Optional parts are {@code null} (variable, fact type, multi-line pattern) or empty (lists) when the
 * text does not have the corresponding shape. A bound variable is expected to start with {@code $};
 * a binding without it is still reported here and left to validation.
 * </p>
 *
 * @param content           raw condition text
 * @param conditionType     condition kind
 * @param variable          bound variable, or {@code null}
 * @param factType          matched fact type, or {@code null}
 * @param constraints       recognized {@code field op value} constraints
 * @param multiLine         whether the condition spans lines or holds a multi-line pattern
 * @param multiLinePattern  the pattern owned by this condition, or {@code null}
 * @param nestedConditions  parts this condition decomposes into
 * @param spanLines         every line number covered, ascending
 * @param parenthesesRanges every unmasked parenthesis of the condition text, in document order
 * @param range             source range
 * @since 1.0
 */
public record ConditionNode(
        String content,
        ConditionType conditionType,
        String variable,
        String factType,
        List<ConstraintNode> constraints,
        boolean multiLine,
        MultiLinePatternNode multiLinePattern,
        List<ConditionNode> nestedConditions,
        List<Integer> spanLines,
        List<Range> parenthesesRanges,
        Range range
) implements AstNode {

    public ConditionNode {
        Objects.requireNonNull(content, "content is required");
        Objects.requireNonNull(conditionType, "conditionType is required");
        Objects.requireNonNull(range, "range is required");
        constraints = List.copyOf(constraints);
        nestedConditions = List.copyOf(nestedConditions);
        spanLines = List.copyOf(spanLines);
        parenthesesRanges = List.copyOf(parenthesesRanges);
    }

    public boolean isMultiLine() {
        return multiLine;
    }

    public static Builder builder(String content, Range range) {
        return new Builder(content, range);
    }

    /**
     * Fluent builder; only content and range are mandatory.
     */
    public static final class Builder {
        private final String content;
        private final Range range;
        private ConditionType conditionType = ConditionType.PATTERN;
        private String variable;
        private String factType;
        private List<ConstraintNode> constraints = List.of();
        private boolean multiLine;
        private MultiLinePatternNode multiLinePattern;
        private List<ConditionNode> nestedConditions = List.of();
        private List<Integer> spanLines = List.of();
        private List<Range> parenthesesRanges = List.of();

        private Builder(String content, Range range) {
            this.content = content;
            this.range = range;
        }

        public Builder conditionType(ConditionType conditionType) { this.conditionType = conditionType; return this; }
        public Builder variable(String variable) { this.variable = variable; return this; }
        public Builder factType(String factType) { this.factType = factType; return this; }
        public Builder constraints(List<ConstraintNode> constraints) { this.constraints = constraints; return this; }
        public Builder multiLine(boolean multiLine) { this.multiLine = multiLine; return this; }
        public Builder multiLinePattern(MultiLinePatternNode pattern) { this.multiLinePattern = pattern; return this; }
        public Builder nestedConditions(List<ConditionNode> nested) { this.nestedConditions = nested; return this; }
        public Builder spanLines(List<Integer> spanLines) { this.spanLines = spanLines; return this; }
        public Builder parenthesesRanges(List<Range> ranges) { this.parenthesesRanges = ranges; return this; }

        public ConditionNode build() {
            return new ConditionNode(content, conditionType, variable, factType, constraints, multiLine,
                    multiLinePattern, nestedConditions, spanLines, parenthesesRanges, range);
        }
    }
}
