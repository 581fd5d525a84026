package io.github.cyfko.drlparser.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A logical construct ({@code exists}, {@code not}, {@code eval}, {@code forall}, {@code collect},
 * {@code accumulate}) whose argument list may span several lines and nest.
 * <p>
 * Every entry of {@link #nestedPatterns()} sits exactly one level deeper than its parent. Past the
 * configured maximum depth the tree is truncated: the node at the cap has no nested patterns.
 * </p>
 *
 * @param keyword           introducing keyword
 * @param content           full source text from the keyword through the closing parenthesis
 *                          (or through the last scanned line when incomplete)
 * @param complete          whether the parentheses of the construct are balanced
 * @param depth             nesting level, 0 for a pattern directly under a condition
 * @param nestedPatterns    patterns found inside this one, one level deeper
 * @param innerConditions   the body split on top-level {@code and}/{@code or}
 * @param parenthesesRanges every unmasked parenthesis of {@link #content()}, in document order
 * @param range             source range
 * @since 1.0
 */
public record MultiLinePatternNode(
        PatternKeyword keyword,
        String content,
        boolean complete,
        int depth,
        List<MultiLinePatternNode> nestedPatterns,
        List<ConditionNode> innerConditions,
        List<Range> parenthesesRanges,
        Range range
) implements AstNode {

    public MultiLinePatternNode {
        Objects.requireNonNull(keyword, "keyword is required");
        Objects.requireNonNull(content, "content is required");
        Objects.requireNonNull(range, "range is required");
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative, got: " + depth);
        }
        nestedPatterns = List.copyOf(nestedPatterns);
        innerConditions = List.copyOf(innerConditions);
        parenthesesRanges = List.copyOf(parenthesesRanges);
        for (MultiLinePatternNode nested : nestedPatterns) {
            if (nested.depth() != depth + 1) {
                throw new IllegalArgumentException(
                        "nested pattern depth " + nested.depth() + " does not follow parent depth " + depth);
            }
        }
    }

    /**
     * @return the condition type equivalent of {@link #keyword()}
     */
    public ConditionType patternType() {
        return keyword.conditionType();
    }

    public boolean isComplete() {
        return complete;
    }
}
