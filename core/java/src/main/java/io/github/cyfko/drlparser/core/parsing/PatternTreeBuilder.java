package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.config.ParserPolicy;
import io.github.cyfko.drlparser.core.model.ConditionNode;
import io.github.cyfko.drlparser.core.model.MultiLinePatternNode;
import io.github.cyfko.drlparser.core.model.Position;
import io.github.cyfko.drlparser.core.model.Range;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns scanned {@link PatternMetadata} into a {@link MultiLinePatternNode} tree.
 * <p>
 * The body between the outer parentheses is searched for nested pattern keywords. Each one becomes a
 * child one level deeper; the search resumes after the child's closing parenthesis, so a keyword is
 * owned by exactly one node. The body is also split on top-level {@code and}/{@code or} into
 * {@link MultiLinePatternNode#innerConditions()}; a part that is itself one of the children reuses the
 * child node.
 * </p>
 * <p>
 * Recursion is bounded by {@link ParserPolicy#maxNestingDepth()}: a pattern at that depth is returned
 * as a leaf, without nested patterns or inner conditions.
 * </p>
 *
 * @since 1.0
 */
public final class PatternTreeBuilder {

    private final ParserPolicy policy;
    private final MultiLinePatternDetector detector;

    public PatternTreeBuilder(ParserPolicy policy, MultiLinePatternDetector detector) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
        this.detector = Objects.requireNonNull(detector, "detector is required");
    }

    /**
     * @param pattern    scanned pattern; its content starts with the keyword
     * @param depth      nesting level of the pattern
     * @param conditions parser used for the inner conditions
     * @return the pattern tree
     */
    public MultiLinePatternNode build(PatternMetadata pattern, int depth, ConditionParser conditions) {
        String content = pattern.content();
        TextPositions positions = TextPositions.of(content, pattern.range().start());
        List<Range> parentheses = ConditionParser.parenthesesRanges(content, positions);

        int open = CharacterClassifier.indexOfCode(content, '(');
        if (depth >= policy.maxNestingDepth() || open < 0) {
            return new MultiLinePatternNode(pattern.keyword(), content, pattern.complete(), depth,
                    List.of(), List.of(), parentheses, pattern.range());
        }

        int close = pattern.complete() ? content.length() - 1 : content.length();
        String inner = content.substring(open + 1, Math.max(open + 1, close));
        TextPositions innerPositions = TextPositions.of(inner, positions.positionAt(open + 1));

        List<MultiLinePatternNode> nested = new ArrayList<>();
        Map<Position, MultiLinePatternNode> byStart = new HashMap<>();
        int resumeAt = 0;
        for (MultiLinePatternDetector.KeywordHit hit : MultiLinePatternDetector.findKeywords(inner)) {
            if (hit.offset() < resumeAt) {
                continue;
            }
            PatternMetadata child = detector.scan(inner, hit, innerPositions);
            MultiLinePatternNode node = build(child, depth + 1, conditions);
            nested.add(node);
            byStart.put(node.range().start(), node);
            resumeAt = hit.offset() + child.content().length();
        }

        List<ConditionNode> innerConditions = new ArrayList<>();
        for (LogicalSplitter.Part part : LogicalSplitter.splitLogical(inner).parts()) {
            innerConditions.add(conditions.parse(part.text(), innerPositions.positionAt(part.offset()),
                    depth + 1, byStart, null));
        }

        return new MultiLinePatternNode(pattern.keyword(), content, pattern.complete(), depth,
                nested, innerConditions, parentheses, pattern.range());
    }

    /**
     * @return true if the pattern has keyword hits that a node at {@code depth} will not represent
     */
    public boolean isTruncated(MultiLinePatternNode node) {
        return node.depth() >= policy.maxNestingDepth() && MultiLinePatternDetector.hasNestedPatterns(node.content());
    }
}
