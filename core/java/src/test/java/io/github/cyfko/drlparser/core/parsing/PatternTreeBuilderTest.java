package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.config.ParserPolicy;
import io.github.cyfko.drlparser.core.model.ConditionNode;
import io.github.cyfko.drlparser.core.model.ConditionType;
import io.github.cyfko.drlparser.core.model.MultiLinePatternNode;
import io.github.cyfko.drlparser.core.model.PatternKeyword;
import io.github.cyfko.drlparser.core.model.Position;
import io.github.cyfko.drlparser.core.model.Range;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link PatternTreeBuilder}.
 *
 * @since 1.0
 */
@DisplayName("PatternTreeBuilder Tests")
class PatternTreeBuilderTest {

    private static MultiLinePatternNode build(ParserPolicy policy, String text) {
        ConditionParser conditions = new ConditionParser(policy);
        PatternMetadata pattern = conditions.detector().detect(text, Position.of(0, 0)).orElseThrow();
        return conditions.treeBuilder().build(pattern, 0, conditions);
    }

    @Test
    @DisplayName("Siblings are children of the same node, each keyword owned once")
    void testSiblings() {
        MultiLinePatternNode root = build(ParserPolicy.defaults(),
                "forall(\n  not(A(x == 1))\n  exists(B(not(C())))\n)");

        assertEquals(PatternKeyword.FORALL, root.keyword());
        assertEquals(2, root.nestedPatterns().size());
        assertEquals(PatternKeyword.NOT, root.nestedPatterns().get(0).keyword());
        MultiLinePatternNode exists = root.nestedPatterns().get(1);
        assertEquals(PatternKeyword.EXISTS, exists.keyword());
        assertEquals(Position.of(2, 2), exists.range().start());
        assertEquals(1, exists.nestedPatterns().size());
        assertEquals(2, exists.nestedPatterns().get(0).depth());
    }

    @Test
    @DisplayName("Inner conditions split on and/or and reuse child nodes")
    void testInnerConditions() {
        MultiLinePatternNode root = build(ParserPolicy.defaults(),
                "exists(\n  Person(age > 18) and not(\n    Account()\n  )\n)");

        assertEquals(2, root.innerConditions().size());
        ConditionNode person = root.innerConditions().get(0);
        assertEquals("Person", person.factType());
        assertEquals(Range.of(1, 2, 1, 18), person.range());

        ConditionNode negation = root.innerConditions().get(1);
        assertEquals(ConditionType.NOT, negation.conditionType());
        assertSame(root.nestedPatterns().get(0), negation.multiLinePattern());
    }

    @Test
    @DisplayName("Parentheses ranges cover every code parenthesis")
    void testParenthesesRanges() {
        MultiLinePatternNode root = build(ParserPolicy.defaults(), "eval(f(\"(\"))");
        assertEquals(4, root.parenthesesRanges().size());
        assertEquals(Range.of(0, 4, 0, 5), root.parenthesesRanges().get(0));
    }

    @Test
    @DisplayName("Depth cap turns the node into a leaf and flags truncation")
    void testDepthCap() {
        ParserPolicy policy = ParserPolicy.builder().maxNestingDepth(2).build();
        ConditionParser conditions = new ConditionParser(policy);
        MultiLinePatternNode root = build(policy, "not(exists(not(exists(A()))))");

        MultiLinePatternNode level1 = root.nestedPatterns().get(0);
        MultiLinePatternNode level2 = level1.nestedPatterns().get(0);
        assertEquals(2, level2.depth());
        assertTrue(level2.nestedPatterns().isEmpty());
        assertTrue(level2.innerConditions().isEmpty());
        assertTrue(conditions.treeBuilder().isTruncated(level2));
        assertFalse(conditions.treeBuilder().isTruncated(level1));
    }

    @Test
    @DisplayName("Incomplete pattern keeps everything after its parenthesis as body")
    void testIncomplete() {
        MultiLinePatternNode root = build(ParserPolicy.defaults(), "not(\n  exists(A()\n");

        assertFalse(root.isComplete());
        assertEquals(1, root.nestedPatterns().size());
        assertFalse(root.nestedPatterns().get(0).isComplete());
    }
}
