package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.api.ParseError;
import io.github.cyfko.drlparser.core.api.Severity;
import io.github.cyfko.drlparser.core.config.ParserPolicy;
import io.github.cyfko.drlparser.core.model.ConditionNode;
import io.github.cyfko.drlparser.core.model.DroolsFile;
import io.github.cyfko.drlparser.core.model.GlobalNode;
import io.github.cyfko.drlparser.core.model.PackageNode;
import io.github.cyfko.drlparser.core.model.Position;
import io.github.cyfko.drlparser.core.model.QueryNode;
import io.github.cyfko.drlparser.core.model.Range;
import io.github.cyfko.drlparser.core.model.RuleNode;
import io.github.cyfko.drlparser.core.model.WhenNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link StructuralDiagnostics}.
 *
 * @since 1.0
 */
@DisplayName("StructuralDiagnostics Tests")
class StructuralDiagnosticsTest {

    private static StructuralDiagnostics diagnostics(ParserPolicy policy, ConditionParser parser) {
        return new StructuralDiagnostics(parser.treeBuilder(), policy.maxNestingDepth());
    }

    @Test
    @DisplayName("Invalid headers are reported at the statement start")
    void testInvalidHeaders() {
        ParserPolicy policy = ParserPolicy.defaults();
        DroolsFile file = DroolsFile.of(List.of(
                new PackageNode("", Range.of(0, 0, 0, 9)),
                new GlobalNode("Foo", "foo", Range.of(1, 0, 1, 15)),
                new QueryNode("", List.of(), List.of(), Range.of(2, 2, 3, 3))), Range.of(0, 0, 3, 3));

        List<ParseError> errors = diagnostics(policy, new ConditionParser(policy)).collect(file);

        assertEquals(2, errors.size());
        assertEquals("Invalid package declaration", errors.get(0).message());
        assertEquals("Invalid query declaration", errors.get(1).message());
        assertEquals(Position.of(2, 2), errors.get(1).range().start());
    }

    @Test
    @DisplayName("Incomplete pattern in a when block spans the pattern")
    void testIncompletePattern() {
        ParserPolicy policy = ParserPolicy.defaults();
        ConditionParser parser = new ConditionParser(policy);
        ConditionNode condition = parser.parse("exists(\n      A(x)", Position.of(2, 4));
        RuleNode rule = new RuleNode("R", List.of(),
                new WhenNode(List.of(condition), Range.of(1, 2, 3, 10)), null, Range.of(0, 0, 3, 10));

        List<ParseError> errors = diagnostics(policy, parser).collect(DroolsFile.of(List.of(rule), rule.range()));

        assertEquals(1, errors.size());
        assertEquals("Incomplete multi-line pattern: 1 unmatched opening parenthesis", errors.get(0).message());
        assertEquals(Severity.ERROR, errors.get(0).severity());
        assertEquals(Position.of(2, 4), errors.get(0).range().start());
    }

    @Test
    @DisplayName("Truncated tree yields one warning")
    void testTruncation() {
        ParserPolicy policy = ParserPolicy.builder().maxNestingDepth(1).build();
        ConditionParser parser = new ConditionParser(policy);
        ConditionNode condition = parser.parse(String.join("\n",
                "not(",
                "  exists(",
                "    eval(",
                "      true))",
                "  )"), Position.of(1, 2));
        QueryNode query = new QueryNode("q", List.of(), List.of(condition), Range.of(0, 0, 6, 3));

        List<ParseError> errors = diagnostics(policy, parser).collect(DroolsFile.of(List.of(query), query.range()));

        assertEquals(1, errors.size());
        assertEquals(Severity.WARNING, errors.get(0).severity());
        assertEquals("Pattern nesting exceeds maximum depth 1", errors.get(0).message());
        assertEquals(Position.of(2, 2), errors.get(0).range().start());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "not(|Incomplete multi-line pattern: 1 unmatched opening parenthesis",
            "accumulate((|Incomplete multi-line pattern: 2 unmatched opening parentheses",
            "eval({|Incomplete multi-line pattern: 1 unmatched opening parenthesis, 1 unmatched opening brace",
            "eval({{|Incomplete multi-line pattern: 1 unmatched opening parenthesis, 2 unmatched opening braces"
    })
    @DisplayName("Incomplete pattern messages count unmatched openers")
    void testIncompleteMessage(String content, String expected) {
        assertEquals(expected, StructuralDiagnostics.incompleteMessage(content));
    }
}
