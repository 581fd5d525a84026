package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.model.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link ConditionSplitter}.
 *
 * @since 1.0
 */
@DisplayName("ConditionSplitter Tests")
class ConditionSplitterTest {

    private static List<ConditionSplitter.Chunk> split(String... lines) {
        return ConditionSplitter.split(new LineCursor(List.of(lines), 0), 0, lines.length);
    }

    private static List<String> texts(List<ConditionSplitter.Chunk> chunks) {
        return chunks.stream().map(ConditionSplitter.Chunk::text).toList();
    }

    @Test
    @DisplayName("One condition per line with document positions")
    void testOnePerLine() {
        List<ConditionSplitter.Chunk> chunks = split(
                "    $p : Person()",
                "    Account(owner == $p)",
                "    eval(true)");

        assertEquals(List.of("$p : Person()", "Account(owner == $p)", "eval(true)"), texts(chunks));
        assertEquals(Position.of(1, 4), chunks.get(1).start());
    }

    @Test
    @DisplayName("Open parentheses keep following lines in the chunk")
    void testOpenParentheses() {
        List<ConditionSplitter.Chunk> chunks = split(
                "  exists(",
                "    Person(age > 18)",
                "  )",
                "  Account()");

        assertEquals(List.of("exists(\n    Person(age > 18)\n  )", "Account()"), texts(chunks));
    }

    @Test
    @DisplayName("Continuation operators join the next fact line")
    void testContinuation() {
        List<ConditionSplitter.Chunk> chunks = split(
                "  Person() or",
                "  Company()",
                "  $a : Account()",
                "  and Order()");

        assertEquals(List.of("Person() or\n  Company()", "$a : Account()\n  and Order()"), texts(chunks));
    }

    @Test
    @DisplayName("Comment lines between conditions are skipped, inside a condition they are kept")
    void testComments() {
        List<ConditionSplitter.Chunk> chunks = split(
                "  // first",
                "  not(",
                "    // inner",
                "    A()",
                "  )",
                "",
                "  /* gap */",
                "  B()");

        assertEquals(List.of("not(\n    // inner\n    A()\n  )", "B()"), texts(chunks));
        assertEquals(Position.of(1, 2), chunks.get(0).start());
    }

    @Test
    @DisplayName("Quote inside a comment does not open a string")
    void testQuoteInComment() {
        List<ConditionSplitter.Chunk> chunks = split(
                "  A() // it's fine",
                "  B()");
        assertEquals(2, chunks.size());
    }

    @Test
    @DisplayName("Empty block yields no chunk")
    void testEmpty() {
        assertTrue(split("", "   ", "// nothing").isEmpty());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "$x : Foo()||true",
            "exists(||true",
            "not Foo()||true",
            "Foo()|Bar() from|false",
            "Foo()|Bar(),|false",
            "or Foo()||false",
            "x > 1||false"
    })
    @DisplayName("Condition starters")
    void testStartsCondition(String code, String previous, boolean expected) {
        assertEquals(expected, ConditionSplitter.startsCondition(code, previous == null ? "" : previous));
    }
}
