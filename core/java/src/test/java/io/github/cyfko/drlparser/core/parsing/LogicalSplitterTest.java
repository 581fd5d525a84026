package io.github.cyfko.drlparser.core.parsing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link LogicalSplitter}.
 *
 * @since 1.0
 */
@DisplayName("LogicalSplitter Tests")
class LogicalSplitterTest {

    private static List<String> texts(List<LogicalSplitter.Part> parts) {
        return parts.stream().map(LogicalSplitter.Part::text).toList();
    }

    @Nested
    @DisplayName("Logical operators")
    class LogicalTests {

        @Test
        @DisplayName("Top-level and splits, with offsets into the text")
        void testAnd() {
            LogicalSplitter.Split split = LogicalSplitter.splitLogical("A() and B(x)");

            assertTrue(split.isLogical());
            assertTrue(split.hasAnd());
            assertFalse(split.hasOr());
            assertEquals(List.of(new LogicalSplitter.Part("A()", 0), new LogicalSplitter.Part("B(x)", 8)),
                    split.parts());
        }

        @Test
        @DisplayName("Mixed operators are both reported")
        void testMixed() {
            LogicalSplitter.Split split = LogicalSplitter.splitLogical("A()\n  or B() and C()");

            assertEquals(List.of("A()", "B()", "C()"), texts(split.parts()));
            assertTrue(split.hasAnd());
            assertTrue(split.hasOr());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "Person(a and b)",
                "android() order()",
                "A(x == \" and \")",
                "A() // and B()",
                "A()and B()"
        })
        @DisplayName("Nested, embedded, masked or unspaced operators do not split")
        void testNoSplit(String text) {
            LogicalSplitter.Split split = LogicalSplitter.splitLogical(text);
            assertFalse(split.isLogical());
            assertEquals(1, split.parts().size());
        }

        @Test
        @DisplayName("Blank text has no parts")
        void testBlank() {
            assertTrue(LogicalSplitter.splitLogical("   ").parts().isEmpty());
        }
    }

    @Nested
    @DisplayName("Commas")
    class CommaTests {

        @Test
        @DisplayName("Commas split only at depth zero")
        void testCommas() {
            List<LogicalSplitter.Part> parts = LogicalSplitter.splitCommas("a > 1, f(b, c), d in [1, 2], e == \"x,y\"");

            assertEquals(List.of("a > 1", "f(b, c)", "d in [1, 2]", "e == \"x,y\""), texts(parts));
            assertEquals(7, parts.get(1).offset());
        }

        @Test
        @DisplayName("Empty pieces are dropped")
        void testEmptyPieces() {
            assertEquals(List.of("a"), texts(LogicalSplitter.splitCommas(" , a ,")));
        }
    }
}
