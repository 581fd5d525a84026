package io.github.cyfko.drlparser.core.api;

import io.github.cyfko.drlparser.core.model.DroolsFile;
import io.github.cyfko.drlparser.core.model.Position;
import io.github.cyfko.drlparser.core.spi.PatternCache;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Test suite for the value types of the parser API.
 *
 * @since 1.0
 */
@DisplayName("API Types Tests")
class ApiTypesTest {

    @Nested
    @DisplayName("ChangeRange")
    class ChangeRangeTests {

        @Test
        @DisplayName("Accepts an insertion point")
        void testInsertionPoint() {
            ChangeRange range = new ChangeRange(4, 4);
            assertEquals(4, range.start());
            assertEquals(4, range.end());
        }

        @Test
        @DisplayName("Rejects negative or inverted offsets")
        void testInvalid() {
            assertThrows(IllegalArgumentException.class, () -> new ChangeRange(-1, 2));
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new ChangeRange(5, 3));
            assertEquals("end (3) must not precede start (5)", e.getMessage());
        }
    }

    @Nested
    @DisplayName("IncrementalParseOptions")
    class OptionsTests {

        private final PatternCache cache = mock(PatternCache.class);

        @Test
        @DisplayName("Complete only with a tree, a cache and a document URI")
        void testIsComplete() {
            DroolsFile ast = DroolsFile.empty();

            assertTrue(new IncrementalParseOptions(List.of(), ast, cache, "file:///a.drl", 1L).isComplete());
            assertFalse(new IncrementalParseOptions(List.of(), null, cache, "file:///a.drl", 1L).isComplete());
            assertFalse(new IncrementalParseOptions(List.of(), ast, null, "file:///a.drl", 1L).isComplete());
            assertFalse(new IncrementalParseOptions(List.of(), ast, cache, null, 1L).isComplete());
            assertFalse(new IncrementalParseOptions(List.of(), ast, cache, " ", 1L).isComplete());
        }

        @Test
        @DisplayName("Ranges are required and copied")
        void testRanges() {
            assertThrows(NullPointerException.class,
                    () -> new IncrementalParseOptions(null, DroolsFile.empty(), cache, "u", 1L));

            List<ChangeRange> ranges = new ArrayList<>(List.of(new ChangeRange(0, 1)));
            IncrementalParseOptions options = new IncrementalParseOptions(ranges, DroolsFile.empty(), cache, "u", 1L);
            ranges.clear();
            assertEquals(1, options.ranges().size());
        }
    }

    @Nested
    @DisplayName("ParseResult and ParseError")
    class ResultTests {

        private final ParseResult result = new ParseResult(DroolsFile.empty(), List.of(
                ParseError.warning("Maximum nesting depth exceeded", Position.of(0, 2)),
                ParseError.error("Unmatched closing parenthesis", Position.of(1, 0)),
                ParseError.error("Unclosed parenthesis", Position.of(2, 4))));

        @Test
        @DisplayName("Factory methods produce width-one ranges")
        void testFactories() {
            ParseError error = result.errors().get(1);
            assertTrue(error.isError());
            assertEquals(Position.of(1, 1), error.range().end());
            assertFalse(result.errors().get(0).isError());
        }

        @Test
        @DisplayName("hasErrors ignores warnings")
        void testHasErrors() {
            assertTrue(result.hasErrors());
            assertFalse(new ParseResult(DroolsFile.empty(), List.of(result.errors().get(0))).hasErrors());
        }

        @Test
        @DisplayName("limitedErrors keeps the first diagnostics")
        void testLimitedErrors() {
            assertEquals(2, result.limitedErrors(2).size());
            assertEquals(3, result.limitedErrors(10).size());
            assertTrue(result.limitedErrors(0).isEmpty());
            assertThrows(IllegalArgumentException.class, () -> result.limitedErrors(-1));
        }

        @Test
        @DisplayName("Tree and diagnostic fields are required")
        void testRequired() {
            assertThrows(NullPointerException.class, () -> new ParseResult(null, List.of()));
            assertThrows(NullPointerException.class,
                    () -> new ParseError("m", null, Severity.ERROR));
        }
    }
}
