package io.github.cyfko.drlparser.core.impl;

import io.github.cyfko.drlparser.core.api.ChangeRange;
import io.github.cyfko.drlparser.core.api.IncrementalParseOptions;
import io.github.cyfko.drlparser.core.api.ParseResult;
import io.github.cyfko.drlparser.core.cache.InMemoryPatternCache;
import io.github.cyfko.drlparser.core.model.DroolsFile;
import io.github.cyfko.drlparser.core.parsing.ParenthesesTracker;
import io.github.cyfko.drlparser.core.spi.LineSpan;
import io.github.cyfko.drlparser.core.spi.PatternCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Incremental parsing through {@link BasicDrlParser#parse(String, IncrementalParseOptions)}.
 * <p>
 * Every incremental result is compared with a full parse of the same text: tree and diagnostics must
 * be equal.
 * </p>
 *
 * @since 1.0
 */
@DisplayName("Incremental parsing Tests")
class IncrementalParseControllerTest {

    private static final String URI = "file:///rules/sample.drl";

    private static final String ORIGINAL = String.join("\n",
            "rule \"First\"",
            "when",
            "    exists(",
            "        Person(age > 18)",
            "    )",
            "then",
            "    log(\"first\");",
            "end",
            "",
            "rule \"Second\"",
            "when",
            "    Account(balance < 0)",
            "then",
            "end");

    private BasicDrlParser parser;
    private DroolsFile previous;

    @Mock
    private PatternCache mockCache;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        parser = new BasicDrlParser();
        previous = parser.parse(ORIGINAL).ast();
    }

    private static ChangeRange changeOf(String text, String replacement) {
        int start = text.indexOf(replacement);
        assertTrue(start >= 0, "replacement not found: " + replacement);
        return new ChangeRange(start, start + replacement.length());
    }

    private ParseResult incremental(String text, DroolsFile base, PatternCache cache, ChangeRange... ranges) {
        return parser.parse(text, new IncrementalParseOptions(List.of(ranges), base, cache, URI, 1L));
    }

    private void assertMatchesFullParse(String text, ParseResult incremental) {
        ParseResult full = parser.parse(text);
        assertEquals(full.ast(), incremental.ast());
        assertEquals(full.errors(), incremental.errors());
    }

    @Nested
    @DisplayName("Pattern path")
    class PatternPathTests {

        @Test
        @DisplayName("Edit inside a multi-line pattern rebuilds only its rule")
        void testEditInsidePattern() {
            String edited = ORIGINAL.replace("age > 18", "age > 21");

            ParseResult result = incremental(edited, previous, mockCache, changeOf(edited, "21"));

            assertMatchesFullParse(edited, result);
            assertSame(previous.rules().get(1), result.ast().rules().get(1));
            assertEquals("21", result.ast().rules().get(0).when().conditions().get(0)
                    .multiLinePattern().innerConditions().get(0).constraints().get(0).value());
        }

        @Test
        @DisplayName("Pattern cache is consulted and written for the edited lines")
        void testPatternCacheInteraction() {
            String edited = ORIGINAL.replace("age > 18", "age > 21");

            incremental(edited, previous, mockCache, changeOf(edited, "21"));

            verify(mockCache).getCachedMultiLinePatterns(eq(URI), eq(1L), eq(List.of(LineSpan.of(3, 3))));
            verify(mockCache).cacheMultiLinePatterns(eq(URI), eq(1L), anyList(), eq(List.of(LineSpan.of(3, 3))));
            verify(mockCache).cacheParenthesesTracker(eq(URI), eq(1L), any(ParenthesesTracker.class),
                    eq(LineSpan.of(0, 13)));
        }

        @Test
        @DisplayName("Successive edits reuse the cached tracker and stay equal to a full parse")
        void testSuccessiveEditsWithRealCache() {
            PatternCache cache = new InMemoryPatternCache(8);

            String first = ORIGINAL.replace("age > 18", "age > 21");
            ParseResult firstResult = incremental(first, previous, cache, changeOf(first, "21"));
            assertMatchesFullParse(first, firstResult);

            String second = first.replace("Person(age > 21)", "Person(age > (21");
            ParseResult secondResult = incremental(second, firstResult.ast(), cache, changeOf(second, "(21"));
            assertMatchesFullParse(second, secondResult);
            assertTrue(secondResult.hasErrors());
            assertFalse(secondResult.ast().rules().get(0).when().conditions().get(0)
                    .multiLinePattern().isComplete());

            String third = second.replace("Person(age > (21", "Person(age > 21)");
            ParseResult thirdResult = incremental(third, secondResult.ast(), cache, changeOf(third, "21)"));
            assertMatchesFullParse(third, thirdResult);
            assertFalse(thirdResult.hasErrors());
        }

        @Test
        @DisplayName("Re-sending unchanged text reuses the cached pattern scan")
        void testCachedPatternReused() {
            PatternCache cache = spy(new InMemoryPatternCache(8));
            String edited = ORIGINAL.replace("age > 18", "age > 21");
            ParseResult once = incremental(edited, previous, cache, changeOf(edited, "21"));

            ParseResult twice = incremental(edited, once.ast(), cache, changeOf(edited, "21"));

            assertEquals(once, twice);
            verify(cache, times(2)).getCachedMultiLinePatterns(eq(URI), eq(1L), anyList());
            assertEquals(1, cache.getCachedMultiLinePatterns(URI, 1L, List.of(LineSpan.of(3, 3))).size());
        }

        @Test
        @DisplayName("Unclosed cached pattern is rescanned after the edited line grows")
        void testIncompleteCachedPatternRescanned() {
            PatternCache cache = new InMemoryPatternCache(8);
            String text = String.join("\n",
                    "rule \"R\"",
                    "when",
                    "    exists(",
                    "        Person(age > 18)",
                    "then",
                    "end");
            DroolsFile base = parser.parse(text).ast();
            String first = text.replace("age > 18", "age > 19");
            ParseResult firstResult = incremental(first, base, cache, changeOf(first, "19"));
            assertMatchesFullParse(first, firstResult);

            String second = first.replace("Person(age > 19)", "Person(age > 19) and Foo()");
            ParseResult secondResult = incremental(second, firstResult.ast(), cache, changeOf(second, " and Foo()"));

            assertMatchesFullParse(second, secondResult);
            assertTrue(secondResult.ast().rules().get(0).when().conditions().get(0)
                    .multiLinePattern().content().contains("Foo()"));
        }

        @Test
        @DisplayName("Edit inside a query body rebuilds the query")
        void testEditInsideQuery() {
            String text = String.join("\n",
                    "query \"risky\"",
                    "    exists(",
                    "        Account(balance < 0)",
                    "    )",
                    "end");
            DroolsFile base = parser.parse(text).ast();
            String edited = text.replace("balance < 0", "balance < 5");

            ParseResult result = incremental(edited, base, mockCache, changeOf(edited, "5"));

            assertMatchesFullParse(edited, result);
            assertEquals("5", result.ast().queries().get(0).conditions().get(0)
                    .multiLinePattern().innerConditions().get(0).constraints().get(0).value());
            verify(mockCache).cacheMultiLinePatterns(eq(URI), eq(1L), anyList(), eq(List.of(LineSpan.of(2, 2))));
        }
    }

    @Nested
    @DisplayName("Statement path")
    class StatementPathTests {

        @Test
        @DisplayName("Header edit re-parses the first rule and shares the second")
        void testHeaderEdit() {
            String edited = ORIGINAL.replace("\"First\"", "\"Fixed\"");

            ParseResult result = incremental(edited, previous, mockCache, changeOf(edited, "Fixed"));

            assertMatchesFullParse(edited, result);
            assertEquals("Fixed", result.ast().rules().get(0).name());
            assertSame(previous.rules().get(1), result.ast().rules().get(1));
        }

        @Test
        @DisplayName("Inserted lines re-parse to the end of the document")
        void testLineInsertion() {
            String edited = ORIGINAL.replace("    Account(balance < 0)\n",
                    "    Account(balance < 0)\n    Customer(vip == true)\n");

            ParseResult result = incremental(edited, previous, mockCache, changeOf(edited, "    Customer(vip == true)"));

            assertMatchesFullParse(edited, result);
            assertSame(previous.rules().get(0), result.ast().rules().get(0));
            assertEquals(2, result.ast().rules().get(1).when().conditions().size());
        }

        @Test
        @DisplayName("Appended rule is picked up")
        void testAppendRule() {
            String edited = ORIGINAL + "\n\nrule \"Third\"\nwhen\nthen\nend";

            ParseResult result = incremental(edited, previous, mockCache,
                    new ChangeRange(ORIGINAL.length(), edited.length()));

            assertMatchesFullParse(edited, result);
            assertEquals(3, result.ast().rules().size());
        }

        @Test
        @DisplayName("Opening a block comment swallows the following statements")
        void testUnterminatedBlockComment() {
            String edited = ORIGINAL.replace("end\n\nrule \"Second\"", "end\n/*\nrule \"Second\"");

            ParseResult result = incremental(edited, previous, mockCache, changeOf(edited, "/*"));

            assertMatchesFullParse(edited, result);
            assertEquals(1, result.ast().rules().size());
        }

        @Test
        @DisplayName("Replacing a query terminator re-parses the following statements")
        void testQueryTerminatorReplaced() {
            String text = String.join("\n",
                    "query \"q\"",
                    "    not(",
                    "      Ban()",
                    "    )",
                    "end",
                    "",
                    "declare Thing",
                    "end");
            DroolsFile base = parser.parse(text).ast();
            String edited = text.replaceFirst("\nend\n", "\nnot(Foo())\n");

            ParseResult result = incremental(edited, base, mockCache, changeOf(edited, "not(Foo())"));

            assertMatchesFullParse(edited, result);
            assertEquals(parser.parse(edited).ast().queries().get(0).range(),
                    result.ast().queries().get(0).range());
        }

        @Test
        @DisplayName("Edit introducing rule boundaries takes the statement path")
        void testBoundaryEdit() {
            String edited = ORIGINAL.replace("    log(\"first\");", "end\nrule \"X\"");

            ParseResult result = incremental(edited, previous, mockCache, changeOf(edited, "end\nrule \"X\""));

            assertMatchesFullParse(edited, result);
            assertEquals(List.of("First", "X", "Second"),
                    result.ast().rules().stream().map(r -> r.name()).toList());
        }
    }

    @Nested
    @DisplayName("Options handling")
    class OptionsTests {

        @Test
        @DisplayName("Empty change list returns the previous tree")
        void testNoChanges() {
            ParseResult result = parser.parse(ORIGINAL,
                    new IncrementalParseOptions(List.of(), previous, mockCache, URI, 1L));

            assertSame(previous, result.ast());
            assertTrue(result.errors().isEmpty());
        }

        @Test
        @DisplayName("Incomplete options fall back to a full parse without touching a cache")
        void testIncompleteOptions() {
            String edited = ORIGINAL.replace("age > 18", "age > 21");

            ParseResult noCache = parser.parse(edited,
                    new IncrementalParseOptions(List.of(changeOf(edited, "21")), previous, null, URI, 1L));
            ParseResult noUri = parser.parse(edited,
                    new IncrementalParseOptions(List.of(changeOf(edited, "21")), previous, mockCache, " ", 1L));

            assertMatchesFullParse(edited, noCache);
            assertMatchesFullParse(edited, noUri);
            verifyNoInteractions(mockCache);
        }

        @Test
        @DisplayName("Cache failure becomes a critical error")
        void testCacheFailure() {
            when(mockCache.getCachedMultiLinePatterns(any(), anyLong(), anyList()))
                    .thenThrow(new IllegalStateException("cache unavailable"));
            String edited = ORIGINAL.replace("age > 18", "age > 21");

            ParseResult result = incremental(edited, previous, mockCache, changeOf(edited, "21"));

            assertEquals(DroolsFile.empty(), result.ast());
            assertEquals("Critical parsing error: cache unavailable", result.errors().get(0).message());
        }

        @Test
        @DisplayName("Change ranges past the end of the text are clamped")
        void testClampedRange() {
            String edited = ORIGINAL + "\n";

            ParseResult result = incremental(edited, previous, mockCache, new ChangeRange(0, edited.length() + 50));

            assertMatchesFullParse(edited, result);
        }
    }
}
