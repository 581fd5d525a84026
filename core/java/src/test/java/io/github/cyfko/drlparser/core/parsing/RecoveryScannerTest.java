package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.config.ParserPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link RecoveryScanner}.
 *
 * @since 1.0
 */
@DisplayName("RecoveryScanner Tests")
class RecoveryScannerTest {

    private static ParseContext after(ParserPolicy policy, String... lines) {
        ParseContext context = new ParseContext(List.of(lines), policy, new ConditionParser(policy));
        context.cursor().moveTo(1);
        return context;
    }

    private static ParseContext after(String... lines) {
        return after(ParserPolicy.defaults(), lines);
    }

    @Test
    @DisplayName("end closes the malformed construct and is consumed")
    void testConsumesEnd() {
        ParseContext context = after("declare ???", "  a : int", "end // done", "rule \"R\"");

        assertEquals(2, RecoveryScanner.resync(context));
        assertEquals(3, context.cursor().index());
    }

    @ParameterizedTest
    @ValueSource(strings = {"when", "  then", "rule \"R\"", "import a.B;", "function void f() {}"})
    @DisplayName("Section keywords and statement starts are left for the caller")
    void testStopsBefore(String boundary) {
        ParseContext context = after("rule ???", "  junk", boundary, "end");

        assertEquals(1, RecoveryScanner.resync(context));
        assertEquals(2, context.cursor().index());
    }

    @Test
    @DisplayName("Keywords inside comments are not boundaries")
    void testMaskedBoundary() {
        ParseContext context = after("query (", "  // end", "  /* rule */ junk", "end");

        assertEquals(3, RecoveryScanner.resync(context));
        assertEquals(4, context.cursor().index());
    }

    @Test
    @DisplayName("Skipped lines are bounded by the lookahead")
    void testLookahead() {
        ParserPolicy policy = ParserPolicy.builder().maxResyncLookahead(3).build();
        ParseContext context = after(policy, "rule ???", "a", "b", "c", "d", "e", "end");

        assertEquals(3, RecoveryScanner.resync(context));
        assertEquals(4, context.cursor().index());
    }

    @Test
    @DisplayName("Nothing to skip at the end of the document")
    void testEndOfDocument() {
        ParseContext context = after("rule ???");

        assertEquals(0, RecoveryScanner.resync(context));
        assertFalse(context.cursor().hasNext());
    }
}
