package io.github.cyfko.drlparser.core.parsing;

/**
 * Skips a malformed region up to the next line the parser can resume from.
 * <p>
 * Boundaries are an {@code end} line (consumed, since it closes the malformed construct), a
 * {@code when} or {@code then} line, and the start of any top-level statement (left for the caller).
 * At most {@link io.github.cyfko.drlparser.core.config.ParserPolicy#maxResyncLookahead()} lines are
 * skipped.
 * </p>
 *
 * @since 1.0
 */
public final class RecoveryScanner {

    private RecoveryScanner() {}

    /**
     * @param context parse state; the cursor is on the first line after the malformed header
     * @return the number of lines skipped
     */
    public static int resync(ParseContext context) {
        LineCursor cursor = context.cursor();
        int from = cursor.index();
        int limit = Math.min(cursor.size(), from + context.policy().maxResyncLookahead());
        while (cursor.index() < limit) {
            String code = cursor.code();
            if (code.equals("end")) {
                cursor.advance();
                break;
            }
            if (code.equals("when") || code.equals("then") || StatementScanner.startsStatement(code)) {
                break;
            }
            cursor.advance();
        }
        return cursor.index() - from;
    }
}
