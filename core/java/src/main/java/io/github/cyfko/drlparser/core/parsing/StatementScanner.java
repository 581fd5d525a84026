package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.model.AstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a document line by line and hands each top-level statement to the first
 * {@link StatementParser} that accepts it.
 * <p>
 * Lines without code (blank, {@code //} or inside {@code /* ... *&#47;}) and lines no parser accepts
 * are skipped without a diagnostic.
 * </p>
 *
 * @since 1.0
 */
public final class StatementScanner {

    private static final String[] STATEMENT_PREFIXES =
            {"package ", "import ", "global ", "function ", "rule ", "query ", "declare "};

    private final List<StatementParser> parsers;

    public StatementScanner() {
        this(List.of(new DeclarationParser(), new FunctionParser(), new RuleParser(), new QueryParser()));
    }

    public StatementScanner(List<StatementParser> parsers) {
        this.parsers = List.copyOf(parsers);
    }

    /**
     * @param code code part of a line, trimmed
     * @return true if the line starts a top-level statement
     */
    public static boolean startsStatement(String code) {
        for (String prefix : STATEMENT_PREFIXES) {
            if (code.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Outcome of a scan.
     *
     * @param nodes          statements in document order
     * @param inBlockComment whether the scan stopped inside a top-level block comment
     */
    public record Result(List<AstNode> nodes, boolean inBlockComment) {
    }

    /**
     * Parses the statements starting before {@code stopLine}, from the cursor position. The cursor
     * must be at the start of the document or on the line after a statement. The last statement may
     * extend past {@code stopLine}.
     *
     * @param context  parse state
     * @param stopLine line at which no new statement is started
     * @return the statements and the lexical state where the scan stopped
     */
    public Result scan(ParseContext context, int stopLine) {
        LineCursor cursor = context.cursor();
        List<AstNode> nodes = new ArrayList<>();
        ScanState state = ScanState.START;
        while (cursor.hasNext() && cursor.index() < stopLine) {
            LineCursor.CodeLine line = LineCursor.codeLine(cursor.current(), state);
            StatementParser parser = line.code().isEmpty() ? null : find(line.code());
            if (parser == null) {
                state = line.next();
                cursor.advance();
                continue;
            }
            int before = cursor.index();
            cursor.skipPrefix(state.inBlockComment() ? LineCursor.blockCommentEnd(cursor.current()) : 0);
            nodes.add(parser.parse(context));
            cursor.skipPrefix(0);
            if (cursor.index() <= before) {
                cursor.moveTo(before + 1);
            }
            state = ScanState.START;
        }
        return new Result(nodes, state.inBlockComment());
    }

    private StatementParser find(String code) {
        for (StatementParser parser : parsers) {
            if (parser.accepts(code)) {
                return parser;
            }
        }
        return null;
    }
}
