package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.model.Position;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cuts the lines of a {@code when} block or query body into one text chunk per condition.
 * <p>
 * A line starts a new condition when the parentheses of the current chunk are balanced and the line
 * begins with {@code $ident :} or with a pattern keyword followed by {@code (}. A line beginning with a
 * fact type ({@code Type(}) also starts one, unless the previous line ends with an operator that
 * continues the condition ({@code and}, {@code or}, {@code from}, {@code ,}, {@code &&}, {@code ||}).
 * Any other line continues the current chunk. While a chunk is open, a line never splits it.
 * </p>
 * <p>
 * Lines without code (blank or comment only) between conditions are skipped. A chunk keeps the line
 * breaks of its source so positions inside it can be recovered.
 * </p>
 *
 * @since 1.0
 */
public final class ConditionSplitter {

    private static final Pattern BINDING_START = Pattern.compile("^\\$\\w+\\s*:");
    private static final Pattern KEYWORD_START =
            Pattern.compile("^(exists|not|eval|forall|collect|accumulate)\\s*\\(");
    private static final Pattern FACT_START =
            Pattern.compile("^(?:(?:not|exists|forall)\\s+)?\\w+(?:\\.\\w+)*\\s*\\(");
    private static final Pattern CONTINUED = Pattern.compile("(?:\\b(?:and|or|from)|,|&&|\\|\\|)$");
    private static final Pattern LEADING_OPERATOR = Pattern.compile("^(?:and|or)\\b");

    private ConditionSplitter() {}

    /**
     * One condition's text.
     *
     * @param text  text from the first non-blank character of the first line, trailing blanks removed
     * @param start document position of the first character of {@code text}
     */
    public record Chunk(String text, Position start) {
    }

    /**
     * @param cursor lines of the document
     * @param from   first line of the block
     * @param to     line after the block
     * @return the condition chunks in document order
     */
    public static List<Chunk> split(LineCursor cursor, int from, int to) {
        List<Chunk> chunks = new ArrayList<>();
        StringBuilder current = null;
        Position start = null;
        List<String> skipped = new ArrayList<>();
        int balance = 0;
        String previousCode = "";
        ScanState state = ScanState.START;

        for (int i = from; i < to; i++) {
            String line = cursor.line(i);
            LineCursor.CodeLine scan = LineCursor.codeLine(line, state);
            state = scan.next();

            if (scan.code().isEmpty()) {
                if (current != null) {
                    skipped.add(line);
                }
                continue;
            }
            if (current == null || (balance <= 0 && startsCondition(scan.code(), previousCode))) {
                flush(chunks, current, start);
                start = cursor.lineStart(i);
                current = new StringBuilder(line.substring(start.character()));
                skipped.clear();
                balance = 0;
            } else {
                for (String gap : skipped) {
                    current.append('\n').append(gap);
                }
                skipped.clear();
                current.append('\n').append(line);
            }
            balance += scan.balance();
            previousCode = scan.code();
        }
        flush(chunks, current, start);
        return chunks;
    }

    static boolean startsCondition(String code, String previousCode) {
        if (BINDING_START.matcher(code).find() || KEYWORD_START.matcher(code).find()) {
            return true;
        }
        return FACT_START.matcher(code).find()
                && !CONTINUED.matcher(previousCode).find()
                && !LEADING_OPERATOR.matcher(code).find();
    }

    private static void flush(List<Chunk> chunks, StringBuilder current, Position start) {
        if (current != null) {
            chunks.add(new Chunk(current.toString().stripTrailing(), start));
        }
    }
}
