package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.model.Position;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Explicit read position over the lines of a document, shared by the statement parsers of one parse.
 *
 * @since 1.0
 */
public final class LineCursor {

    private final List<String> lines;
    private int index;
    private int skippedLine = -1;
    private int skippedColumns;

    public LineCursor(List<String> lines, int index) {
        this.lines = Objects.requireNonNull(lines, "lines is required");
        this.index = index;
    }

    /**
     * Splits text into lines on {@code \n}, dropping a trailing {@code \r} from each line.
     * The result always has at least one line.
     */
    public static List<String> split(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= text.length(); i++) {
            if (i == text.length() || text.charAt(i) == '\n') {
                int end = i > start && text.charAt(i - 1) == '\r' ? i - 1 : i;
                lines.add(text.substring(start, end));
                start = i + 1;
            }
        }
        return lines;
    }

    /**
     * Code part of one line and its parenthesis balance.
     *
     * @param code    the line with comments removed and string literals kept, trimmed
     * @param balance unmasked {@code (} minus unmasked {@code )}
     * @param next    lexical state at the start of the following line
     */
    public record CodeLine(String code, int balance, ScanState next) {
    }

    /**
     * Scans one line starting from a given lexical state.
     */
    public static CodeLine codeLine(String line, ScanState in) {
        StringBuilder code = new StringBuilder(line.length());
        int balance = 0;
        ScanState state = in;
        for (int i = 0; i < line.length(); i++) {
            ScanState before = state;
            state = CharacterClassifier.classify(line, i, state);
            char c = line.charAt(i);
            if (state.code()) {
                code.append(c);
                if (c == '(') {
                    balance++;
                } else if (c == ')') {
                    balance--;
                }
            } else if (before.inString() || state.inString()) {
                code.append(c);
            }
        }
        return new CodeLine(code.toString().trim(), balance, state.nextLine());
    }

    /**
     * @return the code part of a line scanned on its own
     */
    public static String codeText(String line) {
        return codeLine(line, ScanState.START).code();
    }

    public boolean hasNext() {
        return index < lines.size();
    }

    public String current() {
        return lines.get(index);
    }

    /**
     * @return {@link #codeText(String)} of the current line, past any skipped prefix
     */
    public String code() {
        return codeText(index == skippedLine ? current().substring(skippedColumns) : current());
    }

    /**
     * Hides the first {@code columns} characters of the current line from {@link #code()} and
     * {@link #lineStart(int)}, such as the tail of a block comment opened on an earlier line.
     * Zero clears it.
     */
    public void skipPrefix(int columns) {
        skippedLine = columns > 0 ? index : -1;
        skippedColumns = columns;
    }

    /**
     * @return index just past the {@code *}{@code /} closing a block comment open at the start of
     * the line, or zero if the comment does not close on it
     */
    public static int blockCommentEnd(String line) {
        ScanState state = ScanState.IN_BLOCK_COMMENT;
        for (int i = 0; i < line.length(); i++) {
            state = CharacterClassifier.classify(line, i, state);
            if (!state.inBlockComment()) {
                return i + 2;
            }
        }
        return 0;
    }

    public void advance() {
        index++;
    }

    public int index() {
        return index;
    }

    public void moveTo(int line) {
        this.index = line;
    }

    public String line(int line) {
        return lines.get(line);
    }

    public int size() {
        return lines.size();
    }

    public List<String> lines() {
        return lines;
    }

    /**
     * @return position of the first non-blank character of a line
     */
    public Position lineStart(int line) {
        String text = lines.get(line);
        int indent = line == skippedLine ? skippedColumns : 0;
        while (indent < text.length() && Character.isWhitespace(text.charAt(indent))) {
            indent++;
        }
        return Position.of(line, indent == text.length() ? 0 : indent);
    }

    /**
     * @return position just past the last non-blank character of a line
     */
    public Position lineEnd(int line) {
        return Position.of(line, lines.get(line).stripTrailing().length());
    }

    /**
     * Text of lines {@code from..to} (inclusive) joined with {@code \n}.
     */
    public String join(int from, int to) {
        return String.join("\n", lines.subList(from, to + 1));
    }
}
