package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.api.ParseError;
import io.github.cyfko.drlparser.core.model.Position;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Records every unmasked parenthesis and brace of a document and matches them into pairs.
 * <p>
 * Lines are fed in document order through {@link #trackLine(String, int)}; block-comment state carries
 * from one line to the next. Matching is positional: {@link #rebuildMatchedPairs()} sorts the recorded
 * brackets and pairs each closing bracket with the most recent unmatched opening bracket of the same
 * kind. Parentheses and braces are matched independently.
 * </p>
 * <p>
 * A tracker is mutable and owned by one parse at a time. Use {@link #copy()} to hand it to another
 * owner, such as a cache.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ParenthesesTracker tracker = new ParenthesesTracker();
 * for (int i = 0; i < lines.size(); i++) {
 *     tracker.trackLine(lines.get(i), i);
 * }
 * List<ParseError> errors = tracker.validateAtEndOfFile();
 * }</pre>
 *
 * @since 1.0
 */
public final class ParenthesesTracker {

    private final List<Bracket> brackets = new ArrayList<>();
    /** Whether a block comment is open at the start of each tracked line. */
    private final TreeMap<Integer, Boolean> commentAtLineStart = new TreeMap<>();
    private ScanState carry = ScanState.START;

    private final List<BracketPair> matchedPairs = new ArrayList<>();
    private final List<Bracket> unmatchedOpen = new ArrayList<>();
    private final List<Bracket> unmatchedClose = new ArrayList<>();
    private boolean dirty;

    /**
     * Records the unmasked brackets of one line, continuing the lexical state of the previous call.
     *
     * @param line       line text, without its terminator
     * @param lineNumber document line number
     */
    public void trackLine(String line, int lineNumber) {
        commentAtLineStart.put(lineNumber, carry.inBlockComment());
        carry = scanLine(line, lineNumber, carry);
        dirty = true;
    }

    /**
     * Tracks every line of a document, starting from a clean state.
     */
    public void trackLines(List<String> lines) {
        carry = ScanState.START;
        for (int i = 0; i < lines.size(); i++) {
            trackLine(lines.get(i), i);
        }
    }

    private ScanState scanLine(String line, int lineNumber, ScanState in) {
        ScanState state = in;
        for (int i = 0; i < line.length(); i++) {
            state = CharacterClassifier.classify(line, i, state);
            char c = line.charAt(i);
            if (state.code() && "(){}".indexOf(c) >= 0) {
                brackets.add(new Bracket(Position.of(lineNumber, i), c));
            }
        }
        return state.nextLine();
    }

    /**
     * Forgets every bracket recorded on lines {@code fromLine..toLine} (inclusive).
     */
    public void removeLines(int fromLine, int toLine) {
        brackets.removeIf(b -> b.line() >= fromLine && b.line() <= toLine);
        commentAtLineStart.subMap(fromLine, true, toLine, true).clear();
        dirty = true;
    }

    /**
     * Re-records lines {@code fromLine..toLine} of a document whose line count did not change.
     * <p>
     * Tracking resumes with the comment state recorded for {@code fromLine} and continues past
     * {@code toLine} for as long as the comment state entering a line differs from the recorded one.
     * </p>
     *
     * @param lines    every line of the current document
     * @param fromLine first changed line
     * @param toLine   last changed line
     * @return the last line that was re-recorded
     */
    public int retrack(List<String> lines, int fromLine, int toLine) {
        boolean inComment = commentAtLineStart.getOrDefault(fromLine, false);
        ScanState state = inComment ? ScanState.IN_BLOCK_COMMENT : ScanState.START;
        int line = fromLine;
        while (line < lines.size()) {
            Boolean recorded = commentAtLineStart.get(line);
            if (line > toLine && recorded != null && recorded == state.inBlockComment()) {
                break;
            }
            removeLines(line, line);
            commentAtLineStart.put(line, state.inBlockComment());
            state = scanLine(lines.get(line), line, state);
            line++;
        }
        dirty = true;
        return line - 1;
    }

    /**
     * Recomputes matched pairs and unmatched sets from the recorded brackets. Never throws.
     */
    public void rebuildMatchedPairs() {
        matchedPairs.clear();
        unmatchedOpen.clear();
        unmatchedClose.clear();

        List<Bracket> sorted = new ArrayList<>(brackets);
        sorted.sort(Bracket.BY_POSITION);
        Deque<Bracket> parens = new ArrayDeque<>();
        Deque<Bracket> braces = new ArrayDeque<>();
        for (Bracket bracket : sorted) {
            Deque<Bracket> stack = bracket.isParenthesis() ? parens : braces;
            if (bracket.isOpening()) {
                stack.push(bracket);
            } else if (stack.isEmpty()) {
                unmatchedClose.add(bracket);
            } else {
                matchedPairs.add(new BracketPair(stack.pop(), bracket));
            }
        }
        unmatchedOpen.addAll(parens);
        unmatchedOpen.addAll(braces);
        unmatchedOpen.sort(Bracket.BY_POSITION);
        dirty = false;
    }

    /**
     * @return one error per unmatched bracket, in document order
     */
    public List<ParseError> validateAtEndOfFile() {
        ensureMatched();
        List<Bracket> unmatched = new ArrayList<>(unmatchedOpen);
        unmatched.addAll(unmatchedClose);
        unmatched.sort(Bracket.BY_POSITION);

        List<ParseError> errors = new ArrayList<>(unmatched.size());
        for (Bracket bracket : unmatched) {
            errors.add(ParseError.error(describe(bracket), bracket.position()));
        }
        return errors;
    }

    private static String describe(Bracket bracket) {
        return "Unmatched " + (bracket.isOpening() ? "opening " : "closing ")
                + (bracket.isParenthesis() ? "parenthesis" : "brace");
    }

    private void ensureMatched() {
        if (dirty) {
            rebuildMatchedPairs();
        }
    }

    public List<Position> openPositions() {
        return positions(true);
    }

    public List<Position> closePositions() {
        return positions(false);
    }

    private List<Position> positions(boolean opening) {
        List<Bracket> sorted = new ArrayList<>(brackets);
        sorted.sort(Bracket.BY_POSITION);
        List<Position> result = new ArrayList<>();
        for (Bracket bracket : sorted) {
            if (bracket.isOpening() == opening) {
                result.add(bracket.position());
            }
        }
        return result;
    }

    public List<BracketPair> matchedPairs() {
        ensureMatched();
        return List.copyOf(matchedPairs);
    }

    public List<Bracket> unmatchedOpen() {
        ensureMatched();
        return List.copyOf(unmatchedOpen);
    }

    public List<Bracket> unmatchedClose() {
        ensureMatched();
        return List.copyOf(unmatchedClose);
    }

    public boolean isBalanced() {
        ensureMatched();
        return unmatchedOpen.isEmpty() && unmatchedClose.isEmpty();
    }

    /**
     * @return the highest tracked line number, or {@code -1} when nothing was tracked
     */
    public int lastTrackedLine() {
        return commentAtLineStart.isEmpty() ? -1 : commentAtLineStart.lastKey();
    }

    /**
     * @return an independent tracker with the same recorded state
     */
    public ParenthesesTracker copy() {
        ParenthesesTracker copy = new ParenthesesTracker();
        copy.brackets.addAll(brackets);
        for (Map.Entry<Integer, Boolean> entry : commentAtLineStart.entrySet()) {
            copy.commentAtLineStart.put(entry.getKey(), entry.getValue());
        }
        copy.carry = carry;
        copy.dirty = true;
        return copy;
    }
}
