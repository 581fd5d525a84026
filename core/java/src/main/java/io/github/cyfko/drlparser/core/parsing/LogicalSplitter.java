package io.github.cyfko.drlparser.core.parsing;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits condition text on top-level {@code and} / {@code or}, and on top-level commas.
 * <p>
 * "Top-level" means outside string literals and comments and at parenthesis depth 0. A logical
 * operator must be a whole word with whitespace on both sides, so identifiers such as {@code android}
 * or {@code order} are never split.
 * </p>
 *
 * @since 1.0
 */
public final class LogicalSplitter {

    private LogicalSplitter() {}

    /**
     * A non-blank piece of the split text.
     *
     * @param text   the piece, without surrounding whitespace
     * @param offset offset of the piece's first character in the split text
     */
    public record Part(String text, int offset) {
    }

    /**
     * The operators found while splitting.
     *
     * @param parts     pieces in text order
     * @param hasAnd    whether a top-level {@code and} was found
     * @param hasOr     whether a top-level {@code or} was found
     */
    public record Split(List<Part> parts, boolean hasAnd, boolean hasOr) {

        public boolean isLogical() {
            return parts.size() > 1;
        }
    }

    /**
     * Splits on top-level {@code and} / {@code or}.
     *
     * @param text condition text
     * @return the parts; a single part holding the whole text when there is nothing to split
     */
    public static Split splitLogical(String text) {
        List<Part> parts = new ArrayList<>();
        boolean hasAnd = false;
        boolean hasOr = false;
        ScanState state = ScanState.START;
        int depth = 0;
        int partStart = 0;

        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n') {
                state = state.nextLine();
                i++;
                continue;
            }
            state = CharacterClassifier.classify(text, i, state);
            if (state.code()) {
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth = Math.max(0, depth - 1);
                } else if (depth == 0) {
                    int length = operatorLength(text, i);
                    if (length > 0) {
                        if (length == 3) {
                            hasAnd = true;
                        } else {
                            hasOr = true;
                        }
                        addPart(parts, text, partStart, i);
                        i += length;
                        partStart = i;
                        continue;
                    }
                }
            }
            i++;
        }
        addPart(parts, text, partStart, text.length());
        return new Split(parts, hasAnd, hasOr);
    }

    /**
     * Splits on top-level commas, the separator of constraints inside a fact pattern body.
     *
     * @param text pattern body
     * @return the non-blank pieces
     */
    public static List<Part> splitCommas(String text) {
        List<Part> parts = new ArrayList<>();
        ScanState state = ScanState.START;
        int depth = 0;
        int partStart = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                state = state.nextLine();
                continue;
            }
            state = CharacterClassifier.classify(text, i, state);
            if (!state.code()) {
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                addPart(parts, text, partStart, i);
                partStart = i + 1;
            }
        }
        addPart(parts, text, partStart, text.length());
        return parts;
    }

    private static int operatorLength(String text, int i) {
        if (i == 0 || !Character.isWhitespace(text.charAt(i - 1))) {
            return 0;
        }
        if (isWordAt(text, i, "and")) {
            return 3;
        }
        if (isWordAt(text, i, "or")) {
            return 2;
        }
        return 0;
    }

    private static boolean isWordAt(String text, int i, String word) {
        int after = i + word.length();
        return text.startsWith(word, i) && after < text.length() && Character.isWhitespace(text.charAt(after));
    }

    private static void addPart(List<Part> parts, String text, int from, int to) {
        int start = from;
        int end = to;
        while (start < end && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        if (start < end) {
            parts.add(new Part(text.substring(start, end), start));
        }
    }
}
