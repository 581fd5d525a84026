package io.github.cyfko.drlparser.core.parsing;

/**
 * Decides, character by character, whether text is code or lies inside a string literal, a line
 * comment or a block comment.
 * <p>
 * {@link #classify(CharSequence, int, ScanState)} is a pure function of the line, the index and the
 * incoming state. It must be applied left to right, feeding each result into the next call, because
 * string and comment state carry across characters (and block comments across lines).
 * </p>
 * <p>
 * Both {@code "} and {@code '} delimit string literals. A backslash inside a literal makes the
 * following character literal. Quote and comment delimiters are themselves masked.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ScanState state = ScanState.START;
 * for (int i = 0; i < line.length(); i++) {
 *     state = CharacterClassifier.classify(line, i, state);
 *     if (state.code() && line.charAt(i) == '(') {
 *         depth++;
 *     }
 * }
 * state = state.nextLine();
 * }</pre>
 *
 * @since 1.0
 */
public final class CharacterClassifier {

    private CharacterClassifier() {}

    /**
     * Callback of {@link #scan(CharSequence, ScanState, CharVisitor)}.
     */
    @FunctionalInterface
    public interface CharVisitor {
        /**
         * @param c      the character
         * @param offset offset in the scanned text
         * @param line   line of the character, relative to the scanned text
         * @param column column of the character within its line
         * @param code   whether the character is unmasked code
         * @return {@code false} to stop the scan
         */
        boolean visit(char c, int offset, int line, int column, boolean code);
    }

    /**
     * Classifies the character at {@code index}.
     *
     * @param line  the text being scanned; may be a single line or a multi-line slice
     * @param index index of the character to classify
     * @param in    state after the previous character
     * @return the state after this character; {@link ScanState#code()} tells whether it was code
     */
    public static ScanState classify(CharSequence line, int index, ScanState in) {
        char c = line.charAt(index);
        char next = index + 1 < line.length() ? line.charAt(index + 1) : 0;

        if (in.escapedNext()) {
            return new ScanState(in.quote(), in.inLineComment(), in.inBlockComment(), false, false);
        }
        if (in.inLineComment()) {
            return in;
        }
        if (in.inBlockComment()) {
            if (c == '*' && next == '/') {
                return new ScanState((char) 0, false, false, true, false);
            }
            return in;
        }
        if (in.inString()) {
            if (c == '\\') {
                return new ScanState(in.quote(), false, false, true, false);
            }
            if (c == in.quote()) {
                return new ScanState((char) 0, false, false, false, false);
            }
            return in;
        }

        if (c == '"' || c == '\'') {
            return new ScanState(c, false, false, false, false);
        }
        if (c == '/' && next == '/') {
            return new ScanState((char) 0, true, false, false, false);
        }
        if (c == '/' && next == '*') {
            return new ScanState((char) 0, false, true, true, false);
        }
        return CODE;
    }

    private static final ScanState CODE = new ScanState((char) 0, false, false, false, true);

    /**
     * Scans text that may contain line breaks, applying {@link ScanState#nextLine()} at each one.
     * Line breaks are reported to the visitor as masked characters.
     *
     * @param text    text to scan
     * @param initial state before the first character
     * @param visitor receives every character; returning {@code false} stops the scan
     * @return the state after the last visited character
     */
    public static ScanState scan(CharSequence text, ScanState initial, CharVisitor visitor) {
        ScanState state = initial;
        int line = 0;
        int column = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                state = state.nextLine();
                if (!visitor.visit(c, i, line, column, false)) {
                    return state;
                }
                line++;
                column = 0;
                continue;
            }
            state = classify(text, i, state);
            if (!visitor.visit(c, i, line, column, state.code())) {
                return state;
            }
            column++;
        }
        return state;
    }

    /**
     * Computes the code mask of a text: {@code mask[i]} is true when {@code text.charAt(i)} is code.
     *
     * @param text text to classify
     * @return the mask, same length as the text
     */
    public static boolean[] codeMask(CharSequence text) {
        boolean[] mask = new boolean[text.length()];
        scan(text, ScanState.START, (c, offset, line, column, code) -> {
            mask[offset] = code;
            return true;
        });
        return mask;
    }

    /**
     * Computes the difference between unmasked opening and closing characters.
     *
     * @param text  text to scan
     * @param open  opening character, e.g. {@code '('}
     * @param close closing character, e.g. {@code ')'}
     * @return opens minus closes; positive when openings are unmatched
     */
    public static int balance(CharSequence text, char open, char close) {
        int[] balance = {0};
        scan(text, ScanState.START, (c, offset, line, column, code) -> {
            if (code) {
                if (c == open) {
                    balance[0]++;
                } else if (c == close) {
                    balance[0]--;
                }
            }
            return true;
        });
        return balance[0];
    }

    /**
     * Finds the parenthesis closing the one at {@code open}.
     *
     * @param text text holding the parenthesis
     * @param open index of an unmasked {@code (}
     * @return index of the matching {@code )}, or {@code -1} when it is missing
     */
    public static int matchingClose(CharSequence text, int open) {
        int[] result = {-1};
        int[] depth = {0};
        scan(text.subSequence(open, text.length()), ScanState.START, (c, offset, line, column, code) -> {
            if (code && c == '(') {
                depth[0]++;
            } else if (code && c == ')' && --depth[0] == 0) {
                result[0] = open + offset;
                return false;
            }
            return true;
        });
        return result[0];
    }

    /**
     * @return index of the first unmasked occurrence of {@code target}, or {@code -1}
     */
    public static int indexOfCode(CharSequence text, char target) {
        int[] result = {-1};
        scan(text, ScanState.START, (c, offset, line, column, code) -> {
            if (code && c == target) {
                result[0] = offset;
                return false;
            }
            return true;
        });
        return result[0];
    }
}
