package io.github.cyfko.drlparser.core.parsing;

/**
 * Running lexical state of a left-to-right character scan.
 * <p>
 * {@code escapedNext} means the next character is consumed literally, without interpretation. It is
 * set by a backslash inside a string and by the second half of a two-character comment delimiter.
 * </p>
 *
 * @param quote          the quote character of the open string literal, or {@code 0} outside strings
 * @param inLineComment  inside a {@code //} comment; ends at the end of the line
 * @param inBlockComment inside a {@code /* ... *&#47;} comment; survives line breaks
 * @param escapedNext    the next character is consumed literally
 * @param code           the character just classified is unmasked code
 * @since 1.0
 */
public record ScanState(char quote, boolean inLineComment, boolean inBlockComment, boolean escapedNext,
                        boolean code) {

    /** State at the start of a document. */
    public static final ScanState START = new ScanState((char) 0, false, false, false, false);

    /** State at the start of a line that begins inside a block comment. */
    public static final ScanState IN_BLOCK_COMMENT = new ScanState((char) 0, false, true, false, false);

    public boolean inString() {
        return quote != 0;
    }

    /**
     * @return true if the next character would be masked regardless of what it is
     */
    public boolean masking() {
        return inString() || inLineComment || inBlockComment || escapedNext;
    }

    /**
     * State carried over a line break: only an open block comment survives. String literals do not
     * span lines in DRL, so an unterminated one is closed at the end of its line.
     *
     * @return the state at the start of the following line
     */
    public ScanState nextLine() {
        return inBlockComment ? IN_BLOCK_COMMENT : START;
    }
}
