package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.model.Position;
import io.github.cyfko.drlparser.core.model.Range;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps character offsets of a text slice to document positions.
 * <p>
 * The slice starts at {@code base}. Characters on its first line are shifted by {@code base.character()};
 * characters on later lines keep their own column.
 * </p>
 *
 * @since 1.0
 */
public final class TextPositions {

    private final Position base;
    private final int[] lineStarts;
    private final int length;

    private TextPositions(Position base, int[] lineStarts, int length) {
        this.base = base;
        this.lineStarts = lineStarts;
        this.length = length;
    }

    /**
     * @param text slice of the document
     * @param base document position of the first character of the slice
     * @return the offset mapping of the slice
     */
    public static TextPositions of(String text, Position base) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        int[] lineStarts = new int[starts.size()];
        for (int i = 0; i < lineStarts.length; i++) {
            lineStarts[i] = starts.get(i);
        }
        return new TextPositions(base, lineStarts, text.length());
    }

    /**
     * @param offset offset into the slice, clamped to {@code [0, length]}
     * @return the document position of that offset
     */
    public Position positionAt(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= clamped) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        int column = clamped - lineStarts[low];
        if (low == 0) {
            return Position.of(base.line(), base.character() + column);
        }
        return Position.of(base.line() + low, column);
    }

    public Range rangeOf(int startOffset, int endOffset) {
        return new Range(positionAt(startOffset), positionAt(endOffset));
    }

    /**
     * Offsets of the start of each line of a whole document.
     *
     * @param text document text
     * @return mapping rooted at the document start
     */
    public static TextPositions document(String text) {
        return of(text, Position.of(0, 0));
    }

    public int lineCount() {
        return lineStarts.length;
    }
}
