package io.github.cyfko.drlparser.core.spi;

/**
 * Inclusive span of document lines.
 *
 * @param start first line
 * @param end   last line, not before {@code start}
 * @since 1.0
 */
public record LineSpan(int start, int end) {

    public LineSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid line span: " + start + ".." + end);
        }
    }

    public static LineSpan of(int start, int end) {
        return new LineSpan(start, end);
    }

    public boolean intersects(int fromLine, int toLine) {
        return start <= toLine && fromLine <= end;
    }

    public boolean intersects(LineSpan other) {
        return intersects(other.start, other.end);
    }

    public boolean contains(LineSpan other) {
        return start <= other.start && other.end <= end;
    }
}
