package io.github.cyfko.drlparser.core.model;

import java.util.Objects;

/**
 * A span of text between two positions. The end position is exclusive: it points
 * just past the last character covered.
 *
 * @param start first covered position
 * @param end   position just past the last covered character
 * @since 1.0
 */
public record Range(Position start, Position end) {

    /**
     * Canonical constructor with validation.
     */
    public Range {
        Objects.requireNonNull(start, "start is required");
        Objects.requireNonNull(end, "end is required");
        if (end.compareTo(start) < 0) {
            throw new IllegalArgumentException("Range end " + end + " precedes start " + start);
        }
    }

    public static Range of(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new Range(new Position(startLine, startCharacter), new Position(endLine, endCharacter));
    }

    /**
     * Creates a one-character range at the given position.
     *
     * @param position the covered character
     * @return a range of width one
     */
    public static Range at(Position position) {
        return new Range(position, position.next());
    }

    public boolean contains(Range other) {
        return start.compareTo(other.start) <= 0 && end.compareTo(other.end) >= 0;
    }

    @Override
    public String toString() {
        return "[" + start + ".." + end + ")";
    }
}
