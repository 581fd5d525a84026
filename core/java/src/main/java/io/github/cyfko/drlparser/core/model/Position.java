package io.github.cyfko.drlparser.core.model;

/**
 * A zero-based location in a document.
 *
 * @param line      zero-based line index
 * @param character zero-based column (UTF-16 unit) within the line
 * @since 1.0
 */
public record Position(int line, int character) implements Comparable<Position> {

    /**
     * Canonical constructor with validation.
     */
    public Position {
        if (line < 0) {
            throw new IllegalArgumentException("line must not be negative, got: " + line);
        }
        if (character < 0) {
            throw new IllegalArgumentException("character must not be negative, got: " + character);
        }
    }

    public static Position of(int line, int character) {
        return new Position(line, character);
    }

    /**
     * Returns the position one column to the right.
     *
     * @return the next position on the same line
     */
    public Position next() {
        return new Position(line, character + 1);
    }

    @Override
    public int compareTo(Position other) {
        if (line != other.line) {
            return Integer.compare(line, other.line);
        }
        return Integer.compare(character, other.character);
    }

    @Override
    public String toString() {
        return line + ":" + character;
    }
}
