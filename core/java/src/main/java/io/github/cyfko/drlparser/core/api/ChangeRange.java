package io.github.cyfko.drlparser.core.api;

/**
 * An edited region of the new document text, as offsets into the Java string (UTF-16 units).
 *
 * @param start first changed offset, inclusive
 * @param end   end offset, exclusive; equal to {@code start} for a pure deletion point
 * @since 1.0
 */
public record ChangeRange(int start, int end) {

    public ChangeRange {
        if (start < 0) {
            throw new IllegalArgumentException("start must not be negative, got: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("end (" + end + ") must not precede start (" + start + ")");
        }
    }
}
