package io.github.cyfko.drlparser.core.api;

import io.github.cyfko.drlparser.core.model.Position;
import io.github.cyfko.drlparser.core.model.Range;

import java.util.Objects;

/**
 * A problem found while parsing. Errors refer to the tree only through ranges, so the error list and
 * the tree can be serialized independently.
 *
 * @param message  human readable description
 * @param range    location of the problem
 * @param severity advisory severity
 * @since 1.0
 */
public record ParseError(String message, Range range, Severity severity) {

    public ParseError {
        Objects.requireNonNull(message, "message is required");
        Objects.requireNonNull(range, "range is required");
        Objects.requireNonNull(severity, "severity is required");
    }

    public static ParseError error(String message, Position position) {
        return new ParseError(message, Range.at(position), Severity.ERROR);
    }

    public static ParseError warning(String message, Position position) {
        return new ParseError(message, Range.at(position), Severity.WARNING);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
