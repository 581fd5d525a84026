package io.github.cyfko.drlparser.core.model;

import java.util.Objects;

/**
 * A {@code field operator value} constraint projected out of a fact pattern.
 *
 * @param field    constrained field or dotted path
 * @param operator comparison operator, e.g. {@code ==}, {@code matches}, {@code not memberOf}
 * @param value    right-hand side, raw text
 * @param range    source range of the whole constraint
 * @since 1.0
 */
public record ConstraintNode(String field, String operator, String value, Range range) implements AstNode {

    public ConstraintNode {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(operator, "operator is required");
        Objects.requireNonNull(value, "value is required");
        Objects.requireNonNull(range, "range is required");
    }
}
