package io.github.cyfko.drlparser.core.model;

import java.util.Objects;

/**
 * {@code name : Type} field of a declared type.
 *
 * @param name     field name
 * @param dataType field type
 * @param range    source range
 * @since 1.0
 */
public record FieldNode(String name, String dataType, Range range) implements AstNode {

    public FieldNode {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(dataType, "dataType is required");
        Objects.requireNonNull(range, "range is required");
    }
}
