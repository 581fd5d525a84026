package io.github.cyfko.drlparser.core.model;

import java.util.Objects;

/**
 * A {@code Type name} parameter of a function or query.
 *
 * @param dataType parameter type
 * @param name     parameter name
 * @param range    source range within the header line
 * @since 1.0
 */
public record ParameterNode(String dataType, String name, Range range) implements AstNode {

    public ParameterNode {
        Objects.requireNonNull(dataType, "dataType is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(range, "range is required");
    }
}
