package io.github.cyfko.drlparser.core.model;

import java.util.Objects;

/**
 * {@code global Type name;} declaration.
 *
 * @param dataType declared type, empty when malformed
 * @param name     global identifier, empty when malformed
 * @param range    source range
 * @since 1.0
 */
public record GlobalNode(String dataType, String name, Range range) implements AstNode {

    public GlobalNode {
        Objects.requireNonNull(dataType, "dataType is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(range, "range is required");
    }
}
