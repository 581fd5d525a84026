package io.github.cyfko.drlparser.core.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code declare Name ... end} type declaration.
 *
 * @param name   declared type name, empty when malformed
 * @param fields recognized fields
 * @param range  source range
 * @since 1.0
 */
public record DeclareNode(String name, List<FieldNode> fields, Range range) implements AstNode {

    public DeclareNode {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(range, "range is required");
        fields = List.copyOf(fields);
    }
}
