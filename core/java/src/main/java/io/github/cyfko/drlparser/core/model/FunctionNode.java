package io.github.cyfko.drlparser.core.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code function ReturnType name(params) { ... }} definition.
 *
 * @param returnType declared return type, empty when the header is malformed
 * @param name       function name, empty when the header is malformed
 * @param parameters parameters that could be recognized; malformed ones are omitted
 * @param body       raw body text from the opening to the closing brace
 * @param range      source range
 * @since 1.0
 */
public record FunctionNode(String returnType, String name, List<ParameterNode> parameters, String body, Range range)
        implements AstNode {

    public FunctionNode {
        Objects.requireNonNull(returnType, "returnType is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(body, "body is required");
        Objects.requireNonNull(range, "range is required");
        parameters = List.copyOf(parameters);
    }
}
