package io.github.cyfko.drlparser.core.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code query "name"(params) ... end} definition. The body is parsed like a {@code when} block.
 *
 * @param name       query name, empty when malformed
 * @param parameters recognized parameters
 * @param conditions body conditions
 * @param range      source range
 * @since 1.0
 */
public record QueryNode(String name, List<ParameterNode> parameters, List<ConditionNode> conditions, Range range)
        implements AstNode {

    public QueryNode {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(range, "range is required");
        parameters = List.copyOf(parameters);
        conditions = List.copyOf(conditions);
    }
}
