package io.github.cyfko.drlparser.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Condition block of a rule.
 *
 * @param conditions top-level conditions in document order
 * @param range      from the {@code when} keyword through the line before {@code then}
 * @since 1.0
 */
public record WhenNode(List<ConditionNode> conditions, Range range) implements AstNode {

    public WhenNode {
        Objects.requireNonNull(range, "range is required");
        conditions = List.copyOf(conditions);
    }
}
