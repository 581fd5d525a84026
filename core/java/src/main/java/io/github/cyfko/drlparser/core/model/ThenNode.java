package io.github.cyfko.drlparser.core.model;

import java.util.Objects;

/**
 * Action block of a rule. The host-language code is kept as raw text.
 *
 * @param actions raw action code, trimmed
 * @param range   source range, from the {@code then} keyword through the last action line
 * @since 1.0
 */
public record ThenNode(String actions, Range range) implements AstNode {

    public ThenNode {
        Objects.requireNonNull(actions, "actions is required");
        Objects.requireNonNull(range, "range is required");
    }
}
