package io.github.cyfko.drlparser.core.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code rule "name" ... when ... then ... end} definition.
 * <p>
 * When present, the {@code when} and {@code then} ranges lie inside the rule range, do not overlap,
 * and {@code when} precedes {@code then}.
 * </p>
 *
 * @param name       rule name, empty when the header is malformed
 * @param attributes attribute lines between the header and {@code when}
 * @param when       condition block, or {@code null} if the rule has none
 * @param then       action block, or {@code null} if the rule has none
 * @param range      source range
 * @since 1.0
 */
public record RuleNode(String name, List<RuleAttributeNode> attributes, WhenNode when, ThenNode then, Range range)
        implements AstNode {

    public RuleNode {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(range, "range is required");
        attributes = List.copyOf(attributes);
        if (when != null && !range.contains(when.range())) {
            throw new IllegalArgumentException("when block " + when.range() + " escapes rule range " + range);
        }
        if (then != null && !range.contains(then.range())) {
            throw new IllegalArgumentException("then block " + then.range() + " escapes rule range " + range);
        }
        if (when != null && then != null && when.range().end().compareTo(then.range().start()) > 0) {
            throw new IllegalArgumentException("when block must precede then block");
        }
    }
}
