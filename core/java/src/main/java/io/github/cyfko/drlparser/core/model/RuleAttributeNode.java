package io.github.cyfko.drlparser.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A rule attribute line such as {@code salience 10} or {@code no-loop true}.
 *
 * @param name  attribute name
 * @param value raw attribute value, or {@code null} for a bare flag such as {@code no-loop}
 * @param range source range
 * @since 1.0
 */
public record RuleAttributeNode(String name, String value, Range range) implements AstNode {

    public RuleAttributeNode {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(range, "range is required");
    }

    /**
     * Interprets the value as a boolean. A bare flag counts as {@code true}.
     *
     * @return the boolean view, or empty if the value is neither {@code true} nor {@code false}
     */
    public Optional<Boolean> booleanValue() {
        if (value == null || "true".equals(value)) {
            return Optional.of(Boolean.TRUE);
        }
        if ("false".equals(value)) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    /**
     * Interprets the value as a number.
     *
     * @return the numeric view, or empty if the value is absent or not numeric
     */
    public Optional<Double> numericValue() {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(value));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
