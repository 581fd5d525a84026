package io.github.cyfko.drlparser.core.model;

import java.util.Locale;

/**
 * Kind of a condition found in a {@code when} block or a query body.
 *
 * @since 1.0
 */
public enum ConditionType {
    PATTERN,
    EXISTS,
    NOT,
    EVAL,
    FORALL,
    COLLECT,
    ACCUMULATE,
    AND,
    OR;

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
