package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.config.ParserPolicy;

import java.util.List;
import java.util.Objects;

/**
 * State of one parse call, threaded through the statement parsers: the line cursor and the configured
 * collaborators.
 * <p>
 * A context is created per call and never shared between threads.
 * </p>
 *
 * @since 1.0
 */
public final class ParseContext {

    private final LineCursor cursor;
    private final ParserPolicy policy;
    private final ConditionParser conditionParser;

    public ParseContext(List<String> lines, ParserPolicy policy, ConditionParser conditionParser) {
        this.cursor = new LineCursor(lines, 0);
        this.policy = Objects.requireNonNull(policy, "policy is required");
        this.conditionParser = Objects.requireNonNull(conditionParser, "conditionParser is required");
    }

    public LineCursor cursor() {
        return cursor;
    }

    public ParserPolicy policy() {
        return policy;
    }

    public ConditionParser conditionParser() {
        return conditionParser;
    }
}
