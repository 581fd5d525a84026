package io.github.cyfko.drlparser.core.api;

import io.github.cyfko.drlparser.core.model.DroolsFile;

import java.util.List;
import java.util.Objects;

/**
 * Output of one parse call: the syntax tree and every problem the parser produced.
 * <p>
 * The tree is never {@code null}; when parsing fails outright it is {@link DroolsFile#empty()}.
 * </p>
 *
 * @param ast    the syntax tree
 * @param errors all diagnostics in the order they were produced
 * @since 1.0
 */
public record ParseResult(DroolsFile ast, List<ParseError> errors) {

    public ParseResult {
        Objects.requireNonNull(ast, "ast is required");
        errors = List.copyOf(errors);
    }

    /**
     * @return true if at least one diagnostic has {@link Severity#ERROR} severity
     */
    public boolean hasErrors() {
        return errors.stream().anyMatch(ParseError::isError);
    }

    /**
     * Caps the diagnostic list for display. The parser itself never truncates; this is meant for the
     * consuming diagnostics layer, typically with {@code ParserPolicy#maxErrors()}.
     *
     * @param maxErrors maximum number of diagnostics to keep
     * @return the first {@code maxErrors} diagnostics
     */
    public List<ParseError> limitedErrors(int maxErrors) {
        if (maxErrors < 0) {
            throw new IllegalArgumentException("maxErrors must not be negative, got: " + maxErrors);
        }
        return errors.size() <= maxErrors ? errors : errors.subList(0, maxErrors);
    }
}
