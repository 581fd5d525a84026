package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.model.ConstraintNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort projection of a fact pattern body onto {@code field operator value} constraints.
 * <p>
 * The body is split on top-level commas; each piece that reads as a field path, a comparison operator
 * and a value becomes a {@link ConstraintNode}. Anything else (bindings, method calls, {@code &&}
 * chains) is dropped without a diagnostic.
 * </p>
 *
 * @since 1.0
 */
public final class ConstraintParser {

    // Two-character operators are tried before their one-character prefixes.
    private static final Pattern CONSTRAINT = Pattern.compile(
            "^(\\w+(?:\\.\\w+)*)\\s*(?:(==|!=|<=|>=|<|>)|\\s(matches|contains|not\\s+memberOf|memberOf)\\s)\\s*(.+)$",
            Pattern.DOTALL);

    private ConstraintParser() {}

    /**
     * @param body      text between the fact type's parentheses
     * @param positions offset mapping of the text {@code body} was cut from
     * @param bodyStart offset of {@code body} in that text
     * @return recognized constraints, in text order
     */
    public static List<ConstraintNode> parse(String body, TextPositions positions, int bodyStart) {
        List<ConstraintNode> constraints = new ArrayList<>();
        for (LogicalSplitter.Part piece : LogicalSplitter.splitCommas(body)) {
            Matcher matcher = CONSTRAINT.matcher(piece.text());
            if (!matcher.matches()) {
                continue;
            }
            String operator = matcher.group(2) != null
                    ? matcher.group(2)
                    : matcher.group(3).replaceAll("\\s+", " ");
            int start = bodyStart + piece.offset();
            constraints.add(new ConstraintNode(matcher.group(1), operator, matcher.group(4).trim(),
                    positions.rangeOf(start, start + piece.text().length())));
        }
        return constraints;
    }
}
