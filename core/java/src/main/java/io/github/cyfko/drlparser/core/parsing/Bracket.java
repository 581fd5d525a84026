package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.model.Position;

import java.util.Comparator;
import java.util.Objects;

/**
 * One unmasked bracket character and its document position.
 *
 * @param position where the bracket is
 * @param symbol   one of {@code ( ) { }}
 * @since 1.0
 */
public record Bracket(Position position, char symbol) {

    static final Comparator<Bracket> BY_POSITION = Comparator.comparing(Bracket::position);

    public Bracket {
        Objects.requireNonNull(position, "position is required");
        if ("(){}".indexOf(symbol) < 0) {
            throw new IllegalArgumentException("Not a bracket: " + symbol);
        }
    }

    public boolean isOpening() {
        return symbol == '(' || symbol == '{';
    }

    public boolean isParenthesis() {
        return symbol == '(' || symbol == ')';
    }

    public int line() {
        return position.line();
    }
}
