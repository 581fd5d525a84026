package io.github.cyfko.drlparser.core.parsing;

/**
 * An opening bracket and the closing bracket matched to it.
 *
 * @since 1.0
 */
public record BracketPair(Bracket open, Bracket close) {
}
