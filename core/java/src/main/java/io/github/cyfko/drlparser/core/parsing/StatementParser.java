package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.model.AstNode;

/**
 * Parser of one kind of top-level statement.
 * <p>
 * {@link StatementScanner} offers each trimmed statement line to its parsers in turn; the first one
 * that {@linkplain #accepts(String) accepts} it parses the statement, leaving the cursor on the first
 * line after it.
 * </p>
 *
 * @since 1.0
 */
public interface StatementParser {

    /**
     * @param code code part of the current line, trimmed
     * @return true if this parser handles statements starting with this line
     */
    boolean accepts(String code);

    /**
     * Parses the statement at the cursor. Never throws on malformed input: a malformed header yields a
     * node with an empty name, and the rest of the statement is parsed or skipped as far as possible.
     *
     * @param context state of the parse; its cursor is on the statement's first line
     * @return the statement node
     */
    AstNode parse(ParseContext context);
}
