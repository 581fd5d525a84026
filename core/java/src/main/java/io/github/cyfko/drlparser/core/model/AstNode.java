package io.github.cyfko.drlparser.core.model;

/**
 * Common contract of every syntax tree node: each node knows the document range it was parsed from.
 * <p>
 * Nodes are immutable. Consumers (diagnostics, completion, formatting, symbol providers) must treat
 * them as read-only and must not assume optional parts are populated.
 * </p>
 *
 * @since 1.0
 */
public interface AstNode {

    /**
     * @return the source range of this node, end exclusive
     */
    Range range();
}
