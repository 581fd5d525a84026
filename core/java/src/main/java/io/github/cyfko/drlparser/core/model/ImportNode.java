package io.github.cyfko.drlparser.core.model;

import java.util.Objects;

/**
 * {@code import [static] a.b.C;} declaration. The path is empty when the declaration is malformed.
 *
 * @param path     imported type, member or wildcard
 * @param isStatic whether the import is a static import
 * @param range    source range
 * @since 1.0
 */
public record ImportNode(String path, boolean isStatic, Range range) implements AstNode {

    public ImportNode {
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(range, "range is required");
    }
}
