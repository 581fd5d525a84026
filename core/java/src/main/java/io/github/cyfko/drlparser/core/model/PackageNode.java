package io.github.cyfko.drlparser.core.model;

import java.util.Objects;

/**
 * {@code package a.b.c;} declaration. The name is empty when the declaration is malformed.
 *
 * @param name  dotted package name
 * @param range source range
 * @since 1.0
 */
public record PackageNode(String name, Range range) implements AstNode {

    public PackageNode {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(range, "range is required");
    }
}
