package io.github.cyfko.drlparser.core.api;

/**
 * Advisory severity of a {@link ParseError}. Callers decide how to render each level.
 *
 * @since 1.0
 */
public enum Severity {
    ERROR,
    WARNING
}
