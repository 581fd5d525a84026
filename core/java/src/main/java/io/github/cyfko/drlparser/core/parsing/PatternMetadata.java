package io.github.cyfko.drlparser.core.parsing;

import io.github.cyfko.drlparser.core.model.PatternKeyword;
import io.github.cyfko.drlparser.core.model.Range;

import java.util.Objects;

/**
 * Result of scanning one multi-line pattern: where it starts and ends, and whether its parentheses
 * balance. This is the unit stored in a {@link io.github.cyfko.drlparser.core.spi.PatternCache}.
 *
 * @param keyword  introducing keyword
 * @param content  source text from the keyword through the closing parenthesis, or through the point
 *                 where the scan stopped
 * @param range    document range of {@code content}
 * @param complete whether the closing parenthesis was reached
 * @since 1.0
 */
public record PatternMetadata(PatternKeyword keyword, String content, Range range, boolean complete) {

    public PatternMetadata {
        Objects.requireNonNull(keyword, "keyword is required");
        Objects.requireNonNull(content, "content is required");
        Objects.requireNonNull(range, "range is required");
    }

    public int startLine() {
        return range.start().line();
    }

    public int endLine() {
        return range.end().line();
    }

    public int lineCount() {
        return endLine() - startLine() + 1;
    }
}
