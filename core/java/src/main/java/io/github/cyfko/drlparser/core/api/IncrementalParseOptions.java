package io.github.cyfko.drlparser.core.api;

import io.github.cyfko.drlparser.core.model.DroolsFile;
import io.github.cyfko.drlparser.core.spi.PatternCache;

import java.util.List;
import java.util.Objects;

/**
 * Inputs of an incremental parse.
 * <p>
 * The parser falls back to a full parse when {@link #previousAst()}, {@link #cache()} or
 * {@link #documentUri()} is missing.
 * </p>
 *
 * @param ranges       changed regions of the new text
 * @param previousAst  tree of the previous parse of this document
 * @param cache        pattern and bracket cache shared across parses
 * @param documentUri  cache key of the document
 * @param version      cache version token of the document
 * @since 1.0
 */
public record IncrementalParseOptions(
        List<ChangeRange> ranges,
        DroolsFile previousAst,
        PatternCache cache,
        String documentUri,
        long version
) {

    public IncrementalParseOptions {
        Objects.requireNonNull(ranges, "ranges is required");
        ranges = List.copyOf(ranges);
    }

    /**
     * @return true if every collaborator needed for incremental parsing is present
     */
    public boolean isComplete() {
        return previousAst != null && cache != null && documentUri != null && !documentUri.isBlank();
    }
}
