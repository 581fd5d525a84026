package io.github.cyfko.drlparser.core.spi;

import io.github.cyfko.drlparser.core.parsing.ParenthesesTracker;
import io.github.cyfko.drlparser.core.parsing.PatternMetadata;

import java.util.List;
import java.util.Optional;

/**
 * Cache consulted by incremental parsing to reuse multi-line pattern scans and bracket tracking
 * across parses of the same document.
 * <p>
 * Entries are keyed by document URI and a caller-chosen version token. A lookup only sees entries
 * written under the same token.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Implementations must allow lookups concurrently with writes for other documents. Entries of one
 * document are only written by the thread parsing that document.
 * </p>
 *
 * <h2>Implementation Example</h2>
 * <pre>{@code
 * PatternCache cache = new InMemoryPatternCache(64);
 * DrlParser parser = new BasicDrlParser();
 * ParseResult first = parser.parse(text);
 * ParseResult next = parser.parse(edited, new IncrementalParseOptions(
 *     List.of(new ChangeRange(120, 135)), first.ast(), cache, "file:///rules.drl", 1L));
 * }</pre>
 *
 * @since 1.0
 */
public interface PatternCache {

    /**
     * Returns the cached patterns whose lines intersect any of the requested spans.
     *
     * @param documentUri document key
     * @param version     version token
     * @param lineSpans   spans of interest
     * @return matching patterns in document order, empty when nothing is cached
     */
    List<PatternMetadata> getCachedMultiLinePatterns(String documentUri, long version, List<LineSpan> lineSpans);

    /**
     * Stores patterns scanned over the given spans, replacing any cached pattern intersecting them.
     *
     * @param documentUri document key
     * @param version     version token; entries of other versions of the document are dropped
     * @param patterns    patterns found in the spans
     * @param lineSpans   spans that were scanned
     */
    void cacheMultiLinePatterns(String documentUri, long version, List<PatternMetadata> patterns,
                                List<LineSpan> lineSpans);

    /**
     * Returns a copy of the cached bracket tracker, if one was stored for lines covering {@code lines}.
     *
     * @param documentUri document key
     * @param version     version token
     * @param lines       lines the tracker must cover
     * @return an independent tracker, or empty
     */
    Optional<ParenthesesTracker> getCachedParenthesesTracker(String documentUri, long version, LineSpan lines);

    /**
     * Stores a copy of a bracket tracker covering {@code lines}.
     */
    void cacheParenthesesTracker(String documentUri, long version, ParenthesesTracker tracker, LineSpan lines);

    /**
     * Drops every entry of a document.
     *
     * @param documentUri document key
     */
    void invalidate(String documentUri);
}
