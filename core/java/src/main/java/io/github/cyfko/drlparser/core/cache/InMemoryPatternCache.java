package io.github.cyfko.drlparser.core.cache;

import io.github.cyfko.drlparser.core.parsing.ParenthesesTracker;
import io.github.cyfko.drlparser.core.parsing.PatternMetadata;
import io.github.cyfko.drlparser.core.spi.LineSpan;
import io.github.cyfko.drlparser.core.spi.PatternCache;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * Bounded in-memory {@link PatternCache} holding one entry per document.
 * <p>
 * Documents are evicted least recently used first once {@code maxDocuments} is exceeded. Within a
 * document, only entries of the most recently written version token are kept.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * All access goes through a {@link ReadWriteLock}:
 * </p>
 * <ul>
 *   <li>Lookups take the read lock and run concurrently</li>
 *   <li>Writes, invalidation and eviction take the write lock</li>
 * </ul>
 * <p>
 * Trackers are copied on the way in and on the way out, so callers never share a mutable tracker
 * with the cache.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * PatternCache cache = new InMemoryPatternCache(64);
 * cache.cacheMultiLinePatterns(uri, 3L, patterns, List.of(LineSpan.of(10, 14)));
 * List<PatternMetadata> hits = cache.getCachedMultiLinePatterns(uri, 3L, List.of(LineSpan.of(12, 12)));
 * }</pre>
 *
 * @since 1.0
 */
public class InMemoryPatternCache implements PatternCache {

    private static final Logger log = Logger.getLogger(InMemoryPatternCache.class.getName());

    private final int maxDocuments;
    private final Map<String, DocumentEntry> documents;
    private final Deque<String> accessOrder;
    private final ReadWriteLock lock;

    /**
     * @param maxDocuments number of documents kept before eviction
     * @throws IllegalArgumentException if maxDocuments is not positive
     */
    public InMemoryPatternCache(int maxDocuments) {
        if (maxDocuments <= 0) {
            throw new IllegalArgumentException("maxDocuments must be positive, got: " + maxDocuments);
        }
        this.maxDocuments = maxDocuments;
        this.documents = new HashMap<>();
        this.accessOrder = new ConcurrentLinkedDeque<>();
        this.lock = new ReentrantReadWriteLock();
    }

    @Override
    public List<PatternMetadata> getCachedMultiLinePatterns(String documentUri, long version, List<LineSpan> lineSpans) {
        lock.readLock().lock();
        try {
            DocumentEntry entry = documents.get(documentUri);
            if (entry == null || entry.version != version) {
                return List.of();
            }
            touch(documentUri);
            List<PatternMetadata> hits = new ArrayList<>();
            for (PatternMetadata pattern : entry.patterns) {
                if (intersectsAny(pattern, lineSpans)) {
                    hits.add(pattern);
                }
            }
            return List.copyOf(hits);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void cacheMultiLinePatterns(String documentUri, long version, List<PatternMetadata> patterns,
                                       List<LineSpan> lineSpans) {
        lock.writeLock().lock();
        try {
            DocumentEntry entry = entryFor(documentUri, version);
            entry.patterns.removeIf(existing -> intersectsAny(existing, lineSpans));
            entry.patterns.addAll(patterns);
            entry.patterns.sort(Comparator.comparing(p -> p.range().start()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<ParenthesesTracker> getCachedParenthesesTracker(String documentUri, long version, LineSpan lines) {
        lock.readLock().lock();
        try {
            DocumentEntry entry = documents.get(documentUri);
            if (entry == null || entry.version != version || entry.tracker == null
                    || !entry.trackerLines.contains(lines)) {
                return Optional.empty();
            }
            touch(documentUri);
            return Optional.of(entry.tracker.copy());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void cacheParenthesesTracker(String documentUri, long version, ParenthesesTracker tracker, LineSpan lines) {
        lock.writeLock().lock();
        try {
            DocumentEntry entry = entryFor(documentUri, version);
            entry.tracker = tracker.copy();
            entry.trackerLines = lines;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void invalidate(String documentUri) {
        lock.writeLock().lock();
        try {
            documents.remove(documentUri);
            accessOrder.remove(documentUri);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return the number of documents currently cached
     */
    public int size() {
        lock.readLock().lock();
        try {
            return documents.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // Must be called with the write lock held.
    private DocumentEntry entryFor(String documentUri, long version) {
        DocumentEntry entry = documents.get(documentUri);
        if (entry == null || entry.version != version) {
            entry = new DocumentEntry(version);
            documents.put(documentUri, entry);
        }
        accessOrder.remove(documentUri);
        accessOrder.addFirst(documentUri);
        while (accessOrder.size() > maxDocuments) {
            String oldest = accessOrder.removeLast();
            documents.remove(oldest);
            log.fine(() -> "Evicted pattern cache entry of " + oldest);
        }
        return entry;
    }

    // Access order is a concurrent deque, so it can be reordered under the read lock.
    private void touch(String documentUri) {
        if (accessOrder.remove(documentUri)) {
            accessOrder.addFirst(documentUri);
        }
    }

    private static boolean intersectsAny(PatternMetadata pattern, List<LineSpan> spans) {
        for (LineSpan span : spans) {
            if (span.intersects(pattern.startLine(), pattern.endLine())) {
                return true;
            }
        }
        return false;
    }

    private static final class DocumentEntry {
        private final long version;
        private final List<PatternMetadata> patterns = new ArrayList<>();
        private ParenthesesTracker tracker;
        private LineSpan trackerLines;

        private DocumentEntry(long version) {
            this.version = version;
        }
    }
}
