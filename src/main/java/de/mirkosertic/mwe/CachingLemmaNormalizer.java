package de.mirkosertic.mwe;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.Map;

/**
 * {@link LemmaNormalizer} that memoizes results in a bounded Caffeine cache.
 *
 * <p>Normalization depends only on the lowercased word, the language and the override
 * dictionary, and the latter two are fixed per instance, so the lowercased word is the whole
 * cache key.</p>
 *
 * <p>Cache characteristics:</p>
 * <ul>
 *   <li>Bounded by {@code maximumSize}, Caffeine's size based eviction</li>
 *   <li>Thread-safe, shared by all readers of one recognizer</li>
 *   <li>Hits, misses and evictions are recorded by Caffeine, see {@link #getStats()}</li>
 * </ul>
 */
public class CachingLemmaNormalizer extends LemmaNormalizer {

    private final Cache<String, String> cache;

    /**
     * @param language    the language identifier
     * @param overrides   lowercased wordform to lemma overrides
     * @param maximumSize maximum number of cached words, must be positive
     */
    public CachingLemmaNormalizer(final String language,
                                  final Map<String, String> overrides,
                                  final long maximumSize) {
        super(language, overrides);
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive, got " + maximumSize);
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    @Override
    protected String normalizeLowercase(final String lowercaseWord) {
        return cache.get(lowercaseWord, super::normalizeLowercase);
    }

    /**
     * Snapshot of the hit, miss and eviction counters.
     */
    public CacheStats getStats() {
        return cache.stats();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
