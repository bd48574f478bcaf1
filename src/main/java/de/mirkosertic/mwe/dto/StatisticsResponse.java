package de.mirkosertic.mwe.dto;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import de.mirkosertic.mwe.CachingLemmaNormalizer;
import de.mirkosertic.mwe.MweRecognizer;
import de.mirkosertic.mwe.config.BuildInfo;
import de.mirkosertic.mwe.dictionary.DictionaryStatistics;
import org.jspecify.annotations.Nullable;

import java.util.Locale;
import java.util.Map;

/**
 * Diagnostics of one recognizer: dictionary statistics plus runtime state.
 */
public record StatisticsResponse(
        String language,
        boolean enabled,
        int totalMwes,
        Map<Integer, Integer> lengthDistribution,
        Map<String, Integer> posDistribution,
        Map<String, Integer> typeDistribution,
        int lemmaMappings,
        int trieCollisions,
        String softwareVersion,
        @Nullable CacheMetrics cacheMetrics
) {

    /**
     * Normalization cache metrics, absent when caching is disabled.
     */
    public record CacheMetrics(
            String hitRate,
            long totalHits,
            long totalMisses,
            long cacheSize,
            long evictions
    ) {
        static CacheMetrics of(final CachingLemmaNormalizer cache) {
            final CacheStats stats = cache.getStats();
            final double hitRate = stats.requestCount() == 0 ? 0.0 : stats.hitRate() * 100.0;
            return new CacheMetrics(
                    String.format(Locale.ROOT, "%.1f%%", hitRate),
                    stats.hitCount(),
                    stats.missCount(),
                    cache.estimatedSize(),
                    stats.evictionCount());
        }
    }

    public static StatisticsResponse of(final MweRecognizer recognizer) {
        final DictionaryStatistics statistics = recognizer.statistics();
        return new StatisticsResponse(
                recognizer.getLanguage(),
                recognizer.isEnabled(),
                statistics.totalEntries(),
                statistics.lengthDistribution(),
                statistics.posDistribution(),
                statistics.typeDistribution(),
                recognizer.getOverrideCount(),
                recognizer.trie().collisions().size(),
                BuildInfo.getVersion(),
                recognizer.getNormalizationCache().map(CacheMetrics::of).orElse(null));
    }
}
