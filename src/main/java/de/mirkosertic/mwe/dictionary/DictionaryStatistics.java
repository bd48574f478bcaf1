package de.mirkosertic.mwe.dictionary;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate counts over an expression dictionary, computed in one pass.
 *
 * @param totalEntries       number of entries
 * @param lengthDistribution number of entries per surface word count
 * @param posDistribution    number of entries per part-of-speech tag
 * @param typeDistribution   number of entries per expression type name
 */
public record DictionaryStatistics(
        int totalEntries,
        Map<Integer, Integer> lengthDistribution,
        Map<String, Integer> posDistribution,
        Map<String, Integer> typeDistribution
) {

    public static DictionaryStatistics of(final Collection<ExpressionEntry> entries) {
        final Map<Integer, Integer> lengths = new TreeMap<>();
        final Map<String, Integer> pos = new TreeMap<>();
        final Map<String, Integer> types = new TreeMap<>();

        for (final ExpressionEntry entry : entries) {
            lengths.merge(entry.words().length, 1, Integer::sum);
            pos.merge(entry.pos(), 1, Integer::sum);
            types.merge(entry.type().externalName(), 1, Integer::sum);
        }

        return new DictionaryStatistics(entries.size(),
                Collections.unmodifiableMap(lengths),
                Collections.unmodifiableMap(pos),
                Collections.unmodifiableMap(types));
    }
}
