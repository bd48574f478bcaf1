package de.mirkosertic.mwe.dictionary;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where a recognizer's expression dictionary comes from.
 *
 * <p>Two variants exist: an in-memory mapping and a JSON document on disk. Whatever the source,
 * {@link #load()} yields a mapping from surface form to entry. Loading never throws; a source
 * that cannot be read produces an empty mapping and a logged warning.</p>
 */
public interface ExpressionSource {

    /**
     * @return a fresh, mutable, insertion ordered mapping from surface form to entry
     */
    Map<String, ExpressionEntry> load();

    /**
     * A source without entries.
     */
    static ExpressionSource empty() {
        return LinkedHashMap::new;
    }

    /**
     * Entries supplied directly. Keys are surface forms.
     */
    static ExpressionSource of(final Map<String, ExpressionEntry> entries) {
        final Map<String, ExpressionEntry> copy = new LinkedHashMap<>(entries);
        return () -> new LinkedHashMap<>(copy);
    }

    /**
     * Entries supplied directly, keyed by their surface form.
     */
    static ExpressionSource of(final ExpressionEntry... entries) {
        final Map<String, ExpressionEntry> map = new LinkedHashMap<>();
        for (final ExpressionEntry entry : entries) {
            map.put(entry.surfaceForm(), entry);
        }
        return of(map);
    }

    /**
     * A JSON document of the shape {@code {"surface": {"lemma": ..., "pos": ..., "type": ...}}}.
     */
    static ExpressionSource fromJsonFile(final Path path) {
        return () -> JsonDictionaryReader.readExpressions(path);
    }
}
