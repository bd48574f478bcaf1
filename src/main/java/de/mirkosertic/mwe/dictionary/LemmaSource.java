package de.mirkosertic.mwe.dictionary;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Where a recognizer's wordform to lemma override dictionary comes from.
 *
 * <p>Keys and values are lowercased on load, whatever the source. Loading never throws.</p>
 */
public interface LemmaSource {

    Map<String, String> load();

    static LemmaSource empty() {
        return HashMap::new;
    }

    static LemmaSource of(final Map<String, String> overrides) {
        final Map<String, String> lowercased = lowercase(overrides);
        return () -> new HashMap<>(lowercased);
    }

    /**
     * A JSON document of the shape {@code {"wordform": "lemma"}}.
     */
    static LemmaSource fromJsonFile(final Path path) {
        return () -> lowercase(JsonDictionaryReader.readLemmas(path));
    }

    private static Map<String, String> lowercase(final Map<String, String> overrides) {
        final Map<String, String> result = new HashMap<>();
        overrides.forEach((form, lemma) ->
                result.put(form.toLowerCase(Locale.ROOT), lemma.toLowerCase(Locale.ROOT)));
        return result;
    }
}
