package de.mirkosertic.mwe;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Maps a surface word to the canonical form used as trie key.
 *
 * <p>The word is lowercased first. An entry in the override dictionary wins; otherwise the
 * language's rule based fallback from {@link LanguageRules} is applied. Languages without
 * rules get the lowercased word back.</p>
 *
 * <p>Instances are immutable and thread-safe. The override dictionary is expected to hold
 * lowercased keys and values, as produced by {@link de.mirkosertic.mwe.dictionary.LemmaSource}.</p>
 */
public class LemmaNormalizer {

    private final String language;
    private final LanguageRules rules;
    private final Map<String, String> overrides;

    public LemmaNormalizer(final String language, final Map<String, String> overrides) {
        this.language = Objects.requireNonNull(language, "language");
        this.rules = LanguageRules.forLanguage(language);
        this.overrides = Map.copyOf(Objects.requireNonNull(overrides, "overrides"));
    }

    /**
     * Normalizes a single word. The empty string is returned unchanged.
     *
     * @param word the surface form, never null
     * @return the lemma, lowercased
     */
    public String normalize(final String word) {
        if (word.isEmpty()) {
            return word;
        }
        return normalizeLowercase(word.toLowerCase(Locale.ROOT));
    }

    /**
     * Trie key of a word that is kept in its written form. Contractions are only lowercased:
     * the suffix rules would otherwise fold {@code dos} into {@code do} and merge entries that the
     * expanded path keeps apart. Every other word is {@link #normalize normalized}.
     */
    public String normalizeUnexpanded(final String word) {
        if (rules.expandContraction(word).size() > 1) {
            return word.toLowerCase(Locale.ROOT);
        }
        return normalize(word);
    }

    /**
     * Normalization of an already lowercased, non-empty word. Caching subclasses hook in here.
     */
    protected String normalizeLowercase(final String lowercaseWord) {
        final String override = overrides.get(lowercaseWord);
        if (override != null) {
            return override;
        }
        return rules.lemmatize(lowercaseWord);
    }

    public String getLanguage() {
        return language;
    }

    public LanguageRules getRules() {
        return rules;
    }

    public int getOverrideCount() {
        return overrides.size();
    }
}
