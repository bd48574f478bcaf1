package de.mirkosertic.mwe;

import java.util.List;
import java.util.Locale;

/**
 * Language specific morphology used by the recognizer: a fallback lemmatization heuristic
 * and an orthographic contraction table.
 *
 * <p>Both methods receive words that are already lowercased with {@link Locale#ROOT}.</p>
 */
public interface LanguageRules {

    /**
     * Rules for languages without heuristics: words are returned unchanged.
     */
    LanguageRules IDENTITY = new LanguageRules() {
        @Override
        public String lemmatize(final String lowercaseWord) {
            return lowercaseWord;
        }

        @Override
        public List<String> expandContraction(final String word) {
            return List.of(word);
        }

        @Override
        public String toString() {
            return "IdentityRules";
        }
    };

    /**
     * Applies the rule based fallback lemmatization to a lowercased word.
     */
    String lemmatize(String lowercaseWord);

    /**
     * Expands a contraction into the words it stands for.
     *
     * @param word the surface word, any case
     * @return the expansion, or a single-element list holding {@code word} unchanged
     */
    List<String> expandContraction(String word);

    /**
     * Selects the rules for a language identifier ({@code "portuguese"}, {@code "pt"}, ...).
     * Unknown identifiers get {@link #IDENTITY}.
     */
    static LanguageRules forLanguage(final String language) {
        final String key = language.toLowerCase(Locale.ROOT);
        if ("portuguese".equals(key) || "pt".equals(key)) {
            return PortugueseRules.INSTANCE;
        }
        return IDENTITY;
    }
}
