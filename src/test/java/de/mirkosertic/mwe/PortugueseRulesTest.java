package de.mirkosertic.mwe;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PortugueseRules")
class PortugueseRulesTest {

    private final PortugueseRules rules = PortugueseRules.INSTANCE;

    @Nested
    @DisplayName("Suffix rules")
    class SuffixRules {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "limões, limão",
                "pães, pão",
                "mãos, mão",
                "fáceis, fácil",
                "saeis, sal",
                "sóis, sol",
                "flores, flor",
                "meses, mes",
                "luzes, luz",
                "jardins, jardim",
                "bens, bem",
                "cafés, café",
                "manhãs, manhã",
                "falando, falar",
                "comendo, comer",
                "partindo, parter"
        })
        void rewritesKnownSuffixes(final String word, final String expected) {
            assertThat(rules.lemmatize(word)).isEqualTo(expected);
        }

        @Test
        @DisplayName("-res is checked before the generic -s rule")
        void specificSuffixBeforeGenericPlural() {
            assertThat(rules.lemmatize("flores")).isEqualTo("flor");
            assertThat(rules.lemmatize("flores")).isNotEqualTo("flore");
        }

        @Test
        @DisplayName("Two letter words keep their final s")
        void shortWordsKeepFinalS() {
            assertThat(rules.lemmatize("os")).isEqualTo("os");
            assertThat(rules.lemmatize("as")).isEqualTo("as");
        }

        @Test
        @DisplayName("Words without a known suffix pass through")
        void unknownSuffixUnchanged() {
            assertThat(rules.lemmatize("uma")).isEqualTo("uma");
            assertThat(rules.lemmatize("da")).isEqualTo("da");
            assertThat(rules.lemmatize("café")).isEqualTo("café");
            assertThat(rules.lemmatize("manhã")).isEqualTo("manhã");
        }
    }

    @Nested
    @DisplayName("Contractions")
    class Contractions {

        @Test
        void expandsPrepositionArticleContractions() {
            assertThat(rules.expandContraction("da")).containsExactly("de", "a");
            assertThat(rules.expandContraction("num")).containsExactly("em", "um");
            assertThat(rules.expandContraction("às")).containsExactly("a", "as");
            assertThat(rules.expandContraction("pelos")).containsExactly("por", "os");
        }

        @Test
        @DisplayName("Lookup ignores case")
        void caseInsensitiveLookup() {
            assertThat(rules.expandContraction("Da")).containsExactly("de", "a");
            assertThat(rules.expandContraction("NUMA")).containsExactly("em", "uma");
        }

        @Test
        @DisplayName("Other words come back unchanged, original case kept")
        void nonContractionUnchanged() {
            assertThat(rules.expandContraction("Casa")).containsExactly("Casa");
            assertThat(rules.expandContraction("de")).containsExactly("de");
        }
    }

    @Test
    @DisplayName("Language lookup selects Portuguese for its identifiers only")
    void languageSelection() {
        assertThat(LanguageRules.forLanguage("portuguese")).isSameAs(PortugueseRules.INSTANCE);
        assertThat(LanguageRules.forLanguage("PT")).isSameAs(PortugueseRules.INSTANCE);
        assertThat(LanguageRules.forLanguage("english")).isSameAs(LanguageRules.IDENTITY);
        assertThat(LanguageRules.IDENTITY.expandContraction("don't")).containsExactly("don't");
    }
}
