package de.mirkosertic.mwe.matching;

import de.mirkosertic.mwe.LemmaNormalizer;
import de.mirkosertic.mwe.dictionary.ExpressionEntry;
import de.mirkosertic.mwe.dictionary.MweType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MweTrieBuilder")
class MweTrieBuilderTest {

    private static ExpressionEntry entry(final String surface) {
        return ExpressionEntry.of(surface, null, null, null);
    }

    private static MweTrieBuilder portuguese(final Map<String, String> overrides) {
        return new MweTrieBuilder(new LemmaNormalizer("portuguese", overrides));
    }

    @Nested
    @DisplayName("Lemma paths")
    class Paths {

        @Test
        @DisplayName("Contractions produce an expanded and a literal path")
        void contractionPaths() {
            final List<List<String>> paths = portuguese(Map.of()).lemmaPaths(entry("Café da manhã"));

            assertThat(paths).containsExactly(
                    List.of("café", "de", "a", "manhã"),
                    List.of("café", "da", "manhã"));
        }

        @Test
        @DisplayName("Plural contractions stay intact on the literal path")
        void pluralContractionLiteralPath() {
            assertThat(portuguese(Map.of()).lemmaPaths(entry("fim dos mundos")))
                    .containsExactly(
                            List.of("fim", "de", "os", "mundo"),
                            List.of("fim", "dos", "mundo"));
            assertThat(portuguese(Map.of()).lemmaPaths(entry("Pelas ruas")))
                    .containsExactly(
                            List.of("por", "as", "rua"),
                            List.of("pelas", "rua"));
        }

        @Test
        @DisplayName("Without contractions there is one path")
        void singlePath() {
            assertThat(portuguese(Map.of()).lemmaPaths(entry("de acordo com")))
                    .containsExactly(List.of("de", "acordo", "com"));
        }

        @Test
        @DisplayName("Words are normalized with overrides and rules")
        void normalizedWords() {
            assertThat(portuguese(Map.of("deu", "dar")).lemmaPaths(entry("deu certos")))
                    .containsExactly(List.of("dar", "certo"));
        }

        @Test
        @DisplayName("Languages without rules only lowercase")
        void identityLanguage() {
            final MweTrieBuilder builder = new MweTrieBuilder(new LemmaNormalizer("english", Map.of()));

            assertThat(builder.lemmaPaths(entry("Kick the buckets")))
                    .containsExactly(List.of("kick", "the", "buckets"));
        }
    }

    @Test
    @DisplayName("Singular and plural contractions do not collide")
    void contractionNumberKeptApart() {
        final MweTrie trie = portuguese(Map.of()).build(List.of(
                entry("fim do mundo"), entry("fim dos tempos"), entry("fim dos mundos")));

        assertThat(trie.collisions()).isEmpty();
        assertThat(trie.pathCount()).isEqualTo(6);
        assertThat(trie.lookup(List.of("fim", "do", "mundo")).map(MatchRecord::original))
                .contains("fim do mundo");
        assertThat(trie.lookup(List.of("fim", "dos", "mundo")).map(MatchRecord::original))
                .contains("fim dos mundos");
        assertThat(trie.lookup(List.of("fim", "dos", "tempo")).map(MatchRecord::original))
                .contains("fim dos tempos");
    }

    @Test
    @DisplayName("Every path ends on a terminal carrying the entry metadata")
    void terminalsCarryMetadata() {
        final ExpressionEntry breakfast = ExpressionEntry.of("café da manhã", "café da manhã", "NOUN", MweType.FIXED);
        final ExpressionEntry accordingTo = ExpressionEntry.of("de acordo com", null, "ADP", null);

        final MweTrie trie = portuguese(Map.of()).build(List.of(breakfast, accordingTo));

        assertThat(trie.isEmpty()).isFalse();
        assertThat(trie.pathCount()).isEqualTo(3);
        assertThat(trie.collisions()).isEmpty();
        assertThat(trie.lookup(List.of("café", "de", "a", "manhã")))
                .contains(new MatchRecord("café da manhã", "café da manhã", "NOUN", MweType.FIXED, 4));
        assertThat(trie.lookup(List.of("café", "da", "manhã")))
                .contains(new MatchRecord("café da manhã", "café da manhã", "NOUN", MweType.FIXED, 3));
        assertThat(trie.lookup(List.of("de", "acordo", "com")).map(MatchRecord::pos)).contains("ADP");
    }

    @Test
    @DisplayName("Prefixes of a path are not terminals")
    void prefixesAreNotTerminals() {
        final MweTrie trie = portuguese(Map.of()).build(List.of(entry("café da manhã")));

        assertThat(trie.lookup(List.of("café"))).isEmpty();
        assertThat(trie.lookup(List.of("café", "da"))).isEmpty();
        assertThat(trie.lookup(List.of())).isEmpty();
        assertThat(trie.root().childCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Empty dictionary gives the empty trie")
    void emptyDictionary() {
        final MweTrie trie = MweTrieBuilder.build(Map.of(), "portuguese", Map.of());

        assertThat(trie.isEmpty()).isTrue();
        assertThat(trie.pathCount()).isZero();
        assertThat(trie.root().childCount()).isZero();
    }

    @Nested
    @DisplayName("Collisions")
    class Collisions {

        @Test
        @DisplayName("Longer surface form wins regardless of order")
        void longerSurfaceWins() {
            final ExpressionEntry plural = entry("cafés da manhã");
            final ExpressionEntry singular = entry("café da manhã");

            final MweTrie forward = portuguese(Map.of()).build(List.of(plural, singular));
            final MweTrie backward = portuguese(Map.of()).build(List.of(singular, plural));

            for (final MweTrie trie : List.of(forward, backward)) {
                assertThat(trie.lookup(List.of("café", "da", "manhã")).map(MatchRecord::original))
                        .contains("cafés da manhã");
                assertThat(trie.lookup(List.of("café", "de", "a", "manhã")).map(MatchRecord::original))
                        .contains("cafés da manhã");
                assertThat(trie.pathCount()).isEqualTo(2);
                assertThat(trie.collisions()).hasSize(2)
                        .allSatisfy(collision -> {
                            assertThat(collision.kept()).isEqualTo("cafés da manhã");
                            assertThat(collision.discarded()).isEqualTo("café da manhã");
                        });
            }
        }

        @Test
        @DisplayName("Equal length goes to the lexicographically smaller surface form")
        void tieBreak() {
            final MweTrie trie = portuguese(Map.of())
                    .build(List.of(entry("de manhã"), entry("De manhã")));

            assertThat(trie.lookup(List.of("de", "manhã")).map(MatchRecord::original)).contains("De manhã");
            assertThat(trie.collisions())
                    .containsExactly(new MweTrie.Collision(List.of("de", "manhã"), "De manhã", "de manhã"));
        }
    }
}
