package de.mirkosertic.mwe.matching;

import de.mirkosertic.mwe.LemmaNormalizer;
import de.mirkosertic.mwe.Token;
import de.mirkosertic.mwe.dictionary.ExpressionEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("SpanMatcher")
class SpanMatcherTest {

    private static SpanMatcher matcher(final String language,
                                       final Map<String, String> overrides,
                                       final int maxLength,
                                       final String... surfaces) {
        final LemmaNormalizer normalizer = new LemmaNormalizer(language, overrides);
        final List<ExpressionEntry> entries = Arrays.stream(surfaces)
                .map(surface -> ExpressionEntry.of(surface, null, null, null))
                .toList();
        return new SpanMatcher(new MweTrieBuilder(normalizer).build(entries), normalizer, maxLength);
    }

    private static SpanMatcher portuguese(final String... surfaces) {
        return matcher("portuguese", Map.of(), SpanMatcher.DEFAULT_MAX_LENGTH, surfaces);
    }

    private static SpanMatcher english(final String... surfaces) {
        return matcher("english", Map.of(), SpanMatcher.DEFAULT_MAX_LENGTH, surfaces);
    }

    @Nested
    @DisplayName("Portuguese")
    class Portuguese {

        @Test
        @DisplayName("Longest match wins over a shorter expression")
        void longestMatch() {
            final List<MatchSpan> spans = portuguese("de manhã", "café da manhã")
                    .match(Token.listOf("Tomei", "café", "da", "manhã"));

            assertThat(spans).hasSize(1);
            assertThat(spans.get(0).start()).isEqualTo(1);
            assertThat(spans.get(0).end()).isEqualTo(4);
            assertThat(spans.get(0).match().lemma()).isEqualTo("café da manhã");
        }

        @Test
        @DisplayName("Plural word in text matches the singular dictionary form")
        void pluralInText() {
            final List<MatchSpan> spans = portuguese("café da manhã")
                    .match(Token.listOf("Tomei", "cafés", "da", "manhã"));

            assertThat(spans).extracting(MatchSpan::start, MatchSpan::end)
                    .containsExactly(tuple(1, 4));
        }

        @Test
        @DisplayName("Pre-expanded contraction tokens match the expanded path")
        void preExpandedTokens() {
            final List<MatchSpan> spans = portuguese("café da manhã")
                    .match(Token.listOf("Tomei", "café", "de", "a", "manhã"));

            assertThat(spans).hasSize(1);
            assertThat(spans.get(0).start()).isEqualTo(1);
            assertThat(spans.get(0).end()).isEqualTo(5);
            assertThat(spans.get(0).match().original()).isEqualTo("café da manhã");
        }

        @Test
        @DisplayName("Singular and plural contractions in text find their own expression")
        void contractionNumber() {
            final SpanMatcher matcher = portuguese("fim do mundo", "fim dos tempos", "fim dos mundos");

            assertThat(matcher.match(Token.listOf("o", "fim", "do", "mundo")))
                    .extracting(span -> span.match().lemma())
                    .containsExactly("fim do mundo");
            assertThat(matcher.match(Token.listOf("o", "fim", "dos", "tempos")))
                    .extracting(span -> span.match().lemma())
                    .containsExactly("fim dos tempos");
            assertThat(matcher.match(Token.listOf("o", "fim", "dos", "mundos")))
                    .extracting(span -> span.match().lemma())
                    .containsExactly("fim dos mundos");
            assertThat(matcher.match(Token.listOf("o", "fim", "de", "o", "mundo")))
                    .extracting(span -> span.match().lemma())
                    .containsExactly("fim do mundo");
        }

        @Test
        @DisplayName("Shorter expression matches where the longer one does not")
        void shorterExpression() {
            final List<MatchSpan> spans = portuguese("de manhã", "café da manhã")
                    .match(Token.listOf("Acordei", "cedo", "de", "manhã"));

            assertThat(spans).hasSize(1);
            assertThat(spans.get(0).start()).isEqualTo(2);
            assertThat(spans.get(0).match().lemma()).isEqualTo("de manhã");
        }

        @Test
        @DisplayName("Upstream lemma takes precedence over normalization")
        void upstreamLemma() {
            final SpanMatcher matcher = portuguese("dar certo");

            final List<MatchSpan> withLemma = matcher.match(List.of(
                    Token.of("Tudo"), Token.of("deu", "DAR"), Token.of("certo")));
            final List<MatchSpan> withoutLemma = matcher.match(Token.listOf("Tudo", "deu", "certo"));

            assertThat(withLemma).extracting(MatchSpan::start).containsExactly(1);
            assertThat(withoutLemma).isEmpty();
        }

        @Test
        @DisplayName("Empty upstream lemma falls back to normalization")
        void emptyUpstreamLemma() {
            final List<MatchSpan> spans = portuguese("café da manhã")
                    .match(List.of(Token.of("cafés", ""), Token.of("da"), Token.of("manhã")));

            assertThat(spans).hasSize(1);
        }

        @Test
        @DisplayName("Overrides apply to text tokens")
        void overridesApply() {
            final List<MatchSpan> spans = matcher("portuguese", Map.of("deu", "dar"),
                    SpanMatcher.DEFAULT_MAX_LENGTH, "dar certo")
                    .match(Token.listOf("Tudo", "deu", "certo"));

            assertThat(spans).extracting(MatchSpan::start, MatchSpan::end)
                    .containsExactly(tuple(1, 3));
        }
    }

    @Test
    @DisplayName("Greedy scan consumes tokens, later overlapping candidates are skipped")
    void greedyNonOverlapping() {
        final List<MatchSpan> spans = english("a b", "b c").match(Token.listOf("a", "b", "c"));

        assertThat(spans).hasSize(1);
        assertThat(spans.get(0).match().original()).isEqualTo("a b");
    }

    @Test
    @DisplayName("A longer expression is preferred even past a shorter terminal")
    void extendsPastShorterTerminal() {
        final SpanMatcher matcher = english("new york", "new york city");

        assertThat(matcher.match(Token.listOf("I", "love", "New", "York", "City")))
                .extracting(MatchSpan::start, MatchSpan::end)
                .containsExactly(tuple(2, 5));
        assertThat(matcher.match(Token.listOf("New", "York", "is", "big")))
                .extracting(MatchSpan::start, MatchSpan::end)
                .containsExactly(tuple(0, 2));
    }

    @Test
    @DisplayName("Failed long walk falls back to the longest terminal seen")
    void fallsBackToShorterTerminal() {
        final List<MatchSpan> spans = english("new york", "new york city hall")
                .match(Token.listOf("new", "york", "city", "council"));

        assertThat(spans).extracting(span -> span.match().original()).containsExactly("new york");
    }

    @Test
    @DisplayName("Expressions longer than the maximum length are not found")
    void maxLength() {
        final SpanMatcher limited = matcher("english", Map.of(), 2, "new york city");

        assertThat(limited.match(Token.listOf("new", "york", "city"))).isEmpty();
        assertThat(limited.getMaxLength()).isEqualTo(2);
    }

    @Test
    @DisplayName("Several expressions in one sentence")
    void severalMatches() {
        final List<MatchSpan> spans = portuguese("de manhã", "dar certo")
                .match(List.of(Token.of("De"), Token.of("manhã"), Token.of("tudo"),
                        Token.of("deu", "dar"), Token.of("certo")));

        assertThat(spans).extracting(MatchSpan::start, MatchSpan::end).containsExactly(
                tuple(0, 2),
                tuple(3, 5));
    }

    @Test
    void emptyInputs() {
        assertThat(portuguese("de manhã").match(List.of())).isEmpty();
        assertThat(portuguese().match(Token.listOf("de", "manhã"))).isEmpty();
    }

    @Test
    void invalidMaxLength() {
        assertThatThrownBy(() -> new SpanMatcher(MweTrie.empty(), new LemmaNormalizer("english", Map.of()), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Random sentences always yield ordered, disjoint spans of dictionary paths")
    void randomizedSpanInvariants() {
        final Random random = new Random(42);
        final String[] vocabulary = {"a", "b", "c", "d", "e"};

        for (int round = 0; round < 200; round++) {
            final List<String> surfaces = new ArrayList<>();
            for (int e = 0; e < 6; e++) {
                final int length = 1 + random.nextInt(3);
                final StringBuilder surface = new StringBuilder();
                for (int w = 0; w < length; w++) {
                    if (w > 0) {
                        surface.append(' ');
                    }
                    surface.append(vocabulary[random.nextInt(vocabulary.length)]);
                }
                surfaces.add(surface.toString());
            }
            final LemmaNormalizer normalizer = new LemmaNormalizer("english", Map.of());
            final MweTrie trie = new MweTrieBuilder(normalizer).build(surfaces.stream()
                    .distinct()
                    .map(surface -> ExpressionEntry.of(surface, null, null, null))
                    .toList());
            final SpanMatcher matcher = new SpanMatcher(trie, normalizer, 3);

            final String[] words = new String[random.nextInt(12)];
            for (int i = 0; i < words.length; i++) {
                words[i] = vocabulary[random.nextInt(vocabulary.length)];
            }

            final List<MatchSpan> spans = matcher.match(Token.listOf(words));

            int previousEnd = 0;
            for (final MatchSpan span : spans) {
                assertThat(span.start()).isGreaterThanOrEqualTo(previousEnd);
                assertThat(span.end()).isLessThanOrEqualTo(words.length);
                assertThat(span.length()).isEqualTo(span.match().length()).isLessThanOrEqualTo(3);
                assertThat(trie.lookup(Arrays.asList(words).subList(span.start(), span.end()))).isPresent();
                previousEnd = span.end();
            }
        }
    }
}
