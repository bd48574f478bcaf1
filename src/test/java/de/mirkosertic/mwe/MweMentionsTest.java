package de.mirkosertic.mwe;

import de.mirkosertic.mwe.dictionary.MweType;
import de.mirkosertic.mwe.dto.MweMention;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MweMentionsTest {

    private static Token annotated(final String text, final int start, final int end, final String lemma,
                                   final int position) {
        return Token.of(text).withMwe(new MweAnnotation(start, end, lemma, "ADV", MweType.FLAT, start, position));
    }

    @Test
    void testOneMentionPerSpan() {
        final List<Token> tokens = List.of(
                annotated("Uma", 0, 3, "um a um", 0),
                annotated("a", 0, 3, "um a um", 1),
                annotated("uma", 0, 3, "um a um", 2),
                Token.of("e"),
                annotated("de", 4, 6, "de manhã", 0),
                annotated("manhã", 4, 6, "de manhã", 1));

        final List<MweMention> mentions = MweMentions.extract(tokens);

        assertThat(mentions).containsExactly(
                new MweMention(List.of(0, 3), "Uma a uma", "um a um", "ADV", "flat", List.of("Uma", "a", "uma")),
                new MweMention(List.of(4, 6), "de manhã", "de manhã", "ADV", "flat", List.of("de", "manhã")));
    }

    @Test
    void testNoAnnotations() {
        assertThat(MweMentions.extract(Token.listOf("Bom", "dia"))).isEmpty();
        assertThat(MweMentions.extract(List.of())).isEmpty();
    }
}
