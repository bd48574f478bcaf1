package de.mirkosertic.mwe;

import de.mirkosertic.mwe.dto.MweMention;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses annotated tokens into one {@link MweMention} per matched span.
 */
public final class MweMentions {

    private MweMentions() {
    }

    public static List<MweMention> extract(final List<Token> tokens) {
        final List<MweMention> mentions = new ArrayList<>();
        int index = 0;
        while (index < tokens.size()) {
            final MweAnnotation annotation = tokens.get(index).mwe();
            if (annotation == null || annotation.position() != 0) {
                index++;
                continue;
            }

            final int end = Math.min(annotation.spanEnd(), tokens.size());
            final List<String> texts = new ArrayList<>(end - index);
            for (int i = index; i < end; i++) {
                texts.add(tokens.get(i).text());
            }
            mentions.add(new MweMention(
                    List.of(annotation.spanStart(), annotation.spanEnd()),
                    String.join(" ", texts),
                    annotation.lemma(),
                    annotation.pos(),
                    annotation.type().externalName(),
                    texts));
            index = end;
        }
        return mentions;
    }
}
