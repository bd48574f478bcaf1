package de.mirkosertic.mwe;

import de.mirkosertic.mwe.dictionary.MweType;

/**
 * Expression metadata attached to every token inside a matched span.
 *
 * @param spanStart first token index of the span (inclusive)
 * @param spanEnd   end token index of the span (exclusive)
 * @param lemma     lemma of the expression
 * @param pos       part-of-speech tag of the expression
 * @param type      expression type
 * @param head      index of the head token, always {@code spanStart}
 * @param position  offset of the annotated token from {@code spanStart}
 */
public record MweAnnotation(
        int spanStart,
        int spanEnd,
        String lemma,
        String pos,
        MweType type,
        int head,
        int position
) {
}
