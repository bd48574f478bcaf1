package de.mirkosertic.mwe.dto;

import java.util.List;

/**
 * One recognized expression of a sentence.
 */
public record MweMention(
        List<Integer> span,         // [start, end) token indices
        String text,                // token texts joined by single spaces
        String lemma,
        String pos,
        String type,
        List<String> tokens
) {
}
