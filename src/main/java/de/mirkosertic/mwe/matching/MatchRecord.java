package de.mirkosertic.mwe.matching;

import de.mirkosertic.mwe.dictionary.ExpressionEntry;
import de.mirkosertic.mwe.dictionary.MweType;

/**
 * Terminal payload of a trie path.
 *
 * @param original surface form of the dictionary entry
 * @param lemma    lemma of the expression
 * @param pos      part-of-speech tag
 * @param type     expression type
 * @param length   number of lemma tokens on the path
 */
public record MatchRecord(String original, String lemma, String pos, MweType type, int length) {

    static MatchRecord of(final ExpressionEntry entry, final int length) {
        return new MatchRecord(entry.surfaceForm(), entry.lemma(), entry.pos(), entry.type(), length);
    }
}
