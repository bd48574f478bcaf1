package de.mirkosertic.mwe.dictionary;

import de.mirkosertic.mwe.util.WordSplitter;
import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * One dictionary entry: the surface form of an expression and its metadata.
 *
 * @param surfaceForm whitespace separated words, the dictionary key
 * @param lemma       canonical form of the whole expression
 * @param pos         part-of-speech tag
 * @param type        expression type
 */
public record ExpressionEntry(String surfaceForm, String lemma, String pos, MweType type) {

    public static final String DEFAULT_POS = "X";

    public ExpressionEntry {
        Objects.requireNonNull(surfaceForm, "surfaceForm");
        Objects.requireNonNull(lemma, "lemma");
        Objects.requireNonNull(pos, "pos");
        Objects.requireNonNull(type, "type");
        if (WordSplitter.isBlank(surfaceForm)) {
            throw new IllegalArgumentException("surfaceForm must not be blank");
        }
    }

    /**
     * Creates an entry applying the defaults: lemma falls back to the surface form, POS to
     * {@value #DEFAULT_POS} and type to {@link MweType#FIXED}.
     */
    public static ExpressionEntry of(final String surfaceForm,
                                     final @Nullable String lemma,
                                     final @Nullable String pos,
                                     final @Nullable MweType type) {
        return new ExpressionEntry(
                surfaceForm,
                lemma != null ? lemma : surfaceForm,
                pos != null ? pos : DEFAULT_POS,
                type != null ? type : MweType.FIXED);
    }

    /**
     * The surface form split on Unicode whitespace.
     */
    public String[] words() {
        return WordSplitter.split(surfaceForm);
    }
}
