package de.mirkosertic.mwe.matching;

import de.mirkosertic.mwe.MweAnnotation;
import de.mirkosertic.mwe.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Copies a token sequence, attaching an {@link MweAnnotation} to every token covered by a span.
 */
public final class TokenAnnotator {

    private TokenAnnotator() {
    }

    /**
     * @param tokens the input tokens, left untouched
     * @param spans  disjoint spans in start order, as produced by {@link SpanMatcher}
     * @return a new list of the same length and order
     * @throws IllegalStateException if two spans overlap or are out of start order
     */
    public static List<Token> annotate(final List<Token> tokens, final List<MatchSpan> spans) {
        if (!isDisjointAndOrdered(spans)) {
            throw new IllegalStateException("Overlapping or unordered MWE spans: " + spans);
        }

        final MatchSpan[] owner = new MatchSpan[tokens.size()];
        for (final MatchSpan span : spans) {
            final int end = Math.min(span.end(), tokens.size());
            for (int index = span.start(); index < end; index++) {
                owner[index] = span;
            }
        }

        final List<Token> result = new ArrayList<>(tokens.size());
        for (int index = 0; index < tokens.size(); index++) {
            final Token token = tokens.get(index);
            final MatchSpan span = owner[index];
            if (span == null) {
                result.add(token);
                continue;
            }
            final MatchRecord match = span.match();
            result.add(token.withMwe(new MweAnnotation(
                    span.start(),
                    span.end(),
                    match.lemma(),
                    match.pos(),
                    match.type(),
                    span.start(),
                    index - span.start())));
        }
        return result;
    }

    static boolean isDisjointAndOrdered(final List<MatchSpan> spans) {
        for (int i = 1; i < spans.size(); i++) {
            if (spans.get(i - 1).end() > spans.get(i).start()) {
                return false;
            }
        }
        return true;
    }
}
