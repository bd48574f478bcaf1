package de.mirkosertic.mwe.matching;

import de.mirkosertic.mwe.LemmaNormalizer;
import de.mirkosertic.mwe.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finds expression spans in a token sequence with a single greedy left-to-right pass.
 *
 * <p>At each free position the trie is walked token by token, at most {@code maxLength}
 * tokens far, and the longest walk that ends on a terminal node wins. The matched tokens are
 * consumed and the scan continues behind the span. Returned spans never overlap and are
 * ordered by start index.</p>
 *
 * <p>A token's lemma is its upstream lemma, lowercased, when present and non-empty. Otherwise
 * the text is run through {@link LemmaNormalizer#normalizeUnexpanded(String)} of the normalizer
 * that built the trie, the same function that keys the literal trie paths.</p>
 */
public final class SpanMatcher {

    public static final int DEFAULT_MAX_LENGTH = 10;

    private final MweTrie trie;
    private final LemmaNormalizer normalizer;
    private final int maxLength;

    public SpanMatcher(final MweTrie trie, final LemmaNormalizer normalizer, final int maxLength) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be at least 1, got " + maxLength);
        }
        this.trie = trie;
        this.normalizer = normalizer;
        this.maxLength = maxLength;
    }

    public List<MatchSpan> match(final List<Token> tokens) {
        final List<MatchSpan> spans = new ArrayList<>();
        if (tokens.isEmpty() || trie.isEmpty()) {
            return spans;
        }

        final int tokenCount = tokens.size();
        final String[] lemmas = new String[tokenCount];
        final boolean[] consumed = new boolean[tokenCount];

        int i = 0;
        while (i < tokenCount) {
            if (consumed[i]) {
                i++;
                continue;
            }

            MatchRecord longestMatch = null;
            int longestLength = 0;

            MweTrie.Node current = trie.root();
            final int limit = Math.min(i + maxLength, tokenCount);
            for (int j = i; j < limit; j++) {
                if (consumed[j]) {
                    break;
                }
                if (lemmas[j] == null) {
                    lemmas[j] = lemmaOf(tokens.get(j));
                }
                current = current.child(lemmas[j]);
                if (current == null) {
                    break;
                }
                if (current.terminal() != null) {
                    longestMatch = current.terminal();
                    longestLength = j - i + 1;
                }
            }

            if (longestMatch != null) {
                final int end = i + longestLength;
                spans.add(new MatchSpan(i, end, longestMatch));
                for (int k = i; k < end; k++) {
                    consumed[k] = true;
                }
                i = end;
            } else {
                i++;
            }
        }
        return spans;
    }

    String lemmaOf(final Token token) {
        if (token.hasLemma()) {
            return token.lemma().toLowerCase(Locale.ROOT);
        }
        return normalizer.normalizeUnexpanded(token.text());
    }

    public int getMaxLength() {
        return maxLength;
    }
}
