package de.mirkosertic.mwe;

import de.mirkosertic.mwe.matching.MatchSpan;
import org.apache.lucene.analysis.TokenFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionIncrementAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionLengthAttribute;
import org.apache.lucene.analysis.tokenattributes.TypeAttribute;
import org.apache.lucene.util.AttributeSource;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Token filter that recognizes multiword expressions in a token stream and injects one
 * extra token per match.
 *
 * <p>The whole input stream is treated as one sentence: it is buffered on the first call to
 * {@link #incrementToken()} and run through the {@link MweRecognizer}. All original tokens pass
 * through unchanged. Directly after the first token of every match an additional token is
 * emitted:</p>
 * <ul>
 *   <li>term: the expression lemma, e.g. {@code café da manhã}</li>
 *   <li>type: {@value #MWE_TYPE}</li>
 *   <li>position increment 0, position length = number of matched tokens</li>
 *   <li>offsets from the start of the first to the end of the last matched token</li>
 * </ul>
 *
 * <p>Lemmas of the incoming terms are derived by the recognizer's normalizer, so the filter
 * should sit before any stemming or folding filter.</p>
 */
public final class MweTokenFilter extends TokenFilter {

    public static final String MWE_TYPE = "MWE";

    private final CharTermAttribute termAtt = addAttribute(CharTermAttribute.class);
    private final PositionIncrementAttribute posIncAtt = addAttribute(PositionIncrementAttribute.class);
    private final PositionLengthAttribute posLenAtt = addAttribute(PositionLengthAttribute.class);
    private final OffsetAttribute offsetAtt = addAttribute(OffsetAttribute.class);
    private final TypeAttribute typeAtt = addAttribute(TypeAttribute.class);

    private final MweRecognizer recognizer;
    private final Deque<PendingToken> pending = new ArrayDeque<>();
    private boolean buffered;

    private record BufferedToken(AttributeSource.State state, String term, int startOffset, int endOffset) {}

    private record PendingToken(AttributeSource.State state, @Nullable String mweTerm, int positionLength,
                                int startOffset, int endOffset) {}

    public MweTokenFilter(final TokenStream input, final MweRecognizer recognizer) {
        super(input);
        this.recognizer = recognizer;
    }

    @Override
    public boolean incrementToken() throws IOException {
        if (!buffered) {
            bufferInput();
            buffered = true;
        }

        final PendingToken next = pending.poll();
        if (next == null) {
            return false;
        }

        restoreState(next.state());
        if (next.mweTerm() != null) {
            termAtt.setEmpty().append(next.mweTerm());
            posIncAtt.setPositionIncrement(0);
            posLenAtt.setPositionLength(next.positionLength());
            offsetAtt.setOffset(next.startOffset(), next.endOffset());
            typeAtt.setType(MWE_TYPE);
        }
        return true;
    }

    private void bufferInput() throws IOException {
        final List<BufferedToken> tokens = new ArrayList<>();
        while (input.incrementToken()) {
            tokens.add(new BufferedToken(captureState(), termAtt.toString(),
                    offsetAtt.startOffset(), offsetAtt.endOffset()));
        }

        final List<MatchSpan> spans;
        if (recognizer.isEnabled() && !tokens.isEmpty()) {
            spans = recognizer.match(tokens.stream().map(token -> Token.of(token.term())).toList());
        } else {
            spans = List.of();
        }

        int spanIndex = 0;
        for (int i = 0; i < tokens.size(); i++) {
            final BufferedToken token = tokens.get(i);
            pending.add(new PendingToken(token.state(), null, 1, token.startOffset(), token.endOffset()));

            if (spanIndex < spans.size() && spans.get(spanIndex).start() == i) {
                final MatchSpan span = spans.get(spanIndex++);
                final BufferedToken last = tokens.get(span.end() - 1);
                pending.add(new PendingToken(token.state(), span.match().lemma(), span.length(),
                        token.startOffset(), last.endOffset()));
            }
        }
    }

    @Override
    public void reset() throws IOException {
        super.reset();
        pending.clear();
        buffered = false;
    }
}
