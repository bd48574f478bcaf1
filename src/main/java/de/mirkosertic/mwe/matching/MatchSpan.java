package de.mirkosertic.mwe.matching;

/**
 * A matched expression over the token range {@code [start, end)}.
 */
public record MatchSpan(int start, int end, MatchRecord match) {

    public MatchSpan {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean contains(final int index) {
        return index >= start && index < end;
    }
}
