package de.mirkosertic.mwe.matching;

import org.jspecify.annotations.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Prefix tree over lemma sequences. Each node maps a lemma to a child node and may hold
 * one terminal {@link MatchRecord}.
 *
 * <p>A trie is only mutated by {@link MweTrieBuilder} before it is handed out. Afterwards it
 * is read-only and can be shared between threads.</p>
 */
public final class MweTrie {

    private static final MweTrie EMPTY = new MweTrie(new Node(), 0, List.of());

    /**
     * A path that two different surface forms normalized to.
     *
     * @param path      the lemma sequence
     * @param kept      surface form whose record is stored
     * @param discarded surface form whose record was dropped
     */
    public record Collision(List<String> path, String kept, String discarded) {
    }

    public static final class Node {

        private final Map<String, Node> children = new HashMap<>();
        private @Nullable MatchRecord terminal;

        Node() {
        }

        public @Nullable Node child(final String lemma) {
            return children.get(lemma);
        }

        public @Nullable MatchRecord terminal() {
            return terminal;
        }

        public int childCount() {
            return children.size();
        }

        Node getOrCreateChild(final String lemma) {
            return children.computeIfAbsent(lemma, key -> new Node());
        }

        void setTerminal(final MatchRecord record) {
            this.terminal = record;
        }
    }

    private final Node root;
    private final int pathCount;
    private final List<Collision> collisions;

    MweTrie(final Node root, final int pathCount, final List<Collision> collisions) {
        this.root = root;
        this.pathCount = pathCount;
        this.collisions = List.copyOf(collisions);
    }

    public static MweTrie empty() {
        return EMPTY;
    }

    public Node root() {
        return root;
    }

    /**
     * Number of terminal nodes.
     */
    public int pathCount() {
        return pathCount;
    }

    public boolean isEmpty() {
        return pathCount == 0;
    }

    public List<Collision> collisions() {
        return collisions;
    }

    /**
     * Exact lookup of a complete lemma sequence.
     */
    public Optional<MatchRecord> lookup(final List<String> lemmas) {
        Node current = root;
        for (final String lemma : lemmas) {
            current = current.child(lemma);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(current.terminal());
    }
}
