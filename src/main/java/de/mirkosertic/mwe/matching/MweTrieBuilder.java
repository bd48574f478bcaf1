package de.mirkosertic.mwe.matching;

import de.mirkosertic.mwe.LanguageRules;
import de.mirkosertic.mwe.LemmaNormalizer;
import de.mirkosertic.mwe.dictionary.ExpressionEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link MweTrie} from dictionary entries.
 *
 * <p>For every entry the surface form is split on whitespace, each word is expanded with the
 * language's contraction table and every resulting word is normalized. The entry is stored
 * under that lemma path. If expansion changed the sequence, the entry is additionally stored
 * under the lemma path of the unexpanded words, so that text from tokenizers that keep
 * contractions intact matches too. On that literal path a contraction is only lowercased, see
 * {@link LemmaNormalizer#normalizeUnexpanded(String)}.</p>
 *
 * <p>When two different surface forms end on the same path, the record of the longer surface
 * form is kept, ties going to the lexicographically smaller one. The outcome therefore does
 * not depend on dictionary order. Collisions are logged and reported by
 * {@link MweTrie#collisions()}.</p>
 */
public final class MweTrieBuilder {

    private static final Logger logger = LoggerFactory.getLogger(MweTrieBuilder.class);

    static final Comparator<String> SURFACE_PREFERENCE =
            Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder());

    private final LemmaNormalizer normalizer;

    public MweTrieBuilder(final LemmaNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Convenience for a one-off build with a non-caching normalizer.
     */
    public static MweTrie build(final Map<String, ExpressionEntry> dictionary,
                                final String language,
                                final Map<String, String> overrides) {
        return new MweTrieBuilder(new LemmaNormalizer(language, overrides)).build(dictionary.values());
    }

    public MweTrie build(final Collection<ExpressionEntry> entries) {
        if (entries.isEmpty()) {
            return MweTrie.empty();
        }

        final MweTrie.Node root = new MweTrie.Node();
        final List<MweTrie.Collision> collisions = new ArrayList<>();
        int pathCount = 0;

        for (final ExpressionEntry entry : entries) {
            for (final List<String> path : lemmaPaths(entry)) {
                MweTrie.Node current = root;
                for (final String lemma : path) {
                    current = current.getOrCreateChild(lemma);
                }

                final MatchRecord existing = current.terminal();
                final MatchRecord candidate = MatchRecord.of(entry, path.size());
                if (existing == null) {
                    current.setTerminal(candidate);
                    pathCount++;
                } else if (!existing.original().equals(candidate.original())) {
                    final boolean candidateWins =
                            SURFACE_PREFERENCE.compare(candidate.original(), existing.original()) < 0;
                    final MatchRecord kept = candidateWins ? candidate : existing;
                    final MatchRecord discarded = candidateWins ? existing : candidate;
                    current.setTerminal(kept);
                    collisions.add(new MweTrie.Collision(path, kept.original(), discarded.original()));
                    logger.warn("MWE '{}' and '{}' share the lemma path {}, keeping '{}'",
                            existing.original(), candidate.original(), path, kept.original());
                }
            }
        }

        logger.debug("Built MWE trie for {}: {} entries, {} paths, {} collisions",
                normalizer.getLanguage(), entries.size(), pathCount, collisions.size());
        return new MweTrie(root, pathCount, collisions);
    }

    /**
     * The lemma paths an entry is stored under: the contraction-expanded path first, followed by
     * the literal path when it differs.
     */
    public List<List<String>> lemmaPaths(final ExpressionEntry entry) {
        final LanguageRules rules = normalizer.getRules();
        final String[] words = entry.words();

        final List<String> expanded = new ArrayList<>();
        final List<String> literal = new ArrayList<>(words.length);
        for (final String word : words) {
            for (final String part : rules.expandContraction(word)) {
                expanded.add(normalizer.normalize(part));
            }
            literal.add(normalizer.normalizeUnexpanded(word));
        }

        if (expanded.equals(literal)) {
            return List.of(List.copyOf(expanded));
        }
        return List.of(List.copyOf(expanded), List.copyOf(literal));
    }
}
