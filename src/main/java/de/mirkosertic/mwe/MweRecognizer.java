package de.mirkosertic.mwe;

import de.mirkosertic.mwe.dictionary.DictionaryStatistics;
import de.mirkosertic.mwe.dictionary.ExpressionEntry;
import de.mirkosertic.mwe.dictionary.ExpressionSource;
import de.mirkosertic.mwe.dictionary.LemmaSource;
import de.mirkosertic.mwe.dictionary.MweType;
import de.mirkosertic.mwe.matching.MatchSpan;
import de.mirkosertic.mwe.matching.MweTrie;
import de.mirkosertic.mwe.matching.MweTrieBuilder;
import de.mirkosertic.mwe.matching.SpanMatcher;
import de.mirkosertic.mwe.matching.TokenAnnotator;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Recognizes multiword expressions of one language in tokenized sentences.
 *
 * <p>The recognizer owns the expression dictionary and the trie derived from it. Both are held
 * together in an immutable snapshot. Reads ({@link #recognize}, {@link #match},
 * {@link #statistics}) work on the snapshot current at call time. {@link #add} and
 * {@link #remove} copy the dictionary, rebuild the trie and swap in the new snapshot, so readers
 * see either the old or the new state and never a partially rebuilt trie. Writers are
 * serialized.</p>
 *
 * <p>A recognizer whose dictionary is empty is disabled and returns its input unchanged.</p>
 */
public class MweRecognizer {

    private static final Logger logger = LoggerFactory.getLogger(MweRecognizer.class);

    private record Snapshot(Map<String, ExpressionEntry> dictionary, MweTrie trie) {
        boolean enabled() {
            return !dictionary.isEmpty();
        }
    }

    private final String language;
    private final int maxLength;
    private final LemmaNormalizer normalizer;
    private final MweTrieBuilder trieBuilder;
    private final AtomicReference<Snapshot> snapshot;

    public MweRecognizer(final String language, final ExpressionSource expressions, final LemmaSource lemmas) {
        this(language, expressions, lemmas, SpanMatcher.DEFAULT_MAX_LENGTH, 0);
    }

    /**
     * @param language    language identifier, selects the normalization rules
     * @param expressions source of the expression dictionary
     * @param lemmas      source of the wordform to lemma overrides
     * @param maxLength   maximum expression length in tokens, at least 1
     * @param cacheSize   size of the normalization cache, 0 disables caching
     */
    public MweRecognizer(final String language,
                         final ExpressionSource expressions,
                         final LemmaSource lemmas,
                         final int maxLength,
                         final long cacheSize) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be at least 1, got " + maxLength);
        }
        if (cacheSize < 0) {
            throw new IllegalArgumentException("cacheSize must not be negative, got " + cacheSize);
        }
        this.language = Objects.requireNonNull(language, "language");
        this.maxLength = maxLength;

        final Map<String, String> overrides = lemmas.load();
        this.normalizer = cacheSize > 0
                ? new CachingLemmaNormalizer(language, overrides, cacheSize)
                : new LemmaNormalizer(language, overrides);
        this.trieBuilder = new MweTrieBuilder(normalizer);

        final Map<String, ExpressionEntry> dictionary = expressions.load();
        this.snapshot = new AtomicReference<>(createSnapshot(dictionary));

        if (dictionary.isEmpty()) {
            logger.info("MWE recognizer for {} disabled: no expressions loaded", language);
        } else {
            logger.info("Loaded MWE recognizer for {}: {} expressions, {} lemma mappings",
                    language, dictionary.size(), overrides.size());
        }
    }

    public boolean isEnabled() {
        return snapshot.get().enabled();
    }

    /**
     * Finds the expression spans of one sentence.
     */
    public List<MatchSpan> match(final List<Token> tokens) {
        return matcher(snapshot.get()).match(tokens);
    }

    /**
     * Annotates the tokens of one sentence. Returns the input itself when the recognizer is
     * disabled, the input is empty or nothing matched.
     */
    public List<Token> recognize(final List<Token> tokens) {
        return recognize(snapshot.get(), tokens);
    }

    /**
     * Annotates every sentence of a document independently. Sub-token sequences attached to
     * tokens are recognized on their own, then the top-level sequence is recognized. Matches
     * never cross from one level into the other.
     */
    public List<Sentence> recognizeDocument(final List<Sentence> sentences) {
        final Snapshot current = snapshot.get();
        if (!current.enabled() || sentences.isEmpty()) {
            return sentences;
        }

        final List<Sentence> result = new ArrayList<>(sentences.size());
        for (final Sentence sentence : sentences) {
            if (sentence.tokens().isEmpty()) {
                result.add(sentence);
                continue;
            }

            final List<Token> tokens = new ArrayList<>(sentence.tokens().size());
            for (final Token token : sentence.tokens()) {
                if (token.hasExpanded()) {
                    tokens.add(token.withExpanded(recognize(current, token.expanded())));
                } else {
                    tokens.add(token);
                }
            }
            result.add(sentence.withTokens(recognize(current, tokens)));
        }
        return result;
    }

    /**
     * Adds or replaces an expression and rebuilds the trie.
     *
     * @param surfaceForm the expression as written in text
     * @param lemma       lemma, defaults to the surface form
     * @param pos         part-of-speech tag, defaults to {@value ExpressionEntry#DEFAULT_POS}
     * @param type        expression type, defaults to {@link MweType#FIXED}
     */
    public void add(final String surfaceForm,
                    final @Nullable String lemma,
                    final @Nullable String pos,
                    final @Nullable MweType type) {
        add(ExpressionEntry.of(surfaceForm, lemma, pos, type));
    }

    public synchronized void add(final ExpressionEntry entry) {
        final Map<String, ExpressionEntry> dictionary = new LinkedHashMap<>(snapshot.get().dictionary());
        dictionary.put(entry.surfaceForm(), entry);
        snapshot.set(createSnapshot(dictionary));
        logger.debug("Added MWE '{}' for {}, {} expressions", entry.surfaceForm(), language, dictionary.size());
    }

    /**
     * Removes an expression and rebuilds the trie.
     *
     * @return {@code true} if the surface form was present
     */
    public synchronized boolean remove(final String surfaceForm) {
        final Snapshot current = snapshot.get();
        if (!current.dictionary().containsKey(surfaceForm)) {
            return false;
        }
        final Map<String, ExpressionEntry> dictionary = new LinkedHashMap<>(current.dictionary());
        dictionary.remove(surfaceForm);
        snapshot.set(createSnapshot(dictionary));
        logger.debug("Removed MWE '{}' for {}, {} expressions", surfaceForm, language, dictionary.size());
        return true;
    }

    public DictionaryStatistics statistics() {
        return DictionaryStatistics.of(snapshot.get().dictionary().values());
    }

    /**
     * Read-only view of the current dictionary, keyed by surface form.
     */
    public Map<String, ExpressionEntry> dictionary() {
        return snapshot.get().dictionary();
    }

    public MweTrie trie() {
        return snapshot.get().trie();
    }

    public String getLanguage() {
        return language;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public int getOverrideCount() {
        return normalizer.getOverrideCount();
    }

    /**
     * The normalization cache, present when the recognizer was built with a positive cache size.
     */
    public Optional<CachingLemmaNormalizer> getNormalizationCache() {
        if (normalizer instanceof CachingLemmaNormalizer caching) {
            return Optional.of(caching);
        }
        return Optional.empty();
    }

    private Snapshot createSnapshot(final Map<String, ExpressionEntry> dictionary) {
        final MweTrie trie = trieBuilder.build(dictionary.values());
        return new Snapshot(Collections.unmodifiableMap(dictionary), trie);
    }

    private SpanMatcher matcher(final Snapshot current) {
        return new SpanMatcher(current.trie(), normalizer, maxLength);
    }

    private List<Token> recognize(final Snapshot current, final List<Token> tokens) {
        if (!current.enabled() || tokens.isEmpty()) {
            return tokens;
        }
        final List<MatchSpan> spans = matcher(current).match(tokens);
        if (spans.isEmpty()) {
            return tokens;
        }
        return TokenAnnotator.annotate(tokens, spans);
    }
}
