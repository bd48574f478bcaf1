package de.mirkosertic.mwe;

import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A token as produced by the upstream pipeline, optionally annotated with an expression match.
 *
 * @param text       surface text
 * @param lemma      lemma supplied upstream, or {@code null}
 * @param attributes any further upstream fields (id, upos, ...), carried through untouched in input order
 * @param expanded   sub-tokens from multi-word-token expansion, empty if none
 * @param mwe        expression annotation, {@code null} for tokens outside any match
 */
public record Token(
        String text,
        @Nullable String lemma,
        Map<String, Object> attributes,
        List<Token> expanded,
        @Nullable MweAnnotation mwe
) {

    public Token {
        Objects.requireNonNull(text, "text");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        expanded = List.copyOf(expanded);
    }

    public static Token of(final String text) {
        return new Token(text, null, Map.of(), List.of(), null);
    }

    public static Token of(final String text, final @Nullable String lemma) {
        return new Token(text, lemma, Map.of(), List.of(), null);
    }

    public static List<Token> listOf(final String... texts) {
        return Arrays.stream(texts).map(Token::of).toList();
    }

    public Token withMwe(final MweAnnotation annotation) {
        return new Token(text, lemma, attributes, expanded, annotation);
    }

    public Token withExpanded(final List<Token> subTokens) {
        return new Token(text, lemma, attributes, subTokens, mwe);
    }

    public boolean hasLemma() {
        return lemma != null && !lemma.isEmpty();
    }

    public boolean hasExpanded() {
        return !expanded.isEmpty();
    }
}
