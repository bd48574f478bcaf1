package de.mirkosertic.mwe;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A sentence of a document: its tokens plus any other upstream fields.
 */
public record Sentence(List<Token> tokens, Map<String, Object> attributes) {

    public Sentence {
        tokens = List.copyOf(tokens);
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Sentence of(final List<Token> tokens) {
        return new Sentence(tokens, Map.of());
    }

    public Sentence withTokens(final List<Token> newTokens) {
        return new Sentence(newTokens, attributes);
    }
}
