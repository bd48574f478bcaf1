package de.mirkosertic.mwe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts tokens from and to the JSON shape exchanged with the surrounding pipeline.
 *
 * <p>Input tokens are objects with a {@code text} field, an optional {@code lemma}, an optional
 * {@code expanded} array of sub-tokens and arbitrary further fields, which are kept as
 * attributes. A bare JSON string is accepted as a token with that text. Match fields on input
 * tokens ({@code mwe_*}, for example from feeding annotated output back in) are dropped, so that
 * the output only carries the annotation of the current run.</p>
 *
 * <p>Output tokens repeat all input fields and, inside a match, add {@code mwe_span},
 * {@code mwe_lemma}, {@code mwe_pos}, {@code mwe_type}, {@code mwe_head} and
 * {@code mwe_position}.</p>
 */
public final class TokenJsonCodec {

    public static final String TEXT = "text";
    public static final String LEMMA = "lemma";
    public static final String EXPANDED = "expanded";
    public static final String MWE_SPAN = "mwe_span";
    public static final String MWE_LEMMA = "mwe_lemma";
    public static final String MWE_POS = "mwe_pos";
    public static final String MWE_TYPE = "mwe_type";
    public static final String MWE_HEAD = "mwe_head";
    public static final String MWE_POSITION = "mwe_position";

    private static final Set<String> MATCH_FIELDS =
            Set.of(MWE_SPAN, MWE_LEMMA, MWE_POS, MWE_TYPE, MWE_HEAD, MWE_POSITION);

    private final ObjectMapper objectMapper;

    public TokenJsonCodec() {
        this(new ObjectMapper());
    }

    public TokenJsonCodec(final ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a JSON array of tokens.
     *
     * @throws JsonProcessingException if the text is not JSON or not an array of tokens
     */
    public List<Token> readTokens(final String json) throws JsonProcessingException {
        final JsonNode root = objectMapper.readTree(json);
        if (root == null || !root.isArray()) {
            throw new InvalidTokenException("Expected a JSON array of tokens");
        }
        return readTokens(root);
    }

    public List<Token> readTokens(final JsonNode array) throws JsonProcessingException {
        final List<Token> tokens = new ArrayList<>(array.size());
        for (final JsonNode node : array) {
            tokens.add(readToken(node));
        }
        return tokens;
    }

    public Token readToken(final JsonNode node) throws JsonProcessingException {
        if (node.isTextual()) {
            return Token.of(node.asText());
        }
        final JsonNode text = node.get(TEXT);
        if (!node.isObject() || text == null || !text.isTextual()) {
            throw new InvalidTokenException("Token without text field: " + node);
        }

        final JsonNode lemma = node.get(LEMMA);
        final JsonNode expanded = node.get(EXPANDED);
        final List<Token> subTokens = expanded != null && expanded.isArray() ? readTokens(expanded) : List.of();

        final Map<String, Object> attributes = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            final String name = field.getKey();
            if (TEXT.equals(name) || LEMMA.equals(name) || EXPANDED.equals(name)
                    || MATCH_FIELDS.contains(name) || field.getValue().isNull()) {
                continue;
            }
            attributes.put(name, objectMapper.treeToValue(field.getValue(), Object.class));
        }

        return new Token(
                text.asText(),
                lemma != null && lemma.isTextual() ? lemma.asText() : null,
                attributes,
                subTokens,
                null);
    }

    public Map<String, Object> toJsonMap(final Token token) {
        final Map<String, Object> json = new LinkedHashMap<>();
        json.put(TEXT, token.text());
        if (token.lemma() != null) {
            json.put(LEMMA, token.lemma());
        }
        json.putAll(token.attributes());
        if (token.hasExpanded()) {
            json.put(EXPANDED, toJsonMaps(token.expanded()));
        }

        final MweAnnotation mwe = token.mwe();
        if (mwe != null) {
            json.put(MWE_SPAN, List.of(mwe.spanStart(), mwe.spanEnd()));
            json.put(MWE_LEMMA, mwe.lemma());
            json.put(MWE_POS, mwe.pos());
            json.put(MWE_TYPE, mwe.type().externalName());
            json.put(MWE_HEAD, mwe.head());
            json.put(MWE_POSITION, mwe.position());
        }
        return json;
    }

    public List<Map<String, Object>> toJsonMaps(final List<Token> tokens) {
        final List<Map<String, Object>> result = new ArrayList<>(tokens.size());
        for (final Token token : tokens) {
            result.add(toJsonMap(token));
        }
        return result;
    }

    /**
     * Well-formed JSON that does not describe tokens.
     */
    public static final class InvalidTokenException extends JsonProcessingException {

        public InvalidTokenException(final String message) {
            super(message);
        }
    }
}
