package de.mirkosertic.mwe.dictionary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads expression and override dictionaries from JSON files.
 *
 * <p>Every failure (missing file, unreadable file, malformed JSON, wrong top level shape) is
 * logged as a warning and results in an empty mapping. Individual entries of the wrong shape
 * are skipped with a warning; the rest of the document is still used.</p>
 */
public final class JsonDictionaryReader {

    private static final Logger logger = LoggerFactory.getLogger(JsonDictionaryReader.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private JsonDictionaryReader() {
    }

    public static Map<String, ExpressionEntry> readExpressions(final Path path) {
        final Map<String, ExpressionEntry> result = new LinkedHashMap<>();
        final JsonNode root = readObject(path, "MWE database");
        if (root == null) {
            return result;
        }

        final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            final String surfaceForm = field.getKey();
            final JsonNode info = field.getValue();
            if (!info.isObject() || surfaceForm.isBlank()) {
                logger.warn("Skipping malformed MWE entry '{}' in {}", surfaceForm, path);
                continue;
            }
            result.put(surfaceForm, ExpressionEntry.of(
                    surfaceForm,
                    textOrNull(info, "lemma"),
                    textOrNull(info, "pos"),
                    MweType.parse(textOrNull(info, "type"))));
        }
        logger.debug("Read {} MWE entries from {}", result.size(), path);
        return result;
    }

    public static Map<String, String> readLemmas(final Path path) {
        final Map<String, String> result = new LinkedHashMap<>();
        final JsonNode root = readObject(path, "lemma dictionary");
        if (root == null) {
            return result;
        }

        final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                logger.warn("Skipping non-string lemma for '{}' in {}", field.getKey(), path);
                continue;
            }
            result.put(field.getKey(), field.getValue().asText());
        }
        logger.debug("Read {} lemma mappings from {}", result.size(), path);
        return result;
    }

    private static @Nullable JsonNode readObject(final Path path, final String description) {
        try (final Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            final JsonNode root = OBJECT_MAPPER.readTree(reader);
            if (root == null || !root.isObject()) {
                logger.warn("Ignoring {} {}: top level JSON value is not an object", description, path);
                return null;
            }
            return root;
        } catch (final NoSuchFileException e) {
            logger.warn("{} file not found: {}", description, path);
        } catch (final JsonProcessingException e) {
            logger.warn("Invalid JSON in {} {}: {}", description, path, e.getOriginalMessage());
        } catch (final IOException e) {
            logger.warn("Failed to read {} {}", description, path, e);
        }
        return null;
    }

    private static @Nullable String textOrNull(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
