package de.mirkosertic.mwe.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Serializes response DTOs to single-line JSON.
 */
public final class JsonOutput {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private JsonOutput() {
    }

    public static ObjectMapper objectMapper() {
        return OBJECT_MAPPER;
    }

    public static String toJson(final Object obj) {
        try {
            return OBJECT_MAPPER.writeValueAsString(obj);
        } catch (final JsonProcessingException e) {
            return "{\"success\":false,\"error\":\"JSON serialization error: " + escapeJson(e.getOriginalMessage()) + "\"}";
        }
    }

    /**
     * An error object {@code {"success":false,"error":"..."}}.
     */
    public static String error(final String message) {
        return "{\"success\":false,\"error\":\"" + escapeJson(message) + "\"}";
    }

    private static String escapeJson(final String str) {
        if (str == null) {
            return "";
        }
        return str.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
