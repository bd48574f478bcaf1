package de.mirkosertic.mwe.dto;

import java.util.List;
import java.util.Map;

/**
 * Output of one recognized sentence: the annotated tokens in their JSON form and the
 * expressions found.
 */
public record RecognitionResponse(
        List<Map<String, Object>> tokens,
        List<MweMention> mwes
) {
}
