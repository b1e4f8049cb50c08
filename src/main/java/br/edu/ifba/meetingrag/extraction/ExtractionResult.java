package br.edu.ifba.meetingrag.extraction;

import java.util.List;

/**
 * Outcome of analyzing one text.
 *
 * @param entities entities ordered by offset
 * @param topics top keywords, most frequent first
 * @param truncated whether the input exceeded the size ceiling and only its head was analyzed
 */
public record ExtractionResult(List<ExtractedEntity> entities, List<String> topics, boolean truncated) {

    public ExtractionResult {
        entities = List.copyOf(entities);
        topics = List.copyOf(topics);
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), List.of(), false);
    }
}
