package br.edu.ifba.meetingrag.extraction;

import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A structured fact found in a piece of text.
 *
 * @param type entity kind
 * @param value normalized text of the fact
 * @param confidence rule confidence in [0, 1]
 * @param sourceChunkId chunk the entity was extracted from, null until attached to a chunk
 * @param offset character offset of the value inside the analyzed text
 * @param metadata optional structured attributes, e.g. {@code assignee} and {@code due} for action items
 */
public record ExtractedEntity(
    @NotNull EntityType type,
    @NotNull String value,
    double confidence,
    @Nullable String sourceChunkId,
    int offset,
    @NotNull Map<String, String> metadata
) {

    public static final String ASSIGNEE = "assignee";
    public static final String DUE = "due";
    public static final String RULE = "rule";

    public ExtractedEntity {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative, got " + offset);
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public ExtractedEntity withSourceChunk(@NotNull final String chunkId) {
        return new ExtractedEntity(type, value, confidence, chunkId, offset, metadata);
    }
}
