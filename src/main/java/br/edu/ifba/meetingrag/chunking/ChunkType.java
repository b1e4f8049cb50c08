package br.edu.ifba.meetingrag.chunking;

import java.util.Locale;

/**
 * How a chunk was cut from its document.
 */
public enum ChunkType {
    FULL_DOCUMENT,
    TIME_WINDOW,
    SPEAKER_TURN,
    TOPIC_SEGMENT;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ChunkType fromLabel(final String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
