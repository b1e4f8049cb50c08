package br.edu.ifba.meetingrag.chunking;

import java.util.Locale;

public enum RelationshipType {
    SEQUENTIAL,
    SPEAKER_CONTINUITY,
    TOPIC_SIMILARITY,
    PARENT_CHILD;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RelationshipType fromLabel(final String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
