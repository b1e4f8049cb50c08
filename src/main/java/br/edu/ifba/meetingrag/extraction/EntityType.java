package br.edu.ifba.meetingrag.extraction;

import java.util.Locale;

/**
 * Kinds of structured facts pulled out of meeting text.
 */
public enum EntityType {
    PERSON,
    DECISION,
    ACTION_ITEM,
    RISK,
    DATE,
    TOPIC;

    /**
     * Lower-case label used in persisted rows and log output, e.g. {@code action_item}.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EntityType fromLabel(final String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
