package br.edu.ifba.meetingrag.ingestion;

import java.util.Locale;

/**
 * Webhook event kinds sent by the transcript source.
 */
public enum WebhookEventType {
    /** A new transcript is ready: import it and index it with high priority. */
    COMPLETED,
    /** An existing transcript changed: re-import it and re-index it. */
    UPDATED,
    MEETING_STARTED,
    MEETING_ENDED,
    UNKNOWN;

    public static WebhookEventType fromName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "transcription.completed":
            case "meeting.transcribed":
            case "completed":
                return COMPLETED;
            case "transcript.updated":
            case "updated":
                return UPDATED;
            case "meeting.started":
                return MEETING_STARTED;
            case "meeting.ended":
                return MEETING_ENDED;
            default:
                return UNKNOWN;
        }
    }

    /**
     * Whether the event carries a transcript to import.
     */
    public boolean importsTranscript() {
        return this == COMPLETED || this == UPDATED;
    }
}
