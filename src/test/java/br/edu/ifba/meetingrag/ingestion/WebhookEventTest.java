package br.edu.ifba.meetingrag.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class WebhookEventTest {

    @Nested
    @DisplayName("Payload parsing")
    class Parsing {

        @Test
        void readsEventAndMeetingId() {
            WebhookEvent event = WebhookEvent.parse("{\"event\":\"transcription.completed\",\"meetingId\":\"abc\"}");

            assertEquals("transcription.completed", event.eventName());
            assertEquals(WebhookEventType.COMPLETED, event.type());
            assertEquals("abc", event.transcriptId());
        }

        @Test
        void acceptsAlternativeFieldNames() {
            WebhookEvent event = WebhookEvent.parse("{\"eventType\":\"transcript.updated\",\"meeting_id\":\" xyz \"}");

            assertEquals(WebhookEventType.UPDATED, event.type());
            assertEquals("xyz", event.transcriptId());
        }

        @Test
        void prefersTranscriptIdOverMeetingId() {
            WebhookEvent event = WebhookEvent.parse(
                "{\"type\":\"completed\",\"transcriptId\":\"t-1\",\"meetingId\":\"m-1\"}");

            assertEquals("t-1", event.transcriptId());
        }

        @Test
        void missingFieldsYieldUnknownEvent() {
            WebhookEvent event = WebhookEvent.parse("{\"data\":{}}");

            assertEquals("unknown", event.eventName());
            assertEquals(WebhookEventType.UNKNOWN, event.type());
            assertNull(event.transcriptId());
        }

        @Test
        void rejectsInvalidJson() {
            assertThrows(IllegalArgumentException.class, () -> WebhookEvent.parse("{event:"));
        }

        @Test
        void rejectsNonObjectJson() {
            assertThrows(IllegalArgumentException.class, () -> WebhookEvent.parse("[1,2,3]"));
        }
    }

    @ParameterizedTest
    @CsvSource({
        "transcription.completed, COMPLETED",
        "Meeting.Transcribed, COMPLETED",
        "completed, COMPLETED",
        "transcript.updated, UPDATED",
        "meeting.started, MEETING_STARTED",
        "meeting.ended, MEETING_ENDED",
        "something.else, UNKNOWN"
    })
    void mapsEventNames(String name, WebhookEventType expected) {
        assertEquals(expected, WebhookEventType.fromName(name));
    }

    @Test
    void onlyTranscriptEventsImport() {
        assertTrue(WebhookEventType.COMPLETED.importsTranscript());
        assertTrue(WebhookEventType.UPDATED.importsTranscript());
        assertFalse(WebhookEventType.MEETING_ENDED.importsTranscript());
        assertFalse(WebhookEventType.UNKNOWN.importsTranscript());
        assertEquals(WebhookEventType.UNKNOWN, WebhookEventType.fromName(null));
    }
}
