package br.edu.ifba.meetingrag.ingestion;

import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Parsed webhook payload.
 *
 * @param eventName event name as sent, {@code unknown} when absent
 * @param transcriptId transcript the event refers to, if any
 */
public record WebhookEvent(String eventName, WebhookEventType type, @Nullable String transcriptId) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Reads {@code event} (or {@code type}) and {@code transcriptId} (or {@code meeting_id},
     * {@code meetingId}) from a JSON body.
     *
     * @throws IllegalArgumentException if the body is not a JSON object
     */
    public static WebhookEvent parse(String body) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Webhook payload must be a JSON object");
        }
        String eventName = firstText(root, "event", "type", "eventType");
        String transcriptId = firstText(root, "transcriptId", "meeting_id", "meetingId");
        return new WebhookEvent(eventName == null ? "unknown" : eventName, WebhookEventType.fromName(eventName),
            transcriptId);
    }

    @Nullable
    private static String firstText(JsonNode root, String... fields) {
        for (String field : fields) {
            JsonNode node = root.get(field);
            if (node != null && node.isValueNode() && !node.asText().isBlank()) {
                return node.asText().trim();
            }
        }
        return null;
    }
}
