package br.edu.ifba.meetingrag.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.nio.file.Path;
import java.sql.Connection;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.meetingrag.storage.WebhookEventRecord;
import br.edu.ifba.meetingrag.storage.WebhookEventStatus;

class SQLiteWebhookEventLogTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private SQLiteWebhookEventLog log;

    @BeforeEach
    void setUp() throws Exception {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("webhooks.db").toString());
        Connection conn = connectionManager.getWriteConnection();
        try {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
        log = new SQLiteWebhookEventLog(connectionManager);
    }

    @AfterEach
    void tearDown() {
        connectionManager.close();
    }

    @Test
    void recordedEventIsListedWithItsStatus() {
        String id = log.record("Transcription completed", "t-1", "{\"meetingId\":\"t-1\"}",
            WebhookEventStatus.RECEIVED, null, T0);

        log.updateStatus(id, WebhookEventStatus.PROCESSED, "queued", T0.plusSeconds(2));

        WebhookEventRecord event = log.recent(10).get(0);
        assertEquals(id, event.id());
        assertEquals("t-1", event.transcriptId());
        assertEquals(WebhookEventStatus.PROCESSED, event.status());
        assertEquals("queued", event.detail());
        assertEquals(T0, event.receivedAt());
        assertEquals(T0.plusSeconds(2), event.updatedAt());
    }

    @Test
    void recentIsNewestFirstAndLimited() {
        log.record("a", null, "{}", WebhookEventStatus.REJECTED, "bad signature", T0);
        log.record("b", null, "{}", WebhookEventStatus.IGNORED, null, T0.plusSeconds(1));
        log.record("c", null, "{}", WebhookEventStatus.RECEIVED, null, T0.plusSeconds(2));

        List<WebhookEventRecord> recent = log.recent(2);

        assertEquals(List.of("c", "b"), recent.stream().map(WebhookEventRecord::eventType).toList());
        assertNull(recent.get(0).transcriptId());
    }

    @Test
    void purgeDeletesEventsReceivedBeforeCutoff() {
        log.record("old", null, "{}", WebhookEventStatus.PROCESSED, null, T0);
        log.record("new", null, "{}", WebhookEventStatus.PROCESSED, null, T0.plusSeconds(3600));

        assertEquals(1, log.purgeOlderThan(T0.plusSeconds(60)));
        assertEquals(List.of("new"), log.recent(10).stream().map(WebhookEventRecord::eventType).toList());
    }
}
