package br.edu.ifba.meetingrag.storage.impl;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.jboss.logging.Logger;

import br.edu.ifba.meetingrag.shared.UuidUtils;
import br.edu.ifba.meetingrag.storage.WebhookEventLog;
import br.edu.ifba.meetingrag.storage.WebhookEventRecord;
import br.edu.ifba.meetingrag.storage.WebhookEventStatus;

public final class SQLiteWebhookEventLog implements WebhookEventLog {

    private static final Logger LOG = Logger.getLogger(SQLiteWebhookEventLog.class);

    private final SQLiteConnectionManager connectionManager;

    public SQLiteWebhookEventLog(SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public String record(String eventType, String transcriptId, String payload, WebhookEventStatus status,
            String detail, Instant at) {
        String id = UuidUtils.randomV7().toString();
        connectionManager.inWriteTransaction("record webhook event " + eventType, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("""
                    INSERT INTO webhook_events (id, event_type, transcript_id, payload, status, detail, received_at,
                        updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                    """)) {
                stmt.setString(1, id);
                stmt.setString(2, eventType);
                stmt.setString(3, transcriptId);
                stmt.setString(4, payload);
                stmt.setString(5, status.name());
                stmt.setString(6, detail);
                stmt.setLong(7, at.toEpochMilli());
                stmt.setLong(8, at.toEpochMilli());
                return stmt.executeUpdate();
            }
        });
        return id;
    }

    @Override
    public void updateStatus(String id, WebhookEventStatus status, String detail, Instant at) {
        int updated = connectionManager.inWriteTransaction("update webhook event " + id, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "UPDATE webhook_events SET status = ?, detail = ?, updated_at = ? WHERE id = ?")) {
                stmt.setString(1, status.name());
                stmt.setString(2, detail);
                stmt.setLong(3, at.toEpochMilli());
                stmt.setString(4, id);
                return stmt.executeUpdate();
            }
        });
        if (updated == 0) {
            LOG.warnf("Webhook event %s not found, status %s not recorded", id, status);
        }
    }

    @Override
    public List<WebhookEventRecord> recent(int limit) {
        return connectionManager.read("list webhook events", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("""
                    SELECT id, event_type, transcript_id, payload, status, detail, received_at, updated_at
                      FROM webhook_events
                     ORDER BY received_at DESC, id DESC
                     LIMIT ?
                    """)) {
                stmt.setInt(1, limit);
                try (ResultSet rs = stmt.executeQuery()) {
                    List<WebhookEventRecord> events = new ArrayList<>();
                    while (rs.next()) {
                        events.add(toRecord(rs));
                    }
                    return events;
                }
            }
        });
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        int deleted = connectionManager.inWriteTransaction("purge webhook events", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM webhook_events WHERE received_at < ?")) {
                stmt.setLong(1, cutoff.toEpochMilli());
                return stmt.executeUpdate();
            }
        });
        if (deleted > 0) {
            LOG.infof("Purged %d webhook events received before %s", Integer.valueOf(deleted), cutoff);
        }
        return deleted;
    }

    private static WebhookEventRecord toRecord(ResultSet rs) throws SQLException {
        return new WebhookEventRecord(
            rs.getString("id"),
            rs.getString("event_type"),
            rs.getString("transcript_id"),
            rs.getString("payload"),
            WebhookEventStatus.valueOf(rs.getString("status")),
            rs.getString("detail"),
            SqlColumns.getInstant(rs, "received_at"),
            SqlColumns.getInstant(rs, "updated_at"));
    }
}
