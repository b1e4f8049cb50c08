package br.edu.ifba.meetingrag.storage.impl;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.jboss.logging.Logger;

import br.edu.ifba.meetingrag.queue.ProcessingTask;
import br.edu.ifba.meetingrag.queue.TaskQueue;
import br.edu.ifba.meetingrag.queue.TaskStatus;
import br.edu.ifba.meetingrag.queue.TaskType;
import br.edu.ifba.meetingrag.shared.UuidUtils;

/**
 * {@link TaskQueue} over the {@code processing_tasks} table.
 *
 * <p>Every transition runs inside a write transaction on the single write connection, so
 * claim and lease checks are atomic. Lease ownership is verified with
 * {@code WHERE status = 'PROCESSING' AND lease_owner = ?}.</p>
 */
public final class SQLiteTaskQueue implements TaskQueue {

    private static final Logger LOG = Logger.getLogger(SQLiteTaskQueue.class);

    private static final String COLUMNS = """
        id, type, payload, priority, status, attempts, last_error, scheduled_at, lease_owner, lease_expires_at,
        created_at, updated_at, completed_at
        """;

    private static final int MAX_ERROR_LENGTH = 2000;

    private final SQLiteConnectionManager connectionManager;
    private final Clock clock;
    private final int maxAttempts;

    public SQLiteTaskQueue(SQLiteConnectionManager connectionManager, Clock clock, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.connectionManager = connectionManager;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }

    @Override
    public ProcessingTask enqueue(TaskType type, String payload, int priority) {
        Instant now = clock.instant();
        return connectionManager.inWriteTransaction("enqueue " + type + " task for " + payload, conn -> {
            Optional<ProcessingTask> active = findActive(conn, type, payload);
            if (active.isPresent()) {
                ProcessingTask existing = active.get();
                if (priority > existing.priority()) {
                    try (PreparedStatement stmt = conn.prepareStatement(
                            "UPDATE processing_tasks SET priority = ?, updated_at = ? WHERE id = ?")) {
                        stmt.setInt(1, priority);
                        stmt.setLong(2, now.toEpochMilli());
                        stmt.setString(3, existing.id());
                        stmt.executeUpdate();
                    }
                    LOG.debugf("Raised priority of task %s to %d", existing.id(), Integer.valueOf(priority));
                    return load(conn, existing.id());
                }
                LOG.debugf("Task for %s %s already %s, not enqueued again", type, payload, existing.status());
                return existing;
            }

            String id = UuidUtils.randomV7().toString();
            try (PreparedStatement stmt = conn.prepareStatement("""
                    INSERT INTO processing_tasks (id, type, payload, priority, status, attempts, scheduled_at,
                        created_at, updated_at)
                    VALUES (?, ?, ?, ?, 'PENDING', 0, ?, ?, ?)
                    """)) {
                stmt.setString(1, id);
                stmt.setString(2, type.name());
                stmt.setString(3, payload);
                stmt.setInt(4, priority);
                stmt.setLong(5, now.toEpochMilli());
                stmt.setLong(6, now.toEpochMilli());
                stmt.setLong(7, now.toEpochMilli());
                stmt.executeUpdate();
            }
            LOG.debugf("Enqueued %s task %s for %s with priority %d", type, id, payload, Integer.valueOf(priority));
            return load(conn, id);
        });
    }

    @Override
    public List<ProcessingTask> claim(String workerId, int limit, Duration lease) {
        if (limit <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        Instant leaseExpiresAt = now.plus(lease);

        return connectionManager.inWriteTransaction("claim tasks for " + workerId, conn -> {
            List<String> ids = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement("""
                    SELECT id FROM processing_tasks
                     WHERE status = 'PENDING' AND scheduled_at <= ?
                     ORDER BY priority DESC, scheduled_at, created_at
                     LIMIT ?
                    """)) {
                stmt.setLong(1, now.toEpochMilli());
                stmt.setInt(2, limit);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        ids.add(rs.getString(1));
                    }
                }
            }

            List<ProcessingTask> claimed = new ArrayList<>(ids.size());
            try (PreparedStatement stmt = conn.prepareStatement("""
                    UPDATE processing_tasks
                       SET status = 'PROCESSING', lease_owner = ?, lease_expires_at = ?, updated_at = ?
                     WHERE id = ? AND status = 'PENDING'
                    """)) {
                for (String id : ids) {
                    stmt.setString(1, workerId);
                    stmt.setLong(2, leaseExpiresAt.toEpochMilli());
                    stmt.setLong(3, now.toEpochMilli());
                    stmt.setString(4, id);
                    stmt.executeUpdate();
                    claimed.add(load(conn, id));
                }
            }
            if (!claimed.isEmpty()) {
                LOG.debugf("Worker %s claimed %d tasks", workerId, Integer.valueOf(claimed.size()));
            }
            return claimed;
        });
    }

    @Override
    public List<ProcessingTask> reclaimExpired() {
        Instant now = clock.instant();
        return connectionManager.inWriteTransaction("reclaim expired leases", conn -> reclaimExpiredLeases(conn, now));
    }

    private List<ProcessingTask> reclaimExpiredLeases(Connection conn, Instant now) throws SQLException {
        List<ProcessingTask> expired = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement("SELECT " + COLUMNS
                + " FROM processing_tasks WHERE status = 'PROCESSING' AND lease_expires_at <= ?")) {
            stmt.setLong(1, now.toEpochMilli());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    expired.add(toTask(rs));
                }
            }
        }

        List<ProcessingTask> failed = new ArrayList<>();
        for (ProcessingTask task : expired) {
            int attempts = task.attempts() + 1;
            String error = "Lease of worker " + task.leaseOwner() + " expired";
            if (attempts >= maxAttempts) {
                LOG.warnf("Task %s (%s %s) failed permanently: lease expired on attempt %d",
                    task.id(), task.type(), task.payload(), Integer.valueOf(attempts));
                finish(conn, task.id(), TaskStatus.FAILED, attempts, error, now);
                failed.add(load(conn, task.id()));
            } else {
                LOG.warnf("Task %s (%s %s) lease expired, returning it to the queue (attempt %d of %d)",
                    task.id(), task.type(), task.payload(), Integer.valueOf(attempts), Integer.valueOf(maxAttempts));
                reschedule(conn, task.id(), attempts, error, now, now);
            }
        }
        return failed;
    }

    @Override
    public ProcessingTask complete(ProcessingTask task) {
        Instant now = clock.instant();
        return connectionManager.inWriteTransaction("complete task " + task.id(), conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("""
                    UPDATE processing_tasks
                       SET status = 'COMPLETED', completed_at = ?, updated_at = ?, lease_owner = NULL,
                           lease_expires_at = NULL
                     WHERE id = ? AND status = 'PROCESSING' AND lease_owner = ?
                    """)) {
                stmt.setLong(1, now.toEpochMilli());
                stmt.setLong(2, now.toEpochMilli());
                stmt.setString(3, task.id());
                stmt.setString(4, task.leaseOwner());
                requireLeased(stmt.executeUpdate(), task);
            }
            return load(conn, task.id());
        });
    }

    @Override
    public ProcessingTask requeue(ProcessingTask task, String error, Instant nextAttemptAt) {
        Instant now = clock.instant();
        return connectionManager.inWriteTransaction("requeue task " + task.id(), conn -> {
            int attempts = currentAttempts(conn, task) + 1;
            if (attempts >= maxAttempts) {
                LOG.warnf("Task %s reached %d attempts, failing it instead of requeueing",
                    task.id(), Integer.valueOf(attempts));
                finish(conn, task.id(), TaskStatus.FAILED, attempts, error, now);
            } else {
                reschedule(conn, task.id(), attempts, error, nextAttemptAt, now);
            }
            return load(conn, task.id());
        });
    }

    @Override
    public ProcessingTask fail(ProcessingTask task, String error) {
        Instant now = clock.instant();
        return connectionManager.inWriteTransaction("fail task " + task.id(), conn -> {
            int attempts = currentAttempts(conn, task) + 1;
            finish(conn, task.id(), TaskStatus.FAILED, Math.min(attempts, maxAttempts), error, now);
            return load(conn, task.id());
        });
    }

    private int currentAttempts(Connection conn, ProcessingTask task) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT attempts FROM processing_tasks WHERE id = ? AND status = 'PROCESSING' AND lease_owner = ?")) {
            stmt.setString(1, task.id());
            stmt.setString(2, task.leaseOwner());
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw notLeased(task);
                }
                return rs.getInt(1);
            }
        }
    }

    private static void reschedule(Connection conn, String id, int attempts, String error, Instant scheduledAt,
            Instant now) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("""
                UPDATE processing_tasks
                   SET status = 'PENDING', attempts = ?, last_error = ?, scheduled_at = ?, updated_at = ?,
                       lease_owner = NULL, lease_expires_at = NULL
                 WHERE id = ?
                """)) {
            stmt.setInt(1, attempts);
            stmt.setString(2, truncate(error));
            stmt.setLong(3, scheduledAt.toEpochMilli());
            stmt.setLong(4, now.toEpochMilli());
            stmt.setString(5, id);
            stmt.executeUpdate();
        }
    }

    private static void finish(Connection conn, String id, TaskStatus status, int attempts, String error, Instant now)
            throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("""
                UPDATE processing_tasks
                   SET status = ?, attempts = ?, last_error = ?, completed_at = ?, updated_at = ?,
                       lease_owner = NULL, lease_expires_at = NULL
                 WHERE id = ?
                """)) {
            stmt.setString(1, status.name());
            stmt.setInt(2, attempts);
            stmt.setString(3, truncate(error));
            stmt.setLong(4, now.toEpochMilli());
            stmt.setLong(5, now.toEpochMilli());
            stmt.setString(6, id);
            stmt.executeUpdate();
        }
    }

    @Override
    public ProcessingTask reset(String taskId) {
        Instant now = clock.instant();
        return connectionManager.inWriteTransaction("reset task " + taskId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("""
                    UPDATE processing_tasks
                       SET status = 'PENDING', attempts = 0, scheduled_at = ?, updated_at = ?, completed_at = NULL
                     WHERE id = ? AND status = 'FAILED'
                    """)) {
                stmt.setLong(1, now.toEpochMilli());
                stmt.setLong(2, now.toEpochMilli());
                stmt.setString(3, taskId);
                if (stmt.executeUpdate() == 0) {
                    throw new IllegalStateException("Task " + taskId + " is not failed and cannot be reset");
                }
            }
            LOG.infof("Task %s reset to pending by operator", taskId);
            return load(conn, taskId);
        });
    }

    @Override
    public Optional<ProcessingTask> findById(String taskId) {
        return connectionManager.read("find task " + taskId, conn -> find(conn, taskId));
    }

    @Override
    public Map<TaskStatus, Long> countByStatus() {
        return connectionManager.read("count tasks by status", conn -> {
            Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
            for (TaskStatus status : TaskStatus.values()) {
                counts.put(status, 0L);
            }
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT status, COUNT(*) FROM processing_tasks GROUP BY status");
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    counts.put(TaskStatus.valueOf(rs.getString(1)), rs.getLong(2));
                }
            }
            return counts;
        });
    }

    @Override
    public int purge(Instant olderThan) {
        int deleted = connectionManager.inWriteTransaction("purge tasks", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "DELETE FROM processing_tasks WHERE status IN ('COMPLETED', 'FAILED') AND updated_at < ?")) {
                stmt.setLong(1, olderThan.toEpochMilli());
                return stmt.executeUpdate();
            }
        });
        if (deleted > 0) {
            LOG.infof("Purged %d finished tasks older than %s", Integer.valueOf(deleted), olderThan);
        }
        return deleted;
    }

    private static Optional<ProcessingTask> findActive(Connection conn, TaskType type, String payload)
            throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT " + COLUMNS
                + " FROM processing_tasks WHERE type = ? AND payload = ? AND status IN ('PENDING', 'PROCESSING')")) {
            stmt.setString(1, type.name());
            stmt.setString(2, payload);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(toTask(rs)) : Optional.empty();
            }
        }
    }

    private static Optional<ProcessingTask> find(Connection conn, String id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM processing_tasks WHERE id = ?")) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(toTask(rs)) : Optional.empty();
            }
        }
    }

    private static ProcessingTask load(Connection conn, String id) throws SQLException {
        return find(conn, id).orElseThrow(() -> new IllegalStateException("Task " + id + " disappeared"));
    }

    private static void requireLeased(int updated, ProcessingTask task) {
        if (updated == 0) {
            throw notLeased(task);
        }
    }

    private static IllegalStateException notLeased(ProcessingTask task) {
        return new IllegalStateException(
            "Task " + task.id() + " is no longer leased by " + task.leaseOwner());
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }

    private static ProcessingTask toTask(ResultSet rs) throws SQLException {
        return new ProcessingTask(
            rs.getString("id"),
            TaskType.valueOf(rs.getString("type")),
            rs.getString("payload"),
            rs.getInt("priority"),
            TaskStatus.valueOf(rs.getString("status")),
            rs.getInt("attempts"),
            rs.getString("last_error"),
            SqlColumns.getInstant(rs, "scheduled_at"),
            rs.getString("lease_owner"),
            SqlColumns.getInstant(rs, "lease_expires_at"),
            SqlColumns.getInstant(rs, "created_at"),
            SqlColumns.getInstant(rs, "updated_at"),
            SqlColumns.getInstant(rs, "completed_at"));
    }
}
