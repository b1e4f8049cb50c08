package br.edu.ifba.meetingrag.storage.impl;

import java.time.Duration;

/**
 * Exception thrown when SQLite database is locked and cannot be accessed.
 *
 * <p>SQLite uses file-level locking, so only one writer can hold the database at a time.
 * This exception is thrown when a statement could not acquire the lock within the busy
 * timeout. It is a transient failure: the ingestion pipeline requeues the task and tries
 * again later.</p>
 *
 * <p>Common causes:</p>
 * <ul>
 *   <li>A long chunk-set replacement holding the write lock</li>
 *   <li>An external process (backup, sqlite3 shell) holding the database file</li>
 * </ul>
 *
 * <p>Increase {@code meetingrag.storage.sqlite.busy-timeout} when this happens routinely.</p>
 */
public final class SQLiteDatabaseLockedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Duration waitTime;
    private final String operation;

    /**
     * @param operation the operation that could not acquire the lock
     * @param waitTime the configured busy timeout
     * @param cause the underlying exception
     */
    public SQLiteDatabaseLockedException(String operation, Duration waitTime, Throwable cause) {
        super(String.format("SQLite database is locked: '%s' could not acquire the lock within %d ms",
            operation, waitTime.toMillis()), cause);
        this.operation = operation;
        this.waitTime = waitTime;
    }

    public Duration getWaitTime() {
        return waitTime;
    }

    public String getOperation() {
        return operation;
    }
}
