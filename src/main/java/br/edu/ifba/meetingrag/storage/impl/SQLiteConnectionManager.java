package br.edu.ifba.meetingrag.storage.impl;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

/**
 * Manages SQLite connections and pragma configuration.
 * Thread-safe with connection pooling for read operations.
 *
 * <p>Features:</p>
 * <ul>
 *   <li>WAL mode enabled by default, so readers see the last committed state while a write is in progress</li>
 *   <li>Connection pool for read operations</li>
 *   <li>Exclusive write connection guarded by a ReentrantLock</li>
 *   <li>Configurable busy timeout for lock waiting</li>
 *   <li>Foreign key enforcement enabled</li>
 * </ul>
 *
 * <p>Usage:</p>
 * <pre>
 * SQLiteConnectionManager manager = new SQLiteConnectionManager("data/meetingrag.db");
 * int rows = manager.inWriteTransaction("purge tasks", conn -> { ... });
 * </pre>
 */
public final class SQLiteConnectionManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SQLiteConnectionManager.class);

    private static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(30);
    private static final boolean DEFAULT_WAL_MODE = true;
    private static final int DEFAULT_POOL_SIZE = 4;
    private static final int DEFAULT_CACHE_SIZE = -2000; // 2MB

    private final String databasePath;
    private final Duration busyTimeout;
    private final boolean walMode;
    private final BlockingQueue<Connection> readPool;
    private final ReentrantLock writeLock;

    private Connection writeConnection;
    private volatile boolean closed = false;

    /**
     * Unit of JDBC work run on a managed connection.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    /**
     * Creates a connection manager with default settings.
     *
     * @param databasePath path to SQLite database file
     */
    public SQLiteConnectionManager(String databasePath) {
        this(databasePath, DEFAULT_BUSY_TIMEOUT, DEFAULT_WAL_MODE, DEFAULT_POOL_SIZE);
    }

    /**
     * Creates a connection manager with custom settings.
     *
     * @param databasePath path to SQLite database file
     * @param busyTimeout how long to wait for locks
     * @param walMode whether to enable WAL mode
     * @param readPoolSize number of connections in read pool
     */
    public SQLiteConnectionManager(String databasePath, Duration busyTimeout, boolean walMode, int readPoolSize) {
        this.databasePath = databasePath;
        this.busyTimeout = busyTimeout;
        this.walMode = walMode;
        this.readPool = new ArrayBlockingQueue<>(readPoolSize);
        this.writeLock = new ReentrantLock();
    }

    /**
     * Creates a new connection with pragmas configured.
     *
     * @return configured Connection
     * @throws RuntimeException if connection creation fails
     */
    public Connection createConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }

        try {
            Path parentDir = Paths.get(databasePath).toAbsolutePath().getParent();
            if (parentDir != null && !Files.exists(parentDir)) {
                Files.createDirectories(parentDir);
                LOG.infof("Created database directory: %s", parentDir);
            }
        } catch (Exception e) {
            LOG.warnf("Could not create parent directory for %s: %s", databasePath, e.getMessage());
        }

        try {
            SQLiteConfig config = new SQLiteConfig();
            config.enforceForeignKeys(true);
            config.setBusyTimeout((int) busyTimeout.toMillis());
            config.setCacheSize(DEFAULT_CACHE_SIZE);

            Connection conn = DriverManager.getConnection("jdbc:sqlite:" + databasePath, config.toProperties());
            applyPragmas(conn);

            LOG.debugf("Created SQLite connection to %s", databasePath);
            return conn;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create SQLite connection to " + databasePath, e);
        }
    }

    /**
     * Gets a connection for read operations from the pool.
     * Creates a new connection if pool is empty.
     *
     * @return pooled read Connection
     */
    public Connection getReadConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }

        Connection conn = readPool.poll();
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    return conn;
                }
            } catch (SQLException e) {
                LOG.debug("Read connection was closed, creating new one", e);
            }
        }
        return createConnection();
    }

    /**
     * Returns a read connection to the pool.
     *
     * @param conn the connection to release
     */
    public void releaseReadConnection(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            if (!conn.isClosed() && !closed) {
                if (!readPool.offer(conn)) {
                    // Pool is full, close the connection
                    conn.close();
                }
            } else {
                conn.close();
            }
        } catch (SQLException e) {
            LOG.debug("Error releasing read connection", e);
        }
    }

    /**
     * Gets exclusive connection for write operations.
     * Only one write connection can be active at a time; the caller must
     * call {@link #releaseWriteConnection(Connection)} to release the lock.
     *
     * @return write Connection with lock held
     */
    public Connection getWriteConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }

        writeLock.lock();
        try {
            if (writeConnection == null || writeConnection.isClosed()) {
                writeConnection = createConnection();
            }
            return writeConnection;
        } catch (SQLException | RuntimeException e) {
            writeLock.unlock();
            throw new RuntimeException("Failed to get write connection", e);
        }
    }

    /**
     * Releases the write connection lock.
     *
     * @param conn the write connection (must match current write connection)
     */
    public void releaseWriteConnection(Connection conn) {
        if (conn == writeConnection && writeLock.isHeldByCurrentThread()) {
            writeLock.unlock();
        }
    }

    /**
     * Runs {@code work} on a pooled read connection.
     *
     * @param operation description used in error messages
     */
    public <T> T read(String operation, SqlWork<T> work) {
        Connection conn = getReadConnection();
        try {
            return work.execute(conn);
        } catch (SQLException e) {
            throw translate(operation, e);
        } finally {
            releaseReadConnection(conn);
        }
    }

    /**
     * Runs {@code work} in a transaction on the write connection. The transaction is
     * committed when {@code work} returns and rolled back when it throws.
     *
     * @param operation description used in error messages
     */
    public <T> T inWriteTransaction(String operation, SqlWork<T> work) {
        Connection conn = getWriteConnection();
        try {
            conn.setAutoCommit(false);
            T result = work.execute(conn);
            conn.commit();
            return result;
        } catch (SQLException e) {
            rollbackQuietly(conn, operation);
            throw translate(operation, e);
        } catch (RuntimeException e) {
            rollbackQuietly(conn, operation);
            throw e;
        } finally {
            try {
                conn.setAutoCommit(true);
            } catch (SQLException e) {
                LOG.debug("Error restoring auto-commit", e);
            }
            releaseWriteConnection(conn);
        }
    }

    /**
     * Converts a JDBC failure into an unchecked exception. Lock contention becomes
     * {@link SQLiteDatabaseLockedException}, everything else a RuntimeException.
     */
    public RuntimeException translate(String operation, SQLException e) {
        if (e instanceof SQLiteException sqliteException && isBusyOrLocked(sqliteException.getResultCode())) {
            return new SQLiteDatabaseLockedException(operation, busyTimeout, e);
        }
        return new RuntimeException("Failed to " + operation, e);
    }

    private static boolean isBusyOrLocked(SQLiteErrorCode code) {
        return code != null && (code.name().startsWith("SQLITE_BUSY") || code.name().startsWith("SQLITE_LOCKED"));
    }

    private void rollbackQuietly(Connection conn, String operation) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            LOG.warnf("Rollback of '%s' failed: %s", operation, rollbackFailure.getMessage());
        }
    }

    /**
     * Applies SQLite pragmas for performance.
     *
     * @param conn the connection to configure
     * @throws SQLException if pragma execution fails
     */
    public void applyPragmas(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            if (walMode) {
                stmt.execute("PRAGMA journal_mode = WAL");
            }
            stmt.execute("PRAGMA synchronous = NORMAL");
            stmt.execute("PRAGMA temp_store = MEMORY");
        }
    }

    public String getDatabasePath() {
        return databasePath;
    }

    public Duration getBusyTimeout() {
        return busyTimeout;
    }

    public boolean isWalModeEnabled() {
        return walMode;
    }

    /**
     * Closes the connection manager and all connections.
     */
    @Override
    public void close() {
        closed = true;

        if (writeConnection != null) {
            try {
                writeConnection.close();
            } catch (SQLException e) {
                LOG.debug("Error closing write connection", e);
            }
            writeConnection = null;
        }

        Connection conn;
        while ((conn = readPool.poll()) != null) {
            try {
                conn.close();
            } catch (SQLException e) {
                LOG.debug("Error closing pooled connection", e);
            }
        }

        LOG.infof("Closed SQLite connection manager for %s", databasePath);
    }
}
