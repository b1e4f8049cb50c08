package br.edu.ifba.meetingrag.storage.impl;

import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import br.edu.ifba.meetingrag.queue.TaskQueue;
import br.edu.ifba.meetingrag.storage.BlobStore;
import br.edu.ifba.meetingrag.storage.ChunkStore;
import br.edu.ifba.meetingrag.storage.DocumentStore;
import br.edu.ifba.meetingrag.storage.WebhookEventLog;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

/**
 * CDI producer for the SQLite-backed stores, the task queue and the filesystem blob store.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Creates and manages the SQLiteConnectionManager</li>
 *   <li>Runs schema migrations on startup</li>
 *   <li>Produces storage interface implementations for CDI injection</li>
 * </ul>
 *
 * <p>Example configuration:</p>
 * <pre>
 * meetingrag.storage.sqlite.path=data/meetingrag.db
 * meetingrag.storage.blob-root=data/blobs
 * </pre>
 */
@ApplicationScoped
public class SQLiteStorageProvider {

    private static final Logger LOG = Logger.getLogger(SQLiteStorageProvider.class);

    @ConfigProperty(name = "meetingrag.storage.sqlite.path", defaultValue = "data/meetingrag.db")
    String databasePath;

    @ConfigProperty(name = "meetingrag.storage.sqlite.read-pool-size", defaultValue = "4")
    int readPoolSize;

    @ConfigProperty(name = "meetingrag.storage.sqlite.busy-timeout", defaultValue = "30000")
    long busyTimeoutMs;

    @ConfigProperty(name = "meetingrag.storage.sqlite.wal-mode", defaultValue = "true")
    boolean walMode;

    @ConfigProperty(name = "meetingrag.storage.blob-root", defaultValue = "data/blobs")
    String blobRoot;

    @ConfigProperty(name = "meetingrag.retry.max-attempts", defaultValue = "3")
    int maxAttempts;

    private SQLiteConnectionManager connectionManager;

    @PostConstruct
    void initialize() {
        LOG.infof("Initializing SQLite storage with database: %s", databasePath);

        connectionManager = new SQLiteConnectionManager(
            databasePath,
            Duration.ofMillis(busyTimeoutMs),
            walMode,
            readPoolSize
        );

        Connection conn = connectionManager.getWriteConnection();
        try {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to run SQLite schema migrations", e);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }

        LOG.info("SQLite storage initialized successfully");
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down SQLite storage");
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    @Produces
    @ApplicationScoped
    public DocumentStore produceDocumentStore() {
        return new SQLiteDocumentStore(connectionManager);
    }

    @Produces
    @ApplicationScoped
    public ChunkStore produceChunkStore() {
        return new SQLiteChunkStore(connectionManager);
    }

    @Produces
    @ApplicationScoped
    public TaskQueue produceTaskQueue() {
        return new SQLiteTaskQueue(connectionManager, Clock.systemUTC(), maxAttempts);
    }

    @Produces
    @ApplicationScoped
    public WebhookEventLog produceWebhookEventLog() {
        return new SQLiteWebhookEventLog(connectionManager);
    }

    @Produces
    @ApplicationScoped
    public BlobStore produceBlobStore() {
        LOG.infof("Blob store rooted at %s", blobRoot);
        return new FileSystemBlobStore(Paths.get(blobRoot));
    }
}
