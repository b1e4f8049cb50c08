package br.edu.ifba.meetingrag.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.meetingrag.MutableClock;
import br.edu.ifba.meetingrag.queue.ProcessingTask;
import br.edu.ifba.meetingrag.queue.TaskStatus;
import br.edu.ifba.meetingrag.queue.TaskType;

class SQLiteTaskQueueTest {

    private static final Duration LEASE = Duration.ofMinutes(10);

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private MutableClock clock;
    private SQLiteTaskQueue queue;

    @BeforeEach
    void setUp() throws Exception {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("queue.db").toString());
        Connection conn = connectionManager.getWriteConnection();
        try {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        queue = new SQLiteTaskQueue(connectionManager, clock, 3);
    }

    @AfterEach
    void tearDown() {
        connectionManager.close();
    }

    @Nested
    @DisplayName("Enqueueing")
    class Enqueue {

        @Test
        void newTaskIsPendingAndDueNow() {
            ProcessingTask task = queue.enqueue(TaskType.VECTORIZE, "doc-1", 5);

            assertEquals(TaskStatus.PENDING, task.status());
            assertEquals(0, task.attempts());
            assertEquals(clock.instant(), task.scheduledAt());
            assertNull(task.leaseOwner());
        }

        @Test
        void duplicateActiveTaskIsNotCreatedTwice() {
            ProcessingTask first = queue.enqueue(TaskType.VECTORIZE, "doc-1", 5);
            ProcessingTask second = queue.enqueue(TaskType.VECTORIZE, "doc-1", 3);

            assertEquals(first.id(), second.id());
            assertEquals(5, second.priority());
            assertEquals(1L, queue.countByStatus().get(TaskStatus.PENDING));
        }

        @Test
        void duplicateWithHigherPriorityRaisesIt() {
            ProcessingTask first = queue.enqueue(TaskType.VECTORIZE, "doc-1", 5);
            ProcessingTask raised = queue.enqueue(TaskType.VECTORIZE, "doc-1", 10);

            assertEquals(first.id(), raised.id());
            assertEquals(10, raised.priority());
        }

        @Test
        void sameDocumentCanBeQueuedAgainOnceFinished() {
            queue.enqueue(TaskType.VECTORIZE, "doc-1", 5);
            ProcessingTask claimed = queue.claim("w1", 1, LEASE).get(0);
            queue.complete(claimed);

            ProcessingTask again = queue.enqueue(TaskType.VECTORIZE, "doc-1", 5);

            assertTrue(!again.id().equals(claimed.id()));
            assertEquals(TaskStatus.PENDING, again.status());
        }

        @Test
        void differentTypesForSamePayloadAreDistinct() {
            ProcessingTask vectorize = queue.enqueue(TaskType.VECTORIZE, "t-1", 5);
            ProcessingTask retry = queue.enqueue(TaskType.WEBHOOK_RETRY, "t-1", 7);

            assertTrue(!vectorize.id().equals(retry.id()));
        }
    }

    @Nested
    @DisplayName("Claiming")
    class Claim {

        @Test
        void claimsHighestPriorityFirstThenOldest() {
            queue.enqueue(TaskType.VECTORIZE, "low", 1);
            clock.advance(Duration.ofSeconds(1));
            queue.enqueue(TaskType.VECTORIZE, "high-old", 10);
            clock.advance(Duration.ofSeconds(1));
            queue.enqueue(TaskType.VECTORIZE, "high-new", 10);

            List<ProcessingTask> claimed = queue.claim("w1", 2, LEASE);

            assertEquals(List.of("high-old", "high-new"), claimed.stream().map(ProcessingTask::payload).toList());
            assertTrue(claimed.stream().allMatch(task -> task.status() == TaskStatus.PROCESSING));
            assertEquals("w1", claimed.get(0).leaseOwner());
            assertEquals(clock.instant().plus(LEASE), claimed.get(0).leaseExpiresAt());
        }

        @Test
        void claimedTaskIsNotHandedToAnotherWorker() {
            queue.enqueue(TaskType.VECTORIZE, "doc-1", 5);

            assertEquals(1, queue.claim("w1", 5, LEASE).size());
            assertTrue(queue.claim("w2", 5, LEASE).isEmpty());
        }

        @Test
        void futureTasksAreNotClaimed() {
            queue.enqueue(TaskType.VECTORIZE, "doc-1", 5);
            ProcessingTask claimed = queue.claim("w1", 1, LEASE).get(0);
            queue.requeue(claimed, "rate limited", clock.instant().plusSeconds(60));

            assertTrue(queue.claim("w1", 1, LEASE).isEmpty());

            clock.advance(Duration.ofSeconds(60));
            assertEquals(1, queue.claim("w1", 1, LEASE).size());
        }

        @Test
        void expiredLeaseIsReclaimedAndCountsAsAttempt() {
            queue.enqueue(TaskType.VECTORIZE, "doc-1", 5);
            ProcessingTask first = queue.claim("w1", 1, LEASE).get(0);

            clock.advance(LEASE.plusSeconds(1));
            assertTrue(queue.reclaimExpired().isEmpty());
            ProcessingTask reclaimed = queue.claim("w2", 1, LEASE).get(0);

            assertEquals(first.id(), reclaimed.id());
            assertEquals("w2", reclaimed.leaseOwner());
            assertEquals(1, reclaimed.attempts());
            assertTrue(reclaimed.lastError().contains("w1"));
            assertThrows(IllegalStateException.class, () -> queue.complete(first));
        }

        @Test
        void leaseExpiringOnLastAttemptFailsTheTask() {
            ProcessingTask task = queue.enqueue(TaskType.VECTORIZE, "doc-1", 5);
            List<ProcessingTask> failedByReclaim = List.of();
            for (int i = 0; i < 3; i++) {
                assertEquals(1, queue.claim("w" + i, 1, LEASE).size());
                clock.advance(LEASE.plusSeconds(1));
                failedByReclaim = queue.reclaimExpired();
            }

            assertTrue(queue.claim("w9", 1, LEASE).isEmpty());
            ProcessingTask failed = queue.findById(task.id()).orElseThrow();
            assertEquals(TaskStatus.FAILED, failed.status());
            assertEquals(3, failed.attempts());
            assertEquals(List.of(failed), failedByReclaim);
        }

        @Test
        void claimDoesNotTakeOverAnExpiredLease() {
            queue.enqueue(TaskType.VECTORIZE, "doc-1", 5);
            ProcessingTask first = queue.claim("w1", 1, LEASE).get(0);
            clock.advance(LEASE.plusSeconds(1));

            assertTrue(queue.claim("w2", 1, LEASE).isEmpty());
            assertEquals("w1", queue.findById(first.id()).orElseThrow().leaseOwner());
        }

        @Test
        void nonPositiveLimitClaimsNothing() {
            queue.enqueue(TaskType.VECTORIZE, "doc-1", 5);

            assertTrue(queue.claim("w1", 0, LEASE).isEmpty());
        }
    }

    @Nested
    @DisplayName("Finishing")
    class Finish {

        @Test
        void completeRecordsCompletion() {
            queue.enqueue(TaskType.VECTORIZE, "doc-1", 5);
            ProcessingTask claimed = queue.claim("w1", 1, LEASE).get(0);
            clock.advance(Duration.ofSeconds(3));

            ProcessingTask done = queue.complete(claimed);

            assertEquals(TaskStatus.COMPLETED, done.status());
            assertEquals(clock.instant(), done.completedAt());
            assertNull(done.leaseOwner());
            assertThrows(IllegalStateException.class, () -> queue.complete(claimed));
        }

        @Test
        void requeueIncrementsAttemptsUntilCeiling() {
            ProcessingTask task = queue.enqueue(TaskType.VECTORIZE, "doc-1", 5);

            ProcessingTask afterFirst = queue.requeue(queue.claim("w1", 1, LEASE).get(0), "timeout", clock.instant());
            assertEquals(TaskStatus.PENDING, afterFirst.status());
            assertEquals(1, afterFirst.attempts());
            assertEquals("timeout", afterFirst.lastError());

            ProcessingTask afterSecond = queue.requeue(queue.claim("w1", 1, LEASE).get(0), "timeout", clock.instant());
            assertEquals(2, afterSecond.attempts());

            ProcessingTask afterThird = queue.requeue(queue.claim("w1", 1, LEASE).get(0), "timeout", clock.instant());
            assertEquals(TaskStatus.FAILED, afterThird.status());
            assertEquals(3, afterThird.attempts());
            assertNotNull(afterThird.completedAt());
            assertEquals(task.id(), afterThird.id());
        }

        @Test
        void failIsPermanent() {
            queue.enqueue(TaskType.VECTORIZE, "doc-1", 5);
            ProcessingTask failed = queue.fail(queue.claim("w1", 1, LEASE).get(0), "document missing");

            assertEquals(TaskStatus.FAILED, failed.status());
            assertEquals(1, failed.attempts());
            assertTrue(queue.claim("w1", 1, LEASE).isEmpty());
        }

        @Test
        void longErrorsAreTruncated() {
            queue.enqueue(TaskType.VECTORIZE, "doc-1", 5);
            ProcessingTask failed = queue.fail(queue.claim("w1", 1, LEASE).get(0), "x".repeat(5000));

            assertEquals(2000, failed.lastError().length());
        }

        @Test
        void resetReturnsFailedTaskToPending() {
            queue.enqueue(TaskType.VECTORIZE, "doc-1", 5);
            ProcessingTask failed = queue.fail(queue.claim("w1", 1, LEASE).get(0), "boom");

            ProcessingTask reset = queue.reset(failed.id());

            assertEquals(TaskStatus.PENDING, reset.status());
            assertEquals(0, reset.attempts());
            assertThrows(IllegalStateException.class, () -> queue.reset(failed.id()));
        }
    }

    @Test
    void purgeRemovesOnlyOldFinishedTasks() {
        queue.enqueue(TaskType.VECTORIZE, "old", 5);
        queue.complete(queue.claim("w1", 1, LEASE).get(0));
        queue.enqueue(TaskType.VECTORIZE, "pending", 5);

        clock.advance(Duration.ofDays(8));
        queue.enqueue(TaskType.VECTORIZE, "recent", 1);
        queue.fail(queue.claim("w1", 1, LEASE).stream()
            .filter(task -> task.payload().equals("pending")).findFirst().orElseThrow(), "boom");

        int purged = queue.purge(clock.instant().minus(Duration.ofDays(7)));

        assertEquals(1, purged);
        Map<TaskStatus, Long> counts = queue.countByStatus();
        assertEquals(0L, counts.get(TaskStatus.COMPLETED));
        assertEquals(1L, counts.get(TaskStatus.FAILED));
        assertEquals(1L, counts.get(TaskStatus.PENDING));
    }
}
