package br.edu.ifba.meetingrag.queue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable work queue with lease semantics.
 *
 * <p>A claimed task belongs to exactly one worker until it is completed, failed or requeued
 * by that worker, or until its lease expires. Reclaiming an expired lease counts as a failed
 * attempt. Transitions out of {@code PROCESSING} require the caller to still own the lease.</p>
 */
public interface TaskQueue {

    /**
     * Enqueues a task unless an identical one (same type and payload) is already pending or
     * processing; in that case the existing task is returned, with its priority raised to
     * {@code priority} if that is higher.
     */
    ProcessingTask enqueue(TaskType type, String payload, int priority);

    /**
     * Returns every processing task whose lease has expired to the queue, counting the expiry
     * as a failed attempt. Tasks that reach the attempt ceiling this way are failed instead.
     *
     * @return the tasks failed by this call, so callers can fail whatever the tasks point at
     */
    List<ProcessingTask> reclaimExpired();

    /**
     * Claims up to {@code limit} due pending tasks, highest priority first, then oldest schedule.
     * Expired leases are not reclaimed here; call {@link #reclaimExpired()} first.
     */
    List<ProcessingTask> claim(String workerId, int limit, Duration lease);

    /**
     * @throws IllegalStateException if the task is no longer leased by its owner
     */
    ProcessingTask complete(ProcessingTask task);

    /**
     * Records a failed attempt and makes the task pending again at {@code nextAttemptAt}.
     * If that attempt reaches {@link #maxAttempts()} the task is failed instead; callers
     * inspect the returned status.
     *
     * @throws IllegalStateException if the task is no longer leased by its owner
     */
    ProcessingTask requeue(ProcessingTask task, String error, Instant nextAttemptAt);

    /**
     * Records a failed attempt and marks the task permanently failed.
     *
     * @throws IllegalStateException if the task is no longer leased by its owner
     */
    ProcessingTask fail(ProcessingTask task, String error);

    /**
     * Operator action: returns a failed task to pending with its attempts cleared.
     *
     * @throws IllegalStateException if the task is not failed
     */
    ProcessingTask reset(String taskId);

    Optional<ProcessingTask> findById(String taskId);

    Map<TaskStatus, Long> countByStatus();

    /**
     * Deletes completed and failed tasks last updated before {@code olderThan}.
     *
     * @return number of deleted tasks
     */
    int purge(Instant olderThan);

    /**
     * The attempt ceiling this queue enforces.
     */
    int maxAttempts();
}
