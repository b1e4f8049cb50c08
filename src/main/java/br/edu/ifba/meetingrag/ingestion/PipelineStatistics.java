package br.edu.ifba.meetingrag.ingestion;

import java.util.Map;

import br.edu.ifba.meetingrag.queue.TaskStatus;
import br.edu.ifba.meetingrag.storage.DocumentState;

/**
 * Snapshot of pipeline progress.
 */
public record PipelineStatistics(
    Map<DocumentState, Long> documentsByState,
    long chunks,
    long embeddedChunks,
    Map<TaskStatus, Long> tasksByStatus
) {

    public PipelineStatistics {
        documentsByState = Map.copyOf(documentsByState);
        tasksByStatus = Map.copyOf(tasksByStatus);
    }

    public long documents() {
        return documentsByState.values().stream().mapToLong(Long::longValue).sum();
    }
}
