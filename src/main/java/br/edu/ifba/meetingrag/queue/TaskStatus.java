package br.edu.ifba.meetingrag.queue;

/**
 * Task lifecycle: {@code PENDING -> PROCESSING -> COMPLETED | FAILED}. A processing task may
 * go back to pending for a retry. Only an operator reset leaves {@code FAILED}.
 */
public enum TaskStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
