package br.edu.ifba.meetingrag.ingestion;

import java.util.List;

/**
 * Per-stage counts of a sync run. One failing transcript is counted, not fatal.
 *
 * @param listed transcripts returned by the source
 * @param imported transcripts stored as new or updated documents
 * @param skipped transcripts already present and not forced
 * @param failed transcripts that could not be imported
 * @param enqueued vectorize tasks enqueued
 * @param errors one message per failure
 */
public record SyncReport(int listed, int imported, int skipped, int failed, int enqueued,
        HousekeepingReport housekeeping, List<String> errors) {

    public SyncReport {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
