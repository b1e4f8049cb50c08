package br.edu.ifba.meetingrag.ingestion;

import java.time.Instant;

import org.jetbrains.annotations.Nullable;

/**
 * Options of one sync run.
 *
 * @param limit maximum transcripts pulled from the source; 0 uses the configured fetch limit
 * @param since only pull transcripts dated on or after this instant
 * @param forceUpdate re-import transcripts that already exist as documents
 * @param pullFromSource pull new transcripts from the source
 * @param enqueueUnprocessed enqueue a vectorize task per unprocessed document
 * @param cleanup run housekeeping after the sync
 */
public record SyncOptions(
    int limit,
    @Nullable Instant since,
    boolean forceUpdate,
    boolean pullFromSource,
    boolean enqueueUnprocessed,
    boolean cleanup
) {

    public SyncOptions {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative, got " + limit);
        }
    }

    public static SyncOptions defaults() {
        return new SyncOptions(0, null, false, true, true, false);
    }

    /**
     * Enqueue already imported documents without contacting the source.
     */
    public static SyncOptions enqueueOnly() {
        return new SyncOptions(0, null, false, false, true, false);
    }
}
