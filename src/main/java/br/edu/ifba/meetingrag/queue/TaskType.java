package br.edu.ifba.meetingrag.queue;

public enum TaskType {
    /** Pull new transcripts from the source and enqueue unprocessed documents. */
    SYNC,
    /** Segment, embed and index one document; payload is the document id. */
    VECTORIZE,
    /** Re-fetch a transcript whose webhook import failed; payload is the transcript id. */
    WEBHOOK_RETRY
}
