package br.edu.ifba.meetingrag.storage;

/**
 * Pipeline state of a document: {@code NEW -> FETCHED -> SEGMENTED -> EMBEDDED -> INDEXED},
 * with {@code FAILED} reachable from any state.
 */
public enum DocumentState {
    NEW,
    FETCHED,
    SEGMENTED,
    EMBEDDED,
    INDEXED,
    FAILED
}
