package br.edu.ifba.meetingrag.storage;

public enum WebhookEventStatus {
    RECEIVED,
    PROCESSED,
    IGNORED,
    FAILED,
    REJECTED
}
