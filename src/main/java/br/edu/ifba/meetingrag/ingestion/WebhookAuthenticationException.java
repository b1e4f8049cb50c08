package br.edu.ifba.meetingrag.ingestion;

/**
 * Webhook request rejected because its signature is missing or does not match.
 * The HTTP layer answers it with 401.
 */
public class WebhookAuthenticationException extends RuntimeException {

    public WebhookAuthenticationException(String message) {
        super(message);
    }
}
