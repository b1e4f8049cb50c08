package br.edu.ifba.meetingrag.ingestion;

/**
 * A task references data that does not exist, such as an unknown document or missing raw content.
 */
public class DataIntegrityException extends RuntimeException {

    public DataIntegrityException(String message) {
        super(message);
    }
}
