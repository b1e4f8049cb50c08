package br.edu.ifba.meetingrag.chunking;

/**
 * Strategy selector. {@code AUTO} runs every strategy whose markup is present
 * and falls back to {@code TOPIC} when none is.
 */
public enum SegmentationStrategy {
    AUTO,
    SPEAKER_TURN,
    TIME_WINDOW,
    TOPIC
}
