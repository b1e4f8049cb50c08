package br.edu.ifba.meetingrag.source;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import br.edu.ifba.meetingrag.source.TranscriptFormatter.Sentence;

class TranscriptFormatterTest {

    @Test
    @DisplayName("consecutive sentences of one speaker form a single timestamped line")
    void mergesSpeakerTurns() {
        String formatted = TranscriptFormatter.format("Weekly sync", List.of(
            new Sentence("alice", "Hello everyone.", 0.0),
            new Sentence("alice", "Let's start.", 4.5),
            new Sentence("bob smith", "Morning!", 3725.0),
            new Sentence("alice", "Great.", 3730.2)));

        assertEquals("# Weekly sync\n\n"
            + "[00:00:00] Alice: Hello everyone. Let's start.\n"
            + "[01:02:05] Bob Smith: Morning!\n"
            + "[01:02:10] Alice: Great.\n", formatted);
    }

    @Test
    void skipsBlankSentencesAndMissingTimestamps() {
        String formatted = TranscriptFormatter.format(" ", List.of(
            new Sentence(null, "Is this on?", null),
            new Sentence("carol", "  ", 12.0)));

        assertEquals("# Untitled meeting\n\nUnknown Speaker: Is this on?\n", formatted);
    }

    @Test
    void emptyTranscriptKeepsTheHeader() {
        assertEquals("# Empty\n", TranscriptFormatter.format("Empty", List.of()));
    }

    @Test
    void speakerLabelsAreCapitalizedAndShort() {
        assertEquals("Maria Da Silva", TranscriptFormatter.speakerLabel("maria da silva santos"));
        assertEquals("Speaker", TranscriptFormatter.speakerLabel("speaker 2"));
        assertEquals("Unknown Speaker", TranscriptFormatter.speakerLabel("42"));
        assertEquals("Unknown Speaker", TranscriptFormatter.speakerLabel(null));
    }

    @Test
    void formatsTimestamps() {
        assertEquals("00:00:59", TranscriptFormatter.timestamp(59));
        assertEquals("10:00:00", TranscriptFormatter.timestamp(36000));
    }
}
