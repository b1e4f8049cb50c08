package br.edu.ifba.meetingrag.chunking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TranscriptParserTest {

    private final TranscriptParser parser = new TranscriptParser();

    @Test
    void parsesTimestampAndMultiWordSpeaker() {
        final TranscriptLine line = parser.parseLine(0, "[00:05:10] Alice Smith: hello there");

        assertEquals("Alice Smith", line.speaker());
        assertEquals(Integer.valueOf(310), line.offsetSeconds());
    }

    @Test
    void parsesTimestampWithoutSpeaker() {
        final TranscriptLine line = parser.parseLine(3, "[05:10] the build is green");

        assertNull(line.speaker());
        assertEquals(Integer.valueOf(310), line.offsetSeconds());
        assertEquals(3, line.lineNumber());
    }

    @Test
    void structuredLabelsAreNotSpeakers() {
        assertNull(parser.parseLine(0, "Decision: ship on Friday").speaker());
        assertNull(parser.parseLine(0, "Action items: none").speaker());
        assertEquals("Bob", parser.parseLine(0, "Bob: ship on Friday").speaker());
    }

    @Test
    void parseSecondsHandlesBothFormatsAndRejectsOutOfRange() {
        assertEquals(Integer.valueOf(310), TranscriptParser.parseSeconds("05:10"));
        assertEquals(Integer.valueOf(3723), TranscriptParser.parseSeconds("1:02:03"));
        assertNull(TranscriptParser.parseSeconds("00:75"));
        assertNull(TranscriptParser.parseSeconds(null));
    }

    @Test
    void markupNeedsAtLeastTwoLinesAndThirtyPercent() {
        final TranscriptParser.ParsedTranscript sparse = parser.parse(
            "Alice: hi\nline one\nline two\nline three\nline four\nline five\nline six\nline seven");
        assertFalse(sparse.hasSpeakerMarkup());

        final TranscriptParser.ParsedTranscript dense = parser.parse("Alice: hi\nBob: hello\nnotes");
        assertTrue(dense.hasSpeakerMarkup());
    }

    @Test
    void backwardsTimestampsAreNotUsableTimeMarkup() {
        final TranscriptParser.ParsedTranscript parsed = parser.parse(
            "[00:10] Alice: later\n[00:05] Bob: earlier\n[00:20] Alice: latest");

        assertTrue(parsed.hasSpeakerMarkup());
        assertFalse(parsed.hasTimeMarkup());
    }

    @Test
    void durationSpansFirstToLastTimestamp() {
        final TranscriptParser.ParsedTranscript parsed = parser.parse(
            "[00:01:00] Alice: start\n\nsome untimed line\n[00:11:00] Bob: end");

        assertEquals(600, parsed.durationSeconds());
        assertEquals(3, parsed.lines().size());
    }
}
