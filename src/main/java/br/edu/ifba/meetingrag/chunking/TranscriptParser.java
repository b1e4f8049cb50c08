package br.edu.ifba.meetingrag.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import br.edu.ifba.meetingrag.extraction.ExtractionRules;

/**
 * Detects speaker labels and timestamps line by line.
 *
 * <p>Recognized forms: {@code [00:05:10] Alice: text}, {@code 05:10 Alice Smith: text},
 * {@code Alice: text} and {@code [05:10] text}. Unparseable timestamps are ignored
 * rather than rejected, so malformed markup only weakens detection.</p>
 */
final class TranscriptParser {

    private static final Pattern SPEAKER_LINE = Pattern.compile(
        "^\\s*(?:\\[?(\\d{1,2}:\\d{2}(?::\\d{2})?)\\]?\\s*-?\\s*)?"
            + "([A-Z][\\p{L}'.-]*(?:\\s+[A-Z][\\p{L}'.-]*){0,2})\\s*:\\s*(.*)$");

    private static final Pattern TIMED_LINE = Pattern.compile(
        "^\\s*\\[?(\\d{1,2}:\\d{2}(?::\\d{2})?)\\]?\\s+(.*)$");

    private static final int MARKUP_SHARE_PERCENT = 30;

    ParsedTranscript parse(final String content) {
        final String[] rawLines = content.split("\\r?\\n", -1);
        final List<TranscriptLine> lines = new ArrayList<>();
        for (int i = 0; i < rawLines.length; i++) {
            final String raw = rawLines[i];
            if (raw.isBlank()) {
                continue;
            }
            lines.add(parseLine(i, raw));
        }
        return new ParsedTranscript(lines);
    }

    TranscriptLine parseLine(final int lineNumber, final String raw) {
        final Matcher speakerMatcher = SPEAKER_LINE.matcher(raw);
        if (speakerMatcher.matches()) {
            final String label = speakerMatcher.group(2).trim();
            if (!ExtractionRules.isNonPersonLabel(label)) {
                return new TranscriptLine(lineNumber, raw, label, parseSeconds(speakerMatcher.group(1)));
            }
        }
        final Matcher timedMatcher = TIMED_LINE.matcher(raw);
        if (timedMatcher.matches()) {
            return new TranscriptLine(lineNumber, raw, null, parseSeconds(timedMatcher.group(1)));
        }
        return new TranscriptLine(lineNumber, raw, null, null);
    }

    /**
     * Parses {@code mm:ss} or {@code hh:mm:ss}; returns null for anything out of range.
     */
    static Integer parseSeconds(final String timestamp) {
        if (timestamp == null) {
            return null;
        }
        final String[] parts = timestamp.split(":");
        try {
            int seconds = 0;
            for (int i = 0; i < parts.length; i++) {
                final int value = Integer.parseInt(parts[i]);
                if (i > 0 && value >= 60) {
                    return null;
                }
                seconds = seconds * 60 + value;
            }
            return Integer.valueOf(seconds);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parsed view of a transcript with markup statistics.
     */
    record ParsedTranscript(List<TranscriptLine> lines) {

        ParsedTranscript {
            lines = List.copyOf(lines);
        }

        long speakerLineCount() {
            return lines.stream().filter(TranscriptLine::hasSpeaker).count();
        }

        long timedLineCount() {
            return lines.stream().filter(TranscriptLine::hasTimestamp).count();
        }

        boolean hasSpeakerMarkup() {
            final long speakerLines = speakerLineCount();
            return speakerLines >= 2 && speakerLines * 100 >= (long) lines.size() * MARKUP_SHARE_PERCENT;
        }

        /**
         * Timestamps count as usable markup only when they never go backwards.
         */
        boolean hasTimeMarkup() {
            final long timedLines = timedLineCount();
            if (timedLines < 2 || timedLines * 100 < (long) lines.size() * MARKUP_SHARE_PERCENT) {
                return false;
            }
            int previous = -1;
            for (final TranscriptLine line : lines) {
                if (line.hasTimestamp()) {
                    if (line.offsetSeconds() < previous) {
                        return false;
                    }
                    previous = line.offsetSeconds();
                }
            }
            return true;
        }

        int durationSeconds() {
            Integer first = null;
            Integer last = null;
            for (final TranscriptLine line : lines) {
                if (line.hasTimestamp()) {
                    if (first == null) {
                        first = line.offsetSeconds();
                    }
                    last = line.offsetSeconds();
                }
            }
            return first == null ? 0 : last - first;
        }
    }
}
