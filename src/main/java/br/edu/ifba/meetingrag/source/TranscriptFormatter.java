package br.edu.ifba.meetingrag.source;

import java.util.List;
import java.util.Locale;

import org.jetbrains.annotations.Nullable;

/**
 * Renders source sentences as segmentable text.
 *
 * <p>Output starts with a {@code # Title} header, followed by one
 * {@code [hh:mm:ss] Speaker: text} line per speaker turn. Consecutive sentences of the
 * same speaker are joined into one line.</p>
 */
public final class TranscriptFormatter {

    private TranscriptFormatter() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * A single spoken sentence.
     *
     * @param startSeconds offset from the start of the meeting, null when unknown
     */
    public record Sentence(@Nullable String speaker, String text, @Nullable Double startSeconds) {}

    public static String format(String title, List<Sentence> sentences) {
        StringBuilder out = new StringBuilder();
        out.append("# ").append(title == null || title.isBlank() ? "Untitled meeting" : title.trim()).append("\n\n");

        String currentSpeaker = null;
        Double turnStart = null;
        StringBuilder turn = new StringBuilder();
        for (Sentence sentence : sentences) {
            if (sentence.text() == null || sentence.text().isBlank()) {
                continue;
            }
            String speaker = speakerLabel(sentence.speaker());
            if (!speaker.equals(currentSpeaker)) {
                appendTurn(out, currentSpeaker, turnStart, turn);
                currentSpeaker = speaker;
                turnStart = sentence.startSeconds();
                turn.setLength(0);
            }
            if (turn.length() > 0) {
                turn.append(' ');
            }
            turn.append(sentence.text().trim());
        }
        appendTurn(out, currentSpeaker, turnStart, turn);
        return out.toString().stripTrailing() + "\n";
    }

    private static void appendTurn(StringBuilder out, String speaker, Double startSeconds, StringBuilder turn) {
        if (speaker == null || turn.length() == 0) {
            return;
        }
        if (startSeconds != null && startSeconds >= 0) {
            out.append('[').append(timestamp(startSeconds.longValue())).append("] ");
        }
        out.append(speaker).append(": ").append(turn).append('\n');
    }

    static String timestamp(long totalSeconds) {
        return String.format(Locale.ROOT, "%02d:%02d:%02d", totalSeconds / 3600, (totalSeconds % 3600) / 60,
            totalSeconds % 60);
    }

    /**
     * Speaker label the segmenter recognizes: capitalized words, no digits.
     */
    static String speakerLabel(@Nullable String speaker) {
        if (speaker == null || speaker.isBlank()) {
            return "Unknown Speaker";
        }
        StringBuilder label = new StringBuilder();
        for (String word : speaker.trim().split("\\s+")) {
            String letters = word.replaceAll("[^\\p{L}'.-]", "");
            if (letters.isEmpty()) {
                continue;
            }
            if (label.length() > 0) {
                label.append(' ');
            }
            label.append(Character.toUpperCase(letters.charAt(0))).append(letters.substring(1));
            if (label.chars().filter(c -> c == ' ').count() == 2) {
                break;
            }
        }
        return label.length() == 0 ? "Unknown Speaker" : label.toString();
    }
}
