package br.edu.ifba.meetingrag.chunking;

import org.jetbrains.annotations.Nullable;

/**
 * One non-blank source line with the markup detected on it.
 *
 * @param lineNumber zero-based line index in the source
 * @param text the line as written, without the trailing newline
 * @param speaker speaker label when the line starts with "Name:", else null
 * @param offsetSeconds timestamp when the line carries one, else null
 */
public record TranscriptLine(int lineNumber, String text, @Nullable String speaker, @Nullable Integer offsetSeconds) {

    public boolean hasSpeaker() {
        return speaker != null;
    }

    public boolean hasTimestamp() {
        return offsetSeconds != null;
    }
}
