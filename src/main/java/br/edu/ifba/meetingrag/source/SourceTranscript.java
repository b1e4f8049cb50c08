package br.edu.ifba.meetingrag.source;

import java.time.Instant;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A transcript as delivered by a {@link TranscriptSource}.
 *
 * @param raw formatted transcript text, null in listings
 * @param participants participant names or e-mail addresses as reported by the source
 */
public record SourceTranscript(
    @NotNull String id,
    @NotNull String title,
    @Nullable Instant date,
    @Nullable Integer durationSeconds,
    @Nullable String raw,
    @NotNull List<String> participants
) {

    public SourceTranscript {
        participants = participants == null ? List.of() : List.copyOf(participants);
    }

    public boolean hasContent() {
        return raw != null && !raw.isBlank();
    }
}
