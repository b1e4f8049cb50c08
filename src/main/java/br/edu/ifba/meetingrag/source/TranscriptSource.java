package br.edu.ifba.meetingrag.source;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.jetbrains.annotations.Nullable;

/**
 * External meeting-transcript provider.
 *
 * <p>Implementations throw {@link TranscriptSourceException}; its transient flag tells
 * callers whether retrying later can help.</p>
 */
public interface TranscriptSource {

    /**
     * Most recent transcripts, newest first, without their sentence content.
     *
     * @param limit maximum number of transcripts
     * @param since only transcripts dated on or after this instant; null for no bound
     */
    List<SourceTranscript> listRecent(int limit, @Nullable Instant since);

    /**
     * Full transcript with formatted content, or empty when the source does not know the id.
     */
    Optional<SourceTranscript> getById(String transcriptId);
}
