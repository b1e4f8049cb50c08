package br.edu.ifba.meetingrag.ingestion;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import org.jboss.logging.Logger;

import br.edu.ifba.meetingrag.source.SourceTranscript;
import br.edu.ifba.meetingrag.source.TranscriptMetadata;
import br.edu.ifba.meetingrag.source.TranscriptSource;
import br.edu.ifba.meetingrag.storage.BlobStore;
import br.edu.ifba.meetingrag.storage.Document;
import br.edu.ifba.meetingrag.storage.DocumentStore;
import br.edu.ifba.meetingrag.utils.TokenUtil;

/**
 * Copies transcripts from the {@link TranscriptSource} into the blob store and the document store.
 *
 * <p>The document id is the source transcript id. Re-importing an existing document
 * refreshes its content and descriptive fields; its processing state is kept.</p>
 */
public class TranscriptImporter {

    private static final Logger LOG = Logger.getLogger(TranscriptImporter.class);

    static final String KEY_PREFIX = "transcripts/";

    private final TranscriptSource source;
    private final DocumentStore documentStore;
    private final BlobStore blobStore;
    private final Clock clock;

    public TranscriptImporter(TranscriptSource source, DocumentStore documentStore, BlobStore blobStore, Clock clock) {
        this.source = source;
        this.documentStore = documentStore;
        this.blobStore = blobStore;
        this.clock = clock;
    }

    public TranscriptSource source() {
        return source;
    }

    /**
     * Fetches the full transcript and stores it.
     *
     * @throws DataIntegrityException if the source does not know the transcript
     */
    public Document importTranscript(String transcriptId) {
        SourceTranscript transcript = source.getById(transcriptId)
            .orElseThrow(() -> new DataIntegrityException("Transcript " + transcriptId + " not found in source"));
        return store(transcript);
    }

    /**
     * Imports a transcript seen in a listing unless it already exists and {@code force} is false.
     *
     * @return the stored document, or empty when skipped
     */
    public Optional<Document> importListed(SourceTranscript listed, boolean force) {
        if (!force && documentStore.findById(listed.id()).isPresent()) {
            LOG.debugf("Transcript %s already imported, skipping", listed.id());
            return Optional.empty();
        }
        return Optional.of(importTranscript(listed.id()));
    }

    Document store(SourceTranscript transcript) {
        Instant now = clock.instant();
        String content = transcript.raw() == null ? "" : transcript.raw();
        String key = blobKey(transcript.id());
        blobStore.put(key, content.getBytes(StandardCharsets.UTF_8));

        TranscriptMetadata metadata = TranscriptMetadata.fromTitle(transcript.title());
        Optional<Document> existing = documentStore.findById(transcript.id());
        String project = existing.map(Document::project).orElse(null);
        String department = existing.map(Document::department).orElse(null);

        Document document = Document.create(transcript.id(), transcript.title(), transcript.date(), key,
                TokenUtil.countWords(content), now)
            .withClassification(metadata.category(), project, department, metadata.tags())
            .withParticipants(transcript.participants(), transcript.durationSeconds());
        documentStore.upsert(document);

        LOG.infof("Imported transcript %s '%s' (%d characters, category %s)",
            transcript.id(), transcript.title(), Integer.valueOf(content.length()), metadata.category());
        return documentStore.findById(transcript.id()).orElse(document);
    }

    static String blobKey(String transcriptId) {
        return KEY_PREFIX + transcriptId.replaceAll("[^A-Za-z0-9._-]", "_") + ".md";
    }
}
