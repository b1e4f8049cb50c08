package br.edu.ifba.meetingrag;

import java.time.Clock;

import org.jboss.logging.Logger;

import br.edu.ifba.meetingrag.chunking.Segmenter;
import br.edu.ifba.meetingrag.embedding.EmbeddingClient;
import br.edu.ifba.meetingrag.embedding.EmbeddingFunction;
import br.edu.ifba.meetingrag.extraction.EntityExtractor;
import br.edu.ifba.meetingrag.extraction.ExtractionRules;
import br.edu.ifba.meetingrag.ingestion.IngestionOrchestrator;
import br.edu.ifba.meetingrag.ingestion.TranscriptImporter;
import br.edu.ifba.meetingrag.ingestion.WebhookVerifier;
import br.edu.ifba.meetingrag.queue.TaskQueue;
import br.edu.ifba.meetingrag.search.SimilaritySearchService;
import br.edu.ifba.meetingrag.source.TranscriptSource;
import br.edu.ifba.meetingrag.storage.BlobStore;
import br.edu.ifba.meetingrag.storage.ChunkStore;
import br.edu.ifba.meetingrag.storage.DocumentStore;
import br.edu.ifba.meetingrag.storage.WebhookEventLog;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

/**
 * CDI producer wiring the plain pipeline components from {@link PipelineConfig}.
 *
 * <p>The components themselves take their collaborators and settings through constructors
 * and carry no CDI annotations, so tests build them directly.</p>
 */
@ApplicationScoped
public class PipelineProducer {

    private static final Logger LOG = Logger.getLogger(PipelineProducer.class);

    @Inject
    PipelineConfig config;

    @Produces
    @ApplicationScoped
    public EntityExtractor produceEntityExtractor() {
        return new EntityExtractor(ExtractionRules.defaults(), config.extraction().maxTextLength(),
            config.extraction().maxTopics());
    }

    @Produces
    @ApplicationScoped
    public Segmenter produceSegmenter(EntityExtractor extractor) {
        return new Segmenter(extractor);
    }

    @Produces
    @ApplicationScoped
    public EmbeddingClient produceEmbeddingClient(EmbeddingFunction function) {
        LOG.infof("Embedding model %s, dimension %d", config.embedding().model(),
            Integer.valueOf(config.embedding().dimension()));
        return new EmbeddingClient(function, config.embedding().toSettings(), config.retry().toPolicy());
    }

    void closeEmbeddingClient(@Disposes EmbeddingClient client) {
        client.close();
    }

    @Produces
    @ApplicationScoped
    public SimilaritySearchService produceSearchService(EmbeddingClient embeddingClient, ChunkStore chunkStore) {
        return new SimilaritySearchService(embeddingClient, chunkStore, config.search().toSettings());
    }

    @Produces
    @ApplicationScoped
    public WebhookVerifier produceWebhookVerifier() {
        WebhookVerifier verifier = new WebhookVerifier(config.webhook().secret().orElse(null));
        if (!verifier.isEnabled()) {
            LOG.warn("No webhook secret configured, webhook signatures are not verified");
        }
        return verifier;
    }

    @Produces
    @ApplicationScoped
    public TranscriptImporter produceTranscriptImporter(TranscriptSource source, DocumentStore documentStore,
            BlobStore blobStore) {
        return new TranscriptImporter(source, documentStore, blobStore, Clock.systemUTC());
    }

    @Produces
    @ApplicationScoped
    public IngestionOrchestrator produceOrchestrator(DocumentStore documentStore, ChunkStore chunkStore,
            BlobStore blobStore, TaskQueue taskQueue, WebhookEventLog webhookEventLog, TranscriptImporter importer,
            Segmenter segmenter, EmbeddingClient embeddingClient, WebhookVerifier webhookVerifier) {
        return new IngestionOrchestrator(documentStore, chunkStore, blobStore, taskQueue, webhookEventLog, importer,
            segmenter, config.segmentation().toSettings(), embeddingClient, webhookVerifier,
            config.retry().toPolicy(), config.toIngestionSettings(), Clock.systemUTC());
    }

    void closeOrchestrator(@Disposes IngestionOrchestrator orchestrator) {
        orchestrator.close();
    }
}
