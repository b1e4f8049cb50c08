package br.edu.ifba.meetingrag.embedding.client;

import br.edu.ifba.meetingrag.embedding.EmbeddingException;
import br.edu.ifba.meetingrag.embedding.EmbeddingFunction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Bridges the Quarkus-managed {@link LlmEmbeddingClient} to {@link EmbeddingFunction}.
 *
 * <p>HTTP 408, 429 and 5xx responses and connection failures are reported as transient
 * {@link EmbeddingException}s; other error statuses and malformed responses as permanent.</p>
 */
@ApplicationScoped
public class RestEmbeddingFunction implements EmbeddingFunction {

    private static final Logger LOG = Logger.getLogger(RestEmbeddingFunction.class);

    @Inject
    @RestClient
    LlmEmbeddingClient embeddingClient;

    @ConfigProperty(name = "meetingrag.embedding.model", defaultValue = "text-embedding-3-small")
    String embeddingModel;

    @Override
    public CompletableFuture<List<float[]>> embed(@NotNull final List<String> texts) {
        if (texts.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        LOG.debugf("Embedding request - texts count: %d, model: %s", Integer.valueOf(texts.size()), embeddingModel);

        try {
            final EmbeddingResponse response = embeddingClient.embed(new EmbeddingRequest(embeddingModel, texts, null));
            return CompletableFuture.completedFuture(toVectors(response, texts.size()));
        } catch (WebApplicationException e) {
            final int status = e.getResponse() != null ? e.getResponse().getStatus() : 500;
            LOG.warnf("Embedding API responded with HTTP %d", Integer.valueOf(status));
            return CompletableFuture.failedFuture(
                EmbeddingException.forStatus(status, "Embedding API responded with HTTP " + status, e));
        } catch (ProcessingException e) {
            LOG.warnf("Embedding API unreachable: %s", e.getMessage());
            return CompletableFuture.failedFuture(
                EmbeddingException.transientFailure("Embedding API unreachable: " + e.getMessage(), e));
        } catch (EmbeddingException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static List<float[]> toVectors(final EmbeddingResponse response, final int expected) {
        if (response == null || response.getData() == null || response.getData().isEmpty()) {
            throw EmbeddingException.permanent("Embedding API returned no data");
        }
        if (response.getData().size() != expected) {
            throw EmbeddingException.permanent(String.format("Expected %d embeddings but received %d",
                expected, response.getData().size()));
        }

        final List<EmbeddingResponse.Embedding> ordered = new ArrayList<>(response.getData());
        if (ordered.stream().allMatch(item -> item.getIndex() != null)) {
            ordered.sort(Comparator.comparing(EmbeddingResponse.Embedding::getIndex));
        }

        // Convert List<Double> to float[] for each embedding
        final List<float[]> vectors = new ArrayList<>(ordered.size());
        for (final EmbeddingResponse.Embedding item : ordered) {
            final List<Double> values = item.getEmbedding();
            if (values == null || values.isEmpty()) {
                throw EmbeddingException.permanent("Embedding API returned null or empty vector");
            }
            final float[] vector = new float[values.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = values.get(i).floatValue();
            }
            vectors.add(vector);
        }
        return vectors;
    }
}
