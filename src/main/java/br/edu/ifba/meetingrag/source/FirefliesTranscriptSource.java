package br.edu.ifba.meetingrag.source;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

import br.edu.ifba.meetingrag.source.FirefliesClient.FirefliesSentence;
import br.edu.ifba.meetingrag.source.FirefliesClient.FirefliesTranscript;
import br.edu.ifba.meetingrag.source.FirefliesClient.GraphQLError;
import br.edu.ifba.meetingrag.source.FirefliesClient.GraphQLRequest;
import br.edu.ifba.meetingrag.source.FirefliesClient.TranscriptResponse;
import br.edu.ifba.meetingrag.source.FirefliesClient.TranscriptsResponse;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import io.smallrye.faulttolerance.api.RetryWhen;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;

/**
 * {@link TranscriptSource} backed by the Fireflies.ai GraphQL API.
 *
 * <p>Calls are guarded by a timeout and retried with exponential backoff while the
 * failure is transient; permanent failures (bad credentials, GraphQL errors) surface
 * immediately.</p>
 */
@ApplicationScoped
public class FirefliesTranscriptSource implements TranscriptSource {

    private static final Logger LOG = Logger.getLogger(FirefliesTranscriptSource.class);

    /** The API refuses larger pages. */
    static final int MAX_PAGE_SIZE = 25;

    @Inject
    @RestClient
    FirefliesClient client;

    @ConfigProperty(name = "meetingrag.sync.fetch-limit", defaultValue = "25")
    int defaultFetchLimit;

    @Override
    @Timeout(value = 30, unit = ChronoUnit.SECONDS)
    @Retry(maxRetries = 3, delay = 500, delayUnit = ChronoUnit.MILLIS, maxDuration = 2, durationUnit = ChronoUnit.MINUTES)
    @ExponentialBackoff(maxDelay = 10, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientSourceFailure.class)
    public List<SourceTranscript> listRecent(int limit, Instant since) {
        int pageSize = Math.min(limit > 0 ? limit : defaultFetchLimit, MAX_PAGE_SIZE);
        Map<String, Object> variables = new HashMap<>();
        variables.put("limit", Integer.valueOf(pageSize));
        if (since != null) {
            variables.put("fromDate", since.toString());
        }

        TranscriptsResponse response = call("list transcripts",
            () -> client.listTranscripts(new GraphQLRequest(FirefliesClient.TRANSCRIPTS_QUERY, variables)));
        requireNoErrors(response.errors());
        if (response.data() == null || response.data().transcripts() == null) {
            return List.of();
        }

        List<SourceTranscript> transcripts = new ArrayList<>();
        for (FirefliesTranscript transcript : response.data().transcripts()) {
            transcripts.add(toSourceTranscript(transcript, null));
        }
        LOG.debugf("Fireflies listed %d transcripts", Integer.valueOf(transcripts.size()));
        return transcripts;
    }

    @Override
    @Timeout(value = 30, unit = ChronoUnit.SECONDS)
    @Retry(maxRetries = 3, delay = 500, delayUnit = ChronoUnit.MILLIS, maxDuration = 2, durationUnit = ChronoUnit.MINUTES)
    @ExponentialBackoff(maxDelay = 10, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientSourceFailure.class)
    public Optional<SourceTranscript> getById(String transcriptId) {
        TranscriptResponse response = call("fetch transcript " + transcriptId,
            () -> client.getTranscript(new GraphQLRequest(FirefliesClient.TRANSCRIPT_QUERY, Map.of("id", transcriptId))));
        requireNoErrors(response.errors());
        if (response.data() == null || response.data().transcript() == null) {
            LOG.infof("Fireflies has no transcript %s", transcriptId);
            return Optional.empty();
        }

        FirefliesTranscript transcript = response.data().transcript();
        List<TranscriptFormatter.Sentence> sentences = new ArrayList<>();
        if (transcript.sentences() != null) {
            for (FirefliesSentence sentence : transcript.sentences()) {
                String speaker = sentence.speakerName() != null ? sentence.speakerName()
                    : sentence.speakerId() != null ? "Speaker " + speakerLetter(sentence.speakerId().intValue()) : null;
                sentences.add(new TranscriptFormatter.Sentence(speaker, sentence.text(), sentence.startTime()));
            }
        }
        String raw = TranscriptFormatter.format(transcript.title(), sentences);
        return Optional.of(toSourceTranscript(transcript, raw));
    }

    private static SourceTranscript toSourceTranscript(FirefliesTranscript transcript, String raw) {
        Instant date = transcript.date() == null ? null : Instant.ofEpochMilli(transcript.date().longValue());
        Integer duration = transcript.duration() == null ? null
            : Integer.valueOf((int) Math.round(transcript.duration().doubleValue() * 60));
        String title = transcript.title() == null || transcript.title().isBlank() ? "Untitled meeting" : transcript.title();
        return new SourceTranscript(transcript.id(), title, date, duration, raw, transcript.participants());
    }

    private static String speakerLetter(int speakerId) {
        return String.valueOf((char) ('A' + Math.floorMod(speakerId, 26)));
    }

    private static <T> T call(String operation, Supplier<T> request) {
        try {
            T response = request.get();
            if (response == null) {
                throw new TranscriptSourceException("Fireflies returned an empty response to " + operation, true);
            }
            return response;
        } catch (WebApplicationException e) {
            int status = e.getResponse() != null ? e.getResponse().getStatus() : 500;
            boolean transientFailure = status == 408 || status == 429 || status >= 500;
            LOG.warnf("Fireflies responded with HTTP %d to %s", Integer.valueOf(status), operation);
            throw new TranscriptSourceException(
                "Fireflies responded with HTTP " + status + " to " + operation, transientFailure, e);
        } catch (ProcessingException e) {
            LOG.warnf("Fireflies unreachable during %s: %s", operation, e.getMessage());
            throw new TranscriptSourceException("Fireflies unreachable: " + e.getMessage(), true, e);
        }
    }

    private static void requireNoErrors(List<GraphQLError> errors) {
        if (errors != null && !errors.isEmpty()) {
            StringBuilder message = new StringBuilder("Fireflies GraphQL errors:");
            for (GraphQLError error : errors) {
                message.append(' ').append(error.message());
            }
            throw new TranscriptSourceException(message.toString(), false);
        }
    }

    /**
     * Retry predicate: only transient source failures are retried.
     */
    public static final class TransientSourceFailure implements Predicate<Throwable> {

        @Override
        public boolean test(Throwable throwable) {
            return throwable instanceof TranscriptSourceException sourceException && sourceException.isTransient();
        }
    }
}
