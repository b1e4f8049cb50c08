package br.edu.ifba.meetingrag.source;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.ConfigProvider;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * REST client for the Fireflies.ai GraphQL API.
 *
 * <p>Configured via:</p>
 * <pre>
 * quarkus.rest-client."fireflies".url=https://api.fireflies.ai
 * fireflies.api-key=...
 * </pre>
 */
@RegisterRestClient(configKey = "fireflies")
@ClientHeaderParam(name = "Authorization", value = "{lookupAuth}")
@Path("/graphql")
public interface FirefliesClient {

    String TRANSCRIPTS_QUERY = """
        query GetTranscripts($limit: Int, $fromDate: DateTime) {
          transcripts(limit: $limit, fromDate: $fromDate) {
            id
            title
            date
            duration
            participants
          }
        }
        """;

    String TRANSCRIPT_QUERY = """
        query GetTranscriptContent($id: String!) {
          transcript(id: $id) {
            id
            title
            date
            duration
            participants
            sentences {
              text
              speaker_name
              speaker_id
              start_time
            }
          }
        }
        """;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    TranscriptsResponse listTranscripts(GraphQLRequest request);

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    TranscriptResponse getTranscript(GraphQLRequest request);

    default String lookupAuth() {
        return ConfigProvider.getConfig()
            .getOptionalValue("fireflies.api-key", String.class)
            .map(key -> "Bearer " + key)
            .orElse(null);
    }

    record GraphQLRequest(String query, Map<String, Object> variables) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GraphQLError(String message) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TranscriptsResponse(TranscriptsData data, List<GraphQLError> errors) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TranscriptsData(List<FirefliesTranscript> transcripts) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TranscriptResponse(TranscriptData data, List<GraphQLError> errors) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TranscriptData(FirefliesTranscript transcript) {}

    /**
     * @param date epoch milliseconds
     * @param duration meeting length in minutes
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record FirefliesTranscript(
        String id,
        String title,
        Double date,
        Double duration,
        List<String> participants,
        List<FirefliesSentence> sentences
    ) {}

    /**
     * @param startTime offset from the start of the meeting in seconds
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record FirefliesSentence(
        String text,
        @JsonProperty("speaker_name") String speakerName,
        @JsonProperty("speaker_id") Integer speakerId,
        @JsonProperty("start_time") Double startTime
    ) {}
}
