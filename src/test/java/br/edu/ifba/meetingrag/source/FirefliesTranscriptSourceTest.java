package br.edu.ifba.meetingrag.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import br.edu.ifba.meetingrag.source.FirefliesClient.FirefliesSentence;
import br.edu.ifba.meetingrag.source.FirefliesClient.FirefliesTranscript;
import br.edu.ifba.meetingrag.source.FirefliesClient.GraphQLError;
import br.edu.ifba.meetingrag.source.FirefliesClient.GraphQLRequest;
import br.edu.ifba.meetingrag.source.FirefliesClient.TranscriptData;
import br.edu.ifba.meetingrag.source.FirefliesClient.TranscriptResponse;
import br.edu.ifba.meetingrag.source.FirefliesClient.TranscriptsData;
import br.edu.ifba.meetingrag.source.FirefliesClient.TranscriptsResponse;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;

/**
 * Exercises the source without CDI; fault tolerance interceptors are not active here.
 */
class FirefliesTranscriptSourceTest {

    private static final double DATE = 1_709_280_000_000d;

    private FirefliesClient client;
    private FirefliesTranscriptSource source;

    @BeforeEach
    void setUp() {
        client = mock(FirefliesClient.class);
        source = new FirefliesTranscriptSource();
        source.client = client;
        source.defaultFetchLimit = 25;
    }

    private static WebApplicationException httpError(Response.Status status) {
        Response response = mock(Response.class);
        when(response.getStatus()).thenReturn(status.getStatusCode());
        when(response.getStatusInfo()).thenReturn(status);
        return new WebApplicationException(response);
    }

    @Nested
    @DisplayName("Listing")
    class Listing {

        @Test
        void listsTranscriptsWithoutContent() {
            when(client.listTranscripts(any())).thenReturn(new TranscriptsResponse(new TranscriptsData(List.of(
                new FirefliesTranscript("ff-1", "Daily standup", DATE, 15.5, List.of("a@x.io"), null),
                new FirefliesTranscript("ff-2", " ", null, null, null, null))), null));

            List<SourceTranscript> listed = source.listRecent(10, null);

            assertEquals(2, listed.size());
            SourceTranscript first = listed.get(0);
            assertEquals("ff-1", first.id());
            assertEquals(Instant.ofEpochMilli((long) DATE), first.date());
            assertEquals(Integer.valueOf(930), first.durationSeconds());
            assertNull(first.raw());
            assertEquals(List.of("a@x.io"), first.participants());
            assertEquals("Untitled meeting", listed.get(1).title());
            assertTrue(listed.get(1).participants().isEmpty());
        }

        @Test
        void capsPageSizeAndPassesSince() {
            when(client.listTranscripts(any())).thenReturn(new TranscriptsResponse(new TranscriptsData(List.of()), null));
            Instant since = Instant.parse("2024-03-01T00:00:00Z");

            source.listRecent(500, since);

            ArgumentCaptor<GraphQLRequest> request = ArgumentCaptor.forClass(GraphQLRequest.class);
            verify(client).listTranscripts(request.capture());
            assertEquals(Integer.valueOf(FirefliesTranscriptSource.MAX_PAGE_SIZE), request.getValue().variables().get("limit"));
            assertEquals(since.toString(), request.getValue().variables().get("fromDate"));
            assertEquals(FirefliesClient.TRANSCRIPTS_QUERY, request.getValue().query());
        }

        @Test
        void usesDefaultLimitWhenNoneGiven() {
            source.defaultFetchLimit = 7;
            when(client.listTranscripts(any())).thenReturn(new TranscriptsResponse(null, null));

            assertTrue(source.listRecent(0, null).isEmpty());

            ArgumentCaptor<GraphQLRequest> request = ArgumentCaptor.forClass(GraphQLRequest.class);
            verify(client).listTranscripts(request.capture());
            assertEquals(Integer.valueOf(7), request.getValue().variables().get("limit"));
            assertFalse(request.getValue().variables().containsKey("fromDate"));
        }
    }

    @Nested
    @DisplayName("Fetching")
    class Fetching {

        @Test
        @DisplayName("sentences are rendered as timestamped speaker lines")
        void rendersSentences() {
            when(client.getTranscript(any())).thenReturn(new TranscriptResponse(new TranscriptData(
                new FirefliesTranscript("ff-1", "Daily standup", DATE, 10.0, List.of(), List.of(
                    new FirefliesSentence("Morning all.", "ana lima", 0, 1.0),
                    new FirefliesSentence("Blocked on review.", null, 1, 65.0)))), null));

            Optional<SourceTranscript> transcript = source.getById("ff-1");

            assertTrue(transcript.isPresent());
            assertEquals("# Daily standup\n\n"
                + "[00:00:01] Ana Lima: Morning all.\n"
                + "[00:01:05] Speaker B: Blocked on review.\n", transcript.get().raw());
            assertEquals(Integer.valueOf(600), transcript.get().durationSeconds());
        }

        @Test
        void unknownTranscriptIsEmpty() {
            when(client.getTranscript(any())).thenReturn(new TranscriptResponse(new TranscriptData(null), null));

            assertTrue(source.getById("missing").isEmpty());
        }

        @Test
        void graphQlErrorsArePermanent() {
            when(client.getTranscript(any())).thenReturn(
                new TranscriptResponse(null, List.of(new GraphQLError("object not found"))));

            TranscriptSourceException e = assertThrows(TranscriptSourceException.class, () -> source.getById("x"));

            assertFalse(e.isTransient());
            assertTrue(e.getMessage().contains("object not found"));
        }

        @Test
        void emptyResponseIsTransient() {
            when(client.getTranscript(any())).thenReturn(null);

            assertTrue(assertThrows(TranscriptSourceException.class, () -> source.getById("x")).isTransient());
        }
    }

    @Nested
    @DisplayName("Transport failures")
    class TransportFailures {

        @Test
        void unreachableApiIsTransient() {
            when(client.listTranscripts(any())).thenThrow(new ProcessingException("connection refused"));

            TranscriptSourceException e = assertThrows(TranscriptSourceException.class,
                () -> source.listRecent(5, null));

            assertTrue(e.isTransient());
            assertTrue(new FirefliesTranscriptSource.TransientSourceFailure().test(e));
        }

        @Test
        void serverErrorsAreTransient() {
            WebApplicationException unavailable = httpError(Response.Status.SERVICE_UNAVAILABLE);
            when(client.getTranscript(any())).thenThrow(unavailable);

            assertTrue(assertThrows(TranscriptSourceException.class, () -> source.getById("x")).isTransient());
        }

        @Test
        void authenticationErrorsArePermanent() {
            WebApplicationException unauthorized = httpError(Response.Status.UNAUTHORIZED);
            when(client.getTranscript(any())).thenThrow(unauthorized);

            TranscriptSourceException e = assertThrows(TranscriptSourceException.class, () -> source.getById("x"));

            assertFalse(e.isTransient());
            assertTrue(e.getMessage().contains("401"));
            assertFalse(new FirefliesTranscriptSource.TransientSourceFailure().test(e));
        }
    }
}
