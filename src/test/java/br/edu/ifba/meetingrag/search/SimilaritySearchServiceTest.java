package br.edu.ifba.meetingrag.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import br.edu.ifba.meetingrag.chunking.Chunk;
import br.edu.ifba.meetingrag.chunking.ChunkType;
import br.edu.ifba.meetingrag.embedding.EmbeddingClient;
import br.edu.ifba.meetingrag.embedding.EmbeddingException;
import br.edu.ifba.meetingrag.embedding.VectorCodec;
import br.edu.ifba.meetingrag.storage.CandidateChunk;
import br.edu.ifba.meetingrag.storage.ChunkNeighbours;
import br.edu.ifba.meetingrag.storage.ChunkStore;

/**
 * Unit tests for {@link SimilaritySearchService} with a mocked store and embedding client.
 */
class SimilaritySearchServiceTest {

    private static final Instant OLD = Instant.parse("2024-01-10T10:00:00Z");
    private static final Instant NEW = Instant.parse("2024-02-10T10:00:00Z");
    private static final float[] QUERY = {1f, 0f};

    private EmbeddingClient embeddingClient;
    private ChunkStore chunkStore;
    private SimilaritySearchService service;

    @BeforeEach
    void setUp() {
        embeddingClient = mock(EmbeddingClient.class);
        chunkStore = mock(ChunkStore.class);
        service = new SimilaritySearchService(embeddingClient, chunkStore, SearchSettings.defaults());
        when(chunkStore.findNeighbours(anyString())).thenReturn(ChunkNeighbours.none());
    }

    private static Chunk chunk(String documentId, int position, ChunkType type, String content, Integer start,
            Integer end) {
        return new Chunk(documentId + "_" + position, documentId, position, type, content, null, start, end, 10, 0.5,
            List.of(), List.of(), null, null, null, null, null);
    }

    private static CandidateChunk candidate(String documentId, int position, float[] vector, Instant date) {
        return new CandidateChunk(chunk(documentId, position, ChunkType.TOPIC_SEGMENT, "content " + position, null,
            null), VectorCodec.encode(vector), "Meeting " + documentId, date);
    }

    @Nested
    @DisplayName("Semantic ranking")
    class Semantic {

        @Test
        @DisplayName("only candidates above the relevance threshold are returned, best first")
        void thresholdAndOrder() {
            when(embeddingClient.embedOne("budget")).thenReturn(QUERY);
            when(chunkStore.findSearchCandidates(any(), anyInt())).thenReturn(List.of(
                candidate("d1", 1, new float[] {0f, 1f}, NEW),
                candidate("d1", 2, new float[] {0.8f, 0.6f}, NEW),
                candidate("d1", 3, new float[] {1f, 0f}, NEW),
                candidate("d1", 4, new float[] {0.5f, 0.866f}, NEW),
                candidate("d1", 5, new float[] {0.9f, 0.1f}, NEW)));

            SearchResponse response = service.search("budget", null, 10);

            assertEquals(SearchMode.SEMANTIC, response.mode());
            assertEquals(List.of("d1_3", "d1_5", "d1_2"),
                response.results().stream().map(SearchResult::chunkId).toList());
            assertEquals(1.0, response.results().get(0).similarity(), 1e-6);
            assertTrue(response.results().stream().allMatch(result -> result.similarity() >= 0.7));
            assertEquals(0, response.skippedCorrupt());
        }

        @Test
        @DisplayName("equal similarity ranks the newer document first")
        void tieBreakByRecency() {
            when(embeddingClient.embedOne("budget")).thenReturn(QUERY);
            when(chunkStore.findSearchCandidates(any(), anyInt())).thenReturn(List.of(
                candidate("old", 1, new float[] {1f, 0f}, OLD),
                candidate("undated", 1, new float[] {1f, 0f}, null),
                candidate("new", 1, new float[] {1f, 0f}, NEW)));

            SearchResponse response = service.search("budget", SearchFilters.none(), 10);

            assertEquals(List.of("new", "old", "undated"),
                response.results().stream().map(SearchResult::documentId).toList());
        }

        @Test
        @DisplayName("unreadable vectors are skipped and counted")
        void corruptVectorsSkipped() {
            when(embeddingClient.embedOne("budget")).thenReturn(QUERY);
            CandidateChunk truncated = new CandidateChunk(chunk("d1", 1, ChunkType.TOPIC_SEGMENT, "x", null, null),
                new byte[] {1, 2, 3, 4, 5}, "Meeting", NEW);
            CandidateChunk wrongDimension = candidate("d1", 2, new float[] {1f, 0f, 0f}, NEW);
            CandidateChunk notFinite = candidate("d1", 3, new float[] {Float.NaN, 1f}, NEW);
            when(chunkStore.findSearchCandidates(any(), anyInt())).thenReturn(List.of(truncated, wrongDimension,
                notFinite, candidate("d1", 4, new float[] {1f, 0f}, NEW)));

            SearchResponse response = service.search("budget", null, 10);

            assertEquals(3, response.skippedCorrupt());
            assertEquals(List.of("d1_4"), response.results().stream().map(SearchResult::chunkId).toList());
        }

        @Test
        void limitIsClampedAndOverFetched() {
            when(embeddingClient.embedOne("budget")).thenReturn(QUERY);
            when(chunkStore.findSearchCandidates(any(), anyInt())).thenReturn(List.of(
                candidate("d1", 1, new float[] {1f, 0f}, NEW),
                candidate("d1", 2, new float[] {1f, 0f}, NEW)));

            SearchResponse limited = service.search("budget", null, 1);
            assertEquals(1, limited.count());
            verify(chunkStore).findSearchCandidates(SearchFilters.none(), 3);

            service.search("budget", null, 1000);
            verify(chunkStore).findSearchCandidates(SearchFilters.none(), 150);
        }

        @Test
        @DisplayName("timed results carry neighbouring text inside the context window")
        void contextExpansion() {
            Chunk window = chunk("d1", 2, ChunkType.TIME_WINDOW, "we agreed on the budget", 300, 600);
            Chunk previous = chunk("d1", 1, ChunkType.TIME_WINDOW, "earlier talk", 0, 320);
            Chunk farNext = chunk("d1", 3, ChunkType.TIME_WINDOW, "much later", 900, 1200);
            when(embeddingClient.embedOne("budget")).thenReturn(QUERY);
            when(chunkStore.findSearchCandidates(any(), anyInt())).thenReturn(List.of(
                new CandidateChunk(window, VectorCodec.encode(QUERY), "Meeting", NEW)));
            when(chunkStore.findNeighbours("d1_2")).thenReturn(new ChunkNeighbours(previous, farNext));

            SearchResult result = service.search("budget", null, 5).results().get(0);

            assertEquals("earlier talk", result.contextBefore());
            assertNull(result.contextAfter());
        }
    }

    @Nested
    @DisplayName("Fallbacks")
    class Fallbacks {

        @Test
        void blankQueryReturnsNothing() {
            SearchResponse response = service.search("  ", null, 10);

            assertTrue(response.results().isEmpty());
            verifyNoInteractions(embeddingClient);
        }

        @Test
        @DisplayName("filters excluding every document give an empty response")
        void filtersMatchingNothing() {
            SearchFilters future = SearchFilters.builder().from(Instant.parse("2030-01-01T00:00:00Z")).build();
            when(chunkStore.findSearchCandidates(eq(future), anyInt())).thenReturn(List.of());
            when(chunkStore.searchText(eq("budget"), eq(future), anyInt())).thenReturn(List.of());

            SearchResponse response = service.search("budget", future, 10);

            assertTrue(response.results().isEmpty());
            verify(embeddingClient, never()).embedOne(anyString());
        }

        @Test
        @DisplayName("a failing query embedding falls back to text search")
        void embeddingFailureFallsBack() {
            when(chunkStore.findSearchCandidates(any(), anyInt())).thenReturn(List.of(
                candidate("d1", 1, new float[] {1f, 0f}, NEW)));
            when(embeddingClient.embedOne("Budget")).thenThrow(EmbeddingException.forStatus(503, "down", null));
            when(chunkStore.searchText(eq("Budget"), any(), anyInt())).thenReturn(List.of(
                new CandidateChunk(chunk("d1", 1, ChunkType.TOPIC_SEGMENT, "The budget and the BUDGET", null, null),
                    null, "Meeting", NEW)));

            SearchResponse response = service.search("Budget", null, 10);

            assertEquals(SearchMode.TEXT, response.mode());
            SearchResult result = response.results().get(0);
            assertNull(result.similarity());
            assertEquals("The **budget** and the **BUDGET**", result.highlight());
        }

        @Test
        void semanticDisabledUsesTextMode() {
            service = new SimilaritySearchService(embeddingClient, chunkStore,
                new SearchSettings(false, 0.7, 3, 50, 30, 150));
            when(chunkStore.searchText(eq("risk"), any(), anyInt())).thenReturn(List.of());

            SearchResponse response = service.search("risk", null, 10);

            assertEquals(SearchMode.TEXT, response.mode());
            verifyNoInteractions(embeddingClient);
        }
    }

    @Test
    void highlightQuotesRegexCharacters() {
        assertEquals("cost is **$5.00** today", SimilaritySearchService.highlight("cost is $5.00 today", "$5.00"));
        assertEquals("no match", SimilaritySearchService.highlight("no match", "zzz"));
    }
}
