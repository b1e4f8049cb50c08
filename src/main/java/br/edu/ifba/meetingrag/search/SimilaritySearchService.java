package br.edu.ifba.meetingrag.search;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import br.edu.ifba.meetingrag.chunking.Chunk;
import br.edu.ifba.meetingrag.chunking.ChunkType;
import br.edu.ifba.meetingrag.embedding.EmbeddingClient;
import br.edu.ifba.meetingrag.embedding.EmbeddingException;
import br.edu.ifba.meetingrag.embedding.VectorCodec;
import br.edu.ifba.meetingrag.embedding.VectorMath;
import br.edu.ifba.meetingrag.storage.CandidateChunk;
import br.edu.ifba.meetingrag.storage.ChunkNeighbours;
import br.edu.ifba.meetingrag.storage.ChunkStore;
import br.edu.ifba.meetingrag.utils.TokenUtil;

/**
 * Similarity-ranked retrieval over stored chunks with metadata filters.
 *
 * <p>Semantic mode embeds the query, loads up to {@code limit * overFetchMultiplier}
 * embedded candidates matching the filters, ranks them by cosine similarity and drops
 * those below the relevance threshold. Ties are broken by newer document first, then by
 * document id and position. Speaker-turn and time-window results are enriched with the
 * text of their neighbours.</p>
 *
 * <p>Text mode is used when semantic search is disabled, when the query cannot be
 * embedded, or when no embedded chunk matches the filters. It ranks substring matches
 * by document recency.</p>
 *
 * <p>A candidate whose stored vector is unreadable is skipped and counted; it never fails
 * the search.</p>
 */
public class SimilaritySearchService {

    private static final Logger LOG = Logger.getLogger(SimilaritySearchService.class);

    static final Comparator<SearchResult> RANKING = Comparator
        .comparing((SearchResult result) -> result.similarity(), Comparator.nullsLast(Comparator.reverseOrder()))
        .thenComparing(SearchResult::documentDate, Comparator.nullsLast(Comparator.reverseOrder()))
        .thenComparing(SearchResult::documentId)
        .thenComparingInt(SearchResult::position);

    private final EmbeddingClient embeddingClient;
    private final ChunkStore chunkStore;
    private final SearchSettings settings;

    public SimilaritySearchService(final EmbeddingClient embeddingClient, final ChunkStore chunkStore,
            final SearchSettings settings) {
        this.embeddingClient = embeddingClient;
        this.chunkStore = chunkStore;
        this.settings = settings;
    }

    /**
     * Runs a semantic search, falling back to text mode where semantic ranking is not possible.
     * A blank query yields an empty response.
     */
    public SearchResponse search(@NotNull final String query, @Nullable final SearchFilters filters, final int limit) {
        final SearchFilters effectiveFilters = filters == null ? SearchFilters.none() : filters;
        if (query == null || query.isBlank()) {
            return SearchResponse.empty(query, settings.semanticEnabled() ? SearchMode.SEMANTIC : SearchMode.TEXT);
        }
        final int effectiveLimit = clampLimit(limit);

        if (!settings.semanticEnabled()) {
            return textSearch(query, effectiveFilters, effectiveLimit);
        }

        final List<CandidateChunk> candidates = chunkStore.findSearchCandidates(effectiveFilters,
            effectiveLimit * settings.overFetchMultiplier());
        if (candidates.isEmpty()) {
            LOG.debugf("No embedded chunk matches the filters, using text search for '%s'", query);
            return textSearch(query, effectiveFilters, effectiveLimit);
        }

        final float[] queryVector;
        try {
            queryVector = embeddingClient.embedOne(query);
        } catch (EmbeddingException e) {
            LOG.warnf("Query embedding failed, falling back to text search: %s", e.getMessage());
            return textSearch(query, effectiveFilters, effectiveLimit);
        }

        final List<SearchResult> ranked = new ArrayList<>();
        int skipped = 0;
        for (final CandidateChunk candidate : candidates) {
            final float[] vector = readVector(candidate, queryVector.length);
            if (vector == null) {
                skipped++;
                continue;
            }
            final double similarity = VectorMath.cosineSimilarity(queryVector, vector);
            if (similarity < settings.relevanceThreshold()) {
                continue;
            }
            ranked.add(toResult(candidate, Double.valueOf(similarity), null));
        }
        ranked.sort(RANKING);

        final List<SearchResult> top = ranked.subList(0, Math.min(effectiveLimit, ranked.size()));
        final List<SearchResult> results = new ArrayList<>(top.size());
        for (final SearchResult result : top) {
            results.add(withContext(result));
        }

        if (skipped > 0) {
            LOG.warnf("Skipped %d chunks with unusable embeddings while searching '%s'", Integer.valueOf(skipped), query);
        }
        LOG.debugf("Semantic search '%s': %d candidates, %d above threshold, %d returned",
            query, Integer.valueOf(candidates.size()), Integer.valueOf(ranked.size()), Integer.valueOf(results.size()));
        return new SearchResponse(query, SearchMode.SEMANTIC, results, skipped);
    }

    /**
     * Substring search ranked by document recency, with matches highlighted.
     */
    public SearchResponse textSearch(@NotNull final String query, @Nullable final SearchFilters filters,
            final int limit) {
        if (query == null || query.isBlank()) {
            return SearchResponse.empty(query, SearchMode.TEXT);
        }
        final SearchFilters effectiveFilters = filters == null ? SearchFilters.none() : filters;
        final List<CandidateChunk> matches = chunkStore.searchText(query, effectiveFilters, clampLimit(limit));

        final List<SearchResult> results = new ArrayList<>(matches.size());
        for (final CandidateChunk match : matches) {
            results.add(toResult(match, null, highlight(match.chunk().content(), query)));
        }
        LOG.debugf("Text search '%s' returned %d results", query, Integer.valueOf(results.size()));
        return new SearchResponse(query, SearchMode.TEXT, results, 0);
    }

    public FilterOptions filterOptions() {
        return chunkStore.filterOptions();
    }

    private int clampLimit(final int limit) {
        return Math.max(1, Math.min(limit, settings.maxLimit()));
    }

    @Nullable
    private static float[] readVector(final CandidateChunk candidate, final int dimension) {
        final byte[] blob = candidate.embeddingBlob();
        if (blob == null) {
            return null;
        }
        final float[] vector;
        try {
            vector = VectorCodec.decode(blob);
        } catch (IllegalArgumentException e) {
            LOG.debugf("Chunk %s has an undecodable embedding: %s", candidate.chunk().id(), e.getMessage());
            return null;
        }
        if (vector.length != dimension || !VectorMath.isFinite(vector)) {
            LOG.debugf("Chunk %s embedding has dimension %d (expected %d) or non-finite values",
                candidate.chunk().id(), Integer.valueOf(vector.length), Integer.valueOf(dimension));
            return null;
        }
        return vector;
    }

    private static SearchResult toResult(final CandidateChunk candidate, @Nullable final Double similarity,
            @Nullable final String highlight) {
        final Chunk chunk = candidate.chunk();
        final Instant date = candidate.documentDate();
        return new SearchResult(chunk.id(), chunk.documentId(), candidate.documentTitle(), date, chunk.type(),
            chunk.position(), chunk.content(), chunk.speaker(), chunk.startSeconds(), chunk.endSeconds(),
            similarity, null, null, highlight);
    }

    private SearchResult withContext(final SearchResult result) {
        if (result.type() != ChunkType.SPEAKER_TURN && result.type() != ChunkType.TIME_WINDOW) {
            return result;
        }
        final ChunkNeighbours neighbours;
        try {
            neighbours = chunkStore.findNeighbours(result.chunkId());
        } catch (RuntimeException e) {
            LOG.warnf("Context lookup for chunk %s failed: %s", result.chunkId(), e.getMessage());
            return result;
        }

        String before = null;
        final Chunk previous = neighbours.previous();
        if (previous != null && previous.type() == result.type() && withinWindowBefore(previous, result)) {
            before = TokenUtil.tailTokens(previous.content(), settings.contextTokens());
        }
        String after = null;
        final Chunk next = neighbours.next();
        if (next != null && next.type() == result.type() && withinWindowAfter(next, result)) {
            after = TokenUtil.headTokens(next.content(), settings.contextTokens());
        }
        return result.withContext(before, after);
    }

    private boolean withinWindowBefore(final Chunk previous, final SearchResult result) {
        if (previous.endSeconds() == null || result.startSeconds() == null) {
            return true;
        }
        return previous.endSeconds() >= result.startSeconds() - settings.contextWindowSeconds();
    }

    private boolean withinWindowAfter(final Chunk next, final SearchResult result) {
        if (next.startSeconds() == null || result.endSeconds() == null) {
            return true;
        }
        return next.startSeconds() <= result.endSeconds() + settings.contextWindowSeconds();
    }

    /**
     * Wraps every case-insensitive occurrence of {@code query} in {@code **}.
     */
    static String highlight(final String content, final String query) {
        final Matcher matcher = Pattern.compile(Pattern.quote(query.trim()),
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE).matcher(content);
        final StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement("**" + matcher.group() + "**"));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
