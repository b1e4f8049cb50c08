package br.edu.ifba.meetingrag.search;

import java.util.List;

/**
 * @param mode how the results were ranked
 * @param skippedCorrupt candidates ignored because their stored vector could not be used
 */
public record SearchResponse(String query, SearchMode mode, List<SearchResult> results, int skippedCorrupt) {

    public SearchResponse {
        results = List.copyOf(results);
    }

    static SearchResponse empty(String query, SearchMode mode) {
        return new SearchResponse(query, mode, List.of(), 0);
    }

    public int count() {
        return results.size();
    }
}
