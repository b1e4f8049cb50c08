package br.edu.ifba.meetingrag.search;

public enum SearchMode {
    /** Ranked by cosine similarity to the query embedding. */
    SEMANTIC,
    /** Substring match ranked by document recency. */
    TEXT
}
