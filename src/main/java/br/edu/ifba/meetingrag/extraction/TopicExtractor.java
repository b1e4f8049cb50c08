package br.edu.ifba.meetingrag.extraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Frequency-based keyword extraction: stopword-filtered token counts, top-K.
 */
public final class TopicExtractor {

    private static final Pattern WORD = Pattern.compile("\\p{L}[\\p{L}'-]{3,}");

    private static final Pattern SPEAKER_PREFIX = Pattern.compile(
        "(?m)^\\s*(?:\\[?\\d{1,2}:\\d{2}(?::\\d{2})?\\]?\\s*)?[A-Z][\\p{L}'.-]*(?:\\s+[A-Z][\\p{L}'.-]*)?\\s*:");

    public static final Set<String> STOPWORDS = Set.of(
        "the", "and", "that", "this", "with", "have", "from", "they", "will", "would", "could", "should",
        "what", "when", "where", "which", "there", "their", "them", "then", "than", "been", "were", "into",
        "about", "also", "just", "like", "really", "very", "well", "here", "some", "more", "most", "much",
        "many", "only", "other", "over", "such", "each", "your", "yours", "ours", "mine", "does", "doing",
        "done", "make", "made", "said", "says", "going", "know", "think", "want", "need", "needs", "yeah",
        "okay", "right", "good", "great", "sure", "thanks", "thank", "maybe", "actually", "basically",
        "thing", "things", "something", "anything", "everything", "nothing", "kind", "sort", "stuff",
        "still", "even", "because", "though", "while", "after", "before", "again", "always", "never",
        "can't", "don't", "won't", "it's", "i'm", "we're", "they're", "that's", "there's", "let's",
        "gonna", "wanna", "let", "get", "got", "gets", "take", "took", "come", "came", "look", "looks",
        "people", "time", "today", "week", "next", "last", "first", "back", "around", "through", "being",
        "those", "these", "both", "either", "whether", "might", "must", "shall", "able", "whole", "same",
        "yes", "all", "any", "are", "was", "for", "not", "but", "you", "our", "out", "who", "how", "why",
        "him", "her", "his", "its", "has", "had", "did", "can", "may", "one", "two");

    private final int maxTopics;

    public TopicExtractor(final int maxTopics) {
        if (maxTopics < 0) {
            throw new IllegalArgumentException("maxTopics must be non-negative");
        }
        this.maxTopics = maxTopics;
    }

    /**
     * Returns the most frequent non-stopword terms, ties broken by first occurrence.
     * Speaker labels at line starts are ignored.
     */
    public List<TopicCount> topics(final String text) {
        if (text == null || text.isBlank() || maxTopics == 0) {
            return List.of();
        }
        final String body = maskSpeakerLabels(text);
        final Map<String, TopicCount> counts = new LinkedHashMap<>();
        final Matcher matcher = WORD.matcher(body);
        while (matcher.find()) {
            String word = matcher.group().toLowerCase(Locale.ROOT);
            if (word.endsWith("'s")) {
                word = word.substring(0, word.length() - 2);
            }
            if (word.length() < 4 || STOPWORDS.contains(word)) {
                continue;
            }
            final int offset = matcher.start();
            counts.merge(word, new TopicCount(word, 1, offset),
                (existing, added) -> new TopicCount(existing.term(), existing.count() + 1, existing.firstOffset()));
        }

        final List<TopicCount> ranked = new ArrayList<>(counts.values());
        ranked.sort(Comparator.comparingInt(TopicCount::count).reversed()
            .thenComparingInt(TopicCount::firstOffset));
        return List.copyOf(ranked.subList(0, Math.min(maxTopics, ranked.size())));
    }

    private static String maskSpeakerLabels(final String text) {
        final Matcher matcher = SPEAKER_PREFIX.matcher(text);
        final StringBuilder masked = new StringBuilder(text);
        while (matcher.find()) {
            for (int i = matcher.start(); i < matcher.end(); i++) {
                if (!Character.isWhitespace(masked.charAt(i))) {
                    masked.setCharAt(i, ' ');
                }
            }
        }
        return masked.toString();
    }

    /**
     * A term with its frequency and first character offset.
     */
    public record TopicCount(String term, int count, int firstOffset) {
    }
}
