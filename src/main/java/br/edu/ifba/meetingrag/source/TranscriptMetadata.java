package br.edu.ifba.meetingrag.source;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Document classification inferred from a meeting title.
 *
 * @param category one of {@code standup}, {@code planning}, {@code retrospective}, {@code review},
 *                 {@code one-on-one} or {@code general}
 * @param tags up to {@link #MAX_TAGS} lower-case title words longer than three characters
 */
public record TranscriptMetadata(String category, List<String> tags) {

    public static final String GENERAL = "general";
    public static final int MAX_TAGS = 5;

    public TranscriptMetadata {
        tags = List.copyOf(tags);
    }

    public static TranscriptMetadata fromTitle(String title) {
        if (title == null || title.isBlank()) {
            return new TranscriptMetadata(GENERAL, List.of());
        }
        String lower = title.toLowerCase(Locale.ROOT);
        return new TranscriptMetadata(category(lower), tags(lower));
    }

    private static String category(String title) {
        if (title.contains("standup") || title.contains("stand-up") || title.contains("daily")) {
            return "standup";
        }
        if (title.contains("planning") || title.contains("sprint")) {
            return "planning";
        }
        if (title.contains("retro")) {
            return "retrospective";
        }
        if (title.contains("review")) {
            return "review";
        }
        if (title.contains("1:1") || title.contains("one-on-one") || title.contains("1-on-1")) {
            return "one-on-one";
        }
        return GENERAL;
    }

    private static List<String> tags(String title) {
        Set<String> tags = new LinkedHashSet<>();
        for (String word : title.split("\\s+")) {
            String cleaned = word.replaceAll("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$", "");
            if (cleaned.length() > 3) {
                tags.add(cleaned);
            }
            if (tags.size() == MAX_TAGS) {
                break;
            }
        }
        return new ArrayList<>(tags);
    }
}
