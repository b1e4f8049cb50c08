package br.edu.ifba.meetingrag.chunking;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import br.edu.ifba.meetingrag.extraction.EntityType;
import br.edu.ifba.meetingrag.extraction.ExtractedEntity;

/**
 * Heuristic chunk importance in [0, 1].
 *
 * <p>Base 0.3; +0.2 for a decision, +0.15 for an action item, +0.15 for a risk;
 * up to +0.1 for length relative to the target size and up to +0.1 for lexical
 * density (distinct words over words). Full-document chunks always score 1.0.</p>
 */
final class ImportanceScorer {

    private static final double BASE = 0.3;
    private static final double DECISION_BOOST = 0.2;
    private static final double ACTION_BOOST = 0.15;
    private static final double RISK_BOOST = 0.15;
    private static final double LENGTH_WEIGHT = 0.1;
    private static final double DENSITY_WEIGHT = 0.1;

    private static final Pattern WORD_SPLIT = Pattern.compile("[^\\p{L}\\p{N}']+");

    private final int targetTokens;

    ImportanceScorer(final int targetTokens) {
        this.targetTokens = targetTokens;
    }

    double score(final ChunkType type, final String content, final int tokenCount, final List<ExtractedEntity> entities) {
        return switch (type) {
            case FULL_DOCUMENT -> 1.0;
            case TIME_WINDOW, SPEAKER_TURN, TOPIC_SEGMENT -> scoreSegment(content, tokenCount, entities);
        };
    }

    private double scoreSegment(final String content, final int tokenCount, final List<ExtractedEntity> entities) {
        double score = BASE;
        if (contains(entities, EntityType.DECISION)) {
            score += DECISION_BOOST;
        }
        if (contains(entities, EntityType.ACTION_ITEM)) {
            score += ACTION_BOOST;
        }
        if (contains(entities, EntityType.RISK)) {
            score += RISK_BOOST;
        }
        score += LENGTH_WEIGHT * Math.min(1.0, (double) tokenCount / targetTokens);
        score += DENSITY_WEIGHT * lexicalDensity(content);
        return Math.round(Math.min(1.0, score) * 1000.0) / 1000.0;
    }

    private static boolean contains(final List<ExtractedEntity> entities, final EntityType type) {
        return entities.stream().anyMatch(entity -> entity.type() == type);
    }

    private static double lexicalDensity(final String content) {
        int total = 0;
        final Set<String> distinct = new HashSet<>();
        for (final String word : WORD_SPLIT.split(content)) {
            if (word.isEmpty()) {
                continue;
            }
            total++;
            distinct.add(word.toLowerCase(Locale.ROOT));
        }
        return total == 0 ? 0.0 : (double) distinct.size() / total;
    }
}
