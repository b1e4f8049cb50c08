package br.edu.ifba.meetingrag.extraction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jboss.logging.Logger;

/**
 * Pulls people, decisions, action items, risks, dates and topics out of free text.
 *
 * <p>Deterministic and side-effect free. Pattern rules come from an
 * {@link ExtractionRules} table; topics come from {@link TopicExtractor}.
 * Input longer than {@code maxTextLength} characters is cut to its head and the
 * result is flagged as truncated.</p>
 */
public final class EntityExtractor {

    private static final Logger LOG = Logger.getLogger(EntityExtractor.class);

    public static final int DEFAULT_MAX_TEXT_LENGTH = 50_000;
    public static final int DEFAULT_MAX_TOPICS = 5;

    private static final int MAX_VALUE_LENGTH = 300;
    private static final double DUPLICATE_SIMILARITY = 0.8;
    private static final double TOPIC_BASE_CONFIDENCE = 0.3;
    private static final double TOPIC_FREQUENCY_WEIGHT = 0.3;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LEADING_NOISE = Pattern.compile("^[\\s\"'*:,;\\-]+");
    private static final Pattern TRAILING_NOISE = Pattern.compile("[\\s\"'*.,;:!?\\-]+$");
    private static final Pattern LIST_SEPARATOR = Pattern.compile("\\s*(?:,|;|\\band\\b|&)\\s*");
    private static final Pattern METADATA_TAIL = Pattern.compile(
        "(?i)\\s*[,;(\\[-]?\\s*\\b(?:owner|assignee|assigned to|due)\\b\\s*:.*$");
    private static final Pattern OWNER = Pattern.compile(
        "(?i)\\b(?:owner|assignee|assigned to)\\s*:?\\s*([A-Za-z][a-z]+(?:\\s+[A-Z][a-z]+)?)");
    private static final Pattern DUE = Pattern.compile(
        "(?i)\\b(?:due|by)\\s*:?\\s*(\\d{4}-\\d{2}-\\d{2}|\\d{1,2}/\\d{1,2}(?:/\\d{2,4})?"
            + "|(?:next\\s+)?(?:monday|tuesday|wednesday|thursday|friday|saturday|sunday|week|month)"
            + "|tomorrow|end\\s+of\\s+(?:the\\s+)?(?:day|week|month|quarter)"
            + "|(?:jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*\\.?\\s+\\d{1,2})");

    private final ExtractionRules rules;
    private final TopicExtractor topicExtractor;
    private final int maxTextLength;

    public EntityExtractor() {
        this(ExtractionRules.defaults(), DEFAULT_MAX_TEXT_LENGTH, DEFAULT_MAX_TOPICS);
    }

    public EntityExtractor(final ExtractionRules rules, final int maxTextLength, final int maxTopics) {
        if (maxTextLength <= 0) {
            throw new IllegalArgumentException("maxTextLength must be positive");
        }
        this.rules = rules;
        this.maxTextLength = maxTextLength;
        this.topicExtractor = new TopicExtractor(maxTopics);
    }

    /**
     * Extracts entities from {@code text}. Empty or blank text yields an empty list.
     */
    public List<ExtractedEntity> extract(final String text) {
        return analyze(text).entities();
    }

    /**
     * Extracts entities and topics and reports whether the input had to be truncated.
     */
    public ExtractionResult analyze(final String text) {
        if (text == null || text.isBlank()) {
            return ExtractionResult.empty();
        }

        final boolean truncated = text.length() > maxTextLength;
        final String input = truncated ? text.substring(0, maxTextLength) : text;
        if (truncated) {
            LOG.debugf("Extraction input truncated from %d to %d characters",
                Integer.valueOf(text.length()), Integer.valueOf(maxTextLength));
        }

        final List<ExtractedEntity> found = new ArrayList<>();
        final Map<EntityType, List<int[]>> claimed = new EnumMap<>(EntityType.class);

        for (final ExtractionRule rule : rules.rules()) {
            final Matcher matcher = rule.pattern().matcher(input);
            while (matcher.find()) {
                if (overlapsClaimed(claimed, rule.type(), matcher.start(), matcher.end())) {
                    continue;
                }
                final String raw = matcher.group(rule.valueGroup());
                if (raw == null) {
                    continue;
                }
                final int valueOffset = matcher.start(rule.valueGroup());
                final List<String> values = rule.listValue()
                    ? Arrays.asList(LIST_SEPARATOR.split(raw))
                    : List.of(raw);

                boolean accepted = false;
                for (final String value : values) {
                    final ExtractedEntity entity = toEntity(rule, matcher, value, valueOffset);
                    if (entity != null) {
                        found.add(entity);
                        accepted = true;
                    }
                }
                if (accepted) {
                    claimed.computeIfAbsent(rule.type(), t -> new ArrayList<>())
                        .add(new int[] {matcher.start(), matcher.end()});
                }
            }
        }

        final List<TopicExtractor.TopicCount> topicCounts = topicExtractor.topics(input);
        final List<String> topics = new ArrayList<>(topicCounts.size());
        if (!topicCounts.isEmpty()) {
            final int maxCount = topicCounts.get(0).count();
            for (final TopicExtractor.TopicCount topic : topicCounts) {
                topics.add(topic.term());
                final double confidence = round(TOPIC_BASE_CONFIDENCE
                    + TOPIC_FREQUENCY_WEIGHT * topic.count() / maxCount);
                found.add(new ExtractedEntity(EntityType.TOPIC, topic.term(), confidence, null,
                    topic.firstOffset(), Map.of(ExtractedEntity.RULE, "keyword-frequency")));
            }
        }

        final List<ExtractedEntity> entities = deduplicate(found);
        entities.sort(Comparator.comparingInt(ExtractedEntity::offset)
            .thenComparing(ExtractedEntity::type)
            .thenComparing(ExtractedEntity::value));
        return new ExtractionResult(entities, topics, truncated);
    }

    /**
     * Merges near-duplicates of the same type, keeping the more confident entity.
     * Two values are duplicates when their normalized Levenshtein similarity exceeds 0.8.
     */
    public static List<ExtractedEntity> deduplicate(final List<ExtractedEntity> entities) {
        final Map<EntityType, List<ExtractedEntity>> byType = new EnumMap<>(EntityType.class);
        for (final ExtractedEntity candidate : entities) {
            final List<ExtractedEntity> kept = byType.computeIfAbsent(candidate.type(), t -> new ArrayList<>());
            final String normalized = normalize(candidate.value());
            int duplicateIndex = -1;
            for (int i = 0; i < kept.size(); i++) {
                if (isDuplicate(normalized, normalize(kept.get(i).value()))) {
                    duplicateIndex = i;
                    break;
                }
            }
            if (duplicateIndex < 0) {
                kept.add(candidate);
            } else if (candidate.confidence() > kept.get(duplicateIndex).confidence()) {
                kept.set(duplicateIndex, candidate);
            }
        }
        final List<ExtractedEntity> result = new ArrayList<>();
        byType.values().forEach(result::addAll);
        return result;
    }

    private ExtractedEntity toEntity(final ExtractionRule rule, final Matcher matcher, final String rawValue,
            final int valueOffset) {
        String value = clean(rawValue);
        final Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(ExtractedEntity.RULE, rule.name());

        switch (rule.type()) {
            case PERSON -> {
                value = cleanPersonName(value);
                if (value == null) {
                    return null;
                }
            }
            case ACTION_ITEM -> {
                collectActionMetadata(rule, matcher, value, metadata);
                value = clean(METADATA_TAIL.matcher(value).replaceFirst(""));
            }
            case DECISION, RISK, DATE, TOPIC -> {
                // value used as matched
            }
        }

        if (value.length() < 2) {
            return null;
        }
        return new ExtractedEntity(rule.type(), value, rule.confidence(), null, valueOffset, metadata);
    }

    private void collectActionMetadata(final ExtractionRule rule, final Matcher matcher, final String value,
            final Map<String, String> metadata) {
        String assignee = rule.assigneeGroup() > 0 ? matcher.group(rule.assigneeGroup()) : null;
        if (assignee == null) {
            final Matcher owner = OWNER.matcher(value);
            if (owner.find()) {
                assignee = owner.group(1);
            }
        }
        if (assignee != null && !ExtractionRules.PRONOUNS.contains(assignee.toLowerCase(Locale.ROOT))) {
            metadata.put(ExtractedEntity.ASSIGNEE, clean(assignee));
        }

        String due = rule.dueGroup() > 0 ? matcher.group(rule.dueGroup()) : null;
        if (due == null) {
            final Matcher dueMatcher = DUE.matcher(value);
            if (dueMatcher.find()) {
                due = dueMatcher.group(1);
            }
        }
        if (due != null && !clean(due).isEmpty()) {
            metadata.put(ExtractedEntity.DUE, clean(due));
        }
    }

    private static String cleanPersonName(final String value) {
        final List<String> words = new ArrayList<>(Arrays.asList(WHITESPACE.split(value)));
        while (!words.isEmpty()) {
            final String first = words.get(0).toLowerCase(Locale.ROOT);
            if (ExtractionRules.PRONOUNS.contains(first) || TopicExtractor.STOPWORDS.contains(first)) {
                words.remove(0);
            } else {
                break;
            }
        }
        if (words.isEmpty() || words.size() > 3) {
            return null;
        }
        final String name = String.join(" ", words);
        if (ExtractionRules.isNonPersonLabel(name) || !Character.isUpperCase(name.charAt(0))) {
            return null;
        }
        return name;
    }

    private static String clean(final String value) {
        String cleaned = WHITESPACE.matcher(value).replaceAll(" ");
        cleaned = LEADING_NOISE.matcher(cleaned).replaceFirst("");
        cleaned = TRAILING_NOISE.matcher(cleaned).replaceFirst("");
        if (cleaned.length() > MAX_VALUE_LENGTH) {
            cleaned = cleaned.substring(0, MAX_VALUE_LENGTH).trim();
        }
        return cleaned;
    }

    private static boolean overlapsClaimed(final Map<EntityType, List<int[]>> claimed, final EntityType type,
            final int start, final int end) {
        final List<int[]> spans = claimed.get(type);
        if (spans == null) {
            return false;
        }
        for (final int[] span : spans) {
            if (start < span[1] && span[0] < end) {
                return true;
            }
        }
        return false;
    }

    private static boolean isDuplicate(final String a, final String b) {
        if (a.equals(b)) {
            return true;
        }
        final int longest = Math.max(a.length(), b.length());
        if (longest == 0 || Math.abs(a.length() - b.length()) > longest * (1.0 - DUPLICATE_SIMILARITY)) {
            return false;
        }
        return TextSimilarity.levenshtein(a, b) > DUPLICATE_SIMILARITY;
    }

    private static String normalize(final String value) {
        return value.toLowerCase(Locale.ROOT).trim();
    }

    private static double round(final double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
