package br.edu.ifba.meetingrag.extraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Declarative table of labeled pattern rules.
 *
 * <p>Rules are kept sorted by descending confidence. The extractor walks them in
 * that order and a lower-confidence rule never re-reports text already claimed by
 * a stronger rule of the same type, so anchored cues ("Decision: ...") win over
 * bare keywords.</p>
 */
public final class ExtractionRules {

    private static final String MONTHS =
        "(?:Jan(?:uary)?|Feb(?:ruary)?|Mar(?:ch)?|Apr(?:il)?|May|June?|July?|Aug(?:ust)?|Sep(?:t(?:ember)?)?|Oct(?:ober)?|Nov(?:ember)?|Dec(?:ember)?)";

    private static final String WEEKDAYS = "(?:monday|tuesday|wednesday|thursday|friday|saturday|sunday)";

    /**
     * Labels that look like "Name:" prefixes but introduce structured content.
     * Compared lower-case.
     */
    public static final Set<String> NON_PERSON_LABELS = Set.of(
        "decision", "decided", "agreed", "resolved", "concluded",
        "action item", "action items", "action", "todo", "to-do", "task", "follow-up", "follow up", "next steps",
        "risk", "risks", "issue", "issues", "concern", "concerns", "problem", "problems", "blocker", "blockers",
        "note", "notes", "summary", "agenda", "owner", "assignee", "due", "date", "time", "duration",
        "participants", "attendees", "title", "topic", "topics", "keywords", "overview", "update", "question",
        "answer", "http", "https", "re", "fyi");

    public static final Set<String> PRONOUNS = Set.of(
        "i", "we", "you", "he", "she", "it", "they", "this", "that", "there", "everyone", "someone", "nobody",
        "somebody", "anyone", "one", "who", "what", "then", "so", "and", "but", "also", "maybe", "yes", "no");

    private static final ExtractionRules DEFAULT = new ExtractionRules(defaultRules());

    private final List<ExtractionRule> rules;

    public ExtractionRules(final List<ExtractionRule> rules) {
        final List<ExtractionRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingDouble(ExtractionRule::confidence).reversed());
        this.rules = List.copyOf(sorted);
    }

    public static ExtractionRules defaults() {
        return DEFAULT;
    }

    public List<ExtractionRule> rules() {
        return rules;
    }

    public static boolean isNonPersonLabel(final String label) {
        return NON_PERSON_LABELS.contains(label.trim().toLowerCase(Locale.ROOT));
    }

    private static List<ExtractionRule> defaultRules() {
        final List<ExtractionRule> rules = new ArrayList<>();

        // decisions
        rules.add(ExtractionRule.of("decision-label", EntityType.DECISION,
            "(?im)\\b(?:decision|decided|agreed|resolved|concluded)\\s*:\\s*([^\\n]+)", 0.95));
        rules.add(ExtractionRule.of("decision-phrase", EntityType.DECISION,
            "(?i)\\b(?:we|the team|it was|they|everyone|we've)\\s+(?:have\\s+|has\\s+)?(?:decided|agreed|resolved|concluded)\\s+(?:to|that|on|upon)\\s+([^.!?\\n]+)", 0.85));
        rules.add(ExtractionRule.of("decision-statement", EntityType.DECISION,
            "(?i)\\b(?:the\\s+)?(?:final\\s+)?decision\\s+(?:is|was)\\s+(?:to\\s+|that\\s+)?([^.!?\\n]+)", 0.8));
        rules.add(ExtractionRule.of("decision-going-forward", EntityType.DECISION,
            "(?i)\\bgoing\\s+forward,?\\s+(?:we|the\\s+team)\\s+(?:will|shall)\\s+([^.!?\\n]+)", 0.7));

        // action items
        rules.add(ExtractionRule.of("action-label", EntityType.ACTION_ITEM,
            "(?im)\\b(?:action\\s+items?|todo|to-do|task|follow[- ]up)\\s*:\\s*([^\\n]+)", 0.95));
        rules.add(ExtractionRule.of("action-named-owner", EntityType.ACTION_ITEM,
            "\\b(?!(?:We|I|It|They|This|That|There|You|He|She|Everyone|Someone|Nobody|What|Who)\\b)([A-Z][a-z]+)\\s+will\\s+([^.!?\\n]+)", 0.8)
            .withValueGroup(2).withAssigneeGroup(1));
        rules.add(ExtractionRule.of("action-deadline", EntityType.ACTION_ITEM,
            "(?i)\\b(?:need|needs)\\s+to\\s+([^.!?\\n]+?)\\s+by\\s+([^.!?\\n]+)", 0.75)
            .withDueGroup(2));
        rules.add(ExtractionRule.of("action-follow-up", EntityType.ACTION_ITEM,
            "(?i)\\b(?:i'll|i will|we'll|we will|will)\\s+follow\\s+up\\s+(?:on|with)\\s+([^.!?\\n]+)", 0.7));
        rules.add(ExtractionRule.of("action-will", EntityType.ACTION_ITEM,
            "(?i)\\b(?:we|i)\\s+will\\s+([^.!?\\n]{8,})", 0.5));

        // risks
        rules.add(ExtractionRule.of("risk-label", EntityType.RISK,
            "(?im)\\b(?:risks?|issues?|concerns?|problems?|blockers?)\\s*:\\s*([^\\n]+)", 0.9));
        rules.add(ExtractionRule.of("risk-phrase", EntityType.RISK,
            "(?i)\\b(?:there(?:'s| is) a risk (?:that|of)|at risk of|risk of|concerned (?:about|that)|worried (?:about|that)|blocked (?:by|on))\\s+([^.!?\\n]+)", 0.75));
        rules.add(ExtractionRule.of("risk-keyword", EntityType.RISK,
            "(?i)([^.!?\\n]*\\b(?:risks?|concerns?|blockers?|blocked)\\b[^.!?\\n]*)", 0.5));

        // dates
        rules.add(ExtractionRule.of("date-iso", EntityType.DATE,
            "\\b(\\d{4}-\\d{2}-\\d{2})\\b", 0.95));
        rules.add(ExtractionRule.of("date-month-day", EntityType.DATE,
            "\\b(" + MONTHS + "\\.?\\s+\\d{1,2}(?:st|nd|rd|th)?(?:,?\\s+\\d{4})?)\\b", 0.9));
        rules.add(ExtractionRule.of("date-numeric", EntityType.DATE,
            "\\b(\\d{1,2}/\\d{1,2}/\\d{2,4})\\b", 0.85));
        rules.add(ExtractionRule.of("date-relative", EntityType.DATE,
            "(?i)\\b((?:next|this|last)\\s+(?:week|month|quarter|year|" + WEEKDAYS + ")|tomorrow|end\\s+of\\s+(?:the\\s+)?(?:day|week|month|quarter))\\b", 0.7));

        // people
        rules.add(ExtractionRule.of("person-title", EntityType.PERSON,
            "\\b((?:Mr|Mrs|Ms|Dr|Prof)\\.?\\s+[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)?)", 0.95));
        rules.add(ExtractionRule.of("person-speaker", EntityType.PERSON,
            "(?m)^\\s*(?:\\[?\\d{1,2}:\\d{2}(?::\\d{2})?\\]?\\s*)?([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)?)\\s*:", 0.9));
        rules.add(ExtractionRule.of("person-participants", EntityType.PERSON,
            "(?im)^\\s*(?:participants|attendees)\\s*:\\s*([^\\n]+)", 0.85).asList());
        rules.add(ExtractionRule.of("person-reported-speech", EntityType.PERSON,
            "\\b([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)?)\\s+(?:said|mentioned|suggested|asked|noted|proposed|explained)\\b", 0.8));

        return rules;
    }
}
