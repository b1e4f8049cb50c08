package br.edu.ifba.meetingrag.extraction;

import java.util.regex.Pattern;

/**
 * One row of the extraction rule table.
 *
 * @param name short identifier recorded in entity metadata
 * @param type entity type produced by matches
 * @param pattern regular expression applied to the whole text
 * @param valueGroup capture group holding the entity value
 * @param confidence confidence assigned to every match
 * @param assigneeGroup capture group holding an assignee, 0 if none
 * @param dueGroup capture group holding a due date, 0 if none
 * @param listValue whether the value is a comma/"and" separated list producing one entity per item
 */
public record ExtractionRule(
    String name,
    EntityType type,
    Pattern pattern,
    int valueGroup,
    double confidence,
    int assigneeGroup,
    int dueGroup,
    boolean listValue
) {

    public ExtractionRule {
        if (confidence <= 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Rule " + name + " has confidence outside (0, 1]: " + confidence);
        }
        if (valueGroup < 0 || valueGroup > pattern.matcher("").groupCount()) {
            throw new IllegalArgumentException("Rule " + name + " references missing group " + valueGroup);
        }
    }

    public static ExtractionRule of(final String name, final EntityType type, final String regex, final double confidence) {
        return new ExtractionRule(name, type, Pattern.compile(regex), 1, confidence, 0, 0, false);
    }

    public ExtractionRule withValueGroup(final int group) {
        return new ExtractionRule(name, type, pattern, group, confidence, assigneeGroup, dueGroup, listValue);
    }

    public ExtractionRule withAssigneeGroup(final int group) {
        return new ExtractionRule(name, type, pattern, valueGroup, confidence, group, dueGroup, listValue);
    }

    public ExtractionRule withDueGroup(final int group) {
        return new ExtractionRule(name, type, pattern, valueGroup, confidence, assigneeGroup, group, listValue);
    }

    public ExtractionRule asList() {
        return new ExtractionRule(name, type, pattern, valueGroup, confidence, assigneeGroup, dueGroup, true);
    }
}
