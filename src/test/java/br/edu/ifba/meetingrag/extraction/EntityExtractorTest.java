package br.edu.ifba.meetingrag.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link EntityExtractor}.
 */
class EntityExtractorTest {

    private EntityExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new EntityExtractor();
    }

    private static List<ExtractedEntity> ofType(final List<ExtractedEntity> entities, final EntityType type) {
        return entities.stream().filter(entity -> entity.type() == type).toList();
    }

    @Nested
    @DisplayName("Pattern rules")
    class PatternRules {

        @Test
        @DisplayName("labelled decision is extracted with rule confidence")
        void extractsLabelledDecision() {
            final List<ExtractedEntity> entities =
                extractor.extract("Decision: We will use PostgreSQL for the new service.");

            final List<ExtractedEntity> decisions = ofType(entities, EntityType.DECISION);
            assertEquals(1, decisions.size());
            assertEquals("We will use PostgreSQL for the new service", decisions.get(0).value());
            assertEquals(0.95, decisions.get(0).confidence(), 1e-9);
            assertEquals("decision-label", decisions.get(0).metadata().get(ExtractedEntity.RULE));
        }

        @Test
        @DisplayName("named owner and due date become action item metadata")
        void extractsActionItemWithOwnerAndDue() {
            final List<ExtractedEntity> entities =
                extractor.extract("Alice will prepare the migration plan by Friday.");

            final List<ExtractedEntity> actions = ofType(entities, EntityType.ACTION_ITEM);
            assertEquals(1, actions.size());
            final ExtractedEntity action = actions.get(0);
            assertEquals("prepare the migration plan by Friday", action.value());
            assertEquals("Alice", action.metadata().get(ExtractedEntity.ASSIGNEE));
            assertEquals("Friday", action.metadata().get(ExtractedEntity.DUE));
        }

        @Test
        @DisplayName("stronger risk rule claims the span before the keyword rule")
        void riskPhraseWinsOverKeyword() {
            final List<ExtractedEntity> risks = ofType(
                extractor.extract("There is a risk that the vendor misses the deadline."), EntityType.RISK);

            assertEquals(1, risks.size());
            assertEquals("the vendor misses the deadline", risks.get(0).value());
            assertEquals(0.75, risks.get(0).confidence(), 1e-9);
        }

        @Test
        void extractsIsoAndWrittenDates() {
            final Set<String> dates = ofType(
                extractor.extract("The launch is on 2024-03-15 and the review on March 20, 2024."), EntityType.DATE)
                .stream().map(ExtractedEntity::value).collect(Collectors.toSet());

            assertTrue(dates.contains("2024-03-15"), "ISO date: " + dates);
            assertTrue(dates.contains("March 20, 2024"), "written date: " + dates);
        }

        @Test
        @DisplayName("participants list, titles and reported speech yield people, labels do not")
        void extractsPeople() {
            final String text = "Participants: Alice Smith, Bob Jones and Carol\nDr. Watson said the budget is fine.";

            final Set<String> people = ofType(extractor.extract(text), EntityType.PERSON)
                .stream().map(ExtractedEntity::value).collect(Collectors.toSet());

            assertEquals(Set.of("Alice Smith", "Bob Jones", "Carol", "Dr. Watson"), people);
        }

        @Test
        void entitiesAreOrderedByOffset() {
            final List<ExtractedEntity> entities = extractor.extract(
                "Risk: budget overrun\nDecision: hire two engineers\nTodo: draft the job post");

            for (int i = 1; i < entities.size(); i++) {
                assertTrue(entities.get(i - 1).offset() <= entities.get(i).offset());
            }
        }
    }

    @Nested
    @DisplayName("Topics and limits")
    class TopicsAndLimits {

        @Test
        void topicsAreRankedByFrequency() {
            final ExtractionResult result = extractor.analyze("budget budget budget roadmap roadmap hiring");

            assertEquals(List.of("budget", "roadmap", "hiring"), result.topics());
            final ExtractedEntity budget = ofType(result.entities(), EntityType.TOPIC).stream()
                .filter(entity -> entity.value().equals("budget")).findFirst().orElseThrow();
            assertEquals(0.6, budget.confidence(), 1e-9);
        }

        @Test
        void blankTextYieldsNothing() {
            assertTrue(extractor.extract("   ").isEmpty());
            assertTrue(extractor.extract(null).isEmpty());
            assertFalse(extractor.analyze("").truncated());
        }

        @Test
        void oversizedInputIsTruncatedAndFlagged() {
            final EntityExtractor small = new EntityExtractor(ExtractionRules.defaults(), 20, 5);

            final ExtractionResult result = small.analyze("Decision: adopt trunk based development for all teams");

            assertTrue(result.truncated());
            assertFalse(extractor.analyze("Decision: adopt trunk based development").truncated());
        }
    }

    @Nested
    @DisplayName("Deduplication")
    class Deduplication {

        @Test
        @DisplayName("near-duplicates keep the more confident entity")
        void keepsMoreConfidentDuplicate() {
            final List<ExtractedEntity> merged = EntityExtractor.deduplicate(List.of(
                new ExtractedEntity(EntityType.DECISION, "Use PostgreSQL", 0.7, null, 0, Map.of()),
                new ExtractedEntity(EntityType.DECISION, "use postgresql", 0.95, null, 40, Map.of())));

            assertEquals(1, merged.size());
            assertEquals(0.95, merged.get(0).confidence(), 1e-9);
        }

        @Test
        void differentTypesAreNeverMerged() {
            final List<ExtractedEntity> merged = EntityExtractor.deduplicate(List.of(
                new ExtractedEntity(EntityType.RISK, "vendor delay", 0.9, null, 0, Map.of()),
                new ExtractedEntity(EntityType.ACTION_ITEM, "vendor delay", 0.9, null, 0, Map.of())));

            assertEquals(2, merged.size());
        }

        @Test
        void distinctValuesSurvive() {
            final List<ExtractedEntity> merged = EntityExtractor.deduplicate(List.of(
                new ExtractedEntity(EntityType.PERSON, "Alice", 0.9, null, 0, Map.of()),
                new ExtractedEntity(EntityType.PERSON, "Bob", 0.9, null, 10, Map.of())));

            assertEquals(2, merged.size());
        }
    }
}
