package com.ewas.alerting.detector.scoring;

import com.ewas.alerting.detector.schema.ConfigurationBinder;
import com.ewas.alerting.model.Reading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FieldRule")
class FieldRuleTest {

    private final ConfigurationBinder binder = new ConfigurationBinder();

    private FieldRule rule(Map<String, Object> rules) {
        ScoringSettings settings = binder.bind("rules", ScoringDetector.SCHEMA,
            Map.of("field_scores", Map.of("field", rules)), ScoringSettings.class);
        return settings.getFieldScores().get("field");
    }

    // ========== Rule kinds ==========

    @Test
    @DisplayName("Contains rules check every list item, by name for objects")
    void testContainsOnLists() {
        FieldRule sum = rule(Map.of("contains", Map.of("conflict", 4, "protest", 2)));
        FieldRule max = rule(Map.of("_mode", "max", "contains", Map.of("conflict", 4, "protest", 2)));
        List<Object> topics = List.of(Map.of("name", "Armed Conflict"), "Protest");

        assertEquals(6.0, sum.score(topics), 1e-9);
        assertEquals(4.0, max.score(topics), 1e-9);
    }

    @Test
    @DisplayName("Numeric rules parse text values and add every satisfied operator")
    void testNumeric() {
        FieldRule numeric = rule(Map.of("numeric", Map.of(
            ">=", Map.of("threshold", 5, "score", 3),
            "<", Map.of("threshold", 10, "score", 1),
            "==", Map.of("threshold", 4, "score", 20))));

        assertEquals(4.0, numeric.score("7"), 1e-9);
        assertEquals(21.0, numeric.score(4), 1e-9);
        assertEquals(0.0, numeric.score("n/a"), 1e-9);
    }

    @Test
    @DisplayName("Regex is case-insensitive and exact match compares the text form")
    void testRegexAndExact() {
        FieldRule rule = rule(Map.of(
            "regex", Map.of("killed|dead", 6),
            "exact_match", Map.of("true", 1)));

        assertEquals(6.0, rule.score("Three people KILLED"), 1e-9);
        assertEquals(1.0, rule.score(Boolean.TRUE), 1e-9);
        assertEquals(0.0, rule.score(null), 1e-9);
    }

    // ========== Field paths ==========

    @Test
    @DisplayName("Paths support dots, indexes and the reading fallbacks")
    void testPaths() {
        Reading reading = Reading.builder()
            .text("body text")
            .locationName("Kassala")
            .rawPayload(Map.of(
                "estimatedEventLocation", List.of(Map.of("name", "Kassala town"), "second"),
                "alertTopics", List.of("a", "b")))
            .build();

        assertEquals("Kassala town", FieldPaths.resolve(reading, "estimatedEventLocation[0].name"));
        assertEquals("second", FieldPaths.resolve(reading, "estimatedEventLocation[1]"));
        assertNull(FieldPaths.resolve(reading, "estimatedEventLocation[5]"));
        assertNull(FieldPaths.resolve(reading, "alertType.name"));
        assertEquals(List.of("a", "b"), FieldPaths.resolve(reading, "alertTopics"));
        assertEquals("body text", FieldPaths.resolve(reading, FieldPaths.TEXT_FALLBACK));
        assertEquals("Kassala", FieldPaths.resolve(reading, FieldPaths.LOCATION_FALLBACK));
        assertEquals("estimatedEventLocation", FieldPaths.simpleName("estimatedEventLocation[0]"));
    }
}
