package com.ewas.alerting.detector.scenario;

import com.ewas.alerting.detector.DetectorContext;
import com.ewas.alerting.model.Detection;
import com.ewas.alerting.model.DetectionCandidate;
import com.ewas.alerting.model.DetectorConfig;
import com.ewas.alerting.model.Reading;
import com.ewas.alerting.support.InMemoryReadingSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScenarioTestDetector")
class ScenarioTestDetectorTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");
    private static final Instant START = Instant.parse("2024-06-01T00:00:00Z");

    private InMemoryReadingSource readings;
    private ScenarioTestDetector detector;

    @BeforeEach
    void setUp() {
        readings = new InMemoryReadingSource();
        DetectorConfig config = DetectorConfig.builder().id("s1").name("Pipeline check").type(ScenarioTestDetector.KEY).build();
        detector = new ScenarioTestDetector(config, new ScenarioTestSettings(),
            new DetectorContext(readings, null, Clock.fixed(NOW, ZoneOffset.UTC)));
    }

    private static Reading reading(String id, Double value, Map<String, Object> payload) {
        return Reading.builder()
            .id(id)
            .variableCode("test_scenario")
            .locationId("loc-1")
            .locationName("Gedaref")
            .adminLevel(1)
            .startDate(Instant.parse("2024-06-10T00:00:00Z"))
            .endDate(Instant.parse("2024-06-10T00:00:00Z"))
            .value(value)
            .text("synthetic")
            .rawPayload(new LinkedHashMap<>(payload))
            .build();
    }

    // ========== Detection ==========

    @Test
    @DisplayName("Flagged payload of a known scenario fires with the mapped category")
    void testKnownScenario() {
        readings.add(reading("r1", 160.0, Map.of(
            "should_trigger_alert", true, "scenario", "Food Crisis", "threshold", 100, "variable", "food_prices")));

        List<DetectionCandidate> candidates = detector.detect(START, NOW);

        assertEquals(1, candidates.size());
        DetectionCandidate candidate = candidates.get(0);
        assertEquals("Food security", candidate.getCategory());
        assertEquals("Food security detected in Gedaref", candidate.getTitle());
        assertEquals(NOW, candidate.getTimestamp());
        assertEquals(0.8, candidate.getConfidenceScore(), 1e-9);
        assertEquals("r1", candidate.getDetail().get("source_data_point_id"));
    }

    @Test
    @DisplayName("Unflagged, unknown-scenario and low-confidence payloads are ignored")
    void testIgnored() {
        readings.add(reading("r1", 500.0, Map.of("should_trigger_alert", false, "scenario", "Food Crisis", "threshold", 100)))
            .add(reading("r2", 500.0, Map.of("should_trigger_alert", "true", "scenario", "Locusts", "threshold", 100)))
            .add(reading("r3", 101.0, Map.of("should_trigger_alert", true, "scenario", "Conflict Escalation", "threshold", 100)))
            .add(reading("r4", 1.0, Map.of("should_trigger_alert", "true", "scenario", "Conflict Escalation",
                "confidence_target", 0.92)));

        List<DetectionCandidate> candidates = detector.detect(START, NOW);

        assertEquals(1, candidates.size());
        assertEquals("Conflict", candidates.get(0).getCategory());
        assertEquals(0.92, candidates.get(0).getConfidenceScore());
    }

    @Test
    @DisplayName("A reading that cannot be scored is skipped without aborting the batch")
    void testBadReadingSkipped() {
        readings.add(reading("r1", 10.0, Map.of("should_trigger_alert", true, "scenario", "Food Crisis",
                "threshold", 0, "variable", "resource_availability")))
            .add(reading("r2", null, Map.of("should_trigger_alert", true, "scenario", "Food Crisis",
                "confidence_target", 0.75)));

        List<DetectionCandidate> candidates = detector.detect(START, NOW);

        assertEquals(1, candidates.size());
        assertEquals("r2", candidates.get(0).getDetail().get("source_data_point_id"));
    }

    // ========== Confidence ==========

    @Test
    @DisplayName("Confidence rules")
    void testConfidenceFor() {
        assertEquals(0.9, ScenarioTestDetector.confidenceFor(0.9, null, 0, ""));
        assertEquals(0.75, ScenarioTestDetector.confidenceFor(null, 25.0, 100, "resource_availability"), 1e-12);
        assertEquals(0.0, ScenarioTestDetector.confidenceFor(null, 150.0, 100, "resource_availability"));
        assertEquals(1.0, ScenarioTestDetector.confidenceFor(null, 300.0, 100, "food_prices"));
        assertEquals(0.8, ScenarioTestDetector.confidenceFor(null, 5.0, 0, "food_prices"));
        assertThrows(IllegalArgumentException.class,
            () -> ScenarioTestDetector.confidenceFor(null, null, 100, "food_prices"));
    }

    // ========== Alert shaping ==========

    @Test
    @DisplayName("Severity starts from the scenario and moves with confidence")
    void testSeverity() {
        assertEquals(5, detector.calculateSeverity(detection("Conflict Escalation", 0.95)));
        assertEquals(4, detector.calculateSeverity(detection("Conflict Escalation", 0.7)));
        assertEquals(5, detector.calculateSeverity(detection("Food Crisis", 0.9)));
        assertEquals(4, detector.calculateSeverity(detection("Food Crisis", 0.85)));
        assertEquals(2, detector.calculateSeverity(detection("Other", 0.5)));
        assertEquals(Duration.ofHours(24), detector.validityPeriod(detection("Food Crisis", 0.9)));
        assertEquals("Test Source", detector.dataSourceReference(detection("Food Crisis", 0.9)));
    }

    private static Detection detection(String scenario, double confidence) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("scenario", scenario);
        return Detection.builder().confidenceScore(confidence).detail(detail).build();
    }
}
