package com.ewas.alerting.detector.surge;

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
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConflictSurgeDetector")
class ConflictSurgeDetectorTest {

    private static final Instant START = Instant.parse("2024-05-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-05-08T00:00:00Z");

    private InMemoryReadingSource readings;

    @BeforeEach
    void setUp() {
        readings = new InMemoryReadingSource();
    }

    private ConflictSurgeDetector detector() {
        ConflictSurgeSettings settings = new ConflictSurgeSettings();
        settings.setLookbackPeriodDays(28);
        DetectorConfig config = DetectorConfig.builder().id("d1").name("Conflict surge").type(ConflictSurgeDetector.KEY).build();
        return new ConflictSurgeDetector(config, settings,
            new DetectorContext(readings, null, Clock.fixed(END, ZoneOffset.UTC)));
    }

    private InMemoryReadingSource events(String locationId, double value, String... days) {
        for (String day : days) {
            Instant date = Instant.parse(day + "T00:00:00Z");
            readings.add(Reading.builder()
                .id(locationId + "-" + day)
                .variableCode("acled_events")
                .variableName("Conflict events")
                .locationId(locationId)
                .locationName("Locality " + locationId)
                .adminLevel(2)
                .startDate(date)
                .endDate(date)
                .value(value)
                .build());
        }
        return readings;
    }

    // ========== Surge ==========

    @Test
    @DisplayName("Recent total against the per-period historical average")
    void testSurge() {
        events("L1", 5.0, "2024-04-05", "2024-04-12", "2024-04-19", "2024-04-26");
        events("L1", 5.0, "2024-05-02", "2024-05-04", "2024-05-06");

        List<DetectionCandidate> candidates = detector().detect(START, END);

        assertEquals(1, candidates.size());
        DetectionCandidate candidate = candidates.get(0);
        assertEquals(15.0, candidate.getDetail().get("recent_count"));
        assertEquals(5.0, candidate.getDetail().get("historical_average"));
        assertEquals(3.0, (Double) candidate.getDetail().get("surge_factor"), 1e-9);
        assertEquals(7L, candidate.getDetail().get("analysis_period_days"));
        assertEquals(3, candidate.getDetail().get("events_analyzed"));
        assertEquals(2.0 / 3.0, candidate.getConfidenceScore(), 1e-9);
        assertEquals(END, candidate.getTimestamp());
        assertEquals("Conflict", candidate.getCategory());
        assertEquals("L1", candidate.getLocations().get(0).id());
    }

    @Test
    @DisplayName("Small increases, too few events and missing history do not fire")
    void testNoSurge() {
        events("L1", 10.0, "2024-04-05", "2024-04-12", "2024-04-19", "2024-04-26");
        events("L1", 6.0, "2024-05-02", "2024-05-04");
        events("L2", 3.0, "2024-05-02");
        events("L2", 1.0, "2024-04-10");
        events("L3", 8.0, "2024-05-03");

        assertTrue(detector().detect(START, END).isEmpty());
    }

    @Test
    @DisplayName("History only counts readings of the same location before the window")
    void testBaselineIsPerLocation() {
        events("L1", 1.0, "2024-04-05");
        events("L2", 100.0, "2024-04-05");
        events("L1", 6.0, "2024-05-02");

        List<DetectionCandidate> candidates = detector().detect(START, END);

        assertEquals(1, candidates.size());
        assertEquals(0.25, candidates.get(0).getDetail().get("historical_average"));
        assertEquals(0.95, candidates.get(0).getConfidenceScore(), 1e-9);
    }

    @Test
    @DisplayName("Sub-day windows fall back to the configured analysis period")
    void testShortWindow() {
        assertEquals(7, detector().analysisPeriodDays(END, END.plusSeconds(3600)));
        assertEquals(14, detector().analysisPeriodDays(START, START.plusSeconds(14 * 86_400)));
    }

    // ========== Alert shaping ==========

    @Test
    @DisplayName("Severity follows the surge factor")
    void testSeverity() {
        ConflictSurgeDetector detector = detector();
        assertEquals(5, detector.calculateSeverity(detection(6.0)));
        assertEquals(4, detector.calculateSeverity(detection(3.0)));
        assertEquals(3, detector.calculateSeverity(detection(2.5)));
        assertEquals(2, detector.calculateSeverity(detection(1.5)));
        assertEquals(1, detector.calculateSeverity(detection(1.2)));
        assertEquals(1, detector.calculateSeverity(Detection.builder().build()));
    }

    @Test
    @DisplayName("Template context carries the surge figures")
    void testTemplateContext() {
        Map<String, Object> context = detector().templateContext(detection(3.0));

        assertEquals(3.0, context.get("surge_factor"));
        assertEquals(0, context.get("recent_count"));
        assertEquals(ConflictSurgeDetector.KEY, context.get("detector_type"));
    }

    private static Detection detection(double factor) {
        return Detection.builder().detail(new LinkedHashMap<>(Map.of("surge_factor", factor))).build();
    }
}
