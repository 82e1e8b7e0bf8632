package com.ewas.alerting.detector.scoring;

import com.ewas.alerting.detector.DetectorContext;
import com.ewas.alerting.detector.schema.ConfigurationBinder;
import com.ewas.alerting.exception.DetectorConfigurationException;
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

@DisplayName("ScoringDetector")
class ScoringDetectorTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-03-31T00:00:00Z");

    private InMemoryReadingSource readings;
    private ConfigurationBinder binder;

    @BeforeEach
    void setUp() {
        readings = new InMemoryReadingSource();
        binder = new ConfigurationBinder();
    }

    private ScoringDetector detector(Map<String, Object> configuration) {
        ScoringSettings settings = binder.bind("Alert scoring", ScoringDetector.SCHEMA, configuration, ScoringSettings.class);
        DetectorConfig config = DetectorConfig.builder().id("d1").name("Alert scoring").type(ScoringDetector.KEY).build();
        return new ScoringDetector(config, settings, new DetectorContext(readings, null, Clock.fixed(END, ZoneOffset.UTC)));
    }

    private Map<String, Object> baseConfig() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("field_scores", Map.of("alertType.name", Map.of("exact_match", Map.of("Urgent", 5, "Flash", 10))));
        config.put("keyword_scores", Map.of("clash", 3, "armed", 2));
        config.put("location_multipliers", Map.of("kassala", 2.0));
        return config;
    }

    private Reading alert(String id, String locationId, String startedAt, String alertType, String headline) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("alertType", Map.of("name", alertType));
        if (headline != null) {
            raw.put("headline", headline);
        }
        Instant date = Instant.parse(startedAt);
        return Reading.builder()
            .id(id)
            .variableCode("alerts")
            .variableName("Alerts")
            .sourceName("Dataminr feed")
            .locationId(locationId)
            .locationName("SD-02".equals(locationId) ? "Kassala" : "Khartoum")
            .adminLevel(1)
            .startDate(date)
            .endDate(date)
            .rawPayload(raw)
            .build();
    }

    // ========== Scoring ==========

    @Test
    @DisplayName("Score is (base + field + keyword) times the location multiplier")
    void testScoreComposition() {
        readings.add(alert("a1", "SD-02", "2024-03-05T14:30:00Z", "Urgent", "Armed clash near the market"));

        List<DetectionCandidate> candidates = detector(baseConfig()).detect(START, END);

        assertEquals(1, candidates.size());
        DetectionCandidate candidate = candidates.get(0);
        assertEquals(22.0, (Double) candidate.getDetail().get("score"), 1e-9);
        assertEquals("high", candidate.getDetail().get("alert_level"));
        assertEquals(22.0 / 30.0, candidate.getConfidenceScore(), 1e-9);
        assertEquals("Armed clash near the market", candidate.getTitle());
        assertEquals(Instant.parse("2024-03-05T00:00:00Z"), candidate.getTimestamp());
        assertEquals("Conflict", candidate.getCategory());
        assertEquals(Map.of("name", "Urgent"), candidate.getDetail().get("raw_data_fields"));

        Map<?, ?> components = (Map<?, ?>) candidate.getDetail().get("score_components");
        assertEquals(Map.of("alertType.name", 5.0), components.get("field_scores"));
        assertEquals(5.0, components.get("keyword_score"));
        assertEquals(2.0, components.get("location_multiplier"));
    }

    @Test
    @DisplayName("Alerts under the minimum score are dropped; untitled alerts get a level title")
    void testMinimumScoreAndFallbackTitle() {
        readings.add(alert("a1", "SD-01", "2024-03-05T08:00:00Z", "Flash", null))
            .add(alert("a2", "SD-01", "2024-03-06T08:00:00Z", "Routine", "Market reopened"));

        List<DetectionCandidate> candidates = detector(baseConfig()).detect(START, END);

        assertEquals(1, candidates.size());
        assertEquals("Medium Priority Alert - 2024-03-05", candidates.get(0).getTitle());
    }

    @Test
    @DisplayName("Category mapping rules apply in order before the default category")
    void testCategoryMapping() {
        Map<String, Object> config = baseConfig();
        Map<String, Object> mapping = new LinkedHashMap<>();
        mapping.put("contains:flood", "Natural disasters");
        mapping.put("alertType.name==Flash", "Health emergencies");
        mapping.put("level==high", "Food security");
        config.put("shock_type_mapping", mapping);
        readings.add(alert("a1", "SD-01", "2024-03-05T08:00:00Z", "Flash", "Flood waters rising"))
            .add(alert("a2", "SD-01", "2024-03-06T08:00:00Z", "Flash", "Cholera cases reported"))
            .add(alert("a3", "SD-02", "2024-03-07T08:00:00Z", "Urgent", "Armed clash"))
            .add(alert("a4", "SD-01", "2024-03-08T08:00:00Z", "Urgent", "Armed clash"));

        List<DetectionCandidate> candidates = detector(config).detect(START, END);

        assertEquals(List.of("Natural disasters", "Health emergencies", "Food security", "Conflict"),
            candidates.stream().map(DetectionCandidate::getCategory).toList());
    }

    @Test
    @DisplayName("Source name filter is a case-insensitive fragment")
    void testSourceFilter() {
        readings.add(alert("a1", "SD-01", "2024-03-05T08:00:00Z", "Flash", "Armed clash"));
        Map<String, Object> config = baseConfig();

        config.put("source_name", "DATAMINR");
        assertEquals(1, detector(config).detect(START, END).size());

        config.put("source_name", "acled");
        assertTrue(detector(config).detect(START, END).isEmpty());
    }

    @Test
    @DisplayName("Unknown configuration keys are rejected")
    void testUnknownKey() {
        Map<String, Object> config = baseConfig();
        config.put("keywords", List.of("clash"));

        assertThrows(DetectorConfigurationException.class, () -> detector(config));
    }

    // ========== Clustering ==========

    @Test
    @DisplayName("Alerts at one location within the window form a cluster named after the highest level")
    void testClusters() {
        Map<String, Object> config = baseConfig();
        config.put("enable_clustering", true);
        readings.add(alert("a1", "SD-02", "2024-03-05T10:00:00Z", "Urgent", "Armed clash"))
            .add(alert("a2", "SD-02", "2024-03-05T13:00:00Z", "Flash", null))
            .add(alert("a3", "SD-02", "2024-03-05T22:00:00Z", "Flash", null))
            .add(alert("a4", "SD-01", "2024-03-05T11:00:00Z", "Flash", null));

        List<DetectionCandidate> candidates = detector(config).detect(START, END);

        assertEquals(5, candidates.size());
        DetectionCandidate cluster = candidates.get(4);
        assertEquals("Alert Cluster - High", cluster.getCategory());
        assertEquals(2, cluster.getDetail().get("cluster_size"));
        assertEquals(List.of("a1", "a2"), cluster.getDetail().get("reading_ids"));
        assertEquals(3.0, (Double) cluster.getDetail().get("time_span_hours"), 1e-9);
        assertEquals(Math.min(1.0, 22.0 / 20.0), cluster.getConfidenceScore(), 1e-9);
        assertEquals("SD-02", cluster.getLocations().get(0).id());
    }

    @Test
    @DisplayName("Clustering is off by default")
    void testClusteringOff() {
        readings.add(alert("a1", "SD-02", "2024-03-05T10:00:00Z", "Urgent", "Armed clash"))
            .add(alert("a2", "SD-02", "2024-03-05T11:00:00Z", "Urgent", "Armed clash"));

        assertEquals(2, detector(baseConfig()).detect(START, END).size());
    }
}
