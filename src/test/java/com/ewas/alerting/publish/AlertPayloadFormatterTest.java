package com.ewas.alerting.publish;

import com.ewas.alerting.model.AlertTemplate;
import com.ewas.alerting.model.Detection;
import com.ewas.alerting.support.InMemoryLocationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AlertPayloadFormatter")
class AlertPayloadFormatterTest {

    private AlertPayloadFormatter formatter;
    private Detection detection;
    private AlertTemplate template;

    @BeforeEach
    void setUp() {
        formatter = new AlertPayloadFormatter(new InMemoryLocationStore().add("SD-02", "Kassala", 1, "SD"));
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("value", 140.0);
        detection = Detection.builder()
            .id("det-9")
            .detectorId("detector-1")
            .detectorName("Rainfall watch")
            .detectorType("threshold")
            .eventTimestamp(Instant.parse("2024-04-05T00:00:00Z"))
            .createdAt(Instant.parse("2024-04-05T06:00:00Z"))
            .category("Natural disasters")
            .confidenceScore(0.75)
            .locationIds(new LinkedHashSet<>(List.of("SD-02", "SD-99")))
            .detail(detail)
            .build();
        template = AlertTemplate.builder()
            .id("tpl-1")
            .title("{category} on {event_date}")
            .text("Rainfall reached {detail.value}")
            .build();
    }

    // ========== Payload ==========

    @Test
    @DisplayName("Payload carries id, rendered text, severity and source")
    void testFormat() {
        Map<String, Object> payload = formatter.format(detection, template, "fr");

        assertEquals("ewas-det-9", payload.get("id"));
        assertEquals("Natural disasters on 2024-04-05", payload.get("title"));
        assertEquals("Rainfall reached 140.0", payload.get("content"));
        assertEquals("fr", payload.get("language"));
        assertEquals("high", payload.get("severity"));
        assertEquals("2024-04-05T00:00:00Z", payload.get("timestamp"));
        assertEquals("2024-04-05T06:00:00Z", payload.get("created_at"));
        assertEquals(Map.of("system", "EWAS", "detector", "Rainfall watch", "detector_type", "threshold"),
            payload.get("source"));
    }

    @Test
    @DisplayName("Known locations get name and admin level, unknown ones keep the id")
    void testLocations() {
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> locations = (List<Map<String, Object>>) formatter
            .format(detection, template, "en").get("locations");

        assertEquals(2, locations.size());
        assertEquals(Map.of("id", "SD-02", "name", "Kassala", "admin_level", 1), locations.get(0));
        assertEquals(Map.of("id", "SD-99", "name", "SD-99"), locations.get(1));
    }

    @Test
    @DisplayName("Metadata merges detection detail with identifiers")
    void testMetadata() {
        @SuppressWarnings("unchecked")
        Map<String, Object> metadata = (Map<String, Object>) formatter
            .format(detection, template, "en").get("metadata");

        assertEquals("det-9", metadata.get("detection_id"));
        assertEquals("detector-1", metadata.get("detector_id"));
        assertEquals("tpl-1", metadata.get("template_id"));
        assertEquals(140.0, metadata.get("value"));
    }

    @Test
    @DisplayName("Blank renders fall back to generic title and content")
    void testFallbacks() {
        AlertTemplate empty = AlertTemplate.builder().id("tpl-2").title("{nothing}").build();

        Map<String, Object> payload = formatter.format(detection, empty, "en");

        assertEquals("Alert from Rainfall watch", payload.get("title"));
        assertEquals("Alert detected", payload.get("content"));
    }

    // ========== Severity ==========

    @Test
    @DisplayName("Severity bands follow confidence")
    void testSeverityFor() {
        assertEquals("critical", AlertPayloadFormatter.severityFor(0.9));
        assertEquals("high", AlertPayloadFormatter.severityFor(0.7));
        assertEquals("medium", AlertPayloadFormatter.severityFor(0.4));
        assertEquals("low", AlertPayloadFormatter.severityFor(0.39));
        assertEquals("low", AlertPayloadFormatter.severityFor(null));
    }
}
