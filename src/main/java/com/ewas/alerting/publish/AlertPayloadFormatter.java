package com.ewas.alerting.publish;

import com.ewas.alerting.alert.DetectionContext;
import com.ewas.alerting.model.AlertTemplate;
import com.ewas.alerting.model.Detection;
import com.ewas.alerting.model.Location;
import com.ewas.alerting.store.LocationStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders a detection through a template into the JSON payload external systems accept.
 */
@Component
@RequiredArgsConstructor
public class AlertPayloadFormatter {

    static final String EXTERNAL_ID_PREFIX = "ewas-";
    static final String SOURCE_SYSTEM = "EWAS";

    private final LocationStore locationStore;

    public Map<String, Object> format(Detection detection, AlertTemplate template, String language) {
        Map<String, Object> context = DetectionContext.of(detection);
        String title = template.renderTitle(context);
        String content = template.renderText(context);

        Map<String, Object> source = new LinkedHashMap<>();
        source.put("system", SOURCE_SYSTEM);
        source.put("detector", detection.getDetectorName());
        source.put("detector_type", detection.getDetectorType());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("detection_id", detection.getId());
        metadata.put("detector_id", detection.getDetectorId());
        metadata.put("template_id", template.getId());
        if (detection.getDetail() != null) {
            metadata.putAll(detection.getDetail());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", EXTERNAL_ID_PREFIX + detection.getId());
        payload.put("title", title.isBlank() ? "Alert from " + detection.getDetectorName() : title);
        payload.put("content", content.isBlank() ? "Alert detected" : content);
        payload.put("language", language);
        payload.put("severity", severityFor(detection.getConfidenceScore()));
        payload.put("source", source);
        payload.put("timestamp", detection.getEventTimestamp() == null ? null : detection.getEventTimestamp().toString());
        payload.put("created_at", detection.getCreatedAt() == null ? null : detection.getCreatedAt().toString());
        payload.put("confidence_score", detection.getConfidenceScore());
        payload.put("locations", locations(detection));
        payload.put("metadata", metadata);
        return payload;
    }

    /**
     * critical >= 0.9, high >= 0.7, medium >= 0.4, otherwise low.
     */
    public static String severityFor(Double confidence) {
        double score = confidence == null ? 0.0 : confidence;
        if (score >= 0.9) {
            return "critical";
        }
        if (score >= 0.7) {
            return "high";
        }
        if (score >= 0.4) {
            return "medium";
        }
        return "low";
    }

    private List<Map<String, Object>> locations(Detection detection) {
        if (detection.getLocationIds() == null || detection.getLocationIds().isEmpty()) {
            return List.of();
        }
        Map<String, Location> known = locationStore.findAllById(detection.getLocationIds()).stream()
            .collect(Collectors.toMap(Location::getId, Function.identity(), (a, b) -> a));

        List<Map<String, Object>> result = new ArrayList<>();
        for (String id : detection.getLocationIds()) {
            Location location = known.get(id);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", id);
            entry.put("name", location == null ? id : location.getName());
            if (location != null && location.getAdminLevel() != null) {
                entry.put("admin_level", location.getAdminLevel());
            }
            result.add(entry);
        }
        return result;
    }
}
