package com.ewas.alerting.alert;

import com.ewas.alerting.model.Detection;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Template variables every detection offers, whatever detector produced it.
 */
public final class DetectionContext {

    private DetectionContext() {
    }

    public static Map<String, Object> of(Detection detection) {
        Map<String, Object> context = new LinkedHashMap<>();
        String locations = locationText(detection);
        List<String> locationIds = detection.getLocationIds() == null
            ? List.of() : new ArrayList<>(detection.getLocationIds());

        context.put("detection_id", detection.getId());
        context.put("detector_name", detection.getDetectorName());
        context.put("detection_timestamp", detection.getEventTimestamp());
        context.put("event_date", eventDate(detection));
        context.put("confidence_score", detection.getConfidenceScore());
        context.put("category", detection.getCategory());
        context.put("shock_type", detection.getCategory());
        context.put("title", detection.getTitle());
        context.put("locations", locations);
        context.put("location", locations);
        context.put("primary_location", locationIds.isEmpty() ? null : locationIds.get(0));
        if (detection.getDetail() != null) {
            detection.getDetail().forEach((key, value) -> context.put("detail." + key, value));
        }
        return context;
    }

    /**
     * Location name from the detail payload when the detector recorded one, else the ids.
     */
    public static String locationText(Detection detection) {
        Object name = detection.getDetail() == null ? null : detection.getDetail().get("location_name");
        if (name != null && !name.toString().isBlank()) {
            return name.toString();
        }
        if (detection.getLocationIds() == null || detection.getLocationIds().isEmpty()) {
            return "Unknown location";
        }
        return String.join(", ", detection.getLocationIds());
    }

    public static LocalDate eventDate(Detection detection) {
        Instant ts = detection.getEventTimestamp();
        return ts == null ? null : ts.atZone(ZoneOffset.UTC).toLocalDate();
    }
}
