package com.ewas.alerting.alert;

import com.ewas.alerting.detector.Detector;
import com.ewas.alerting.model.Alert;
import com.ewas.alerting.model.AlertTemplate;
import com.ewas.alerting.model.Detection;
import com.ewas.alerting.store.AlertTemplateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the alert for an accepted detection, from the best matching template or a default text.
 *
 * Template choice: an active template of the detection's category bound to the detector's
 * type, else one bound to no type. Severity, validity and source come from the detector.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertGenerator {

    private static final int MAX_HEADLINE_LENGTH = 200;

    private final AlertTemplateStore templateStore;
    private final Clock clock;

    public Alert generate(Detection detection, Detector detector) {
        Optional<AlertTemplate> template = findTemplate(detection, detector);

        String title;
        String text;
        if (template.isPresent()) {
            Map<String, Object> context = buildContext(detection, detector);
            title = template.get().renderTitle(context);
            text = template.get().renderText(context);
        } else {
            title = defaultTitle(detection);
            text = defaultText(detection, detector);
        }

        Instant now = clock.instant();
        int severity = Math.max(1, Math.min(5, detector.calculateSeverity(detection)));
        return Alert.builder()
            .detectionId(detection.getId())
            .title(title)
            .text(text)
            .category(detection.getCategory())
            .eventDate(DetectionContext.eventDate(detection))
            .locationIds(new ArrayList<>(detection.getLocationIds()))
            .severity(severity)
            .dataSource(detector.dataSourceReference(detection))
            .validFrom(now)
            .validUntil(now.plus(detector.validityPeriod(detection)))
            .build();
    }

    Optional<AlertTemplate> findTemplate(Detection detection, Detector detector) {
        if (detection.getCategory() == null) {
            return Optional.empty();
        }
        try {
            List<AlertTemplate> templates = templateStore.findActiveByCategory(detection.getCategory());
            Optional<AlertTemplate> specific = templates.stream()
                .filter(t -> detector.type().equals(t.getDetectorType()))
                .findFirst();
            if (specific.isPresent()) {
                return specific;
            }
            return templates.stream()
                .filter(t -> t.getDetectorType() == null || t.getDetectorType().isBlank())
                .findFirst();
        } catch (RuntimeException e) {
            log.error("[ALERT-GEN] Failed to load templates for category {}: {}", detection.getCategory(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Generic variables, detail entries as {@code detail.<key>}, then the detector's own variables.
     */
    Map<String, Object> buildContext(Detection detection, Detector detector) {
        Map<String, Object> context = DetectionContext.of(detection);
        context.put("detector_name", detector.name());
        context.putAll(detector.templateContext(detection));
        return context;
    }

    private String defaultTitle(Detection detection) {
        String category = detection.getCategory() != null ? detection.getCategory() : "Alert";
        return category + " detected in " + DetectionContext.locationText(detection);
    }

    private String defaultText(Detection detection, Detector detector) {
        String category = detection.getCategory() != null ? detection.getCategory() : "Alert";
        StringBuilder text = new StringBuilder()
            .append("A ").append(category.toLowerCase(Locale.ROOT))
            .append(" condition has been detected in ").append(DetectionContext.locationText(detection))
            .append(" on ").append(DetectionContext.eventDate(detection)).append('.');

        if (detection.getConfidenceScore() != null && detection.getConfidenceScore() > 0) {
            text.append(String.format(Locale.ROOT, " Detection confidence: %.1f%%", detection.getConfidenceScore() * 100));
        }
        text.append("\n\nDetected by: ").append(detector.name());

        Object headline = detection.getDetail() == null ? null : detection.getDetail().get("headline");
        if (headline != null && !headline.toString().isBlank()) {
            String value = headline.toString();
            text.append("\n\nSource: ").append(value, 0, Math.min(MAX_HEADLINE_LENGTH, value.length()));
        }
        return text.toString();
    }
}
