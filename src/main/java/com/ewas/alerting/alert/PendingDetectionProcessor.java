package com.ewas.alerting.alert;

import com.ewas.alerting.detector.Detector;
import com.ewas.alerting.detector.DetectorRegistry;
import com.ewas.alerting.exception.DetectorConfigurationException;
import com.ewas.alerting.model.Alert;
import com.ewas.alerting.model.Detection;
import com.ewas.alerting.model.DetectorConfig;
import com.ewas.alerting.store.AlertStore;
import com.ewas.alerting.store.DetectionStore;
import com.ewas.alerting.store.DetectorConfigStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns pending, non-duplicate detections into alerts, oldest first.
 *
 * Outcomes per detection:
 * <ul>
 *   <li>alert created (or already present from an earlier pass): PROCESSED and linked</li>
 *   <li>detector gone or no longer buildable: DISMISSED</li>
 *   <li>any other failure: counted as error, left PENDING for the next pass</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PendingDetectionProcessor {

    private final DetectionStore detectionStore;
    private final DetectorConfigStore detectorConfigStore;
    private final AlertStore alertStore;
    private final DetectorRegistry detectorRegistry;
    private final AlertGenerator alertGenerator;
    private final Clock clock;

    public ProcessingSummary processPendingDetections(int maxDetections) {
        Instant start = clock.instant();
        List<Detection> pending = detectionStore.findPendingForProcessing(maxDetections);

        int processed = 0;
        int alertsCreated = 0;
        int dismissed = 0;
        int errors = 0;
        Map<String, Optional<Detector>> detectors = new HashMap<>();

        for (Detection detection : pending) {
            try {
                Optional<Alert> existing = alertStore.findByDetectionId(detection.getId());
                if (existing.isPresent()) {
                    detection.markProcessed(existing.get().getId());
                    detectionStore.save(detection);
                    processed++;
                    log.info("[ALERT-GEN] Detection {} already has alert {}, marked processed",
                        detection.getId(), existing.get().getId());
                    continue;
                }

                Optional<Detector> detector = detectors.computeIfAbsent(detection.getDetectorId(), this::buildDetector);
                if (detector.isEmpty()) {
                    detection.markDismissed();
                    detectionStore.save(detection);
                    processed++;
                    dismissed++;
                    continue;
                }

                Alert alert = alertStore.save(alertGenerator.generate(detection, detector.get()));
                detection.markProcessed(alert.getId());
                detectionStore.save(detection);
                processed++;
                alertsCreated++;
                log.info("[ALERT-GEN] Alert {} created for detection {}: '{}' severity={}",
                    alert.getId(), detection.getId(), alert.getTitle(), alert.getSeverity());
            } catch (RuntimeException e) {
                errors++;
                log.error("[ALERT-GEN] Failed to process detection {}: {}", detection.getId(), e.getMessage());
            }
        }

        ProcessingSummary summary = ProcessingSummary.builder()
            .processed(processed)
            .alertsCreated(alertsCreated)
            .dismissed(dismissed)
            .errors(errors)
            .startTime(start)
            .endTime(clock.instant())
            .build();
        log.info("[ALERT-GEN] Detection processing completed: processed={}, alertsCreated={}, dismissed={}, errors={}",
            processed, alertsCreated, dismissed, errors);
        return summary;
    }

    private Optional<Detector> buildDetector(String detectorId) {
        Optional<DetectorConfig> config = detectorConfigStore.findById(detectorId);
        if (config.isEmpty()) {
            log.warn("[ALERT-GEN] Detector {} no longer exists, dismissing its detections", detectorId);
            return Optional.empty();
        }
        try {
            return Optional.of(detectorRegistry.create(config.get()));
        } catch (DetectorConfigurationException e) {
            log.warn("[ALERT-GEN] Detector {} cannot be built, dismissing its detections: {}", detectorId, e.getMessage());
            return Optional.empty();
        }
    }
}
