package com.ewas.alerting.task;

import com.ewas.alerting.alert.PendingDetectionProcessor;
import com.ewas.alerting.alert.ProcessingSummary;
import com.ewas.alerting.config.AlertFrameworkProperties;
import com.ewas.alerting.dedup.DeduplicationEngine;
import com.ewas.alerting.detector.Detector;
import com.ewas.alerting.detector.DetectorRegistry;
import com.ewas.alerting.exception.DetectorUnavailableException;
import com.ewas.alerting.model.Detection;
import com.ewas.alerting.model.DetectionCandidate;
import com.ewas.alerting.model.DetectorConfig;
import com.ewas.alerting.model.LocationRef;
import com.ewas.alerting.store.DetectionStore;
import com.ewas.alerting.store.DetectorConfigStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One pass of a detector over a window: detect, persist, deduplicate in emission order,
 * record run statistics, then turn new detections into alerts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DetectorRunService {

    private final DetectorConfigStore detectorConfigStore;
    private final DetectionStore detectionStore;
    private final DetectorRegistry detectorRegistry;
    private final DeduplicationEngine deduplicationEngine;
    private final PendingDetectionProcessor pendingDetectionProcessor;
    private final AlertFrameworkProperties properties;
    private final Clock clock;

    /**
     * @param start inclusive window start, defaults to the configured lookback before {@code end}
     * @param end   inclusive window end, defaults to now
     * @throws DetectorUnavailableException when the detector is unknown or inactive
     */
    public RunResult run(String detectorId, Instant start, Instant end) {
        Instant executionStart = clock.instant();
        DetectorConfig config = detectorConfigStore.findById(detectorId)
            .orElseThrow(() -> new DetectorUnavailableException("Detector " + detectorId + " not found"));
        if (!config.isActive()) {
            throw new DetectorUnavailableException("Detector " + config.getName() + " is not active");
        }

        Instant windowEnd = end != null ? end : executionStart;
        Instant windowStart = start != null ? start : windowEnd.minus(properties.getProcessing().getDefaultLookback());
        if (windowStart.isAfter(windowEnd)) {
            throw new IllegalArgumentException("Window start " + windowStart + " is after end " + windowEnd);
        }

        Detector detector = detectorRegistry.create(config);
        log.info("[DETECTOR-RUN] Running {} ({}) over {} .. {}", config.getName(), config.getType(), windowStart, windowEnd);

        List<DetectionCandidate> candidates = detector.detect(windowStart, windowEnd);
        int created = 0;
        int duplicates = 0;
        for (DetectionCandidate candidate : candidates) {
            Detection detection = detectionStore.save(toDetection(config, candidate));
            if (deduplicationEngine.isDuplicate(detection, config)) {
                duplicates++;
            } else {
                created++;
            }
        }

        config.recordRun(executionStart, created);
        detectorConfigStore.save(config);

        RunResult.RunResultBuilder result = RunResult.builder()
            .detectorId(detectorId)
            .startTime(executionStart)
            .windowStart(windowStart)
            .windowEnd(windowEnd)
            .success(true)
            .detectionsCreated(created)
            .detectionsDuplicates(duplicates);

        if (created > 0) {
            try {
                ProcessingSummary summary = pendingDetectionProcessor.processPendingDetections(
                    properties.getProcessing().getMaxPendingPerPass());
                result.alertsCreated(summary.getAlertsCreated());
            } catch (RuntimeException e) {
                log.error("[DETECTOR-RUN] Processing after run of {} failed: {}", config.getName(), e.getMessage());
                result.processingError(e.getMessage());
            }
        }

        log.info("[DETECTOR-RUN] {} completed: candidates={}, created={}, duplicates={}",
            config.getName(), candidates.size(), created, duplicates);
        return result.endTime(clock.instant()).build();
    }

    static Detection toDetection(DetectorConfig config, DetectionCandidate candidate) {
        Set<String> locationIds = new LinkedHashSet<>();
        if (candidate.getLocations() != null) {
            candidate.getLocations().stream().map(LocationRef::id).forEach(locationIds::add);
        }
        String title = candidate.getTitle() == null || candidate.getTitle().isBlank()
            ? "Detection from " + config.getName()
            : candidate.getTitle();

        return Detection.builder()
            .detectorId(config.getId())
            .detectorName(config.getName())
            .detectorType(config.getType())
            .title(title)
            .eventTimestamp(candidate.getTimestamp())
            .confidenceScore(candidate.getConfidenceScore())
            .category(candidate.getCategory())
            .locationIds(locationIds)
            .detail(candidate.getDetail() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(candidate.getDetail()))
            .build();
    }
}
