package com.ewas.alerting.dedup;

import com.ewas.alerting.config.AlertFrameworkProperties;
import com.ewas.alerting.detector.schema.ConfigurationSchema;
import com.ewas.alerting.model.Detection;
import com.ewas.alerting.model.DetectorConfig;
import com.ewas.alerting.store.DetectionStore;
import com.ewas.alerting.store.DetectorConfigStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * DeduplicationEngine - recognizes detections that describe an already-detected event.
 *
 * Checks run in order and stop at the first match:
 * <ol>
 *   <li>exact: same detector, same event timestamp, same location set</li>
 *   <li>temporal: same detector and category, within the temporal window, Jaccard overlap of locations above the minimum</li>
 *   <li>geographic: same detector and category, since one geographic window before, locations in an ancestor/descendant relation</li>
 * </ol>
 * Only pending, non-duplicate detections are candidate originals. Any failure is treated as
 * "not a duplicate". Checks of one detector whose event times fall within the widest
 * window of each other are serialized.
 */
@Slf4j
@Component
public class DeduplicationEngine {

    private final DetectionStore detectionStore;
    private final DetectorConfigStore detectorConfigStore;
    private final LocationHierarchy locationHierarchy;
    private final AlertFrameworkProperties.Deduplication settings;

    // Weak values: a lock stays cached for as long as some check holds it
    private final Cache<String, Object> bucketLocks = Caffeine.newBuilder()
        .weakValues()
        .build();

    public DeduplicationEngine(DetectionStore detectionStore,
                               DetectorConfigStore detectorConfigStore,
                               LocationHierarchy locationHierarchy,
                               AlertFrameworkProperties properties) {
        this.detectionStore = detectionStore;
        this.detectorConfigStore = detectorConfigStore;
        this.locationHierarchy = locationHierarchy;
        this.settings = properties.getDeduplication();
    }

    /**
     * Check a persisted detection, looking up its detector's configuration.
     */
    public boolean isDuplicate(Detection detection) {
        DetectorConfig detector;
        try {
            detector = detectorConfigStore.findById(detection.getDetectorId()).orElse(null);
        } catch (RuntimeException e) {
            log.error("[DEDUP] Cannot load detector {} for detection {}: {}",
                detection.getDetectorId(), detection.getId(), e.getMessage());
            return false;
        }
        return isDuplicate(detection, detector);
    }

    /**
     * Check a persisted detection; when it is a duplicate it is linked to its original,
     * dismissed and saved.
     */
    public boolean isDuplicate(Detection detection, DetectorConfig detector) {
        try {
            if (detector != null && detector.isFlagEnabled(ConfigurationSchema.DISABLE_DEDUPLICATION)) {
                log.info("[DEDUP] Deduplication disabled for detector {}, allowing detection {}",
                    detector.getName(), detection.getId());
                return false;
            }
            if (!detection.isPending()) {
                return detection.isDuplicate();
            }

            List<String> keys = lockKeys(detection, lockBucketWidth());
            Object first = bucketLocks.get(keys.get(0), key -> new Object());
            Object second = bucketLocks.get(keys.get(1), key -> new Object());
            synchronized (first) {
                synchronized (second) {
                    return linkToOriginal(detection);
                }
            }
        } catch (RuntimeException e) {
            log.error("[DEDUP] Deduplication check failed for detection {}: {}", detection.getId(), e.getMessage());
            return false;
        }
    }

    private boolean linkToOriginal(Detection detection) {
        Optional<Match> match = findOriginal(detection);
        if (match.isEmpty()) {
            return false;
        }
        Detection original = match.get().original();
        detection.markDuplicate(original);
        detectionStore.save(detection);
        log.info("[DEDUP] {} duplicate: detection {} duplicates {}",
            match.get().type(), detection.getId(), original.getId());
        return true;
    }

    Optional<Match> findOriginal(Detection detection) {
        Optional<Detection> exact = guarded("exact", detection, () -> findExactDuplicate(detection));
        if (exact.isPresent()) {
            return exact.map(d -> new Match(DuplicateMatch.EXACT, d));
        }
        Optional<Detection> temporal = guarded("temporal", detection, () -> findTemporalDuplicate(detection));
        if (temporal.isPresent()) {
            return temporal.map(d -> new Match(DuplicateMatch.TEMPORAL, d));
        }
        return guarded("geographic", detection, () -> findGeographicDuplicate(detection))
            .map(d -> new Match(DuplicateMatch.GEOGRAPHIC, d));
    }

    private Optional<Detection> findExactDuplicate(Detection detection) {
        Set<String> locations = locationsOf(detection);
        if (locations.isEmpty()) {
            return Optional.empty();
        }
        Instant ts = detection.getEventTimestamp();
        return candidates(detection, ts, ts).stream()
            .filter(candidate -> locations.equals(locationsOf(candidate)))
            .findFirst();
    }

    private Optional<Detection> findTemporalDuplicate(Detection detection) {
        Set<String> locations = locationsOf(detection);
        if (locations.isEmpty()) {
            return Optional.empty();
        }
        Instant ts = detection.getEventTimestamp();
        return candidates(detection, ts.minus(settings.getTemporalWindow()), ts.plus(settings.getTemporalWindow())).stream()
            .filter(candidate -> Objects.equals(candidate.getCategory(), detection.getCategory()))
            .filter(candidate -> jaccard(locations, locationsOf(candidate)) >= settings.getMinLocationOverlap())
            .findFirst();
    }

    private Optional<Detection> findGeographicDuplicate(Detection detection) {
        Set<String> locations = locationsOf(detection);
        if (locations.isEmpty()) {
            return Optional.empty();
        }
        Instant since = detection.getEventTimestamp().minus(settings.getGeographicWindow());
        for (Detection candidate : candidates(detection, since, null)) {
            if (Objects.equals(candidate.getCategory(), detection.getCategory())
                && hasHierarchicalRelationship(locations, locationsOf(candidate))) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Any pair in an ancestor/descendant relation. An unreadable hierarchy relates nothing.
     */
    boolean hasHierarchicalRelationship(Set<String> first, Set<String> second) {
        for (String a : first) {
            for (String b : second) {
                try {
                    if (locationHierarchy.isAncestorOrDescendant(a, b)) {
                        return true;
                    }
                } catch (RuntimeException e) {
                    log.warn("[DEDUP] Hierarchy lookup failed for {} / {}, treating as unrelated: {}", a, b, e.getMessage());
                }
            }
        }
        return false;
    }

    static double jaccard(Set<String> first, Set<String> second) {
        Set<String> intersection = new HashSet<>(first);
        intersection.retainAll(second);
        if (intersection.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(first);
        union.addAll(second);
        return (double) intersection.size() / union.size();
    }

    private List<Detection> candidates(Detection detection, Instant from, Instant to) {
        return detectionStore.findPendingOriginals(detection.getDetectorId(), from, to).stream()
            .filter(candidate -> candidate.getId() != null && !candidate.getId().equals(detection.getId()))
            .filter(candidate -> candidate.getDuplicateOf() == null && candidate.isPending())
            .toList();
    }

    private Optional<Detection> guarded(String check, Detection detection, Supplier<Optional<Detection>> lookup) {
        try {
            return lookup.get();
        } catch (RuntimeException e) {
            log.error("[DEDUP] {} duplicate check failed for detection {}: {}", check, detection.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private static Set<String> locationsOf(Detection detection) {
        return detection.getLocationIds() == null ? Set.of() : new HashSet<>(detection.getLocationIds());
    }

    private Duration lockBucketWidth() {
        Duration temporal = settings.getTemporalWindow();
        Duration geographic = settings.getGeographicWindow();
        return temporal.compareTo(geographic) >= 0 ? temporal : geographic;
    }

    /**
     * Lock keys of a detection: its time bucket and the next one, in ascending order.
     * Buckets are as wide as the widest lookup window, so two detections close enough to
     * match each other always share a key.
     */
    static List<String> lockKeys(Detection detection, Duration bucketWidth) {
        Instant ts = detection.getEventTimestamp();
        if (ts == null) {
            String key = detection.getDetectorId() + "|none";
            return List.of(key, key);
        }
        long bucket = Math.floorDiv(ts.toEpochMilli(), Math.max(1L, bucketWidth.toMillis()));
        return List.of(detection.getDetectorId() + "|" + bucket, detection.getDetectorId() + "|" + (bucket + 1));
    }

    record Match(DuplicateMatch type, Detection original) {
    }
}
