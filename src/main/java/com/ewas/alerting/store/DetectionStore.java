package com.ewas.alerting.store;

import com.ewas.alerting.model.Detection;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of detections.
 */
public interface DetectionStore {

    Detection save(Detection detection);

    Optional<Detection> findById(String id);

    /**
     * Pending detections of a detector that are not duplicates, with event time in [from, to].
     *
     * @param to inclusive upper bound, null for unbounded
     */
    List<Detection> findPendingOriginals(String detectorId, Instant from, Instant to);

    /**
     * Pending, non-duplicate detections, oldest first.
     */
    List<Detection> findPendingForProcessing(int limit);
}
