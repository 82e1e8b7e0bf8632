package com.ewas.alerting.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Detection - a candidate event materialized from a detector run.
 *
 * A detection starts PENDING and ends in exactly one of PROCESSED or DISMISSED.
 * A detection that references an original (duplicateOf) is always DISMISSED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Document(collection = "detections")
@CompoundIndexes({
    @CompoundIndex(name = "detector_status_ts_idx", def = "{'detectorId': 1, 'status': 1, 'eventTimestamp': -1}"),
    @CompoundIndex(name = "status_created_idx", def = "{'status': 1, 'createdAt': 1}")
})
public class Detection {

    @Id
    private String id;

    // ==================== ORIGIN ====================
    @Indexed
    private String detectorId;
    private String detectorName;
    private String detectorType;

    // ==================== EVENT ====================
    private String title;
    private Instant eventTimestamp;

    /**
     * Confidence in [0.0, 1.0], null when the detector does not score.
     */
    private Double confidenceScore;

    /**
     * Categorical type (shock type name), optional.
     */
    private String category;

    @Builder.Default
    private Set<String> locationIds = new LinkedHashSet<>();

    /**
     * Detector-specific payload, persisted and returned verbatim.
     */
    @Builder.Default
    private Map<String, Object> detail = new LinkedHashMap<>();

    // ==================== LIFECYCLE ====================
    @Builder.Default
    private DetectionStatus status = DetectionStatus.PENDING;

    @Indexed(sparse = true)
    private String duplicateOf;

    private String alertId;

    private Instant createdAt;
    private Instant processedAt;

    @JsonIgnore
    public boolean isPending() {
        return status == DetectionStatus.PENDING;
    }

    @JsonIgnore
    public boolean isDuplicate() {
        return duplicateOf != null;
    }

    /**
     * Mark as processed, optionally linking the generated alert.
     */
    public void markProcessed(String generatedAlertId) {
        requirePending("processed");
        this.status = DetectionStatus.PROCESSED;
        this.alertId = generatedAlertId;
        this.processedAt = Instant.now();
    }

    public void markDismissed() {
        requirePending("dismissed");
        this.status = DetectionStatus.DISMISSED;
        this.processedAt = Instant.now();
    }

    /**
     * Link this detection to its original and dismiss it.
     */
    public void markDuplicate(Detection original) {
        requirePending("duplicate");
        if (original == null || original.getId() == null) {
            throw new IllegalArgumentException("Original detection must be persisted");
        }
        if (original.getId().equals(id)) {
            throw new IllegalArgumentException("Detection cannot duplicate itself: " + id);
        }
        this.duplicateOf = original.getId();
        this.status = DetectionStatus.DISMISSED;
        this.processedAt = Instant.now();
    }

    private void requirePending(String target) {
        if (status != DetectionStatus.PENDING) {
            throw new IllegalStateException(String.format(
                "Detection %s is %s and cannot be marked %s", id, status, target));
        }
    }
}
