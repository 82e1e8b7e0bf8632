package com.ewas.alerting.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DetectorConfig - operator-owned definition of a detector instance.
 *
 * The pipeline only mutates the run statistics (lastRun, runCount, detectionCount).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Document(collection = "detectors")
public class DetectorConfig {

    @Id
    private String id;

    @Indexed(unique = true)
    private String name;

    private String description;

    /**
     * Stable registry key of the detector variant (e.g. "zscore").
     */
    private String type;

    @Builder.Default
    private Map<String, Object> configuration = new LinkedHashMap<>();

    @Builder.Default
    private boolean active = true;

    // ==================== RUN STATISTICS ====================
    private Instant lastRun;
    private long runCount;
    private long detectionCount;

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Boolean configuration flag, absent means false.
     */
    public boolean isFlagEnabled(String key) {
        Object value = configuration == null ? null : configuration.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    public void recordRun(Instant runStart, int createdDetections) {
        this.lastRun = runStart;
        this.runCount++;
        this.detectionCount += createdDetections;
        this.updatedAt = Instant.now();
    }

    @JsonIgnore
    public double getAverageDetectionsPerRun() {
        return runCount == 0 ? 0.0 : (double) detectionCount / runCount;
    }

    /**
     * Share of runs that produced detections, estimated from averages; null before the first run.
     */
    @JsonIgnore
    public Double getSuccessRate() {
        if (runCount == 0) {
            return null;
        }
        return Math.min(1.0, getAverageDetectionsPerRun());
    }
}
