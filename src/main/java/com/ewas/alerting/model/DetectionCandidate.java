package com.ewas.alerting.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output record of a detector before persistence.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionCandidate {

    private String title;
    private Instant timestamp;

    @Builder.Default
    private List<LocationRef> locations = new ArrayList<>();

    private Double confidenceScore;
    private String category;

    /**
     * Echoed verbatim into Detection.detail.
     */
    @Builder.Default
    private Map<String, Object> detail = new LinkedHashMap<>();
}
