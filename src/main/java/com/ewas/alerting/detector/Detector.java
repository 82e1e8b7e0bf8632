package com.ewas.alerting.detector;

import com.ewas.alerting.model.Detection;
import com.ewas.alerting.model.DetectionCandidate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A configured detector instance.
 *
 * {@link #detect} turns readings in a window into candidates; the remaining methods
 * shape the alert generated from a persisted detection of this detector.
 */
public interface Detector {

    /**
     * Operator-facing name of the configured instance.
     */
    String name();

    /**
     * Registry key of the variant.
     */
    String type();

    /**
     * Scan readings in [start, end]. Bad records are logged and skipped, never thrown.
     */
    List<DetectionCandidate> detect(Instant start, Instant end);

    /**
     * Severity 1 (lowest) to 5 (critical).
     */
    int calculateSeverity(Detection detection);

    /**
     * Variant-specific template variables, merged over the generic context.
     */
    Map<String, Object> templateContext(Detection detection);

    String dataSourceReference(Detection detection);

    Duration validityPeriod(Detection detection);
}
