package com.ewas.alerting.publish;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of publishing one detection. Successful when at least one system holds the alert.
 */
@Value
@Builder(toBuilder = true)
public class PublishResult {

    String detectionId;
    String templateId;
    String taskId;
    Instant startTime;
    Instant endTime;
    boolean success;
    @Singular("published")
    List<SystemOutcome> publishedAlerts;
    @Singular("failed")
    List<SystemOutcome> failedSystems;
    /**
     * Failures worth another attempt, i.e. configured systems that did not answer.
     */
    boolean retryable;
    int attempts;
    String errorMessage;
}
