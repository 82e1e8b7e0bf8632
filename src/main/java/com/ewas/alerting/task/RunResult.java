package com.ewas.alerting.task;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of one detector run.
 */
@Value
@Builder(toBuilder = true)
public class RunResult {

    String detectorId;
    String taskId;
    Instant startTime;
    Instant endTime;
    Instant windowStart;
    Instant windowEnd;
    boolean success;
    int detectionsCreated;
    int detectionsDuplicates;

    /**
     * Alerts from the processing pass triggered by this run, null when none ran.
     */
    Integer alertsCreated;
    String processingError;
    int attempts;
    String errorMessage;
}
