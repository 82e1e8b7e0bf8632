package com.ewas.alerting.publish;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of an update or cancellation of one published alert.
 */
@Value
@Builder(toBuilder = true)
public class PublicationUpdateResult {

    String publishedAlertId;
    String taskId;
    Instant startTime;
    Instant endTime;
    boolean success;
    int attempts;
    String errorMessage;
}
