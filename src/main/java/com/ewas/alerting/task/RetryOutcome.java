package com.ewas.alerting.task;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Result of a supervised operation: value or last failure, plus the attempt history.
 */
@Value
@Builder
public class RetryOutcome<T> {

    String operationName;
    boolean success;
    T value;
    Exception lastFailure;
    int attempts;

    /**
     * True when the loop stopped on a non-retryable failure.
     */
    boolean terminal;

    @Singular
    List<Duration> backoffs;

    public String errorMessage() {
        return lastFailure == null ? null : lastFailure.getMessage();
    }
}
