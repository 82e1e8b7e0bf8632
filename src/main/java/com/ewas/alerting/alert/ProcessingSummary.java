package com.ewas.alerting.alert;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Counters of one pending-detection processing pass.
 */
@Value
@Builder
public class ProcessingSummary {

    int processed;
    int alertsCreated;
    int dismissed;
    int errors;
    Instant startTime;
    Instant endTime;
}
