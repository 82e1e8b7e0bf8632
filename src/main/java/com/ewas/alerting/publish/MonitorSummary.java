package com.ewas.alerting.publish;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class MonitorSummary {

    Instant startTime;
    Instant endTime;
    int checkedAlerts;
    int statusUpdates;
    int errors;
    @Singular("health")
    Map<String, SystemHealth> apiHealth;
}
