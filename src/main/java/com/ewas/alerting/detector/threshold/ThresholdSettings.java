package com.ewas.alerting.detector.threshold;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class ThresholdSettings {

    private String variableCode;
    private double thresholdValue;
    private String operator = "gt";
    private Integer adminLevel;
    private boolean useDynamicConfidence = true;

    /**
     * Fixed confidence, used only when dynamic confidence is off.
     */
    private double confidenceScore = 1.0;

    /**
     * Ignore the requested window and evaluate the latest readings.
     */
    private boolean useLatestData = false;

    public ComparisonOperator comparison() {
        return ComparisonOperator.fromCode(operator);
    }
}
