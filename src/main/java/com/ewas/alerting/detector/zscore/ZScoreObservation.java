package com.ewas.alerting.detector.zscore;

import lombok.Builder;
import lombok.Value;

/**
 * Scored bucket of one location's series.
 */
@Value
@Builder
public class ZScoreObservation {

    SeriesPoint point;
    double baselineMean;
    double baselineStd;
    int baselinePeriods;
    double zscore;
    double zscoreAbs;
    AlertLevel alertLevel;
    boolean sufficientBaseline;
    double percentDeviation;

    public String direction() {
        return zscore > 0 ? "above_baseline" : "below_baseline";
    }
}
