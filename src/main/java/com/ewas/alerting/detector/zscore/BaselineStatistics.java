package com.ewas.alerting.detector.zscore;

/**
 * Trailing summary of the observations before the current one. Computed per run, never stored.
 */
public record BaselineStatistics(double mean, double std, int periods) {
}
