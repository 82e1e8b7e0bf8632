package com.ewas.alerting.detector.zscore;

import java.time.LocalDate;

/**
 * One aggregated bucket of one location's series.
 */
public record SeriesPoint(String locationId, String locationName, Integer adminLevel, LocalDate date, double value) {
}
