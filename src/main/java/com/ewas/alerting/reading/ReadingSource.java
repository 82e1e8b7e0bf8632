package com.ewas.alerting.reading;

import com.ewas.alerting.model.Reading;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Read-only access to indicator readings.
 *
 * A window selects readings whose [startDate, endDate] period overlaps it; a reading
 * without end date is treated as a point at its start date.
 * Without a window the result is latest-first (descending start date);
 * with a start or end it is chronological.
 */
public interface ReadingSource {

    List<Reading> getReadings(String variableCode, Instant start, Instant end,
                              Collection<String> locationIds, Integer adminLevel);

    default List<Reading> getReadings(String variableCode, Instant start, Instant end) {
        return getReadings(variableCode, start, end, null, null);
    }
}
