package com.ewas.alerting.detector;

import com.ewas.alerting.detector.classification.ModelCache;
import com.ewas.alerting.reading.ReadingSource;

import java.time.Clock;
import java.time.Duration;

/**
 * Collaborators shared by every detector built in one process.
 *
 * @param defaultValidity validity of alerts from detectors that do not derive their own
 */
public record DetectorContext(ReadingSource readingSource, ModelCache modelCache, Clock clock, Duration defaultValidity) {

    public static final Duration DEFAULT_VALIDITY = Duration.ofDays(7);

    public DetectorContext {
        if (defaultValidity == null || defaultValidity.isZero() || defaultValidity.isNegative()) {
            throw new IllegalArgumentException("defaultValidity must be positive, got " + defaultValidity);
        }
    }

    public DetectorContext(ReadingSource readingSource, ModelCache modelCache, Clock clock) {
        this(readingSource, modelCache, clock, DEFAULT_VALIDITY);
    }
}
