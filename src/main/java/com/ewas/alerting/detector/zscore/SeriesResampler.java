package com.ewas.alerting.detector.zscore;

import com.ewas.alerting.model.Reading;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups readings by location and frequency bucket and aggregates each bucket.
 * Only buckets that received readings are emitted; empty periods are not filled.
 */
public class SeriesResampler {

    private final ResampleFrequency frequency;
    private final AggregationFunction aggregation;

    public SeriesResampler(ResampleFrequency frequency, AggregationFunction aggregation) {
        this.frequency = frequency;
        this.aggregation = aggregation;
    }

    /**
     * Series per location id, each ordered by bucket date. Readings without location, date or value are ignored.
     */
    public Map<String, List<SeriesPoint>> resample(List<Reading> readings) {
        List<Reading> usable = readings.stream()
            .filter(r -> r.getLocationId() != null && r.effectiveDate() != null && r.getValue() != null)
            .toList();
        if (usable.isEmpty()) {
            return Map.of();
        }

        LocalDate origin = usable.stream()
            .map(r -> day(r))
            .min(Comparator.naturalOrder())
            .orElseThrow();

        Map<String, TreeMap<LocalDate, Bucket>> grouped = new TreeMap<>();
        for (Reading reading : usable) {
            LocalDate bucketDate = frequency.bucketOf(day(reading), origin);
            grouped.computeIfAbsent(reading.getLocationId(), id -> new TreeMap<>())
                .computeIfAbsent(bucketDate, d -> new Bucket(reading))
                .values.add(reading.getValue());
        }

        Map<String, List<SeriesPoint>> series = new TreeMap<>();
        grouped.forEach((locationId, buckets) -> {
            List<SeriesPoint> points = new ArrayList<>(buckets.size());
            buckets.forEach((date, bucket) -> {
                double value = aggregation.apply(bucket.values);
                points.add(new SeriesPoint(locationId, bucket.locationName, bucket.adminLevel, date,
                    Double.isNaN(value) ? 0.0 : value));
            });
            series.put(locationId, points);
        });
        return series;
    }

    private static LocalDate day(Reading reading) {
        return reading.effectiveDate().atZone(ZoneOffset.UTC).toLocalDate();
    }

    private static final class Bucket {
        private final String locationName;
        private final Integer adminLevel;
        private final List<Double> values = new ArrayList<>();

        private Bucket(Reading first) {
            this.locationName = first.getLocationName();
            this.adminLevel = first.getAdminLevel();
        }
    }
}
