package com.ewas.alerting.detector.surge;

import com.ewas.alerting.detector.AbstractDetector;
import com.ewas.alerting.detector.DetectorContext;
import com.ewas.alerting.detector.DetectorDefinition;
import com.ewas.alerting.detector.schema.ConfigurationSchema;
import com.ewas.alerting.detector.schema.SchemaProperty;
import com.ewas.alerting.detector.schema.SchemaType;
import com.ewas.alerting.model.Detection;
import com.ewas.alerting.model.DetectionCandidate;
import com.ewas.alerting.model.DetectorConfig;
import com.ewas.alerting.model.LocationRef;
import com.ewas.alerting.model.Reading;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flags locations whose event count in the run window is a multiple of their historical average.
 *
 * The baseline sums the location's values over {@code lookback_period_days} ending one day
 * before the window and divides by the number of window-sized periods in the lookback.
 */
public class ConflictSurgeDetector extends AbstractDetector<ConflictSurgeSettings> {

    public static final String KEY = "conflict_surge";
    public static final String CATEGORY = "Conflict";

    static final ConfigurationSchema SCHEMA = ConfigurationSchema.forDetector("Conflict Surge Detector Configuration")
        .description("Detects unusual increases in conflict events against a historical baseline")
        .property("variable_code", SchemaProperty.builder()
            .type(SchemaType.STRING).description("Variable code for conflict event data").defaultValue("acled_events").build())
        .property("threshold_multiplier", SchemaProperty.number("Multiplier for surge detection threshold", 1.0, 10.0, 2.0))
        .property("min_events", SchemaProperty.integer("Minimum events required to trigger detection", 1, 100, 5))
        .property("analysis_period_days", SchemaProperty.integer("Length of analysis period in days", 1, 30, 7))
        .property("lookback_period_days", SchemaProperty.integer("Historical lookback period for the baseline", 7, 365, 30))
        .property("admin_level", SchemaProperty.integer("Administrative level for analysis (0=country, 2=locality)", 0, 5, 2))
        .required("variable_code")
        .additionalProperties(false)
        .build();

    public static final DetectorDefinition<ConflictSurgeSettings> DEFINITION = new DetectorDefinition<>(
        KEY, "Conflict surge", SCHEMA, ConflictSurgeSettings.class, ConflictSurgeDetector::new);

    public ConflictSurgeDetector(DetectorConfig config, ConflictSurgeSettings settings, DetectorContext context) {
        super(config, settings, context);
    }

    @Override
    public String type() {
        return KEY;
    }

    @Override
    protected List<Reading> loadData(Instant start, Instant end) {
        return readingSource.getReadings(settings.getVariableCode(), start, end, null, settings.getAdminLevel());
    }

    @Override
    public List<DetectionCandidate> detect(Instant start, Instant end) {
        List<Reading> readings = loadData(start, end);
        log.info("[DETECTOR-RUN] {} analysing {} {} readings in [{}, {}]",
            name(), readings.size(), settings.getVariableCode(), start, end);

        Map<String, List<Reading>> byLocation = new LinkedHashMap<>();
        for (Reading reading : readings) {
            if (reading.getLocationId() != null) {
                byLocation.computeIfAbsent(reading.getLocationId(), id -> new ArrayList<>()).add(reading);
            }
        }

        List<DetectionCandidate> candidates = new ArrayList<>();
        for (Map.Entry<String, List<Reading>> entry : byLocation.entrySet()) {
            try {
                analyseLocation(entry.getValue(), start, end).ifPresent(candidates::add);
            } catch (RuntimeException e) {
                log.warn("[DETECTOR-RUN] {} skipped location {}: {}", name(), entry.getKey(), e.getMessage());
            }
        }

        log.info("[DETECTOR-RUN] {} completed: surges={}, locations={}", name(), candidates.size(), byLocation.size());
        return candidates;
    }

    Optional<DetectionCandidate> analyseLocation(List<Reading> events, Instant start, Instant end) {
        double recent = sum(events);
        if (recent < settings.getMinEvents()) {
            return Optional.empty();
        }
        Reading first = events.get(0);
        long periodDays = analysisPeriodDays(start, end);
        Double average = historicalAverage(first.getLocationId(), start, periodDays);
        if (average == null || average == 0) {
            return Optional.empty();
        }

        double factor = recent / average;
        if (factor < settings.getThresholdMultiplier()) {
            return Optional.empty();
        }
        double confidence = Math.min(0.95, Math.max(0.1, (factor - 1.0) / 3.0));
        String locationName = first.getLocationName() != null ? first.getLocationName() : first.getLocationId();
        log.info("[DETECTOR-RUN] {} surge in {}: factor={}, recent={}, average={}",
            name(), locationName, String.format("%.2f", factor), recent, average);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("variable_code", settings.getVariableCode());
        detail.put("recent_count", recent);
        detail.put("historical_average", average);
        detail.put("surge_factor", factor);
        detail.put("threshold_multiplier", settings.getThresholdMultiplier());
        detail.put("analysis_period_days", periodDays);
        detail.put("lookback_period_days", settings.getLookbackPeriodDays());
        detail.put("events_analyzed", events.size());
        detail.put("detector_type", KEY);

        List<LocationRef> locations = new ArrayList<>();
        locations.add(first.toLocationRef());
        return Optional.of(DetectionCandidate.builder()
            .title(String.format("Conflict surge in %s: %.1fx the usual level", locationName, factor))
            .timestamp(end)
            .locations(locations)
            .confidenceScore(confidence)
            .category(CATEGORY)
            .detail(detail)
            .build());
    }

    /**
     * Whole days in the window, or the configured period when the window is shorter than a day.
     */
    long analysisPeriodDays(Instant start, Instant end) {
        long days = Duration.between(start, end).toDays();
        return days >= 1 ? days : settings.getAnalysisPeriodDays();
    }

    /**
     * Average total per analysis period over the lookback, null without historical data.
     */
    Double historicalAverage(String locationId, Instant start, long periodDays) {
        Instant historicalEnd = start.minus(Duration.ofDays(1));
        Instant historicalStart = historicalEnd.minus(Duration.ofDays(settings.getLookbackPeriodDays()));
        List<Reading> history = readingSource.getReadings(settings.getVariableCode(), historicalStart, historicalEnd,
            List.of(locationId), null);
        if (history.isEmpty()) {
            return null;
        }
        double periods = Math.max(1.0, (double) settings.getLookbackPeriodDays() / periodDays);
        return sum(history) / periods;
    }

    private static double sum(List<Reading> readings) {
        return readings.stream().mapToDouble(r -> r.getValue() == null ? 0.0 : r.getValue()).sum();
    }

    @Override
    public int calculateSeverity(Detection detection) {
        Double factor = detailNumber(detection, "surge_factor");
        double value = factor == null ? 1.0 : factor;
        if (value >= 5.0) {
            return 5;
        } else if (value >= 3.0) {
            return 4;
        } else if (value >= 2.0) {
            return 3;
        } else if (value >= 1.5) {
            return 2;
        }
        return 1;
    }

    @Override
    public Map<String, Object> templateContext(Detection detection) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("detector_type", KEY);
        for (String key : List.of("surge_factor", "recent_count", "historical_average", "events_analyzed", "analysis_period_days")) {
            Object value = detailValue(detection, key);
            context.put(key, value != null ? value : 0);
        }
        return context;
    }
}
