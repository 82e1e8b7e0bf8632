package com.ewas.alerting.detector.zscore;

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
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-level Z-score anomaly detector over rolling per-location baselines.
 *
 * Readings are loaded from {@code window_size + 30} days before the window start so the
 * first buckets of the window already have a baseline, resampled per location to the
 * configured frequency, and scored. Only buckets inside the requested window with a
 * sufficient baseline and a level of at least {@code min_alert_level} are emitted.
 */
public class ZScoreDetector extends AbstractDetector<ZScoreSettings> {

    public static final String KEY = "zscore";

    private static final int EXTRA_LOOKBACK_DAYS = 30;

    static final ConfigurationSchema SCHEMA = ConfigurationSchema.forDetector("Z-score Detector Configuration")
        .description("Multi-level Z-score anomaly detection on rolling baselines")
        .property("variable_code", SchemaProperty.string("Variable code for the data to analyze"))
        .property("zscore_threshold_1", SchemaProperty.number("Z-score threshold for Low alert (Level 1)", 0.5, 5.0, 1.5))
        .property("zscore_threshold_2", SchemaProperty.number("Z-score threshold for Medium alert (Level 2)", 1.0, 5.0, 2.0))
        .property("zscore_threshold_3", SchemaProperty.number("Z-score threshold for High alert (Level 3)", 1.5, 5.0, 2.5))
        .property("zscore_threshold_4", SchemaProperty.number("Z-score threshold for Critical alert (Level 4)", 2.0, 10.0, 3.0))
        .property("window_size", SchemaProperty.integer("Number of periods in the sliding baseline window", 5, 365, 30))
        .property("min_baseline_periods", SchemaProperty.integer("Minimum periods required before alerting", 3, 100, 7))
        .property("freq", SchemaProperty.oneOf("Data aggregation frequency", "1D", "1D", "1W", "1M", "3M"))
        .property("min_std", SchemaProperty.number("Floor of the baseline standard deviation", 0.01, 1.0, 0.1))
        .property("admin_level", SchemaProperty.integer("Administrative level for analysis (0=country)", 0, 5, 2))
        .property("min_alert_level", SchemaProperty.integer("Minimum alert level to include in detections", 1, 4, 1))
        .property("aggregation_func", SchemaProperty.oneOf("Aggregation function for resampling", "mean",
            "mean", "sum", "max", "min", "std", "count"))
        .property("cause_variable_code", SchemaProperty.builder()
            .type(SchemaType.STRING)
            .description("Variable whose text gives the cause used for categorization")
            .defaultValue("iom_dtm_displacement")
            .build())
        .property("default_category", SchemaProperty.builder()
            .type(SchemaType.STRING)
            .description("Category used when the cause is absent or unrecognized")
            .defaultValue(CauseCategoryMapper.CONFLICT)
            .build())
        .required("variable_code")
        .build();

    public static final DetectorDefinition<ZScoreSettings> DEFINITION = new DetectorDefinition<>(
        KEY, "Z-score", SCHEMA, ZScoreSettings.class, ZScoreDetector::new);

    private final SeriesResampler resampler;
    private final ZScoreCalculator calculator;
    private final CauseCategoryMapper categoryMapper;

    public ZScoreDetector(DetectorConfig config, ZScoreSettings settings, DetectorContext context) {
        super(config, settings, context);
        this.resampler = new SeriesResampler(settings.frequency(), settings.aggregation());
        this.calculator = new ZScoreCalculator(settings);
        this.categoryMapper = new CauseCategoryMapper(settings.getDefaultCategory());
    }

    @Override
    public String type() {
        return KEY;
    }

    @Override
    protected List<Reading> loadData(Instant start, Instant end) {
        Instant extendedStart = start.minus(Duration.ofDays(settings.getWindowSize() + EXTRA_LOOKBACK_DAYS));
        return readingSource.getReadings(settings.getVariableCode(), extendedStart, end, null, settings.getAdminLevel());
    }

    @Override
    public List<DetectionCandidate> detect(Instant start, Instant end) {
        log.info("[DETECTOR-RUN] {} starting Z-score detection: variable={}, thresholds={}, window={}",
            name(), settings.getVariableCode(), Arrays.toString(settings.thresholds()), settings.getWindowSize());

        List<Reading> readings = loadData(start, end);
        if (readings.isEmpty()) {
            log.info("[DETECTOR-RUN] {} found no data for Z-score analysis", name());
            return List.of();
        }

        Map<String, List<SeriesPoint>> series = resampler.resample(readings);
        List<DetectionCandidate> candidates = new ArrayList<>();
        int scored = 0;
        int inWindow = 0;

        for (List<SeriesPoint> locationSeries : series.values()) {
            for (ZScoreObservation observation : calculator.score(locationSeries)) {
                scored++;
                Instant timestamp = toInstant(observation.getPoint().date());
                if (timestamp.isBefore(start) || timestamp.isAfter(end)
                    || !observation.isSufficientBaseline()
                    || observation.getAlertLevel().level() < settings.getMinAlertLevel()) {
                    continue;
                }
                inWindow++;
                try {
                    candidates.add(toCandidate(observation, timestamp));
                } catch (RuntimeException e) {
                    log.warn("[DETECTOR-RUN] {} skipped anomaly at {} on {}: {}", name(),
                        observation.getPoint().locationId(), observation.getPoint().date(), e.getMessage());
                }
            }
        }

        log.info("[DETECTOR-RUN] {} Z-score detection completed: detections={}, processed={}, windowAlerts={}",
            name(), candidates.size(), scored, inWindow);
        return candidates;
    }

    private DetectionCandidate toCandidate(ZScoreObservation observation, Instant timestamp) {
        SeriesPoint point = observation.getPoint();
        String cause = causeFor(point);

        double baseConfidence = Math.min(0.95, Math.max(0.1, (observation.getZscoreAbs() - 1.0) / 4.0));
        double baselineQuality = Math.min(1.0, (double) observation.getBaselinePeriods() / settings.getWindowSize());
        double confidence = baseConfidence * baselineQuality;

        AlertLevel level = observation.getAlertLevel();
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("variable_code", settings.getVariableCode());
        detail.put("zscore", observation.getZscore());
        detail.put("zscore_abs", observation.getZscoreAbs());
        detail.put("alert_level", level.level());
        detail.put("alert_level_name", level.displayName());
        detail.put("baseline_mean", observation.getBaselineMean());
        detail.put("baseline_std", observation.getBaselineStd());
        detail.put("baseline_periods", observation.getBaselinePeriods());
        detail.put("current_value", point.value());
        detail.put("percent_deviation", observation.getPercentDeviation());
        detail.put("threshold_exceeded", level.level() == 0 ? 0.0 : settings.thresholds()[level.level() - 1]);
        detail.put("thresholds", Arrays.stream(settings.thresholds()).boxed().toList());
        detail.put("aggregation_func", settings.getAggregationFunc());
        detail.put("alert_direction", observation.direction());
        detail.put("window_size", settings.getWindowSize());
        detail.put("min_baseline_periods", settings.getMinBaselinePeriods());
        detail.put("displacement_reason", cause);

        log.debug("[DETECTOR-RUN] {} anomaly at {}: level={}, z={}, value={}, mean={}, confidence={}",
            name(), point.locationName(), level.level(), observation.getZscore(), point.value(),
            observation.getBaselineMean(), confidence);

        return DetectionCandidate.builder()
            .timestamp(timestamp)
            .locations(new ArrayList<>(List.of(new LocationRef(point.locationId(), point.locationName(), point.adminLevel()))))
            .confidenceScore(confidence)
            .category(categoryMapper.categoryFor(cause))
            .detail(detail)
            .build();
    }

    /**
     * Cause text for the location on the bucket day; "Unknown" when absent or unreadable.
     */
    private String causeFor(SeriesPoint point) {
        if (settings.getCauseVariableCode() == null) {
            return "Unknown";
        }
        Instant day = toInstant(point.date());
        try {
            List<Reading> causes = readingSource.getReadings(settings.getCauseVariableCode(), day, day,
                List.of(point.locationId()), settings.getAdminLevel());
            return causes.isEmpty() ? "Unknown" : CauseCategoryMapper.normalizeCause(causes.get(0).getText());
        } catch (RuntimeException e) {
            log.warn("[DETECTOR-RUN] {} failed to read cause for {} on {}: {}",
                name(), point.locationId(), point.date(), e.getMessage());
            return "Unknown";
        }
    }

    private static Instant toInstant(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    @Override
    public int calculateSeverity(Detection detection) {
        Double level = detailNumber(detection, "alert_level");
        return level == null ? 1 : AlertLevel.fromLevel(level.intValue()).severity();
    }

    @Override
    public Duration validityPeriod(Detection detection) {
        Double level = detailNumber(detection, "alert_level");
        return Duration.ofDays(level == null ? 7 : AlertLevel.fromLevel(level.intValue()).validityDays());
    }

    @Override
    public String dataSourceReference(Detection detection) {
        Object variable = detailValue(detection, "variable_code");
        return String.format("%s (Z-score analysis of %s)", name(), variable == null ? "unknown" : variable);
    }

    @Override
    public Map<String, Object> templateContext(Detection detection) {
        Map<String, Object> context = new LinkedHashMap<>();
        for (String key : List.of("zscore", "zscore_abs", "alert_level", "alert_level_name", "current_value",
            "baseline_mean", "baseline_std", "percent_deviation", "threshold_exceeded", "alert_direction",
            "baseline_periods", "window_size")) {
            context.put(key, detailValue(detection, key));
        }
        return context;
    }
}
