package com.ewas.alerting.detector.threshold;

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

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fires when a reading value crosses a configured threshold.
 *
 * Dynamic confidence grows with the relative distance from the threshold:
 * {@code 0.5 + 0.5 * min(1, |value - threshold| / max(|threshold|, 1e-9))}, rounded to 3 decimals.
 * Equality operators always score 1.0.
 */
public class ThresholdDetector extends AbstractDetector<ThresholdSettings> {

    public static final String KEY = "threshold";
    public static final String DEFAULT_CATEGORY = "Natural disasters";

    private static final double EPSILON = 1e-9;

    static final ConfigurationSchema SCHEMA = ConfigurationSchema.forDetector("Threshold Detector Configuration")
        .description("Triggers when values cross a threshold using a comparison operator")
        .property("variable_code", SchemaProperty.string("Code of the variable to monitor"))
        .property("threshold_value", SchemaProperty.builder()
            .type(SchemaType.NUMBER).description("Threshold value for comparison").build())
        .property("operator", SchemaProperty.oneOf("Comparison operator", "gt",
            ComparisonOperator.codes().toArray(new String[0])))
        .property("admin_level", SchemaProperty.optionalInteger("Administrative level filter (optional)", 0))
        .property("use_dynamic_confidence", SchemaProperty.bool(
            "Calculate confidence from the relative difference to the threshold", true))
        .property("confidence_score", SchemaProperty.number(
            "Fixed confidence when dynamic confidence is off", 0.0, 1.0, 1.0))
        .property("use_latest_data", SchemaProperty.bool(
            "Ignore the date range and check the most recent data", false))
        .required("variable_code")
        .required("threshold_value")
        .additionalProperties(false)
        .build();

    public static final DetectorDefinition<ThresholdSettings> DEFINITION = new DetectorDefinition<>(
        KEY, "Threshold", SCHEMA, ThresholdSettings.class, ThresholdDetector::new);

    private final ComparisonOperator operator;

    public ThresholdDetector(DetectorConfig config, ThresholdSettings settings, DetectorContext context) {
        super(config, settings, context);
        this.operator = settings.comparison();
    }

    @Override
    public String type() {
        return KEY;
    }

    @Override
    protected List<Reading> loadData(Instant start, Instant end) {
        if (settings.isUseLatestData()) {
            return readingSource.getReadings(settings.getVariableCode(), null, null, null, settings.getAdminLevel());
        }
        return readingSource.getReadings(settings.getVariableCode(), start, end, null, settings.getAdminLevel());
    }

    @Override
    protected Optional<DetectionCandidate> evaluate(Reading reading) {
        Double value = reading.getValue();
        if (value == null || value.isNaN()) {
            log.warn("[DETECTOR-RUN] {} skipping non-numeric value for {} at {}",
                name(), reading.getVariableCode(), reading.getLocationId());
            return Optional.empty();
        }
        double threshold = settings.getThresholdValue();
        if (!operator.test(value, threshold)) {
            return Optional.empty();
        }

        double confidence = settings.isUseDynamicConfidence()
            ? dynamicConfidence(value, threshold, operator)
            : settings.getConfidenceScore();

        List<LocationRef> locations = new ArrayList<>();
        LocationRef location = reading.toLocationRef();
        if (location != null) {
            locations.add(location);
        }
        String locationName = reading.getLocationName() != null ? reading.getLocationName() : "Unknown";

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("variable_code", reading.getVariableCode());
        detail.put("variable_name", reading.getVariableName());
        detail.put("value", value);
        detail.put("threshold_value", threshold);
        detail.put("operator", operator.code());
        detail.put("operator_name", operator.displayName());
        detail.put("start_date", iso(reading.getStartDate()));
        detail.put("end_date", iso(reading.getEndDate()));
        detail.put("location_name", reading.getLocationName());
        detail.put("admin_level", reading.getAdminLevel());
        detail.put("detector_type", KEY);

        return Optional.of(DetectionCandidate.builder()
            .title(String.format("%s: %d in %s", reading.getVariableName(), Math.round(value), locationName))
            .timestamp(reading.effectiveDate())
            .locations(locations)
            .confidenceScore(confidence)
            .category(DEFAULT_CATEGORY)
            .detail(detail)
            .build());
    }

    static double dynamicConfidence(double value, double threshold, ComparisonOperator operator) {
        if (operator.isEquality()) {
            return 1.0;
        }
        double distance = Math.min(1.0, Math.abs(value - threshold) / Math.max(Math.abs(threshold), EPSILON));
        return Math.round((0.5 + 0.5 * distance) * 1000.0) / 1000.0;
    }

    /**
     * Severity from the relative difference between value and threshold.
     */
    @Override
    public int calculateSeverity(Detection detection) {
        Double value = detailNumber(detection, "value");
        Double threshold = detailNumber(detection, "threshold_value");
        if (value == null || threshold == null) {
            return 3;
        }
        Object op = detailValue(detection, "operator");
        if ("eq".equals(op) || "ne".equals(op)) {
            return 3;
        }

        double diffPercent = threshold == 0
            ? Math.abs(value - threshold) * 100
            : Math.abs((value - threshold) / threshold) * 100;

        if (diffPercent >= 100) {
            return 5;
        } else if (diffPercent >= 50) {
            return 4;
        } else if (diffPercent >= 20) {
            return 3;
        } else if (diffPercent >= 10) {
            return 2;
        }
        return 1;
    }

    @Override
    public Map<String, Object> templateContext(Detection detection) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("detector_type", KEY);
        context.put("is_threshold", true);
        for (String key : List.of("value", "threshold_value", "operator", "operator_name", "variable_code", "variable_name")) {
            context.put(key, detailValue(detection, key));
        }
        return context;
    }
}
