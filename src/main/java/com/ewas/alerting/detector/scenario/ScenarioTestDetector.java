package com.ewas.alerting.detector.scenario;

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
 * End-to-end pipeline check: fires for readings whose payload carries
 * {@code should_trigger_alert=true} and a known {@code scenario}.
 *
 * Confidence is {@code confidence_target} from the payload when present. Otherwise it is computed
 * from value and payload threshold: for "resource_availability" lower values score higher,
 * for other variables the ratio above threshold does.
 */
public class ScenarioTestDetector extends AbstractDetector<ScenarioTestSettings> {

    public static final String KEY = "scenario_test";

    static final ConfigurationSchema SCHEMA = ConfigurationSchema.forDetector("Scenario Test Detector Configuration")
        .description("Fires on structured test payloads to verify the pipeline end to end")
        .property("variable_code", SchemaProperty.builder()
            .type(SchemaType.STRING).description("Variable carrying the test payloads").defaultValue("test_scenario").build())
        .property("test_source_name", SchemaProperty.builder()
            .type(SchemaType.STRING).description("Name of the test source").defaultValue("Test Source").build())
        .property("minimum_confidence", SchemaProperty.number("Minimum confidence score for detection", 0.0, 1.0, 0.7))
        .property("scenario_mappings", SchemaProperty.builder()
            .type(SchemaType.OBJECT)
            .description("Scenario name to category")
            .valueType(SchemaType.STRING)
            .build())
        .additionalProperties(false)
        .build();

    public static final DetectorDefinition<ScenarioTestSettings> DEFINITION = new DetectorDefinition<>(
        KEY, "Scenario test", SCHEMA, ScenarioTestSettings.class, ScenarioTestDetector::new);

    public ScenarioTestDetector(DetectorConfig config, ScenarioTestSettings settings, DetectorContext context) {
        super(config, settings, context);
    }

    @Override
    public String type() {
        return KEY;
    }

    @Override
    protected List<Reading> loadData(Instant start, Instant end) {
        return readingSource.getReadings(settings.getVariableCode(), start, end, null, null);
    }

    @Override
    protected Optional<DetectionCandidate> evaluate(Reading reading) {
        Map<String, Object> payload = reading.getRawPayload() == null ? Map.of() : reading.getRawPayload();
        if (!Boolean.TRUE.equals(asBoolean(payload.get("should_trigger_alert")))) {
            return Optional.empty();
        }

        Object scenario = payload.get("scenario");
        String category = scenario == null ? null : settings.getScenarioMappings().get(scenario.toString());
        if (category == null) {
            log.debug("[DETECTOR-RUN] {} unknown scenario '{}', valid scenarios {}",
                name(), scenario, settings.getScenarioMappings().keySet());
            return Optional.empty();
        }

        double threshold = asDouble(payload.get("threshold"), 0.0);
        Object variable = payload.getOrDefault("variable", "");
        double confidence = confidenceFor(payload.get("confidence_target"), reading.getValue(), threshold, variable.toString());

        if (confidence < settings.getMinimumConfidence()) {
            log.debug("[DETECTOR-RUN] {} confidence too low: {} < {}", name(), confidence, settings.getMinimumConfidence());
            return Optional.empty();
        }

        LocationRef location = reading.toLocationRef();
        List<LocationRef> locations = new ArrayList<>();
        if (location != null) {
            locations.add(location);
        }
        String locationName = reading.getLocationName() != null ? reading.getLocationName() : "Unknown location";

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("scenario", scenario.toString());
        detail.put("trigger_value", reading.getValue());
        detail.put("threshold", threshold);
        detail.put("variable", variable.toString());
        detail.put("original_text", reading.getText());
        detail.put("source_data_point_id", reading.getId());

        return Optional.of(DetectionCandidate.builder()
            .title(category + " detected in " + locationName)
            .timestamp(clock.instant())
            .locations(locations)
            .confidenceScore(confidence)
            .category(category)
            .detail(detail)
            .build());
    }

    static double confidenceFor(Object target, Double value, double threshold, String variable) {
        if (target != null) {
            return asDouble(target, 0.0);
        }
        if (value == null) {
            throw new IllegalArgumentException("reading has neither confidence_target nor value");
        }
        if ("resource_availability".equals(variable)) {
            if (threshold == 0) {
                throw new IllegalArgumentException("resource_availability needs a non-zero threshold");
            }
            return clamp((threshold - value) / threshold);
        }
        if (threshold > 0) {
            double ratio = value / threshold;
            return clamp((ratio - 1.0) * 0.5 + 0.5);
        }
        return 0.8;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static Boolean asBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    private static double asDouble(Object value, double fallback) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value == null) {
            return fallback;
        }
        return Double.parseDouble(value.toString());
    }

    /**
     * Base severity by scenario, raised for very confident and lowered for weak detections.
     */
    @Override
    public int calculateSeverity(Detection detection) {
        Object scenario = detailValue(detection, "scenario");
        int base;
        if ("Conflict Escalation".equals(scenario)) {
            base = 5;
        } else if ("Food Crisis".equals(scenario)) {
            base = 4;
        } else {
            base = 3;
        }
        double confidence = detection.getConfidenceScore() == null ? 0.5 : detection.getConfidenceScore();
        if (confidence >= 0.9) {
            return Math.min(5, base + 1);
        } else if (confidence >= 0.8) {
            return base;
        }
        return Math.max(1, base - 1);
    }

    @Override
    public Duration validityPeriod(Detection detection) {
        return Duration.ofHours(24);
    }

    @Override
    public String dataSourceReference(Detection detection) {
        return settings.getTestSourceName();
    }

    @Override
    public Map<String, Object> templateContext(Detection detection) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("test_scenario", detailValue(detection, "scenario"));
        context.put("trigger_value", detailValue(detection, "trigger_value"));
        context.put("threshold_value", detailValue(detection, "threshold"));
        context.put("test_variable", detailValue(detection, "variable"));
        context.put("original_text", detailValue(detection, "original_text"));
        context.put("is_test_alert", true);
        return context;
    }
}
