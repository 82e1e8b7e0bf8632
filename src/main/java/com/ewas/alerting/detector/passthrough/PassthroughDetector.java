package com.ewas.alerting.detector.passthrough;

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
 * Emits every reading in the window with full confidence, optionally filtered by value.
 */
public class PassthroughDetector extends AbstractDetector<PassthroughSettings> {

    public static final String KEY = "passthrough";
    public static final String CATEGORY = "passthrough";

    static final ConfigurationSchema SCHEMA = ConfigurationSchema.forDetector("PassThrough Detector Configuration")
        .description("Returns datapoints, optionally filtered by variable values")
        .property("variable_code", SchemaProperty.string("Code of the variable to process"))
        .property("admin_level", SchemaProperty.optionalInteger("Administrative level filter (optional)", 0))
        .property("filters", SchemaProperty.builder()
            .type(SchemaType.ARRAY)
            .description("List of variable filters to apply")
            .items(ConfigurationSchema.builder()
                .property("variable_name", SchemaProperty.string("Name of the variable to filter on"))
                .property("value", SchemaProperty.builder()
                    .type(SchemaType.STRING).type(SchemaType.NUMBER).type(SchemaType.BOOLEAN)
                    .description("Value to match for the filter")
                    .build())
                .required("variable_name")
                .required("value")
                .additionalProperties(false)
                .build())
            .build())
        .required("variable_code")
        .additionalProperties(false)
        .build();

    public static final DetectorDefinition<PassthroughSettings> DEFINITION = new DetectorDefinition<>(
        KEY, "PassThrough", SCHEMA, PassthroughSettings.class, PassthroughDetector::new);

    public PassthroughDetector(DetectorConfig config, PassthroughSettings settings, DetectorContext context) {
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
    protected Optional<DetectionCandidate> evaluate(Reading reading) {
        if (!passesFilters(reading)) {
            return Optional.empty();
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("variable_code", reading.getVariableCode());
        detail.put("variable_name", reading.getVariableName());
        detail.put("original_value", reading.getValue());
        detail.put("start_date", iso(reading.getStartDate()));
        detail.put("end_date", iso(reading.getEndDate()));
        detail.put("location_name", reading.getLocationName());
        detail.put("admin_level", reading.getAdminLevel());
        detail.put("detector_type", KEY);
        detail.put("applied_filters", settings.getFilters().isEmpty() ? null : filtersAsMaps());

        List<LocationRef> locations = new ArrayList<>();
        LocationRef location = reading.toLocationRef();
        if (location != null) {
            locations.add(location);
        }

        return Optional.of(DetectionCandidate.builder()
            .timestamp(reading.effectiveDate())
            .locations(locations)
            .confidenceScore(1.0)
            .category(CATEGORY)
            .detail(detail)
            .build());
    }

    boolean passesFilters(Reading reading) {
        for (PassthroughSettings.Filter filter : settings.getFilters()) {
            if (filter.getVariableName() == null || filter.getValue() == null) {
                log.warn("[DETECTOR-RUN] {} ignoring incomplete filter {}", name(), filter);
                continue;
            }
            if (filter.getVariableName().equals(reading.getVariableName())
                && !String.valueOf(filter.getValue()).equals(String.valueOf(reading.getValue()))) {
                return false;
            }
        }
        return true;
    }

    private List<Map<String, Object>> filtersAsMaps() {
        List<Map<String, Object>> filters = new ArrayList<>();
        for (PassthroughSettings.Filter filter : settings.getFilters()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("variable_name", filter.getVariableName());
            entry.put("value", filter.getValue());
            filters.add(entry);
        }
        return filters;
    }

    @Override
    public int calculateSeverity(Detection detection) {
        return 1;
    }

    @Override
    public Map<String, Object> templateContext(Detection detection) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("detector_type", KEY);
        context.put("is_passthrough", true);
        context.put("original_value", detailValue(detection, "original_value"));
        context.put("variable_code", detailValue(detection, "variable_code"));
        context.put("variable_name", detailValue(detection, "variable_name"));
        return context;
    }
}
