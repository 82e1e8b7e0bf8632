package com.ewas.alerting.detector.classification;

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

/**
 * Classifies text readings with an externally loaded model and emits the positive ones.
 */
public class ClassificationDetector extends AbstractDetector<ClassificationSettings> {

    public static final String KEY = "classification";

    private static final int MAX_TITLE_LENGTH = 200;

    static final ConfigurationSchema SCHEMA = ConfigurationSchema.forDetector("Classification Detector Configuration")
        .description("Text classification detector delegating scoring to an external model")
        .property("model_path", SchemaProperty.string("Location of the classification model"))
        .property("variable_code", SchemaProperty.string("Code of the variable holding the texts"))
        .property("admin_level", SchemaProperty.optionalInteger("Administrative level filter (optional)", 0))
        .property("min_confidence", SchemaProperty.number("Minimum probability to trigger a detection", 0.0, 1.0, 0.5))
        .property("positive_labels", SchemaProperty.builder()
            .type(SchemaType.ARRAY)
            .description("Labels that count as an alert")
            .defaultValue(List.of("alert"))
            .build())
        .property("headline_field", SchemaProperty.oneOf("Field containing the text to classify", "text",
            "text", "raw_data_headline", "variable_name"))
        .property("batch_size", SchemaProperty.integer("Number of texts per model call", 1, 256, 8))
        .property("category_mapping", SchemaProperty.builder()
            .type(SchemaType.OBJECT)
            .description("Label to category mapping")
            .valueType(SchemaType.STRING)
            .build())
        .property("default_category", SchemaProperty.builder()
            .type(SchemaType.STRING)
            .description("Category for positive labels without a mapping")
            .defaultValue("Conflict")
            .build())
        .required("model_path")
        .required("variable_code")
        .additionalProperties(false)
        .build();

    public static final DetectorDefinition<ClassificationSettings> DEFINITION = new DetectorDefinition<>(
        KEY, "Classification", SCHEMA, ClassificationSettings.class, ClassificationDetector::new);

    private final ModelCache modelCache;

    public ClassificationDetector(DetectorConfig config, ClassificationSettings settings, DetectorContext context) {
        super(config, settings, context);
        this.modelCache = context.modelCache();
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
        log.info("[DETECTOR-RUN] {} classifying {} texts with model {}", name(), readings.size(), settings.getModelPath());
        if (readings.isEmpty()) {
            return List.of();
        }

        ClassificationModel model = modelCache.get(settings.getModelPath());
        List<DetectionCandidate> candidates = new ArrayList<>();
        int batchSize = Math.max(1, settings.getBatchSize());

        for (int from = 0; from < readings.size(); from += batchSize) {
            List<Reading> batch = readings.subList(from, Math.min(readings.size(), from + batchSize));
            List<String> texts = batch.stream().map(this::textOf).toList();
            List<Prediction> predictions = model.classify(texts);

            for (int i = 0; i < batch.size(); i++) {
                Reading reading = batch.get(i);
                try {
                    Prediction prediction = predictions.get(i);
                    if (isPositive(prediction)) {
                        candidates.add(toCandidate(reading, texts.get(i), prediction));
                    }
                } catch (RuntimeException e) {
                    log.warn("[DETECTOR-RUN] {} skipped reading {}: {}", name(), reading.getId(), e.getMessage());
                }
            }
        }

        log.info("[DETECTOR-RUN] {} classification completed: detections={}, processed={}",
            name(), candidates.size(), readings.size());
        return candidates;
    }

    private boolean isPositive(Prediction prediction) {
        return prediction != null
            && settings.getPositiveLabels().contains(prediction.label())
            && prediction.probability() >= settings.getMinConfidence();
    }

    String textOf(Reading reading) {
        String text = switch (settings.getHeadlineField()) {
            case "raw_data_headline" -> {
                Object headline = reading.getRawPayload() == null ? null : reading.getRawPayload().get("headline");
                yield headline == null ? null : headline.toString();
            }
            case "variable_name" -> reading.getVariableName();
            default -> reading.getText();
        };
        if ((text == null || text.isBlank()) && reading.getText() != null) {
            text = reading.getText();
        }
        return text == null ? "" : text;
    }

    private DetectionCandidate toCandidate(Reading reading, String text, Prediction prediction) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("variable_code", reading.getVariableCode());
        detail.put("variable_name", reading.getVariableName());
        detail.put("headline", text);
        detail.put("predicted_label", prediction.label());
        detail.put("model_confidence", prediction.probability());
        detail.put("min_confidence", settings.getMinConfidence());
        detail.put("start_date", iso(reading.getStartDate()));
        detail.put("end_date", iso(reading.getEndDate()));
        detail.put("location_name", reading.getLocationName());
        detail.put("admin_level", reading.getAdminLevel());
        detail.put("detector_type", KEY);
        detail.put("model_path", settings.getModelPath());

        List<LocationRef> locations = new ArrayList<>();
        LocationRef location = reading.toLocationRef();
        if (location != null) {
            locations.add(location);
        }

        String title = text.isEmpty() ? null : text.substring(0, Math.min(MAX_TITLE_LENGTH, text.length()));
        return DetectionCandidate.builder()
            .title(title)
            .timestamp(reading.effectiveDate())
            .locations(locations)
            .confidenceScore(prediction.probability())
            .category(settings.getCategoryMapping().getOrDefault(prediction.label(), settings.getDefaultCategory()))
            .detail(detail)
            .build();
    }

    @Override
    public int calculateSeverity(Detection detection) {
        Double confidence = detection.getConfidenceScore();
        if (confidence == null) {
            return 3;
        }
        if (confidence >= 0.9) {
            return 5;
        } else if (confidence >= 0.8) {
            return 4;
        } else if (confidence >= 0.7) {
            return 3;
        } else if (confidence >= 0.6) {
            return 2;
        }
        return 1;
    }

    @Override
    public String dataSourceReference(Detection detection) {
        return name() + " (text classification)";
    }

    @Override
    public Map<String, Object> templateContext(Detection detection) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("detector_type", KEY);
        context.put("headline", detailValue(detection, "headline"));
        context.put("model_confidence", detailValue(detection, "model_confidence"));
        context.put("model_path", detailValue(detection, "model_path"));
        context.put("is_ml_detection", true);
        return context;
    }
}
