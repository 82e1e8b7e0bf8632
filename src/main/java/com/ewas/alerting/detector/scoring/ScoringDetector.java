package com.ewas.alerting.detector.scoring;

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
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scores text alerts with configurable field, keyword and location rules and emits one
 * detection per alert reaching {@code min_detection_score}.
 *
 * With clustering on, qualifying alerts at the same location whose consecutive start
 * times are at most {@code cluster_window_hours} apart also yield a cluster detection.
 */
public class ScoringDetector extends AbstractDetector<ScoringSettings> {

    public static final String KEY = "scoring";

    private static final int MAX_TITLE_LENGTH = 200;

    static final ConfigurationSchema SCHEMA = ConfigurationSchema.forDetector("Scoring Detector Configuration")
        .description("Scores alerts with field, keyword and location rules")
        .property("variable_code", SchemaProperty.builder()
            .type(SchemaType.STRING).description("Code of the variable holding the alerts").defaultValue("alerts").build())
        .property("source_name", SchemaProperty.builder()
            .type(SchemaType.STRING).description("Source name fragment to filter data").build())
        .property("field_scores", SchemaProperty.builder()
            .type(SchemaType.OBJECT)
            .description("Field path to scoring rules (exact_match, contains, regex, numeric, _mode)")
            .valueType(SchemaType.OBJECT)
            .build())
        .property("keyword_scores", SchemaProperty.builder()
            .type(SchemaType.OBJECT).description("Keyword scoring weights").valueType(SchemaType.NUMBER).build())
        .property("keyword_max_mode", SchemaProperty.bool("Use max instead of sum for keyword scores", false))
        .property("text_fields", SchemaProperty.builder()
            .type(SchemaType.ARRAY)
            .description("Fields to extract text content from")
            .defaultValue(List.of("headline", FieldPaths.TEXT_FALLBACK))
            .build())
        .property("location_multipliers", SchemaProperty.builder()
            .type(SchemaType.OBJECT).description("Location-based score multipliers").valueType(SchemaType.NUMBER).build())
        .property("location_fields", SchemaProperty.builder()
            .type(SchemaType.ARRAY)
            .description("Fields to extract the location name from")
            .defaultValue(List.of("estimatedEventLocation[0]", FieldPaths.LOCATION_FALLBACK))
            .build())
        .property("thresholds", SchemaProperty.builder()
            .type(SchemaType.OBJECT).description("Minimum score per alert level").valueType(SchemaType.NUMBER).build())
        .property("min_detection_score", SchemaProperty.number("Minimum score to emit a detection", 0.0, null, 8.0))
        .property("base_score", SchemaProperty.number("Score every alert starts from", 0.0, null, 1.0))
        .property("enable_clustering", SchemaProperty.bool("Emit detections for temporal clusters of alerts", false))
        .property("cluster_window_hours", SchemaProperty.number("Maximum gap between clustered alerts", 0.0, null, 6.0))
        .property("cluster_min_alerts", SchemaProperty.integer("Minimum alerts per cluster", 2, null, 2))
        .property("shock_type_mapping", SchemaProperty.builder()
            .type(SchemaType.OBJECT).description("Rules for mapping alerts to categories").valueType(SchemaType.STRING).build())
        .property("default_category", SchemaProperty.builder()
            .type(SchemaType.STRING).description("Category when no mapping rule matches").defaultValue("Conflict").build())
        .additionalProperties(false)
        .build();

    public static final DetectorDefinition<ScoringSettings> DEFINITION = new DetectorDefinition<>(
        KEY, "Scoring", SCHEMA, ScoringSettings.class, ScoringDetector::new);

    private final ReadingScorer scorer;

    public ScoringDetector(DetectorConfig config, ScoringSettings settings, DetectorContext context) {
        super(config, settings, context);
        this.scorer = new ReadingScorer(settings);
    }

    @Override
    public String type() {
        return KEY;
    }

    @Override
    protected List<Reading> loadData(Instant start, Instant end) {
        List<Reading> readings = readingSource.getReadings(settings.getVariableCode(), start, end, null, null);
        String source = settings.getSourceName();
        if (source == null || source.isBlank()) {
            return readings;
        }
        String lowered = source.toLowerCase();
        return readings.stream()
            .filter(r -> r.getSourceName() != null && r.getSourceName().toLowerCase().contains(lowered))
            .toList();
    }

    @Override
    public List<DetectionCandidate> detect(Instant start, Instant end) {
        List<Reading> readings = loadData(start, end);
        log.info("[DETECTOR-RUN] {} scoring {} alerts in [{}, {}]", name(), readings.size(), start, end);

        List<ScoredReading> qualifying = new ArrayList<>();
        List<DetectionCandidate> candidates = new ArrayList<>();
        for (Reading reading : readings) {
            try {
                ScoredReading scored = scorer.score(reading);
                if (scored.score() >= settings.getMinDetectionScore()) {
                    candidates.add(toCandidate(scored));
                    qualifying.add(scored);
                }
            } catch (RuntimeException e) {
                log.warn("[DETECTOR-RUN] {} skipped alert {}: {}", name(), reading.getId(), e.getMessage());
            }
        }

        int clusters = 0;
        if (settings.isEnableClustering()) {
            List<DetectionCandidate> clustered = clusterCandidates(qualifying);
            clusters = clustered.size();
            candidates.addAll(clustered);
        }

        log.info("[DETECTOR-RUN] {} completed: candidates={}, qualifying={}, clusters={}, processed={}",
            name(), candidates.size(), qualifying.size(), clusters, readings.size());
        return candidates;
    }

    DetectionCandidate toCandidate(ScoredReading scored) {
        Reading reading = scored.reading();
        Instant date = reading.effectiveDate();

        Object headline = reading.getRawPayload() == null ? null : reading.getRawPayload().get("headline");
        String title = headline instanceof String text && !text.isEmpty()
            ? text.substring(0, Math.min(MAX_TITLE_LENGTH, text.length()))
            : String.format("%s Priority Alert - %s", scored.level().displayName(), date.atZone(ZoneOffset.UTC).toLocalDate());

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("reading_id", reading.getId());
        detail.put("score", scored.score());
        detail.put("alert_level", scored.level().code());
        detail.put("score_components", scored.components());
        detail.put("raw_data_fields", scorer.relevantFields(reading));
        detail.put("reading_start", iso(reading.getStartDate()));
        detail.put("source", KEY);
        detail.put("detector_type", KEY);

        return DetectionCandidate.builder()
            .title(title)
            .timestamp(date.truncatedTo(ChronoUnit.DAYS))
            .locations(locationsOf(reading))
            .confidenceScore(Math.min(scored.score() / 30.0, 1.0))
            .category(scorer.category(scored))
            .detail(detail)
            .build();
    }

    List<DetectionCandidate> clusterCandidates(List<ScoredReading> qualifying) {
        if (qualifying.size() < settings.getClusterMinAlerts()) {
            return List.of();
        }
        Map<String, List<ScoredReading>> byLocation = new LinkedHashMap<>();
        for (ScoredReading scored : qualifying) {
            String locationId = scored.reading().getLocationId();
            if (locationId != null && scored.reading().effectiveDate() != null) {
                byLocation.computeIfAbsent(locationId, id -> new ArrayList<>()).add(scored);
            }
        }

        List<DetectionCandidate> candidates = new ArrayList<>();
        for (List<ScoredReading> alerts : byLocation.values()) {
            for (List<ScoredReading> cluster : temporalClusters(alerts)) {
                toClusterCandidate(cluster).ifPresent(candidates::add);
            }
        }
        return candidates;
    }

    List<List<ScoredReading>> temporalClusters(List<ScoredReading> alerts) {
        List<List<ScoredReading>> clusters = new ArrayList<>();
        if (alerts.size() < settings.getClusterMinAlerts()) {
            return clusters;
        }
        List<ScoredReading> sorted = new ArrayList<>(alerts);
        sorted.sort(Comparator.comparing(scored -> scored.reading().effectiveDate()));
        long windowMillis = Math.round(settings.getClusterWindowHours() * 3_600_000);

        List<ScoredReading> current = new ArrayList<>(List.of(sorted.get(0)));
        for (int i = 1; i < sorted.size(); i++) {
            Duration gap = Duration.between(sorted.get(i - 1).reading().effectiveDate(), sorted.get(i).reading().effectiveDate());
            if (gap.toMillis() <= windowMillis) {
                current.add(sorted.get(i));
            } else {
                if (current.size() >= settings.getClusterMinAlerts()) {
                    clusters.add(current);
                }
                current = new ArrayList<>(List.of(sorted.get(i)));
            }
        }
        if (current.size() >= settings.getClusterMinAlerts()) {
            clusters.add(current);
        }
        return clusters;
    }

    private Optional<DetectionCandidate> toClusterCandidate(List<ScoredReading> cluster) {
        // Highest level by severity; alerts below every threshold do not name a level
        ScoreLevel maxLevel = cluster.stream()
            .map(ScoredReading::level)
            .filter(level -> level != ScoreLevel.NONE)
            .min(Comparator.naturalOrder())
            .orElse(null);
        if (maxLevel == null) {
            return Optional.empty();
        }
        double total = cluster.stream().mapToDouble(ScoredReading::score).sum();
        double average = total / cluster.size();
        Reading earliest = cluster.get(0).reading();
        Reading latest = cluster.get(cluster.size() - 1).reading();
        String locationName = earliest.getLocationName() != null ? earliest.getLocationName() : earliest.getLocationId();

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("cluster_size", cluster.size());
        detail.put("total_score", total);
        detail.put("average_score", average);
        detail.put("max_level", maxLevel.code());
        detail.put("reading_ids", cluster.stream().map(scored -> scored.reading().getId()).toList());
        detail.put("time_span_hours",
            Duration.between(earliest.effectiveDate(), latest.effectiveDate()).toMinutes() / 60.0);
        detail.put("source", KEY + "_cluster");
        detail.put("detector_type", KEY);

        return Optional.of(DetectionCandidate.builder()
            .title(String.format("%d %s alerts in %s", cluster.size(), maxLevel.code(), locationName))
            .timestamp(earliest.effectiveDate().truncatedTo(ChronoUnit.DAYS))
            .locations(locationsOf(earliest))
            .confidenceScore(Math.min(average / 20.0, 1.0))
            .category("Alert Cluster - " + maxLevel.displayName())
            .detail(detail)
            .build());
    }

    private static List<LocationRef> locationsOf(Reading reading) {
        List<LocationRef> locations = new ArrayList<>();
        LocationRef location = reading.toLocationRef();
        if (location != null) {
            locations.add(location);
        }
        return locations;
    }

    @Override
    public Map<String, Object> templateContext(Detection detection) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("detector_type", KEY);
        for (String key : List.of("score", "alert_level", "score_components", "cluster_size", "max_level")) {
            Object value = detailValue(detection, key);
            if (value != null) {
                context.put(key, value);
            }
        }
        return context;
    }
}
