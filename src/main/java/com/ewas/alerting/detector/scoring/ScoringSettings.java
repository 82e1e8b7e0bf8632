package com.ewas.alerting.detector.scoring;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
public class ScoringSettings {

    private String variableCode = "alerts";

    /**
     * Case-insensitive fragment of the source name; blank accepts every source.
     */
    private String sourceName;

    /**
     * Field path to scoring rules, e.g. {@code alertType.name} or {@code estimatedEventLocation[0]}.
     */
    private Map<String, FieldRule> fieldScores = new LinkedHashMap<>();

    private Map<String, Double> keywordScores = new LinkedHashMap<>();
    private boolean keywordMaxMode;
    private List<String> textFields = new ArrayList<>(List.of("headline", FieldPaths.TEXT_FALLBACK));

    /**
     * Location fragment to multiplier; the first fragment found in the location name applies.
     */
    private Map<String, Double> locationMultipliers = new LinkedHashMap<>();
    private List<String> locationFields = new ArrayList<>(List.of("estimatedEventLocation[0]", FieldPaths.LOCATION_FALLBACK));

    private Map<String, Double> thresholds = new LinkedHashMap<>(Map.of(
        "critical", 25.0, "high", 15.0, "medium", 8.0, "low", 4.0));

    private double minDetectionScore = 8.0;
    private double baseScore = 1.0;

    private boolean enableClustering;
    private double clusterWindowHours = 6.0;
    private int clusterMinAlerts = 2;

    /**
     * Rule to category: {@code level==high}, {@code field.path==value} or {@code contains:keyword}.
     */
    private Map<String, String> shockTypeMapping = new LinkedHashMap<>();

    private String defaultCategory = "Conflict";

    public double threshold(ScoreLevel level) {
        return thresholds.getOrDefault(level.code(), level.defaultThreshold());
    }
}
