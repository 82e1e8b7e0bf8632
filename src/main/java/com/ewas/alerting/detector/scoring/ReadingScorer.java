package com.ewas.alerting.detector.scoring;

import com.ewas.alerting.model.Reading;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores a reading as {@code (base + field points + keyword points) * location multiplier}
 * and maps readings to categories through the configured rules.
 */
public class ReadingScorer {

    private final ScoringSettings settings;

    public ReadingScorer(ScoringSettings settings) {
        this.settings = settings;
    }

    public ScoredReading score(Reading reading) {
        Map<String, Double> fieldScores = new LinkedHashMap<>();
        double fieldTotal = 0.0;
        for (Map.Entry<String, FieldRule> entry : settings.getFieldScores().entrySet()) {
            double points = entry.getValue().score(FieldPaths.resolve(reading, entry.getKey()));
            if (points > 0) {
                fieldScores.put(entry.getKey(), points);
                fieldTotal += points;
            }
        }
        double keywordScore = keywordScore(textContent(reading));
        double multiplier = locationMultiplier(locationName(reading));
        double score = (settings.getBaseScore() + fieldTotal + keywordScore) * multiplier;

        Map<String, Object> components = new LinkedHashMap<>();
        components.put("base_score", settings.getBaseScore());
        components.put("field_scores", fieldScores);
        components.put("keyword_score", keywordScore);
        components.put("location_multiplier", multiplier);
        return new ScoredReading(reading, score, ScoreLevel.of(score, settings), components);
    }

    String textContent(Reading reading) {
        List<String> parts = new ArrayList<>();
        for (String path : settings.getTextFields()) {
            if (FieldPaths.resolve(reading, path) instanceof String text && !text.isEmpty()) {
                parts.add(text);
            }
        }
        if (parts.isEmpty() && reading.getText() != null && !reading.getText().isEmpty()) {
            parts.add(reading.getText());
        }
        return String.join(" ", parts);
    }

    double keywordScore(String text) {
        if (text.isEmpty() || settings.getKeywordScores().isEmpty()) {
            return 0.0;
        }
        String lowered = text.toLowerCase();
        List<Double> scores = settings.getKeywordScores().entrySet().stream()
            .filter(entry -> lowered.contains(entry.getKey().toLowerCase()))
            .map(Map.Entry::getValue)
            .toList();
        if (scores.isEmpty()) {
            return 0.0;
        }
        return settings.isKeywordMaxMode()
            ? scores.stream().mapToDouble(Double::doubleValue).max().orElse(0.0)
            : scores.stream().mapToDouble(Double::doubleValue).sum();
    }

    String locationName(Reading reading) {
        for (String path : settings.getLocationFields()) {
            if (FieldPaths.resolve(reading, path) instanceof String name && !name.isEmpty()) {
                return name;
            }
        }
        return reading.getLocationName() == null ? "" : reading.getLocationName();
    }

    double locationMultiplier(String locationName) {
        if (locationName.isEmpty()) {
            return 1.0;
        }
        String lowered = locationName.toLowerCase();
        for (Map.Entry<String, Double> entry : settings.getLocationMultipliers().entrySet()) {
            if (lowered.contains(entry.getKey().toLowerCase())) {
                return entry.getValue();
            }
        }
        return 1.0;
    }

    /**
     * Category of the first matching mapping rule, else the default category.
     */
    public String category(ScoredReading scored) {
        for (Map.Entry<String, String> entry : settings.getShockTypeMapping().entrySet()) {
            if (ruleMatches(entry.getKey(), scored)) {
                return entry.getValue();
            }
        }
        return settings.getDefaultCategory();
    }

    private boolean ruleMatches(String rule, ScoredReading scored) {
        if (rule.startsWith("level==")) {
            return scored.level().code().equals(rule.substring("level==".length()));
        }
        int separator = rule.indexOf("==");
        if (separator > 0) {
            Object value = FieldPaths.resolve(scored.reading(), rule.substring(0, separator));
            return FieldPaths.asText(value).equals(rule.substring(separator + 2));
        }
        if (rule.startsWith("contains:")) {
            String keyword = rule.substring("contains:".length()).toLowerCase();
            return textContent(scored.reading()).toLowerCase().contains(keyword);
        }
        return false;
    }

    /**
     * Values of the scored fields, keyed by their short name.
     */
    public Map<String, Object> relevantFields(Reading reading) {
        Map<String, Object> relevant = new LinkedHashMap<>();
        for (String path : settings.getFieldScores().keySet()) {
            Object value = FieldPaths.resolve(reading, path);
            if (value != null) {
                relevant.put(FieldPaths.simpleName(path), value);
            }
        }
        return relevant;
    }
}
