package com.ewas.alerting.detector.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Points a field value earns. Matches of every rule kind are summed, or the best one
 * taken when {@code _mode} is {@code max}.
 */
@Data
@NoArgsConstructor
public class FieldRule {

    public static final String MAX_MODE = "max";

    @JsonProperty("_mode")
    private String mode;

    private Map<String, Double> exactMatch = new LinkedHashMap<>();

    /**
     * Case-insensitive substrings; list values are checked item by item, using {@code name} of object items.
     */
    private Map<String, Double> contains = new LinkedHashMap<>();

    private Map<String, Double> regex = new LinkedHashMap<>();

    /**
     * Operator ({@code >=}, {@code >}, {@code <=}, {@code <}, {@code ==}) to threshold and score.
     */
    private Map<String, NumericRule> numeric = new LinkedHashMap<>();

    @Data
    @NoArgsConstructor
    public static class NumericRule {
        private double threshold;
        private double score;
    }

    public double score(Object value) {
        if (value == null) {
            return 0.0;
        }
        List<Double> scores = new ArrayList<>();

        Double exact = exactMatch.get(FieldPaths.asText(value));
        if (exact != null) {
            scores.add(exact);
        }

        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                collectContains(itemText(item), scores);
            }
        } else {
            collectContains(FieldPaths.asText(value).toLowerCase(), scores);
        }

        String text = FieldPaths.asText(value);
        regex.forEach((pattern, points) -> {
            if (Pattern.compile(pattern, Pattern.CASE_INSENSITIVE).matcher(text).find()) {
                scores.add(points);
            }
        });

        Double number = FieldPaths.asNumber(value);
        if (number != null) {
            numeric.forEach((operator, rule) -> {
                if (matches(operator, number, rule.getThreshold())) {
                    scores.add(rule.getScore());
                }
            });
        }

        if (scores.isEmpty()) {
            return 0.0;
        }
        if (MAX_MODE.equals(mode)) {
            return scores.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        }
        return scores.stream().mapToDouble(Double::doubleValue).sum();
    }

    private void collectContains(String lowered, List<Double> scores) {
        contains.forEach((substring, points) -> {
            if (lowered.contains(substring.toLowerCase())) {
                scores.add(points);
            }
        });
    }

    private static String itemText(Object item) {
        if (item instanceof Map<?, ?> map && map.get("name") != null) {
            return map.get("name").toString().toLowerCase();
        }
        return FieldPaths.asText(item).toLowerCase();
    }

    static boolean matches(String operator, double value, double threshold) {
        return switch (operator) {
            case ">=" -> value >= threshold;
            case ">" -> value > threshold;
            case "<=" -> value <= threshold;
            case "<" -> value < threshold;
            case "==" -> value == threshold;
            default -> false;
        };
    }
}
