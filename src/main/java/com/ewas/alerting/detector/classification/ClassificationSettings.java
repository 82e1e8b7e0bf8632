package com.ewas.alerting.detector.classification;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
public class ClassificationSettings {

    private String modelPath;
    private String variableCode;
    private Integer adminLevel;

    /**
     * Minimum probability of a positive label to emit a detection.
     */
    private double minConfidence = 0.5;

    private List<String> positiveLabels = new ArrayList<>(List.of("alert"));

    /**
     * Where the text to classify lives: "text", "raw_data_headline" or "variable_name".
     */
    private String headlineField = "text";

    private int batchSize = 8;

    /**
     * Positive label to category; unmapped labels get the default category.
     */
    private Map<String, String> categoryMapping = new LinkedHashMap<>();

    private String defaultCategory = "Conflict";
}
