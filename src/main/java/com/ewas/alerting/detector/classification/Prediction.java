package com.ewas.alerting.detector.classification;

/**
 * Output of a classification model for one text.
 */
public record Prediction(String label, double probability) {
}
