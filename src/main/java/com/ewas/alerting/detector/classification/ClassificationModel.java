package com.ewas.alerting.detector.classification;

import java.util.List;

/**
 * Opaque text scorer. Returns one prediction per input, in input order.
 */
public interface ClassificationModel {

    List<Prediction> classify(List<String> texts);
}
