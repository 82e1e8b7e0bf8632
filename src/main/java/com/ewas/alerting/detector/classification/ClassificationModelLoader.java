package com.ewas.alerting.detector.classification;

@FunctionalInterface
public interface ClassificationModelLoader {

    /**
     * @param modelPath resolved model location
     */
    ClassificationModel load(String modelPath);
}
