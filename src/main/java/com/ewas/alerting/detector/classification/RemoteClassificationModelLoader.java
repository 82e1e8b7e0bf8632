package com.ewas.alerting.detector.classification;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads models served over HTTP: the model path is the scoring endpoint, which takes
 * {@code {"texts": [...]}} and answers {@code {"predictions": [{"label", "probability"}]}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemoteClassificationModelLoader implements ClassificationModelLoader {

    private final RestTemplate restTemplate;

    @Override
    public ClassificationModel load(String modelPath) {
        if (modelPath == null || !(modelPath.startsWith("http://") || modelPath.startsWith("https://"))) {
            throw new IllegalArgumentException("Model path must be an http(s) scoring endpoint: " + modelPath);
        }
        log.info("[MODEL-CACHE] Binding remote classification model at {}", modelPath);
        return texts -> score(modelPath, texts);
    }

    private List<Prediction> score(String endpoint, List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        ScoringResponse response = restTemplate.postForObject(endpoint, Map.of("texts", texts), ScoringResponse.class);
        if (response == null || response.getPredictions() == null || response.getPredictions().size() != texts.size()) {
            throw new IllegalStateException(String.format("Model %s returned %s predictions for %d texts",
                endpoint, response == null || response.getPredictions() == null ? "no" : response.getPredictions().size(),
                texts.size()));
        }
        List<Prediction> predictions = new ArrayList<>(texts.size());
        for (ScoredText scored : response.getPredictions()) {
            predictions.add(new Prediction(scored.getLabel(), scored.getProbability()));
        }
        return predictions;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ScoringResponse {
        private List<ScoredText> predictions;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ScoredText {
        private String label;
        private double probability;
    }
}
