package com.ewas.alerting.detector.scoring;

import com.ewas.alerting.model.Reading;

import java.util.Map;

public record ScoredReading(Reading reading, double score, ScoreLevel level, Map<String, Object> components) {
}
