package com.ewas.alerting.detector.scenario;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
public class ScenarioTestSettings {

    public static final Map<String, String> DEFAULT_SCENARIOS = Map.of(
        "Conflict Escalation", "Conflict",
        "Food Crisis", "Food security");

    private String variableCode = "test_scenario";
    private String testSourceName = "Test Source";
    private double minimumConfidence = 0.7;

    /**
     * Scenario name to category. Scenarios not listed never fire.
     */
    private Map<String, String> scenarioMappings = new LinkedHashMap<>(DEFAULT_SCENARIOS);
}
