package com.ewas.alerting.detector;

import com.ewas.alerting.config.AlertFrameworkProperties;
import com.ewas.alerting.detector.classification.ClassificationDetector;
import com.ewas.alerting.detector.classification.ModelCache;
import com.ewas.alerting.detector.passthrough.PassthroughDetector;
import com.ewas.alerting.detector.scenario.ScenarioTestDetector;
import com.ewas.alerting.detector.schema.ConfigurationBinder;
import com.ewas.alerting.detector.schema.ConfigurationSchema;
import com.ewas.alerting.detector.scoring.ScoringDetector;
import com.ewas.alerting.detector.surge.ConflictSurgeDetector;
import com.ewas.alerting.detector.threshold.ThresholdDetector;
import com.ewas.alerting.detector.zscore.ZScoreDetector;
import com.ewas.alerting.exception.DetectorConfigurationException;
import com.ewas.alerting.model.DetectorConfig;
import com.ewas.alerting.reading.ReadingSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * DetectorRegistry - maps stable type keys to detector definitions.
 *
 * Configurations are validated against the variant's schema and bound to its typed
 * settings here; an unknown key or invalid configuration fails before any run starts.
 */
@Slf4j
@Component
public class DetectorRegistry {

    private final Map<String, DetectorDefinition<?>> definitions = new LinkedHashMap<>();
    private final DetectorContext context;
    private final ConfigurationBinder binder;

    @Autowired
    public DetectorRegistry(ReadingSource readingSource, ModelCache modelCache, Clock clock, ObjectMapper objectMapper,
                            AlertFrameworkProperties properties) {
        this(new DetectorContext(readingSource, modelCache, clock, properties.getProcessing().getDefaultValidity()),
            new ConfigurationBinder(objectMapper));
    }

    public DetectorRegistry(DetectorContext context, ConfigurationBinder binder) {
        this.context = context;
        this.binder = binder;
        register(PassthroughDetector.DEFINITION);
        register(ThresholdDetector.DEFINITION);
        register(ZScoreDetector.DEFINITION);
        register(ClassificationDetector.DEFINITION);
        register(ScenarioTestDetector.DEFINITION);
        register(ScoringDetector.DEFINITION);
        register(ConflictSurgeDetector.DEFINITION);
    }

    public final void register(DetectorDefinition<?> definition) {
        DetectorDefinition<?> previous = definitions.putIfAbsent(definition.key(), definition);
        if (previous != null) {
            throw new IllegalStateException("Detector type already registered: " + definition.key());
        }
        log.debug("[DETECTOR-REGISTRY] Registered detector type '{}'", definition.key());
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(definitions.keySet());
    }

    public boolean isRegistered(String key) {
        return key != null && definitions.containsKey(key);
    }

    public ConfigurationSchema schemaFor(String key) {
        return definition(key).schema();
    }

    /**
     * Published JSON-Schema-like description of a variant's configuration.
     */
    public ObjectNode schemaJson(String key) {
        return definition(key).schema().toJson(binder.mapper());
    }

    /**
     * All violations of a stored configuration; empty when the detector can be built.
     */
    public List<String> validate(DetectorConfig config) {
        if (!isRegistered(config.getType())) {
            return List.of(String.format("type: unknown detector type '%s', expected one of %s", config.getType(), keys()));
        }
        List<String> violations = new ArrayList<>(schemaFor(config.getType())
            .validate(binder.mapper().valueToTree(config.getConfiguration() == null ? Map.of() : config.getConfiguration())));
        if (violations.isEmpty()) {
            try {
                create(config);
            } catch (DetectorConfigurationException e) {
                violations.addAll(e.getViolations());
            } catch (IllegalArgumentException e) {
                violations.add("configuration: " + e.getMessage());
            }
        }
        return violations;
    }

    /**
     * Build a detector instance from its stored configuration.
     *
     * @throws DetectorConfigurationException for unknown types or invalid configurations
     */
    public Detector create(DetectorConfig config) {
        DetectorDefinition<?> definition = definitions.get(config.getType());
        if (definition == null) {
            throw new DetectorConfigurationException(config.getName(),
                List.of(String.format("type: unknown detector type '%s', expected one of %s", config.getType(), keys())));
        }
        return instantiate(definition, config);
    }

    private <C> Detector instantiate(DetectorDefinition<C> definition, DetectorConfig config) {
        C settings = binder.bind(config.getName(), definition.schema(), config.getConfiguration(), definition.settingsType());
        try {
            return definition.factory().create(config, settings, context);
        } catch (IllegalArgumentException e) {
            throw new DetectorConfigurationException(config.getName(), List.of("configuration: " + e.getMessage()));
        }
    }

    private DetectorDefinition<?> definition(String key) {
        DetectorDefinition<?> definition = definitions.get(key);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown detector type: " + key);
        }
        return definition;
    }
}
