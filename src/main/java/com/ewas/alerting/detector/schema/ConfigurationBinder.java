package com.ewas.alerting.detector.schema;

import com.ewas.alerting.exception.DetectorConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Validates a raw configuration map against a schema once and binds it to a typed struct.
 */
@Slf4j
public class ConfigurationBinder {

    private final ObjectMapper mapper;

    public ConfigurationBinder() {
        this(new ObjectMapper());
    }

    public ConfigurationBinder(ObjectMapper baseMapper) {
        this.mapper = baseMapper.copy()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public <T> T bind(String detectorName, ConfigurationSchema schema, Map<String, Object> raw, Class<T> type) {
        JsonNode node = mapper.valueToTree(raw == null ? Map.of() : raw);
        List<String> violations = schema.validate(node);
        if (!violations.isEmpty()) {
            log.error("[DETECTOR-CONFIG] Detector '{}' rejected: {}", detectorName, violations);
            throw new DetectorConfigurationException(detectorName, violations);
        }
        ObjectNode merged = schema.withDefaults(node, mapper);
        try {
            return mapper.treeToValue(merged, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new DetectorConfigurationException(detectorName,
                List.of("configuration: cannot bind to " + type.getSimpleName() + ": " + e.getMessage()));
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
