package com.ewas.alerting.detector.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * JSON-Schema-like description of a detector configuration.
 *
 * Supports the subset detectors need: typed properties with bounds, enums and
 * defaults, required keys, nested item schemas and additionalProperties=false.
 */
@Value
@Builder
public class ConfigurationSchema {

    String title;
    String description;

    @Singular
    Map<String, SchemaProperty> properties;

    @Singular("required")
    List<String> required;

    @Builder.Default
    boolean additionalProperties = true;

    public static final String DISABLE_DEDUPLICATION = "disable_deduplication";
    public static final String MONITORED_SOURCES = "monitored_sources";
    public static final String MONITORED_VARIABLES = "monitored_variables";
    public static final String AUTO_TRIGGER_ON_DATA = "auto_trigger_on_data";

    /**
     * Builder preloaded with the keys every detector accepts.
     */
    public static ConfigurationSchemaBuilder forDetector(String title) {
        return ConfigurationSchema.builder()
            .title(title)
            .property(DISABLE_DEDUPLICATION,
                SchemaProperty.bool("Skip duplicate checks for detections of this detector", false))
            .property(MONITORED_SOURCES, SchemaProperty.builder()
                .type(SchemaType.ARRAY).description("Sources whose processing triggers a run").build())
            .property(MONITORED_VARIABLES, SchemaProperty.builder()
                .type(SchemaType.ARRAY).description("Variables whose updates trigger a run").build())
            .property(AUTO_TRIGGER_ON_DATA,
                SchemaProperty.bool("Run whenever any source finishes processing", false));
    }

    /**
     * Validate an object node, returning human-readable violations (empty when valid).
     */
    public List<String> validate(JsonNode config) {
        return validate("configuration", config);
    }

    List<String> validate(String path, JsonNode config) {
        List<String> violations = new ArrayList<>();
        if (config == null || !config.isObject()) {
            violations.add(path + ": expected an object");
            return violations;
        }
        for (String key : required) {
            JsonNode value = config.get(key);
            if (value == null || value.isMissingNode()) {
                violations.add(String.format("%s.%s: is required", path, key));
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = config.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            SchemaProperty property = properties.get(field.getKey());
            if (property == null) {
                if (!additionalProperties) {
                    violations.add(String.format("%s.%s: unknown key", path, field.getKey()));
                }
                continue;
            }
            violations.addAll(property.validate(path + "." + field.getKey(), field.getValue()));
        }
        return violations;
    }

    /**
     * Copy of the configuration with defaults filled in for absent keys.
     */
    public ObjectNode withDefaults(JsonNode config, ObjectMapper mapper) {
        ObjectNode merged = config != null && config.isObject() ? ((ObjectNode) config).deepCopy() : mapper.createObjectNode();
        properties.forEach((key, property) -> {
            if (!merged.has(key) && property.getDefaultValue() != null) {
                merged.set(key, mapper.valueToTree(property.getDefaultValue()));
            }
        });
        return merged;
    }

    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", "object");
        if (title != null) {
            node.put("title", title);
        }
        if (description != null) {
            node.put("description", description);
        }
        ObjectNode props = node.putObject("properties");
        properties.forEach((key, property) -> props.set(key, property.toJson(mapper)));
        if (!required.isEmpty()) {
            required.forEach(node.putArray("required")::add);
        }
        node.put("additionalProperties", additionalProperties);
        return node;
    }
}
