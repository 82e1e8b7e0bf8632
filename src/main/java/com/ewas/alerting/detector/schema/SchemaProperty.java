package com.ewas.alerting.detector.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * One configuration key: accepted types, bounds, allowed values and default.
 */
@Value
@Builder
public class SchemaProperty {

    @Singular
    Set<SchemaType> types;

    String description;

    Double minimum;
    Double maximum;
    Integer minLength;

    @Singular("allowed")
    List<Object> allowedValues;

    /**
     * Applied when the key is absent; null means no default.
     */
    Object defaultValue;

    /**
     * Schema of array items (for ARRAY) or of nested keys (for OBJECT).
     */
    ConfigurationSchema items;

    /**
     * For OBJECT without nested schema: type every value must have.
     */
    SchemaType valueType;

    public static SchemaProperty string(String description) {
        return SchemaProperty.builder().type(SchemaType.STRING).description(description).minLength(1).build();
    }

    public static SchemaProperty number(String description, Double minimum, Double maximum, Double defaultValue) {
        return SchemaProperty.builder().type(SchemaType.NUMBER).description(description)
            .minimum(minimum).maximum(maximum).defaultValue(defaultValue).build();
    }

    public static SchemaProperty integer(String description, Integer minimum, Integer maximum, Integer defaultValue) {
        return SchemaProperty.builder().type(SchemaType.INTEGER).description(description)
            .minimum(minimum == null ? null : minimum.doubleValue())
            .maximum(maximum == null ? null : maximum.doubleValue())
            .defaultValue(defaultValue).build();
    }

    public static SchemaProperty optionalInteger(String description, Integer minimum) {
        return SchemaProperty.builder().type(SchemaType.INTEGER).type(SchemaType.NULL).description(description)
            .minimum(minimum == null ? null : minimum.doubleValue()).build();
    }

    public static SchemaProperty bool(String description, boolean defaultValue) {
        return SchemaProperty.builder().type(SchemaType.BOOLEAN).description(description).defaultValue(defaultValue).build();
    }

    public static SchemaProperty oneOf(String description, String defaultValue, String... allowed) {
        return SchemaProperty.builder().type(SchemaType.STRING).description(description)
            .allowedValues(List.of(allowed)).defaultValue(defaultValue).build();
    }

    List<String> validate(String path, JsonNode node) {
        List<String> violations = new ArrayList<>();
        if (types.stream().noneMatch(type -> type.matches(node))) {
            violations.add(String.format("%s: expected %s but was %s", path, typeNames(), node.getNodeType().name().toLowerCase()));
            return violations;
        }
        if (node.isNull()) {
            return violations;
        }
        if (node.isNumber()) {
            double value = node.asDouble();
            if (minimum != null && value < minimum) {
                violations.add(String.format("%s: %s is below minimum %s", path, node.asText(), format(minimum)));
            }
            if (maximum != null && value > maximum) {
                violations.add(String.format("%s: %s is above maximum %s", path, node.asText(), format(maximum)));
            }
        }
        if (node.isTextual() && minLength != null && node.asText().length() < minLength) {
            violations.add(String.format("%s: must have at least %d characters", path, minLength));
        }
        if (!allowedValues.isEmpty() && allowedValues.stream().noneMatch(allowed -> sameValue(allowed, node))) {
            violations.add(String.format("%s: '%s' is not one of %s", path, node.asText(), allowedValues));
        }
        if (node.isArray() && items != null) {
            for (int i = 0; i < node.size(); i++) {
                violations.addAll(items.validate(path + "[" + i + "]", node.get(i)));
            }
        }
        if (node.isObject() && items != null) {
            violations.addAll(items.validate(path, node));
        } else if (node.isObject() && valueType != null) {
            node.fields().forEachRemaining(entry -> {
                if (!valueType.matches(entry.getValue())) {
                    violations.add(String.format("%s.%s: expected %s", path, entry.getKey(), valueType.jsonName()));
                }
            });
        }
        return violations;
    }

    ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        if (types.size() == 1) {
            node.put("type", types.iterator().next().jsonName());
        } else {
            ArrayNode typeArray = node.putArray("type");
            types.forEach(type -> typeArray.add(type.jsonName()));
        }
        if (description != null) {
            node.put("description", description);
        }
        if (minimum != null) {
            node.put("minimum", minimum);
        }
        if (maximum != null) {
            node.put("maximum", maximum);
        }
        if (minLength != null) {
            node.put("minLength", minLength);
        }
        if (!allowedValues.isEmpty()) {
            ArrayNode allowed = node.putArray("enum");
            allowedValues.forEach(value -> allowed.add(mapper.valueToTree(value)));
        }
        if (defaultValue != null) {
            node.set("default", mapper.valueToTree(defaultValue));
        }
        if (items != null && types.contains(SchemaType.ARRAY)) {
            node.set("items", items.toJson(mapper));
        } else if (items != null) {
            node.setAll(items.toJson(mapper));
        } else if (valueType != null) {
            node.putObject("patternProperties").putObject(".*").put("type", valueType.jsonName());
        }
        return node;
    }

    private List<String> typeNames() {
        return types.stream().map(SchemaType::jsonName).toList();
    }

    private static boolean sameValue(Object allowed, JsonNode node) {
        if (allowed instanceof Number number) {
            return node.isNumber() && number.doubleValue() == node.asDouble();
        }
        return !node.isContainerNode() && allowed.toString().equals(node.asText());
    }

    private static String format(double bound) {
        return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
    }
}
