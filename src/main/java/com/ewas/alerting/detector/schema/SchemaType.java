package com.ewas.alerting.detector.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON value types accepted in a configuration schema.
 */
public enum SchemaType {
    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    ARRAY("array"),
    OBJECT("object"),
    NULL("null");

    private final String jsonName;

    SchemaType(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }

    public boolean matches(JsonNode node) {
        return switch (this) {
            case STRING -> node.isTextual();
            case NUMBER -> node.isNumber();
            case INTEGER -> node.isIntegralNumber()
                || (node.isNumber() && node.asDouble() == Math.rint(node.asDouble()) && !Double.isInfinite(node.asDouble()));
            case BOOLEAN -> node.isBoolean();
            case ARRAY -> node.isArray();
            case OBJECT -> node.isObject();
            case NULL -> node.isNull();
        };
    }
}
