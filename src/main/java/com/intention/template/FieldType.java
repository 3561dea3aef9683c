package com.intention.template;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.Map;

/**
 * Field types understood by template input and output schemas.
 */
public enum FieldType {

    STRING,
    NUMBER,
    INTEGER,
    BOOLEAN,
    ARRAY,
    OBJECT;

    /**
     * Check a Java value as produced by Jackson for request bodies.
     */
    public boolean matches(Object value) {
        if (value == null) {
            return false;
        }
        return switch (this) {
            case STRING -> value instanceof CharSequence;
            case NUMBER -> value instanceof Number;
            case INTEGER -> value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof Byte
                    || value instanceof java.math.BigInteger;
            case BOOLEAN -> value instanceof Boolean;
            case ARRAY -> value instanceof Collection || value.getClass().isArray();
            case OBJECT -> value instanceof Map;
        };
    }

    public boolean matches(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        return switch (this) {
            case STRING -> node.isTextual();
            case NUMBER -> node.isNumber();
            case INTEGER -> node.isIntegralNumber();
            case BOOLEAN -> node.isBoolean();
            case ARRAY -> node.isArray();
            case OBJECT -> node.isObject();
        };
    }

    public String displayName() {
        return name().toLowerCase();
    }
}
