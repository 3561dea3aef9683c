package com.intention.template;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Required fields and their types for a template's structured output.
 */
public final class ResponseSchema {

    private final Map<String, FieldType> fields;

    public ResponseSchema(Map<String, FieldType> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Map<String, FieldType> getFields() {
        return fields;
    }

    /**
     * @return violations in field declaration order; empty when the node is valid
     */
    public List<String> validate(JsonNode node) {
        List<String> violations = new ArrayList<>();
        if (node == null || !node.isObject()) {
            violations.add("Response must be a JSON object");
            return violations;
        }
        for (Map.Entry<String, FieldType> field : fields.entrySet()) {
            JsonNode value = node.get(field.getKey());
            if (value == null || value.isNull()) {
                violations.add("Missing required field: " + field.getKey());
            } else if (!field.getValue().matches(value)) {
                violations.add(String.format("Invalid type for %s. Expected %s, got %s",
                        field.getKey(), field.getValue().displayName(), value.getNodeType().name().toLowerCase()));
            }
        }
        return violations;
    }
}
