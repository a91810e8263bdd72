package com.zzf.koda.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input contract of a tool: a flat object of typed fields. Renders the JSON schema sent to the
 * model and validates the arguments the model sends back.
 */
public final class ToolSchema {

    public enum FieldType {
        STRING("string"),
        INTEGER("integer"),
        BOOLEAN("boolean"),
        STRING_ARRAY("array");

        private final String jsonType;

        FieldType(String jsonType) {
            this.jsonType = jsonType;
        }

        public String jsonType() {
            return jsonType;
        }

        boolean accepts(JsonNode value) {
            switch (this) {
                case STRING:
                    return value.isTextual();
                case INTEGER:
                    return value.isIntegralNumber() && value.canConvertToInt();
                case BOOLEAN:
                    return value.isBoolean();
                case STRING_ARRAY:
                    if (!value.isArray()) {
                        return false;
                    }
                    for (JsonNode item : value) {
                        if (!item.isTextual()) {
                            return false;
                        }
                    }
                    return true;
                default:
                    return false;
            }
        }
    }

    public static final class Field {
        private final String name;
        private final FieldType type;
        private final String description;
        private final boolean required;

        Field(String name, FieldType type, String description, boolean required) {
            this.name = name;
            this.type = type;
            this.description = description;
            this.required = required;
        }

        public String getName() {
            return name;
        }

        public FieldType getType() {
            return type;
        }

        public String getDescription() {
            return description;
        }

        public boolean isRequired() {
            return required;
        }
    }

    private final Map<String, Field> fields;

    private ToolSchema(Map<String, Field> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Field> getFields() {
        return fields;
    }

    public ObjectNode toJson() {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        ObjectNode schema = nodes.objectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        ArrayNode required = nodes.arrayNode();
        for (Field field : fields.values()) {
            ObjectNode property = properties.putObject(field.name);
            property.put("type", field.type.jsonType());
            if (field.type == FieldType.STRING_ARRAY) {
                property.putObject("items").put("type", "string");
            }
            if (field.description != null && !field.description.isEmpty()) {
                property.put("description", field.description);
            }
            if (field.required) {
                required.add(field.name);
            }
        }
        schema.set("required", required);
        schema.put("additionalProperties", false);
        return schema;
    }

    /**
     * @return human-readable violations, empty when the arguments satisfy the schema
     */
    public List<String> validate(JsonNode args) {
        List<String> violations = new ArrayList<>();
        if (args == null || args.isNull() || args.isMissingNode()) {
            args = JsonNodeFactory.instance.objectNode();
        }
        if (!args.isObject()) {
            violations.add("arguments must be a JSON object");
            return violations;
        }
        for (Field field : fields.values()) {
            JsonNode value = args.get(field.name);
            if (value == null || value.isNull()) {
                if (field.required) {
                    violations.add("missing required field '" + field.name + "'");
                }
                continue;
            }
            if (!field.type.accepts(value)) {
                violations.add("field '" + field.name + "' must be of type " + describe(field.type));
            }
        }
        Iterator<String> names = args.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!fields.containsKey(name)) {
                violations.add("unknown field '" + name + "'");
            }
        }
        return violations;
    }

    private static String describe(FieldType type) {
        return type == FieldType.STRING_ARRAY ? "array of strings" : type.jsonType();
    }

    public static final class Builder {
        private final Map<String, Field> fields = new LinkedHashMap<>();

        public Builder required(String name, FieldType type, String description) {
            return add(name, type, description, true);
        }

        public Builder optional(String name, FieldType type, String description) {
            return add(name, type, description, false);
        }

        private Builder add(String name, FieldType type, String description, boolean required) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("field name is blank");
            }
            if (fields.containsKey(name)) {
                throw new IllegalArgumentException("duplicate field: " + name);
            }
            fields.put(name, new Field(name, type, description, required));
            return this;
        }

        public ToolSchema build() {
            return new ToolSchema(fields);
        }
    }
}
