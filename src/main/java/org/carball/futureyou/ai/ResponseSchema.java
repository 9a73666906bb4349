package org.carball.futureyou.ai;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Field-requirement table for a model response. Every agent validates its parsed JSON
 * through one of these instead of ad hoc key checks.
 */
public final class ResponseSchema {

    public enum FieldType {
        TEXT("a string"),
        NUMBER("a number"),
        ARRAY("an array"),
        OBJECT("an object");

        private final String description;

        FieldType(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }

        boolean matches(JsonNode node) {
            return switch (this) {
                case TEXT -> node.isTextual();
                case NUMBER -> node.isNumber();
                case ARRAY -> node.isArray();
                case OBJECT -> node.isObject();
            };
        }
    }

    public record FieldRequirement(String name, FieldType type, Double min, Double max) {

        boolean hasRange() {
            return min != null || max != null;
        }
    }

    private final String description;
    private final List<FieldRequirement> fields;
    private final ResponseSchema elementSchema;
    private final int expectedSize;

    private ResponseSchema(String description, List<FieldRequirement> fields,
                           ResponseSchema elementSchema, int expectedSize) {
        this.description = description;
        this.fields = Collections.unmodifiableList(fields);
        this.elementSchema = elementSchema;
        this.expectedSize = expectedSize;
    }

    public static Builder object(String description) {
        return new Builder(description);
    }

    /**
     * Schema for a JSON array of exactly {@code expectedSize} elements, each matching {@code elementSchema}.
     */
    public static ResponseSchema arrayOf(String description, int expectedSize, ResponseSchema elementSchema) {
        return new ResponseSchema(description, List.of(), elementSchema, expectedSize);
    }

    public String getDescription() {
        return description;
    }

    public List<FieldRequirement> getFields() {
        return fields;
    }

    public List<String> getFieldNames() {
        List<String> names = new ArrayList<>();
        for (FieldRequirement field : fields) {
            names.add(field.name());
        }
        return names;
    }

    public void validate(JsonNode node) {
        if (elementSchema != null) {
            validateArray(node);
        } else {
            validateObject(node, description);
        }
    }

    private void validateArray(JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new SchemaViolationException(description,
                    "Expected " + expectedSize + " " + description + ", got " + describe(node));
        }
        if (node.size() != expectedSize) {
            throw new SchemaViolationException(description,
                    "Expected " + expectedSize + " " + description + ", got " + node.size());
        }
        for (int i = 0; i < node.size(); i++) {
            elementSchema.validateObject(node.get(i), elementSchema.description + " " + i);
        }
    }

    private void validateObject(JsonNode node, String context) {
        if (node == null || !node.isObject()) {
            throw new SchemaViolationException(context, "Expected " + context + " to be an object, got " + describe(node));
        }
        for (FieldRequirement field : fields) {
            JsonNode value = node.get(field.name());
            if (value == null) {
                throw new SchemaViolationException(field.name(), "Missing key in " + context + ": " + field.name());
            }
            if (!field.type().matches(value)) {
                throw new SchemaViolationException(field.name(),
                        "Key " + field.name() + " in " + context + " must be " + field.type().getDescription()
                                + ", got " + describe(value));
            }
            if (field.hasRange()) {
                double number = value.asDouble();
                if ((field.min() != null && number < field.min()) || (field.max() != null && number > field.max())) {
                    throw new SchemaViolationException(field.name(),
                            "Invalid " + field.name() + " in " + context + ": " + number
                                    + " is outside [" + field.min() + ", " + field.max() + "]");
                }
            }
        }
    }

    private static String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "nothing";
        }
        return node.getNodeType().name().toLowerCase();
    }

    public static final class Builder {

        private final String description;
        private final List<FieldRequirement> fields = new ArrayList<>();

        private Builder(String description) {
            this.description = description;
        }

        public Builder text(String name) {
            fields.add(new FieldRequirement(name, FieldType.TEXT, null, null));
            return this;
        }

        public Builder number(String name, double min, double max) {
            fields.add(new FieldRequirement(name, FieldType.NUMBER, min, max));
            return this;
        }

        public Builder array(String name) {
            fields.add(new FieldRequirement(name, FieldType.ARRAY, null, null));
            return this;
        }

        public Builder object(String name) {
            fields.add(new FieldRequirement(name, FieldType.OBJECT, null, null));
            return this;
        }

        public ResponseSchema build() {
            return new ResponseSchema(description, new ArrayList<>(fields), null, 0);
        }
    }
}
