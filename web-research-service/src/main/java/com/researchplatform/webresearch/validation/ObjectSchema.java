package com.researchplatform.webresearch.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Declared shape of one JSON object. Unknown properties are ignored; each declared field
 * is checked for presence, nullability and value type. Diagnostics carry the full path,
 * e.g. {@code results[2].url: expected url, got "abc"}.
 */
public final class ObjectSchema {

    private final List<FieldRule> fields;

    private ObjectSchema(List<FieldRule> fields) {
        this.fields = List.copyOf(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public void validate(JsonNode node, String path, List<String> diagnostics) {
        if (!node.isObject()) {
            diagnostics.add(pathOrRoot(path) + ": expected object, got " + ValueTypes.describe(node));
            return;
        }
        for (FieldRule field : fields) {
            String fieldPath = path.isEmpty() ? field.name() : path + "." + field.name();
            JsonNode value = node.get(field.name());

            if (value == null || value.isMissingNode()) {
                if (field.presence() == Presence.REQUIRED) {
                    diagnostics.add(fieldPath + ": required");
                }
                continue;
            }
            if (value.isNull()) {
                if (field.presence() != Presence.OPTIONAL_NULLABLE) {
                    diagnostics.add(fieldPath + ": must not be null");
                }
                continue;
            }
            field.type().check(value, fieldPath, diagnostics);
        }
    }

    private static String pathOrRoot(String path) {
        return path.isEmpty() ? "$" : path;
    }

    public record FieldRule(String name, Presence presence, ValueType type) {}

    public static final class Builder {
        private final List<FieldRule> fields = new ArrayList<>();

        private Builder() {}

        public Builder required(String name, ValueType type) {
            fields.add(new FieldRule(name, Presence.REQUIRED, type));
            return this;
        }

        public Builder optional(String name, ValueType type) {
            fields.add(new FieldRule(name, Presence.OPTIONAL, type));
            return this;
        }

        public Builder optionalNullable(String name, ValueType type) {
            fields.add(new FieldRule(name, Presence.OPTIONAL_NULLABLE, type));
            return this;
        }

        public ObjectSchema build() {
            return new ObjectSchema(fields);
        }
    }
}
