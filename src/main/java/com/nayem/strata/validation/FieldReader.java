package com.nayem.strata.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Reads typed fields out of a JSON tree, recording every mismatch instead of
 * stopping at the first one.
 */
final class FieldReader {

    private final List<ValidationError> errors = new ArrayList<>();

    List<ValidationError> errors() {
        return errors;
    }

    boolean hasErrors() {
        return !errors.isEmpty();
    }

    void error(String code, String path, String message) {
        errors.add(new ValidationError(code, path, message));
    }

    static String path(String parent, String field) {
        return parent.isEmpty() ? field : parent + "." + field;
    }

    static String index(String parent, int i) {
        return parent + "[" + i + "]";
    }

    String requiredString(JsonNode node, String field, String parent) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            error(SchemaValidator.Codes.REQUIRED, path(parent, field), "'" + field + "' is required");
            return null;
        }
        if (!value.isTextual()) {
            typeMismatch(field, parent, "string", value);
            return null;
        }
        if (value.asText().isBlank()) {
            error(SchemaValidator.Codes.REQUIRED, path(parent, field), "'" + field + "' must not be blank");
            return null;
        }
        return value.asText();
    }

    String optionalString(JsonNode node, String field, String parent) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            typeMismatch(field, parent, "string", value);
            return null;
        }
        return value.asText();
    }

    boolean optionalBoolean(JsonNode node, String field, String parent) {
        Boolean value = nullableBoolean(node, field, parent);
        return value != null && value;
    }

    Boolean nullableBoolean(JsonNode node, String field, String parent) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isBoolean()) {
            typeMismatch(field, parent, "boolean", value);
            return null;
        }
        return value.asBoolean();
    }

    Integer optionalInt(JsonNode node, String field, String parent) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            typeMismatch(field, parent, "integer", value);
            return null;
        }
        return value.asInt();
    }

    JsonNode optionalObject(JsonNode node, String field, String parent) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isObject()) {
            typeMismatch(field, parent, "object", value);
            return null;
        }
        return value;
    }

    /**
     * Reads an array of objects. Absent arrays read as empty.
     */
    <T> List<T> objects(JsonNode node, String field, String parent, BiFunction<JsonNode, String, T> element) {
        List<T> result = objectsOrNull(node, field, parent, element);
        return result == null ? List.of() : result;
    }

    /**
     * Reads an array of objects, returning {@code null} when the field is absent.
     * Elements that fail to read are dropped; their errors are already recorded.
     */
    <T> List<T> objectsOrNull(JsonNode node, String field, String parent,
            BiFunction<JsonNode, String, T> element) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String arrayPath = path(parent, field);
        if (!value.isArray()) {
            typeMismatch(field, parent, "array", value);
            return null;
        }
        List<T> result = new ArrayList<>(value.size());
        for (int i = 0; i < value.size(); i++) {
            JsonNode item = value.get(i);
            String itemPath = index(arrayPath, i);
            if (!item.isObject()) {
                error(SchemaValidator.Codes.TYPE, itemPath, "expected object but found " + describe(item));
                continue;
            }
            T read = element.apply(item, itemPath);
            if (read != null) {
                result.add(read);
            }
        }
        return result;
    }

    List<String> strings(JsonNode node, String field, String parent) {
        List<String> result = stringsOrNull(node, field, parent);
        return result == null ? List.of() : result;
    }

    List<String> stringsOrNull(JsonNode node, String field, String parent) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isArray()) {
            typeMismatch(field, parent, "array", value);
            return null;
        }
        String arrayPath = path(parent, field);
        List<String> result = new ArrayList<>(value.size());
        for (int i = 0; i < value.size(); i++) {
            JsonNode item = value.get(i);
            if (!item.isTextual()) {
                error(SchemaValidator.Codes.TYPE, index(arrayPath, i), "expected string but found " + describe(item));
                continue;
            }
            result.add(item.asText());
        }
        return result;
    }

    private void typeMismatch(String field, String parent, String expected, JsonNode actual) {
        error(SchemaValidator.Codes.TYPE, path(parent, field),
                "expected " + expected + " but found " + describe(actual));
    }

    private static String describe(JsonNode node) {
        return node.getNodeType().name().toLowerCase();
    }
}
