package com.researchplatform.webresearch.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** Factory methods for the value types used by the response schemas. */
public final class ValueTypes {

    private static final int MAX_ECHO_CHARS = 60;

    private ValueTypes() {}

    public static ValueType string() {
        return (value, path, diagnostics) -> {
            if (!value.isTextual()) {
                diagnostics.add(path + ": expected string, got " + describe(value));
            }
        };
    }

    /** Absolute URL with a scheme and a host. */
    public static ValueType url() {
        return (value, path, diagnostics) -> {
            if (!value.isTextual() || !isAbsoluteUrl(value.asText())) {
                diagnostics.add(path + ": expected url, got " + describe(value));
            }
        };
    }

    public static ValueType number() {
        return number(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    public static ValueType number(double min, double max) {
        return (value, path, diagnostics) -> {
            if (!value.isNumber()) {
                diagnostics.add(path + ": expected number, got " + describe(value));
                return;
            }
            double d = value.asDouble();
            if (d < min || d > max) {
                diagnostics.add(path + ": expected number between " + format(min) + " and "
                    + format(max) + ", got " + value.asText());
            }
        };
    }

    public static ValueType bool() {
        return (value, path, diagnostics) -> {
            if (!value.isBoolean()) {
                diagnostics.add(path + ": expected boolean, got " + describe(value));
            }
        };
    }

    public static ValueType arrayOf(ValueType element) {
        return (value, path, diagnostics) -> {
            if (!value.isArray()) {
                diagnostics.add(path + ": expected array, got " + describe(value));
                return;
            }
            for (int i = 0; i < value.size(); i++) {
                JsonNode item = value.get(i);
                String itemPath = path + "[" + i + "]";
                if (item.isNull()) {
                    diagnostics.add(itemPath + ": expected element, got null");
                } else {
                    element.check(item, itemPath, diagnostics);
                }
            }
        };
    }

    public static ValueType object(ObjectSchema schema) {
        return schema::validate;
    }

    public static ValueType any() {
        return (value, path, diagnostics) -> { };
    }

    public static ValueType stringArray() {
        return arrayOf(string());
    }

    public static ValueType objectArray(ObjectSchema schema) {
        return arrayOf(object(schema));
    }

    public static ValueType anyArray() {
        return arrayOf(any());
    }

    static String describe(JsonNode value) {
        if (value.isTextual()) {
            String text = value.asText();
            if (text.length() > MAX_ECHO_CHARS) {
                text = text.substring(0, MAX_ECHO_CHARS) + "...";
            }
            return "\"" + text + "\"";
        }
        return value.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    private static boolean isAbsoluteUrl(String text) {
        try {
            URI uri = new URI(text);
            return uri.getScheme() != null && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static String format(double bound) {
        return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
    }
}
