package com.eventsync.infrastructure.normalization;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A JSON-LD property value reduced to one of three shapes: absent, a single
 * string, or a list of strings.
 *
 * <p>Publishers encode the same text as {@code "x"}, {@code {"@value":"x"}},
 * {@code {"@type":"Date","@value":"x"}} or {@code ["x", ...]}. Every field decoder
 * of the normalizer goes through {@link #of(JsonNode)} so those variants are
 * resolved in one place.
 */
public final class JsonLdValue {

    public enum Kind {
        ABSENT, SCALAR, LIST
    }

    private static final JsonLdValue ABSENT = new JsonLdValue(Kind.ABSENT, Collections.emptyList());

    private final Kind kind;
    private final List<String> values;

    private JsonLdValue(Kind kind, List<String> values) {
        this.kind = kind;
        this.values = values;
    }

    public static JsonLdValue absent() {
        return ABSENT;
    }

    public static JsonLdValue of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ABSENT;
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            for (JsonNode element : node) {
                JsonLdValue decoded = of(element);
                values.addAll(decoded.values);
            }
            return values.isEmpty() ? ABSENT : new JsonLdValue(Kind.LIST, Collections.unmodifiableList(values));
        }
        if (node.isObject()) {
            return node.has("@value") ? of(node.get("@value")) : ABSENT;
        }
        if (node.isValueNode()) {
            String text = node.asText().trim();
            return text.isEmpty() ? ABSENT : new JsonLdValue(Kind.SCALAR, List.of(text));
        }
        return ABSENT;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isAbsent() {
        return kind == Kind.ABSENT;
    }

    /**
     * The single value, or the first one of a list. Empty string when absent.
     */
    public String firstOrEmpty() {
        return values.isEmpty() ? "" : values.get(0);
    }

    /**
     * All values, or null when absent, so that absent lists are omitted on the wire.
     */
    public List<String> asListOrNull() {
        return values.isEmpty() ? null : values;
    }

    // Field decoders

    /**
     * Text field: plain string or {@code @value} wrapper.
     */
    public static String text(JsonNode node) {
        return of(node).firstOrEmpty();
    }

    /**
     * Date field: additionally accepts typed values such as
     * {@code {"@type":"DateTime","@value":"..."}}. The string is returned as found.
     */
    public static String date(JsonNode node) {
        return of(node).firstOrEmpty();
    }

    /**
     * List field: a single string becomes a one-element list; absent becomes null.
     */
    public static List<String> list(JsonNode node) {
        return of(node).asListOrNull();
    }

    /**
     * Boolean field: JSON boolean or the strings "true"/"false" in any case.
     * Null for anything else.
     */
    public static Boolean bool(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        JsonLdValue value = of(node);
        if (value.kind != Kind.SCALAR) {
            return null;
        }
        switch (value.firstOrEmpty().toLowerCase(Locale.ROOT)) {
            case "true":
                return Boolean.TRUE;
            case "false":
                return Boolean.FALSE;
            default:
                return null;
        }
    }

    /**
     * Numeric field given as a JSON number or a numeric string. Null otherwise.
     */
    public static Double number(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        String text = text(node);
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * First element of an array, or the node itself. Null for an empty array.
     */
    public static JsonNode first(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isArray()) {
            return node.isEmpty() ? null : node.get(0);
        }
        return node;
    }
}
