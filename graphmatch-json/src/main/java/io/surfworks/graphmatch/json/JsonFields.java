package io.surfworks.graphmatch.json;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Typed field access on Gson trees with path-aware errors.
 */
final class JsonFields {

    private JsonFields() {}

    static String requireString(JsonObject obj, String field, String path) {
        JsonElement value = obj.get(field);
        if (value == null || value.isJsonNull()) {
            throw new GraphDefinitionException("Missing required field '" + field + "'", path);
        }
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            throw new GraphDefinitionException("Field '" + field + "' must be a string", path);
        }
        return value.getAsString();
    }

    static String optionalString(JsonObject obj, String field, String fallback, String path) {
        JsonElement value = obj.get(field);
        if (value == null || value.isJsonNull()) {
            return fallback;
        }
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            throw new GraphDefinitionException("Field '" + field + "' must be a string", path);
        }
        return value.getAsString();
    }

    static int optionalInt(JsonObject obj, String field, int fallback, String path) {
        JsonElement value = obj.get(field);
        if (value == null || value.isJsonNull()) {
            return fallback;
        }
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
            throw new GraphDefinitionException("Field '" + field + "' must be a number", path);
        }
        return exactInt(value, "Field '" + field + "'", path);
    }

    static List<String> stringList(JsonObject obj, String field, String path) {
        List<String> values = new ArrayList<>();
        JsonArray array = optionalArray(obj, field, path);
        for (int i = 0; i < array.size(); i++) {
            JsonElement item = array.get(i);
            if (!item.isJsonPrimitive() || !item.getAsJsonPrimitive().isString()) {
                throw new GraphDefinitionException("Expected a string", path + "." + field + "[" + i + "]");
            }
            values.add(item.getAsString());
        }
        return values;
    }

    static Set<String> stringSet(JsonObject obj, String field, String path) {
        return new LinkedHashSet<>(stringList(obj, field, path));
    }

    static List<Integer> intList(JsonObject obj, String field, String path) {
        List<Integer> values = new ArrayList<>();
        JsonArray array = optionalArray(obj, field, path);
        for (int i = 0; i < array.size(); i++) {
            JsonElement item = array.get(i);
            if (!item.isJsonPrimitive() || !item.getAsJsonPrimitive().isNumber()) {
                throw new GraphDefinitionException("Expected a number", path + "." + field + "[" + i + "]");
            }
            values.add(exactInt(item, "Value", path + "." + field + "[" + i + "]"));
        }
        return values;
    }

    static List<JsonObject> objectList(JsonObject obj, String field, String path) {
        List<JsonObject> values = new ArrayList<>();
        JsonArray array = optionalArray(obj, field, path);
        for (int i = 0; i < array.size(); i++) {
            JsonElement item = array.get(i);
            if (!item.isJsonObject()) {
                throw new GraphDefinitionException("Expected an object", path + "." + field + "[" + i + "]");
            }
            values.add(item.getAsJsonObject());
        }
        return values;
    }

    // Rejects fractions and values outside the int range instead of truncating them
    private static int exactInt(JsonElement value, String what, String path) {
        try {
            return value.getAsBigDecimal().intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new GraphDefinitionException(what + " must be an integer in int range, got " + value, path);
        }
    }

    private static JsonArray optionalArray(JsonObject obj, String field, String path) {
        JsonElement value = obj.get(field);
        if (value == null || value.isJsonNull()) {
            return new JsonArray();
        }
        if (!value.isJsonArray()) {
            throw new GraphDefinitionException("Field '" + field + "' must be an array", path);
        }
        return value.getAsJsonArray();
    }
}
