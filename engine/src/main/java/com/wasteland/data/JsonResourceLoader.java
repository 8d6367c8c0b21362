package com.wasteland.data;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;

/**
 * Utility class for loading JSON content from classpath resources.
 *
 * Provides:
 * - UTF-8 encoding
 * - Consistent error handling
 * - Required-field accessors that fail with the field name
 *
 * Usage:
 * <pre>
 * JsonObject data = JsonResourceLoader.load(gson, "/data/locations.json");
 * List&lt;Location&gt; result = JsonResourceLoader.loadAndParse(gson, "/data/locations.json",
 *     json -> parseLocations(json));
 * </pre>
 */
public final class JsonResourceLoader {

    private JsonResourceLoader() {
        // Utility class - prevent instantiation
    }

    /**
     * Load a JSON resource file.
     *
     * @param gson         the Gson instance for parsing
     * @param resourcePath the classpath resource path (e.g., "/data/locations.json")
     * @return the parsed JsonObject
     * @throws JsonLoadException if the resource is missing or not a JSON object
     */
    public static JsonObject load(Gson gson, String resourcePath) {
        try (InputStream is = JsonResourceLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new JsonLoadException("Resource not found: " + resourcePath);
            }

            JsonObject result = gson.fromJson(
                    new InputStreamReader(is, StandardCharsets.UTF_8),
                    JsonObject.class
            );

            if (result == null) {
                throw new JsonLoadException("Parsed JSON is null for: " + resourcePath);
            }

            return result;
        } catch (IOException e) {
            throw new JsonLoadException("I/O error reading " + resourcePath, e);
        } catch (JsonParseException e) {
            throw new JsonLoadException("Malformed JSON in " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load a JSON resource and parse it using a custom parser function.
     *
     * @param gson         the Gson instance for parsing
     * @param resourcePath the classpath resource path
     * @param parser       function to parse the JsonObject into the desired type
     * @param <T>          the result type
     * @return the parsed result
     * @throws JsonLoadException if loading or parsing fails
     */
    public static <T> T loadAndParse(Gson gson, String resourcePath, Function<JsonObject, T> parser) {
        JsonObject json = load(gson, resourcePath);
        try {
            return parser.apply(json);
        } catch (JsonLoadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new JsonLoadException(
                    "Failed to parse JSON from " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Get a required child array from a JsonObject.
     *
     * @param root      the parent JsonObject
     * @param fieldName the field name
     * @return the child JsonArray
     * @throws JsonLoadException if the field doesn't exist or isn't an array
     */
    public static JsonArray getRequiredArray(JsonObject root, String fieldName) {
        JsonElement child = root.get(fieldName);
        if (child == null || !child.isJsonArray()) {
            throw new JsonLoadException("Required array '" + fieldName + "' not found in JSON");
        }
        return child.getAsJsonArray();
    }

    /**
     * Get a required child object from a JsonObject.
     *
     * @param root      the parent JsonObject
     * @param fieldName the field name
     * @return the child JsonObject
     * @throws JsonLoadException if the field doesn't exist or isn't an object
     */
    public static JsonObject getRequiredObject(JsonObject root, String fieldName) {
        JsonElement child = root.get(fieldName);
        if (child == null || !child.isJsonObject()) {
            throw new JsonLoadException("Required object '" + fieldName + "' not found in JSON");
        }
        return child.getAsJsonObject();
    }

    /**
     * Get a required string field from a JsonObject.
     *
     * @throws JsonLoadException if the field is missing or null
     */
    public static String getRequiredString(JsonObject root, String fieldName) {
        JsonElement child = root.get(fieldName);
        if (child == null || child.isJsonNull()) {
            throw new JsonLoadException("Required field '" + fieldName + "' not found in JSON");
        }
        return child.getAsString();
    }

    /**
     * Exception thrown when JSON loading fails.
     */
    public static class JsonLoadException extends RuntimeException {
        public JsonLoadException(String message) {
            super(message);
        }

        public JsonLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
