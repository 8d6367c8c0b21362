package com.wasteland.data;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import com.wasteland.state.InventoryItem;
import com.wasteland.state.stats.ItemStats;

import java.io.IOException;
import java.time.Instant;

/**
 * Centralized factory for creating Gson instances with proper TypeAdapters.
 *
 * <p>Handles {@link Instant} as an ISO-8601 string instead of reflection, which the module
 * system blocks on java.time internals. Item stats are written as flat objects and read back
 * according to the owning item's category.
 *
 * <p>Usage:
 * <pre>
 * // For general use
 * Gson gson = GsonFactory.create();
 *
 * // For responses that keep null fields
 * Gson gson = GsonFactory.builder()
 *     .serializeNulls()
 *     .create();
 * </pre>
 */
public final class GsonFactory {

    private GsonFactory() {
        // Utility class - prevent instantiation
    }

    /**
     * Create a Gson instance with the engine's TypeAdapters registered.
     *
     * @return configured Gson instance
     */
    public static Gson create() {
        return builder().create();
    }

    /**
     * Create a Gson instance with pretty printing enabled.
     *
     * @return configured Gson instance with pretty printing
     */
    public static Gson createPrettyPrinting() {
        return builder().setPrettyPrinting().create();
    }

    /**
     * Get a GsonBuilder pre-configured with the engine's TypeAdapters.
     * Use this when you need additional customization.
     *
     * @return pre-configured GsonBuilder
     */
    public static GsonBuilder builder() {
        return new GsonBuilder()
                .registerTypeAdapter(Instant.class, new InstantAdapter())
                .registerTypeHierarchyAdapter(ItemStats.class, new ItemStatsCodec.StatsSerializer())
                .registerTypeAdapter(InventoryItem.class, new ItemStatsCodec.InventoryItemDeserializer());
    }

    // ========================================================================
    // TypeAdapter for Instant (ISO-8601 format)
    // ========================================================================

    /**
     * TypeAdapter for {@link Instant} using ISO-8601 format.
     * Example: "2024-01-15T10:30:00Z"
     */
    private static class InstantAdapter extends TypeAdapter<Instant> {
        @Override
        public void write(JsonWriter out, Instant value) throws IOException {
            if (value == null) {
                out.nullValue();
            } else {
                out.value(value.toString());
            }
        }

        @Override
        public Instant read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            return Instant.parse(in.nextString());
        }
    }
}
