package com.wasteland.data;

import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.wasteland.state.InventoryItem;
import com.wasteland.state.ItemCategory;
import com.wasteland.state.Rarity;
import com.wasteland.state.stats.ArmorStats;
import com.wasteland.state.stats.ConsumableStats;
import com.wasteland.state.stats.ItemStats;
import com.wasteland.state.stats.MaterialStats;
import com.wasteland.state.stats.TraitStats;
import com.wasteland.state.stats.WeaponStats;

import java.lang.reflect.Type;
import java.time.Instant;
import java.util.Map;

/**
 * Converts between the flat JSON stats object used in content files and responses
 * and the typed {@link ItemStats} variant for an item's category.
 */
public final class ItemStatsCodec {

    private ItemStatsCodec() {
        // Utility class - prevent instantiation
    }

    /**
     * Build the stats variant for {@code category} from a flat JSON object.
     * Missing fields read as zero/false; fields foreign to the category are ignored.
     *
     * @param category the owning item's category
     * @param stats    flat stats object, may be null
     * @return typed stats
     */
    public static ItemStats fromJson(ItemCategory category, JsonObject stats) {
        JsonObject obj = stats != null ? stats : new JsonObject();
        switch (category) {
            case WEAPON:
                return new WeaponStats(intField(obj, "attack"), boolField(obj, "energy"));
            case HEAD:
            case BODY:
                return new ArmorStats(intField(obj, "defense"), intField(obj, "carry"));
            case CONSUMABLE:
                return new ConsumableStats(intField(obj, "heal"), intField(obj, "ammo"));
            case ACCESSORY:
            case ARTIFACT:
                return new TraitStats(intField(obj, "charisma"));
            case MATERIAL:
                return new MaterialStats(intField(obj, "value"), intField(obj, "intel"));
            default:
                throw new IllegalArgumentException("Unhandled category: " + category);
        }
    }

    /**
     * Flat JSON object for a stats variant.
     */
    public static JsonObject toJson(ItemStats stats) {
        JsonObject obj = new JsonObject();
        for (Map.Entry<String, Object> entry : stats.asMap().entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Boolean b) {
                obj.addProperty(entry.getKey(), b);
            } else if (value instanceof Number n) {
                obj.addProperty(entry.getKey(), n);
            } else {
                obj.addProperty(entry.getKey(), String.valueOf(value));
            }
        }
        return obj;
    }

    private static int intField(JsonObject obj, String name) {
        JsonElement element = obj.get(name);
        if (element == null || element.isJsonNull()) {
            return 0;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean() ? 1 : 0;
        }
        return primitive.getAsInt();
    }

    private static boolean boolField(JsonObject obj, String name) {
        JsonElement element = obj.get(name);
        if (element == null || element.isJsonNull()) {
            return false;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isNumber()) {
            return primitive.getAsInt() != 0;
        }
        return primitive.getAsBoolean();
    }

    /**
     * Writes any {@link ItemStats} variant as its flat object.
     */
    static class StatsSerializer implements JsonSerializer<ItemStats> {
        @Override
        public JsonElement serialize(ItemStats src, Type typeOfSrc, JsonSerializationContext context) {
            return toJson(src);
        }
    }

    /**
     * Reads an inventory item, resolving its stats through its category.
     */
    static class InventoryItemDeserializer implements JsonDeserializer<InventoryItem> {
        @Override
        public InventoryItem deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context) {
            if (!json.isJsonObject()) {
                throw new JsonParseException("Inventory item must be an object: " + json);
            }
            JsonObject obj = json.getAsJsonObject();
            try {
                ItemCategory category = ItemCategory.fromId(requiredString(obj, "category"));
                JsonElement token = obj.get("lootTokenId");
                return InventoryItem.builder()
                        .id(requiredString(obj, "id"))
                        .name(requiredString(obj, "name"))
                        .category(category)
                        .rarity(Rarity.fromId(requiredString(obj, "rarity")))
                        .stats(fromJson(category, obj.getAsJsonObject("stats")))
                        .source(requiredString(obj, "source"))
                        .createdAt(Instant.parse(requiredString(obj, "createdAt")))
                        .lootTokenId(token == null || token.isJsonNull() ? null : token.getAsString())
                        .build();
            } catch (RuntimeException e) {
                throw new JsonParseException("Invalid inventory item: " + e.getMessage(), e);
            }
        }

        private static String requiredString(JsonObject obj, String name) {
            JsonElement element = obj.get(name);
            if (element == null || element.isJsonNull()) {
                throw new JsonParseException("Missing field '" + name + "'");
            }
            return element.getAsString();
        }
    }
}
