package com.wasteland.data;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.wasteland.config.EngineConfig;
import com.wasteland.data.model.Coordinate;
import com.wasteland.data.model.Location;
import com.wasteland.data.model.LootEntry;
import com.wasteland.state.ItemCategory;
import com.wasteland.state.Rarity;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository of claimable locations.
 *
 * <p>Locations are loaded from {@code data/locations.json} at startup and never change.
 * A location without {@code radiusM} uses the configured default radius.
 */
@Slf4j
@Singleton
public class LocationRepository {

    public static final String DATA_FILE = "/data/locations.json";

    private final Map<String, Location> locationsById;

    @Inject
    public LocationRepository(EngineConfig config) {
        this(DATA_FILE, config.getDefaultRadiusMeters());
    }

    public LocationRepository(String resourcePath, double defaultRadiusMeters) {
        Gson gson = GsonFactory.create();
        this.locationsById = JsonResourceLoader.loadAndParse(gson, resourcePath,
                root -> parseLocations(root, defaultRadiusMeters));
        log.info("Loaded {} locations from {}", locationsById.size(), resourcePath);
    }

    public Optional<Location> getLocation(String id) {
        return Optional.ofNullable(locationsById.get(id));
    }

    public Collection<Location> getAll() {
        return Collections.unmodifiableCollection(locationsById.values());
    }

    // ========================================================================
    // Parsing
    // ========================================================================

    private static Map<String, Location> parseLocations(JsonObject root, double defaultRadiusMeters) {
        Map<String, Location> result = new LinkedHashMap<>();
        for (JsonElement element : JsonResourceLoader.getRequiredArray(root, "locations")) {
            Location location = parseLocation(element.getAsJsonObject(), defaultRadiusMeters);
            if (result.putIfAbsent(location.id(), location) != null) {
                throw new JsonResourceLoader.JsonLoadException("Duplicate location id: " + location.id());
            }
        }
        return result;
    }

    private static Location parseLocation(JsonObject obj, double defaultRadiusMeters) {
        String id = JsonResourceLoader.getRequiredString(obj, "id");
        double radius = obj.has("radiusM") ? obj.get("radiusM").getAsDouble() : defaultRadiusMeters;
        if (radius <= 0) {
            throw new JsonResourceLoader.JsonLoadException("Location " + id + " has non-positive radius " + radius);
        }

        JsonArray table = JsonResourceLoader.getRequiredArray(obj, "lootTable");
        List<LootEntry> entries = new ArrayList<>(table.size());
        for (JsonElement entry : table) {
            entries.add(parseLootEntry(entry.getAsJsonObject()));
        }
        if (entries.isEmpty()) {
            log.warn("Location {} has an empty loot table; claims there never yield loot", id);
        }

        return Location.builder()
                .id(id)
                .name(JsonResourceLoader.getRequiredString(obj, "name"))
                .coordinate(new Coordinate(obj.get("lat").getAsDouble(), obj.get("lng").getAsDouble()))
                .radiusMeters(radius)
                .lootTable(entries)
                .build();
    }

    private static LootEntry parseLootEntry(JsonObject obj) {
        ItemCategory category = ItemCategory.fromId(JsonResourceLoader.getRequiredString(obj, "type"));
        return LootEntry.builder()
                .id(JsonResourceLoader.getRequiredString(obj, "id"))
                .name(JsonResourceLoader.getRequiredString(obj, "name"))
                .category(category)
                .weight(obj.get("weight").getAsDouble())
                .rarity(Rarity.fromId(JsonResourceLoader.getRequiredString(obj, "rarity")))
                .stats(ItemStatsCodec.fromJson(category, obj.getAsJsonObject("stats")))
                .build();
    }
}
