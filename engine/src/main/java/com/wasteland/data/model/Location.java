package com.wasteland.data.model;

import lombok.Builder;

import java.util.Collections;
import java.util.List;

/**
 * A claimable place in the world with its geofence and loot table.
 */
@Builder
public record Location(
        String id,
        String name,
        Coordinate coordinate,
        /**
         * Geofence radius in metres.
         */
        double radiusMeters,
        /**
         * Loot table in declaration order. Order matters for tie-adjacent rolls.
         */
        List<LootEntry> lootTable
) {
    @Override
    public List<LootEntry> lootTable() {
        return lootTable != null ? Collections.unmodifiableList(lootTable) : Collections.emptyList();
    }
}
