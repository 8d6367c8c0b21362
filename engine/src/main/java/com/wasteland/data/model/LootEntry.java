package com.wasteland.data.model;

import com.wasteland.state.InventoryItem;
import com.wasteland.state.ItemCategory;
import com.wasteland.state.Rarity;
import com.wasteland.state.stats.ItemStats;
import lombok.Builder;

import java.time.Instant;

/**
 * One weighted row of a location's loot table.
 */
@Builder
public record LootEntry(
        String id,
        String name,
        ItemCategory category,
        /**
         * Relative selection weight, always positive.
         */
        double weight,
        Rarity rarity,
        ItemStats stats
) {
    public LootEntry {
        if (!(weight > 0)) {
            throw new IllegalArgumentException("Loot entry " + id + " must have a positive weight, got " + weight);
        }
    }

    /**
     * Materialize this entry as an owned item.
     *
     * @param source name of the location it was found at
     * @param now    creation time
     */
    public InventoryItem toItem(String source, Instant now) {
        return InventoryItem.builder()
                .id(id)
                .name(name)
                .category(category)
                .rarity(rarity)
                .stats(stats)
                .source(source)
                .createdAt(now)
                .build();
    }
}
