package com.wasteland.data.model;

import com.wasteland.state.ItemCategory;
import com.wasteland.state.Rarity;
import com.wasteland.state.stats.ItemStats;
import lombok.Builder;

import java.util.Collections;
import java.util.Map;

/**
 * A crafting recipe: the inputs it consumes and the item it produces.
 */
@Builder
public record Recipe(
        String id,
        String outputName,
        ItemCategory outputCategory,
        Rarity outputRarity,
        ItemStats outputStats,
        /**
         * Material id to quantity, in declaration order. Shortfalls are reported in this order.
         */
        Map<String, Integer> requires
) {
    @Override
    public Map<String, Integer> requires() {
        return requires != null ? Collections.unmodifiableMap(requires) : Collections.emptyMap();
    }

    public int totalInputCount() {
        int total = 0;
        for (int quantity : requires().values()) {
            total += quantity;
        }
        return total;
    }
}
