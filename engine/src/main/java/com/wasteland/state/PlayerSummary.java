package com.wasteland.state;

import java.util.Map;

/**
 * Point-in-time copy of a player's progress, safe to hand out after the lock is released.
 */
public record PlayerSummary(
        String wallet,
        long caps,
        int level,
        int experience,
        int health,
        int maxHealth,
        Map<Faction, Integer> reputation,
        int inventoryCount,
        Map<EquipmentSlot, InventoryItem> gear
) {
}
