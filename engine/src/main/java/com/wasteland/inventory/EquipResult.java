package com.wasteland.inventory;

import com.wasteland.state.EquipmentSlot;
import com.wasteland.state.InventoryItem;
import com.wasteland.state.PlayerSummary;

import javax.annotation.Nullable;

/**
 * Outcome of a successful equip.
 *
 * @param slot     the slot the item now occupies
 * @param item     the equipped item
 * @param replaced the slot's previous occupant, still in the inventory
 * @param player   the player after the change
 */
public record EquipResult(
        EquipmentSlot slot,
        InventoryItem item,
        @Nullable InventoryItem replaced,
        PlayerSummary player
) {
}
