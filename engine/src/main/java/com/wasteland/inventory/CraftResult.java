package com.wasteland.inventory;

import com.wasteland.state.InventoryItem;
import com.wasteland.state.PlayerSummary;

/**
 * Outcome of a successful craft.
 *
 * @param item   the newly crafted item
 * @param player the player after the change
 */
public record CraftResult(InventoryItem item, PlayerSummary player) {
}
