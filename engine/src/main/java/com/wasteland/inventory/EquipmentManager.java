package com.wasteland.inventory;

import com.wasteland.config.EngineConfig;
import com.wasteland.config.MaxHealthPolicy;
import com.wasteland.core.EngineException;
import com.wasteland.progression.ProgressionLedger;
import com.wasteland.state.EquipmentSlot;
import com.wasteland.state.InventoryItem;
import com.wasteland.state.Player;
import com.wasteland.state.PlayerStore;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.Optional;

/**
 * Moves owned items into gear slots.
 *
 * <p>Equipping never adds or removes inventory items. Maximum health is re-derived
 * according to the configured {@link MaxHealthPolicy}.
 */
@Slf4j
@Singleton
public class EquipmentManager {

    private final PlayerStore store;
    private final MaxHealthPolicy maxHealthPolicy;

    @Inject
    public EquipmentManager(PlayerStore store, EngineConfig config) {
        this(store, config.getMaxHealthPolicy());
    }

    public EquipmentManager(PlayerStore store, MaxHealthPolicy maxHealthPolicy) {
        this.store = store;
        this.maxHealthPolicy = maxHealthPolicy;
    }

    /**
     * Equip the first inventory item with {@code itemId}, holding the wallet's lock.
     *
     * @throws EngineException {@code NOT_FOUND} if no such item is owned,
     *                         {@code VALIDATION} if its category has no slot
     */
    public EquipResult equip(String wallet, String itemId) {
        return store.withPlayer(wallet, player -> equip(player, itemId));
    }

    /**
     * Equip against an already-locked player.
     */
    public EquipResult equip(Player player, String itemId) {
        InventoryItem item = player.findItem(itemId)
                .orElseThrow(() -> EngineException.notFound("Item not found"));
        EquipmentSlot slot = item.getCategory().getSlot()
                .orElseThrow(() -> EngineException.validation("Item is not equippable"));

        Optional<InventoryItem> replaced = player.equip(slot, item);

        if (maxHealthPolicy == MaxHealthPolicy.CUMULATIVE) {
            refreshMaxHealth(player);
        } else if (item.getStats().defense() > 0) {
            player.setMaxHealth(Player.BASE_MAX_HEALTH + item.getStats().defense());
        }

        log.debug("{} equipped {} in {} slot", player.getWallet(), item.getId(), slot);
        return new EquipResult(slot, item, replaced.orElse(null), player.summary());
    }

    /**
     * Re-derive maximum health from the player's current gear after a slot changed outside
     * {@link #equip}. Only {@link MaxHealthPolicy#CUMULATIVE} depends on the whole gear set;
     * {@link MaxHealthPolicy#LAST_EQUIPPED} changes on equip alone.
     */
    public void refreshMaxHealth(Player player) {
        if (maxHealthPolicy != MaxHealthPolicy.CUMULATIVE) {
            return;
        }
        int totalDefense = 0;
        for (InventoryItem equipped : player.getGear().values()) {
            if (equipped != null) {
                totalDefense += equipped.getStats().defense();
            }
        }
        int levelBonus = (player.getLevel() - Player.STARTING_LEVEL) * ProgressionLedger.HEALTH_PER_LEVEL;
        player.setMaxHealth(Player.BASE_MAX_HEALTH + levelBonus + totalDefense);
    }
}
