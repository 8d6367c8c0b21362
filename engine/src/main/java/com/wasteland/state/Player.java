package com.wasteland.state;

import lombok.Getter;
import lombok.NonNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable record of one player's progress.
 *
 * <p>Instances are owned by a {@link PlayerStore} and must only be touched inside
 * {@link PlayerStore#withPlayer}, which holds the per-wallet lock. The class itself is
 * not thread-safe.
 *
 * <p>Invariants kept by every mutator: {@code 0 <= health <= maxHealth}, caps never
 * negative, level never decreasing, and every gear slot either empty or holding an item
 * that is also in the inventory.
 */
@Getter
public class Player {

    public static final int STARTING_LEVEL = 1;
    public static final int BASE_MAX_HEALTH = 100;

    @NonNull
    private final String wallet;

    private long caps;

    private int level = STARTING_LEVEL;

    private int experience;

    private int health = BASE_MAX_HEALTH;

    private int maxHealth = BASE_MAX_HEALTH;

    @Getter(lombok.AccessLevel.NONE)
    private final EnumMap<Faction, Integer> reputation = new EnumMap<>(Faction.class);

    @Getter(lombok.AccessLevel.NONE)
    private final List<InventoryItem> inventory = new ArrayList<>();

    @Getter(lombok.AccessLevel.NONE)
    private final EnumMap<EquipmentSlot, InventoryItem> gear = new EnumMap<>(EquipmentSlot.class);

    private Instant lastClaim = Instant.EPOCH;

    public Player(@NonNull String wallet) {
        this.wallet = wallet;
        for (Faction faction : Faction.values()) {
            reputation.put(faction, 0);
        }
        for (EquipmentSlot slot : EquipmentSlot.values()) {
            gear.put(slot, null);
        }
    }

    // ========================================================================
    // Caps & Experience
    // ========================================================================

    public void addCaps(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Caps amount must not be negative: " + amount);
        }
        caps += amount;
    }

    public void addExperience(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Experience amount must not be negative: " + amount);
        }
        experience += amount;
    }

    /**
     * Spend {@code threshold} experience to gain one level.
     * Maximum health grows by {@code healthIncrement} and health refills.
     */
    public void levelUp(int threshold, int healthIncrement) {
        if (threshold <= 0 || experience < threshold) {
            throw new IllegalStateException("Not enough experience to level: " + experience + " < " + threshold);
        }
        experience -= threshold;
        level++;
        maxHealth += healthIncrement;
        health = maxHealth;
    }

    // ========================================================================
    // Health
    // ========================================================================

    /**
     * Apply a health change, clamped to {@code [0, maxHealth]}.
     *
     * @return the health after the change
     */
    public int changeHealth(int delta) {
        health = clampHealth(health + delta);
        return health;
    }

    /**
     * Replace maximum health and pull current health down to it if needed.
     */
    public void setMaxHealth(int maxHealth) {
        if (maxHealth < 0) {
            throw new IllegalArgumentException("Max health must not be negative: " + maxHealth);
        }
        this.maxHealth = maxHealth;
        this.health = clampHealth(health);
    }

    private int clampHealth(int value) {
        return Math.max(0, Math.min(maxHealth, value));
    }

    // ========================================================================
    // Reputation
    // ========================================================================

    public int getReputation(Faction faction) {
        return reputation.getOrDefault(faction, 0);
    }

    /**
     * @return the new reputation value
     */
    public int adjustReputation(Faction faction, int delta) {
        int value = getReputation(faction) + delta;
        reputation.put(faction, value);
        return value;
    }

    public Map<Faction, Integer> getReputation() {
        return Collections.unmodifiableMap(reputation);
    }

    // ========================================================================
    // Inventory
    // ========================================================================

    public List<InventoryItem> getInventory() {
        return Collections.unmodifiableList(inventory);
    }

    public int getInventoryCount() {
        return inventory.size();
    }

    public void addItem(@NonNull InventoryItem item) {
        inventory.add(item);
    }

    /**
     * First item in inventory order with the given id.
     */
    public Optional<InventoryItem> findItem(String itemId) {
        for (InventoryItem item : inventory) {
            if (item.getId().equals(itemId)) {
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }

    public int countItem(String itemId) {
        int count = 0;
        for (InventoryItem item : inventory) {
            if (item.getId().equals(itemId)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Remove up to {@code quantity} items with the given id, most recently added first.
     * Any gear slot holding a removed item is emptied.
     *
     * @return the number of items removed
     */
    public int removeItems(String itemId, int quantity) {
        int removed = 0;
        for (int i = inventory.size() - 1; i >= 0 && removed < quantity; i--) {
            InventoryItem item = inventory.get(i);
            if (item.getId().equals(itemId)) {
                inventory.remove(i);
                unequipInstance(item);
                removed++;
            }
        }
        return removed;
    }

    /**
     * Swap an inventory item for an updated copy, keeping its position and any gear slot it holds.
     *
     * @return false if {@code current} is no longer in the inventory
     */
    public boolean replaceItem(InventoryItem current, InventoryItem replacement) {
        for (int i = 0; i < inventory.size(); i++) {
            if (inventory.get(i) == current) {
                inventory.set(i, replacement);
                for (Map.Entry<EquipmentSlot, InventoryItem> entry : gear.entrySet()) {
                    if (entry.getValue() == current) {
                        entry.setValue(replacement);
                    }
                }
                return true;
            }
        }
        return false;
    }

    private boolean containsInstance(InventoryItem item) {
        for (InventoryItem owned : inventory) {
            if (owned == item) {
                return true;
            }
        }
        return false;
    }

    // ========================================================================
    // Gear
    // ========================================================================

    /**
     * All slots in declaration order; empty slots map to null.
     */
    public Map<EquipmentSlot, InventoryItem> getGear() {
        return Collections.unmodifiableMap(gear);
    }

    public Optional<InventoryItem> getEquipped(EquipmentSlot slot) {
        return Optional.ofNullable(gear.get(slot));
    }

    /**
     * Put an owned item into a slot. The previous occupant stays in the inventory.
     *
     * @return the previous occupant, if any
     */
    public Optional<InventoryItem> equip(EquipmentSlot slot, InventoryItem item) {
        if (!containsInstance(item)) {
            throw new IllegalArgumentException("Item " + item.getId() + " is not in " + wallet + "'s inventory");
        }
        return Optional.ofNullable(gear.put(slot, item));
    }

    private void unequipInstance(InventoryItem item) {
        for (Map.Entry<EquipmentSlot, InventoryItem> entry : gear.entrySet()) {
            if (entry.getValue() == item) {
                entry.setValue(null);
            }
        }
    }

    /**
     * Point gear slots back at the inventory's own instances after deserialization,
     * which produces separate copies. Slots whose item is no longer owned are emptied.
     */
    public void relinkGear() {
        for (EquipmentSlot slot : EquipmentSlot.values()) {
            InventoryItem equipped = gear.get(slot);
            InventoryItem owned = null;
            if (equipped != null) {
                for (InventoryItem item : inventory) {
                    if (item.equals(equipped)) {
                        owned = item;
                        break;
                    }
                }
            }
            gear.put(slot, owned);
        }
        for (Faction faction : Faction.values()) {
            reputation.putIfAbsent(faction, 0);
        }
    }

    // ========================================================================
    // Claims
    // ========================================================================

    public void setLastClaim(@NonNull Instant lastClaim) {
        this.lastClaim = lastClaim;
    }

    public PlayerSummary summary() {
        return new PlayerSummary(
                wallet,
                caps,
                level,
                experience,
                health,
                maxHealth,
                new EnumMap<>(reputation),
                inventory.size(),
                new EnumMap<>(gear));
    }
}
