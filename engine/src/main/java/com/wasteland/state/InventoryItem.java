package com.wasteland.state;

import com.wasteland.state.stats.ItemStats;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Instant;

/**
 * An item a player owns: either rolled loot or a crafted object.
 *
 * <p>Items are immutable. Attaching a loot token produces a new instance that replaces the
 * old one in the owner's inventory (see {@link Player#replaceItem}).
 */
@Value
@Builder(toBuilder = true)
public class InventoryItem {

    /**
     * Source recorded on crafted items.
     */
    public static final String SOURCE_CRAFTING = "crafting";

    /**
     * Template id for loot (several items may share it) or a unique id for crafted items.
     */
    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    ItemCategory category;

    @NonNull
    Rarity rarity;

    @NonNull
    ItemStats stats;

    /**
     * Name of the location the item was found at, or {@link #SOURCE_CRAFTING}.
     */
    @NonNull
    String source;

    @NonNull
    Instant createdAt;

    /**
     * Id of the representational token minted for top-tier loot.
     */
    @Nullable
    String lootTokenId;

    public boolean isEquippable() {
        return category.isEquippable();
    }

    public InventoryItem withLootTokenId(String tokenId) {
        return toBuilder().lootTokenId(tokenId).build();
    }
}
