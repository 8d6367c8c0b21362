package com.wasteland.state;

import com.google.gson.annotations.SerializedName;

import java.util.Locale;

/**
 * Rarity tier of a reward or crafted item.
 */
public enum Rarity {

    @SerializedName("common")
    COMMON(0),

    @SerializedName("uncommon")
    UNCOMMON(0),

    @SerializedName("rare")
    RARE(24),

    @SerializedName("legendary")
    LEGENDARY(60);

    private final int claimBonus;

    Rarity(int claimBonus) {
        this.claimBonus = claimBonus;
    }

    /**
     * Extra caps awarded when a claim rolls loot of this rarity.
     */
    public int getClaimBonus() {
        return claimBonus;
    }

    /**
     * Rare and legendary rewards get the reputation weight bonus and a loot token.
     */
    public boolean isTopTier() {
        return this == RARE || this == LEGENDARY;
    }

    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Rarity fromId(String id) {
        for (Rarity rarity : values()) {
            if (rarity.getId().equalsIgnoreCase(id)) {
                return rarity;
            }
        }
        throw new IllegalArgumentException("Unknown rarity: " + id);
    }

    @Override
    public String toString() {
        return getId();
    }
}
