package com.wasteland.state;

import com.google.gson.annotations.SerializedName;

import java.util.Locale;
import java.util.Optional;

/**
 * Factions a player holds reputation with.
 */
public enum Faction {

    /**
     * Reputation here raises the odds of rare and legendary loot.
     */
    @SerializedName("brotherhood")
    BROTHERHOOD,

    @SerializedName("raiders")
    RAIDERS,

    @SerializedName("vault")
    VAULT;

    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Look up a faction by its lowercase id.
     *
     * @param id faction id such as {@code "brotherhood"}
     * @return the faction, or empty for anything outside the fixed set
     */
    public static Optional<Faction> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (Faction faction : values()) {
            if (faction.getId().equals(id)) {
                return Optional.of(faction);
            }
        }
        return Optional.empty();
    }

    // Gson writes map keys with toString()
    @Override
    public String toString() {
        return getId();
    }
}
