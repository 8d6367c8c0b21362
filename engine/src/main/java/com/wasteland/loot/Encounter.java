package com.wasteland.loot;

import com.wasteland.state.Faction;

/**
 * Random encounters that can happen during a claim.
 */
public enum Encounter {

    RAIDER_AMBUSH(-12, Faction.RAIDERS, 4, "Raider ambush! Lost 12 HP."),

    BROTHERHOOD_PATROL(0, Faction.BROTHERHOOD, 6, "Brotherhood patrol! Gained 6 reputation."),

    VAULT_DWELLER_AID(12, Faction.VAULT, 5, "Vault Dweller aid! Restored 12 HP.");

    private final int healthChange;
    private final Faction faction;
    private final int reputationChange;
    private final String description;

    Encounter(int healthChange, Faction faction, int reputationChange, String description) {
        this.healthChange = healthChange;
        this.faction = faction;
        this.reputationChange = reputationChange;
        this.description = description;
    }

    public int getHealthChange() {
        return healthChange;
    }

    public Faction getFaction() {
        return faction;
    }

    public int getReputationChange() {
        return reputationChange;
    }

    public String getDescription() {
        return description;
    }
}
