package com.wasteland.progression;

import com.wasteland.core.EngineException;
import com.wasteland.state.Faction;
import com.wasteland.state.PlayerStore;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.EnumMap;
import java.util.Map;

/**
 * Reads and adjusts per-faction reputation.
 */
@Slf4j
@Singleton
public class ReputationService {

    private final PlayerStore store;

    @Inject
    public ReputationService(PlayerStore store) {
        this.store = store;
    }

    /**
     * Reputation with every faction, creating the player if needed.
     */
    public Map<Faction, Integer> reputation(String wallet) {
        return store.withPlayer(wallet, player -> new EnumMap<>(player.getReputation()));
    }

    /**
     * Add {@code delta} to one faction's reputation.
     *
     * @param factionId lowercase faction id
     * @return the new reputation value
     * @throws EngineException with {@code VALIDATION} if the faction is not one of the fixed set
     */
    public int adjust(String wallet, String factionId, int delta) {
        Faction faction = Faction.fromId(factionId)
                .orElseThrow(() -> EngineException.validation("Invalid faction"));
        int value = store.withPlayer(wallet, player -> player.adjustReputation(faction, delta));
        log.debug("{} reputation with {} adjusted by {} to {}", wallet, faction, delta, value);
        return value;
    }
}
