package com.wasteland.loot;

import com.wasteland.state.Player;
import com.wasteland.util.Randomization;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.Optional;

/**
 * Rolls the random encounter for a claim and applies its effects to the player.
 *
 * <p>One uniform draw in [0, 1) is split into fixed bands:
 * <ul>
 *   <li>[0.00, 0.18) raider ambush</li>
 *   <li>[0.18, 0.28) brotherhood patrol</li>
 *   <li>[0.28, 0.34) vault dweller aid</li>
 *   <li>[0.34, 1.00) nothing happens</li>
 * </ul>
 */
@Slf4j
@Singleton
public class EncounterResolver {

    static final double AMBUSH_UPPER = 0.18;
    static final double PATROL_UPPER = 0.28;
    static final double AID_UPPER = 0.34;

    private final Randomization randomization;

    @Inject
    public EncounterResolver(Randomization randomization) {
        this.randomization = randomization;
    }

    /**
     * Roll and apply an encounter. Health changes are clamped to {@code [0, maxHealth]}.
     *
     * @param player the claiming player, mutated in place
     * @return the encounter that happened, if any
     */
    public Optional<Encounter> resolve(Player player) {
        Optional<Encounter> encounter = classify(randomization.nextUnit());
        encounter.ifPresent(e -> {
            player.changeHealth(e.getHealthChange());
            player.adjustReputation(e.getFaction(), e.getReputationChange());
            log.debug("Encounter {} for {}", e, player.getWallet());
        });
        return encounter;
    }

    static Optional<Encounter> classify(double roll) {
        if (roll < AMBUSH_UPPER) {
            return Optional.of(Encounter.RAIDER_AMBUSH);
        } else if (roll < PATROL_UPPER) {
            return Optional.of(Encounter.BROTHERHOOD_PATROL);
        } else if (roll < AID_UPPER) {
            return Optional.of(Encounter.VAULT_DWELLER_AID);
        }
        return Optional.empty();
    }
}
