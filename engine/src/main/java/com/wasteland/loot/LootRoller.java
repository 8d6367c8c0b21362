package com.wasteland.loot;

import com.wasteland.data.model.LootEntry;
import com.wasteland.state.Faction;
import com.wasteland.state.Player;
import com.wasteland.util.Randomization;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.List;
import java.util.Optional;

/**
 * Weighted loot selection with a reputation bonus for top-tier entries.
 *
 * <p>Rare and legendary entries have their weight scaled by {@code 1 + bonus}, where
 * {@code bonus = min(0.20, brotherhoodReputation * 0.002)}. Common and uncommon weights are
 * never adjusted. Negative reputation gives no bonus.
 */
@Slf4j
@Singleton
public class LootRoller {

    public static final double REPUTATION_BONUS_PER_POINT = 0.002;
    public static final double MAX_REPUTATION_BONUS = 0.20;

    private final Randomization randomization;

    @Inject
    public LootRoller(Randomization randomization) {
        this.randomization = randomization;
    }

    /**
     * Roll one entry from the table.
     *
     * @param table  the location's loot table, in declaration order
     * @param player the claiming player, for the reputation bonus
     * @return the selected entry, or empty for an empty table
     */
    public Optional<LootEntry> roll(List<LootEntry> table, Player player) {
        if (table.isEmpty()) {
            return Optional.empty();
        }
        double[] weights = effectiveWeights(table, player.getReputation(Faction.BROTHERHOOD));
        int index = randomization.weightedChoice(weights);
        if (index < 0) {
            return Optional.empty();
        }
        LootEntry selected = table.get(index);
        log.debug("Rolled {} ({}) for {}", selected.id(), selected.rarity(), player.getWallet());
        return Optional.of(selected);
    }

    /**
     * Bonus applied to top-tier weights for a given brotherhood reputation.
     */
    public static double reputationBonus(int brotherhoodReputation) {
        return Math.max(0.0, Math.min(MAX_REPUTATION_BONUS, brotherhoodReputation * REPUTATION_BONUS_PER_POINT));
    }

    /**
     * Per-entry weights after the reputation bonus, in table order.
     */
    public static double[] effectiveWeights(List<LootEntry> table, int brotherhoodReputation) {
        double bonus = reputationBonus(brotherhoodReputation);
        double[] weights = new double[table.size()];
        for (int i = 0; i < weights.length; i++) {
            LootEntry entry = table.get(i);
            weights[i] = entry.rarity().isTopTier() ? entry.weight() * (1 + bonus) : entry.weight();
        }
        return weights;
    }
}
