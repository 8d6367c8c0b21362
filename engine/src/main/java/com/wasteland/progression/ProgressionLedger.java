package com.wasteland.progression;

import com.wasteland.state.Player;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Singleton;

/**
 * Applies caps and experience grants and resolves level-ups.
 *
 * <p>The experience needed per level is {@code level * 100}, taken from the level the grant
 * starts at. A grant large enough to cover that amount several times yields several levels
 * in one call, each adding {@link #HEALTH_PER_LEVEL} maximum health and refilling health.
 */
@Slf4j
@Singleton
public class ProgressionLedger {

    public static final int EXPERIENCE_PER_LEVEL = 100;
    public static final int HEALTH_PER_LEVEL = 10;

    /**
     * Credit caps and experience, then level up as often as the experience allows.
     *
     * @param player     the player, mutated in place
     * @param caps       caps to add, not negative
     * @param experience experience to add, not negative
     * @return true if at least one level was gained
     */
    public boolean grant(Player player, long caps, int experience) {
        player.addCaps(caps);
        player.addExperience(experience);

        int threshold = threshold(player.getLevel());
        int levelsGained = 0;
        while (player.getExperience() >= threshold) {
            player.levelUp(threshold, HEALTH_PER_LEVEL);
            levelsGained++;
        }

        if (levelsGained > 0) {
            log.info("{} reached level {} (+{})", player.getWallet(), player.getLevel(), levelsGained);
        }
        return levelsGained > 0;
    }

    /**
     * Experience needed to advance from {@code level}.
     */
    public static int threshold(int level) {
        return level * EXPERIENCE_PER_LEVEL;
    }
}
