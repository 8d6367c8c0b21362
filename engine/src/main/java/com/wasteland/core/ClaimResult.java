package com.wasteland.core;

import com.wasteland.settlement.SettlementOutcome;
import com.wasteland.state.InventoryItem;
import com.wasteland.state.PlayerSummary;
import lombok.Builder;

import javax.annotation.Nullable;
import java.time.Instant;

/**
 * Everything a successful claim produced.
 */
@Builder
public record ClaimResult(
        boolean success,
        String location,
        @Nullable InventoryItem loot,
        @Nullable String encounter,
        long capsEarned,
        boolean leveledUp,
        PlayerSummary player,
        /**
         * Caps mint. Advisory only; the local reward stands whatever it says.
         */
        SettlementOutcome settlement,
        /**
         * Loot token mint, {@code NOT_REQUIRED} unless the loot is rare or legendary.
         */
        SettlementOutcome lootSettlement,
        Instant cooldownEndsAt
) {
}
