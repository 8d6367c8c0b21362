package com.wasteland.core;

import com.google.common.base.Strings;
import com.wasteland.config.EngineConfig;
import com.wasteland.data.LocationRepository;
import com.wasteland.data.model.Location;
import com.wasteland.data.model.LootEntry;
import com.wasteland.data.model.WorldEvent;
import com.wasteland.events.EventSchedule;
import com.wasteland.loot.Encounter;
import com.wasteland.loot.EncounterResolver;
import com.wasteland.loot.LootRoller;
import com.wasteland.navigation.GeofenceResult;
import com.wasteland.navigation.GeofenceValidator;
import com.wasteland.progression.ProgressionLedger;
import com.wasteland.settlement.SettlementOutcome;
import com.wasteland.settlement.SettlementService;
import com.wasteland.state.InventoryItem;
import com.wasteland.state.Player;
import com.wasteland.state.PlayerStore;
import com.wasteland.state.PlayerSummary;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Runs the claim workflow.
 *
 * <p>Validation, cooldown and geofence checks, and every local reward happen under the
 * wallet's lock in one pass. Once the cooldown is committed the claim cannot fail. Settlement
 * runs afterwards without the lock, and its outcome is only reported.
 */
@Slf4j
@Singleton
public class ClaimOrchestrator {

    public static final long BASE_CAPS = 12;
    public static final int CLAIM_EXPERIENCE = 18;

    private final PlayerStore store;
    private final LocationRepository locations;
    private final GeofenceValidator geofence;
    private final LootRoller lootRoller;
    private final EncounterResolver encounters;
    private final ProgressionLedger ledger;
    private final EventSchedule eventSchedule;
    private final SettlementService settlement;
    private final Clock clock;
    private final Duration cooldown;

    @Inject
    public ClaimOrchestrator(PlayerStore store,
                             LocationRepository locations,
                             GeofenceValidator geofence,
                             LootRoller lootRoller,
                             EncounterResolver encounters,
                             ProgressionLedger ledger,
                             EventSchedule eventSchedule,
                             SettlementService settlement,
                             Clock clock,
                             EngineConfig config) {
        this.store = store;
        this.locations = locations;
        this.geofence = geofence;
        this.lootRoller = lootRoller;
        this.encounters = encounters;
        this.ledger = ledger;
        this.eventSchedule = eventSchedule;
        this.settlement = settlement;
        this.clock = clock;
        this.cooldown = config.getClaimCooldown();
    }

    /**
     * Claim rewards at a location.
     *
     * @throws EngineException            {@code VALIDATION} or {@code NOT_FOUND}
     * @throws CooldownActiveException    if the wallet claimed within the cooldown
     * @throws OutOfRangeException        if the reported position is outside the geofence
     */
    public ClaimResult claim(ClaimRequest request) {
        if (Strings.isNullOrEmpty(request.wallet()) || Strings.isNullOrEmpty(request.locationId())) {
            throw EngineException.validation("Missing wallet or locationId");
        }
        Location location = locations.getLocation(request.locationId())
                .orElseThrow(() -> EngineException.notFound("Unknown location"));

        LocalReward reward = store.withPlayer(request.wallet(), player -> reward(player, location, request));

        // Lock released; settlement may be slow
        SettlementOutcome capsOutcome = settlement.settleCaps(request.wallet(), reward.capsEarned());
        SettlementOutcome lootOutcome = SettlementOutcome.notRequired();
        InventoryItem loot = reward.loot();
        if (loot != null) {
            lootOutcome = settlement.mintLootToken(request.wallet(), loot);
            if (lootOutcome.isSuccessful() && lootOutcome.transactionId() != null) {
                loot = attachToken(request.wallet(), loot, lootOutcome.transactionId());
            }
        }

        return ClaimResult.builder()
                .success(true)
                .location(location.name())
                .loot(loot)
                .encounter(reward.encounter() == null ? null : reward.encounter().getDescription())
                .capsEarned(reward.capsEarned())
                .leveledUp(reward.leveledUp())
                .player(reward.player())
                .settlement(capsOutcome)
                .lootSettlement(lootOutcome)
                .cooldownEndsAt(reward.claimedAt().plus(cooldown))
                .build();
    }

    // ========================================================================
    // Locked section
    // ========================================================================

    private LocalReward reward(Player player, Location location, ClaimRequest request) {
        Instant now = clock.instant();

        Duration elapsed = Duration.between(player.getLastClaim(), now);
        if (elapsed.compareTo(cooldown) < 0) {
            throw new CooldownActiveException(cooldown.minus(elapsed));
        }

        GeofenceResult fence = geofence.check(request.position(), location);
        if (!fence.accepted()) {
            log.debug("{} rejected at {}: {}m > {}m", player.getWallet(), location.id(),
                    Math.round(fence.distanceMeters()), fence.allowedMeters());
            throw new OutOfRangeException(fence.distanceMeters(), fence.allowedMeters());
        }

        player.setLastClaim(now);

        Optional<WorldEvent> event = eventSchedule.find(request.eventName())
                .filter(e -> e.appliesTo(location.id()));
        int eventCaps = event.map(WorldEvent::bonusCaps).orElse(0);
        int healthRisk = event.map(WorldEvent::healthRisk).orElse(0);

        InventoryItem loot = null;
        Optional<LootEntry> rolled = lootRoller.roll(location.lootTable(), player);
        if (rolled.isPresent()) {
            loot = rolled.get().toItem(location.name(), now);
            player.addItem(loot);
        }

        Encounter encounter = encounters.resolve(player).orElse(null);
        if (healthRisk > 0) {
            player.changeHealth(-healthRisk);
        }

        long capsEarned = BASE_CAPS + eventCaps + (loot == null ? 0 : loot.getRarity().getClaimBonus());
        boolean leveledUp = ledger.grant(player, capsEarned, CLAIM_EXPERIENCE);

        log.debug("{} claimed {} at {}: loot={}, encounter={}, caps={}", player.getWallet(), location.id(), now,
                loot == null ? "none" : loot.getId(), encounter, capsEarned);
        return new LocalReward(loot, encounter, capsEarned, leveledUp, player.summary(), now);
    }

    private InventoryItem attachToken(String wallet, InventoryItem loot, String tokenId) {
        InventoryItem tokenized = loot.withLootTokenId(tokenId);
        boolean replaced = store.withPlayer(wallet, player -> player.replaceItem(loot, tokenized));
        if (!replaced) {
            // Consumed by a craft between the two locked sections
            log.warn("Loot {} left {}'s inventory before token {} could be attached", loot.getId(), wallet, tokenId);
        }
        return tokenized;
    }

    private record LocalReward(
            @Nullable InventoryItem loot,
            @Nullable Encounter encounter,
            long capsEarned,
            boolean leveledUp,
            PlayerSummary player,
            Instant claimedAt
    ) {
    }
}
