package com.wasteland.core;

import com.wasteland.config.EngineConfig;
import com.wasteland.data.LocationRepository;
import com.wasteland.data.model.Coordinate;
import com.wasteland.events.EventSchedule;
import com.wasteland.loot.EncounterResolver;
import com.wasteland.loot.LootRoller;
import com.wasteland.navigation.GeofenceValidator;
import com.wasteland.progression.ProgressionLedger;
import com.wasteland.settlement.PendingSettlements;
import com.wasteland.settlement.SettlementClient;
import com.wasteland.settlement.SettlementException;
import com.wasteland.settlement.SettlementService;
import com.wasteland.settlement.SettlementStatus;
import com.wasteland.settlement.SimulatedSettlementClient;
import com.wasteland.state.Faction;
import com.wasteland.state.InMemoryPlayerStore;
import com.wasteland.state.InventoryItem;
import com.wasteland.state.Rarity;
import com.wasteland.util.IoExecutor;
import com.wasteland.util.Randomization;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@RunWith(MockitoJUnitRunner.Silent.class)
public class ClaimOrchestratorTest {

    private static final String WALLET = "wallet-1";
    private static final Instant NOW = Instant.parse("2024-06-01T14:00:00Z");

    // NukaTown sits at 36.025, -115.037 with the default 150 m radius; this is ~139 m north
    private static final Coordinate INSIDE_NUKA_TOWN = new Coordinate(36.02625, -115.037);
    private static final Coordinate FAR_FROM_NUKA_TOWN = new Coordinate(36.035, -115.037);

    @Mock
    private Randomization randomization;

    @Mock
    private Clock clock;

    private EngineConfig config;
    private InMemoryPlayerStore store;
    private IoExecutor ioExecutor;
    private PendingSettlements pending;
    private ClaimOrchestrator orchestrator;

    @Before
    public void setUp() {
        config = EngineConfig.defaults();
        store = new InMemoryPlayerStore();
        ioExecutor = new IoExecutor(2);
        pending = new PendingSettlements();

        when(clock.instant()).thenReturn(NOW);
        // First loot entry, no encounter
        when(randomization.weightedChoice(any(double[].class))).thenReturn(0);
        when(randomization.nextUnit()).thenReturn(0.5);

        orchestrator = orchestrator(new SimulatedSettlementClient());
    }

    @After
    public void tearDown() {
        ioExecutor.shutdown();
    }

    private ClaimOrchestrator orchestrator(SettlementClient client) {
        SettlementService settlement = new SettlementService(client, ioExecutor, pending,
                Duration.ofSeconds(2), clock);
        return new ClaimOrchestrator(
                store,
                new LocationRepository(config),
                new GeofenceValidator(),
                new LootRoller(randomization),
                new EncounterResolver(randomization),
                new ProgressionLedger(),
                new EventSchedule(clock),
                settlement,
                clock,
                config);
    }

    private static ClaimRequest request(String locationId, Coordinate coordinate, String eventName) {
        return ClaimRequest.builder()
                .wallet(WALLET)
                .locationId(locationId)
                .coordinate(coordinate)
                .eventName(eventName)
                .build();
    }

    // ========================================================================
    // Happy path
    // ========================================================================

    @Test
    public void testClaim_EndToEnd_FirstEntryNoEncounter() {
        ClaimResult result = orchestrator.claim(request("nukaTown", INSIDE_NUKA_TOWN, null));

        assertTrue(result.success());
        assertEquals("NukaTown", result.location());
        assertEquals("scrap_metal", result.loot().getId());
        assertEquals("NukaTown", result.loot().getSource());
        assertEquals(NOW, result.loot().getCreatedAt());
        assertNull(result.encounter());
        assertEquals(12, result.capsEarned());
        assertFalse(result.leveledUp());

        assertEquals(12, result.player().caps());
        assertEquals(18, result.player().experience());
        assertEquals(1, result.player().level());
        assertEquals(1, result.player().inventoryCount());

        assertEquals(SettlementStatus.SIMULATED, result.settlement().status());
        assertEquals(12, result.settlement().amount());
        assertEquals(SettlementStatus.NOT_REQUIRED, result.lootSettlement().status());
        assertEquals(NOW.plus(Duration.ofHours(1)), result.cooldownEndsAt());
    }

    @Test
    public void testClaim_WithoutCoordinate_SkipsGeofence() {
        ClaimResult result = orchestrator.claim(request("vault13", null, null));

        assertEquals("Vault 13", result.location());
        assertEquals("duct_tape", result.loot().getId());
    }

    @Test
    public void testClaim_RareLoot_BonusCapsAndToken() {
        when(randomization.weightedChoice(any(double[].class))).thenReturn(2);

        ClaimResult result = orchestrator.claim(request("nukaTown", INSIDE_NUKA_TOWN, null));

        assertEquals("rare_tech", result.loot().getId());
        assertEquals(12 + 24, result.capsEarned());
        assertEquals(SettlementStatus.SIMULATED, result.lootSettlement().status());
        assertEquals(SimulatedSettlementClient.SIMULATED_TOKEN, result.loot().getLootTokenId());

        InventoryItem stored = store.withPlayer(WALLET, p -> p.getInventory().get(0));
        assertEquals(SimulatedSettlementClient.SIMULATED_TOKEN, stored.getLootTokenId());
    }

    @Test
    public void testClaim_LegendaryLoot() {
        when(randomization.weightedChoice(any(double[].class))).thenReturn(3);

        ClaimResult result = orchestrator.claim(request("nukaTown", null, null));

        assertEquals(Rarity.LEGENDARY, result.loot().getRarity());
        assertEquals(12 + 60, result.capsEarned());
    }

    @Test
    public void testClaim_Encounter_ReportedAndApplied() {
        when(randomization.nextUnit()).thenReturn(0.2);

        ClaimResult result = orchestrator.claim(request("nukaTown", null, null));

        assertEquals("Brotherhood patrol! Gained 6 reputation.", result.encounter());
        assertEquals(Integer.valueOf(6), result.player().reputation().get(Faction.BROTHERHOOD));
    }

    // ========================================================================
    // Events
    // ========================================================================

    @Test
    public void testClaim_EventAtMatchingLocation_AddsBonusCaps() {
        ClaimResult result = orchestrator.claim(request("vault13", null, "Brotherhood Patrol"));
        assertEquals(12 + 20, result.capsEarned());
    }

    @Test
    public void testClaim_EventAtOtherLocation_Ignored() {
        ClaimResult result = orchestrator.claim(request("nukaTown", null, "Brotherhood Patrol"));
        assertEquals(12, result.capsEarned());
    }

    @Test
    public void testClaim_HealthRiskEvent_CostsHealth() {
        ClaimResult result = orchestrator.claim(request("nukaTown", null, "Raider Skirmish"));

        assertEquals(12, result.capsEarned());
        assertEquals(90, result.player().health());
    }

    @Test
    public void testClaim_UnknownEvent_Ignored() {
        ClaimResult result = orchestrator.claim(request("vault13", null, "Deathclaw Hunt"));
        assertEquals(12, result.capsEarned());
    }

    // ========================================================================
    // Refusals
    // ========================================================================

    @Test
    public void testClaim_MissingFields_Validation() {
        assertRefused(ClaimRequest.builder().locationId("nukaTown").build(), ErrorKind.VALIDATION);
        assertRefused(ClaimRequest.builder().wallet(WALLET).locationId("").build(), ErrorKind.VALIDATION);
        assertEquals(0, store.size());
    }

    @Test
    public void testClaim_UnknownLocation_NotFound() {
        EngineException e = assertRefused(request("megaton", null, null), ErrorKind.NOT_FOUND);
        assertEquals("Unknown location", e.getMessage());
        assertEquals(0, store.size());
    }

    @Test
    public void testClaim_SecondClaimWithinCooldown_RateLimited() {
        orchestrator.claim(request("nukaTown", null, null));

        when(clock.instant()).thenReturn(NOW.plus(Duration.ofMinutes(10)));
        try {
            orchestrator.claim(request("vault13", null, null));
            fail("Expected CooldownActiveException");
        } catch (CooldownActiveException e) {
            assertEquals(ErrorKind.RATE_LIMITED, e.getKind());
            assertEquals(Duration.ofMinutes(50), e.getRemaining());
            assertTrue(e.getRemaining().compareTo(config.getClaimCooldown()) <= 0);
        }

        // Nothing changed by the refused claim
        assertEquals(12, store.find(WALLET).orElseThrow().caps());
        assertEquals(1, store.find(WALLET).orElseThrow().inventoryCount());
    }

    @Test
    public void testClaim_AfterCooldown_Succeeds() {
        orchestrator.claim(request("nukaTown", null, null));

        when(clock.instant()).thenReturn(NOW.plus(Duration.ofHours(1)));
        ClaimResult result = orchestrator.claim(request("nukaTown", null, null));

        assertEquals(24, result.player().caps());
        assertEquals(36, result.player().experience());
    }

    @Test
    public void testClaim_OutOfRange_ForbiddenAndNothingCommitted() {
        try {
            orchestrator.claim(request("nukaTown", FAR_FROM_NUKA_TOWN, null));
            fail("Expected OutOfRangeException");
        } catch (OutOfRangeException e) {
            assertEquals(ErrorKind.FORBIDDEN, e.getKind());
            assertEquals(150.0, e.getAllowedMeters(), 0.0);
            assertEquals(GeofenceValidator.distanceMeters(FAR_FROM_NUKA_TOWN, new Coordinate(36.025, -115.037)),
                    e.getDistanceMeters(), 1e-6);
        }

        // Cooldown was not started, so an in-range claim goes through immediately
        ClaimResult result = orchestrator.claim(request("nukaTown", INSIDE_NUKA_TOWN, null));
        assertEquals(12, result.player().caps());
    }

    // ========================================================================
    // Settlement
    // ========================================================================

    @Test
    public void testClaim_SettlementFailure_RewardStands() throws Exception {
        SettlementClient failing = mock(SettlementClient.class);
        when(failing.mintCaps(anyString(), anyLong())).thenThrow(new SettlementException("Mint failed", "HTTP 503"));
        orchestrator = orchestrator(failing);

        ClaimResult result = orchestrator.claim(request("nukaTown", null, null));

        assertEquals(SettlementStatus.FAILED, result.settlement().status());
        assertEquals("HTTP 503", result.settlement().detail());
        assertEquals(12, result.player().caps());
        assertEquals(12, store.find(WALLET).orElseThrow().caps());
        assertEquals(1, pending.size());
    }

    @Test
    public void testClaim_SettlementTimeout_RewardStands() throws Exception {
        CountDownLatch blocker = new CountDownLatch(1);
        SettlementClient slow = mock(SettlementClient.class);
        when(slow.mintCaps(anyString(), anyLong())).thenAnswer(inv -> {
            blocker.await();
            return "late";
        });
        SettlementService settlement = new SettlementService(slow, ioExecutor, pending, Duration.ofMillis(100), clock);
        orchestrator = new ClaimOrchestrator(store, new LocationRepository(config), new GeofenceValidator(),
                new LootRoller(randomization), new EncounterResolver(randomization), new ProgressionLedger(),
                new EventSchedule(clock), settlement, clock, config);

        ClaimResult result = orchestrator.claim(request("nukaTown", null, null));

        assertEquals(SettlementStatus.TIMEOUT, result.settlement().status());
        assertEquals(12, store.find(WALLET).orElseThrow().caps());
        assertEquals(SettlementStatus.TIMEOUT, pending.drain().get(0).outcome().status());
    }

    // ========================================================================
    // Concurrency
    // ========================================================================

    @Test
    public void testClaim_ParallelClaimsForOneWallet_ExactlyOneSucceeds() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ClaimResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<ClaimResult> task = () -> {
                    start.await();
                    return orchestrator.claim(request("nukaTown", null, null));
                };
                futures.add(pool.submit(task));
            }
            start.countDown();

            int successes = 0;
            int rateLimited = 0;
            for (Future<ClaimResult> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    successes++;
                } catch (ExecutionException e) {
                    assertTrue(e.getCause() instanceof CooldownActiveException);
                    rateLimited++;
                }
            }

            assertEquals(1, successes);
            assertEquals(threads - 1, rateLimited);
            assertEquals(12, store.find(WALLET).orElseThrow().caps());
        } finally {
            pool.shutdownNow();
        }
    }

    private EngineException assertRefused(ClaimRequest request, ErrorKind kind) {
        try {
            orchestrator.claim(request);
            fail("Expected EngineException");
            return null;
        } catch (EngineException e) {
            assertEquals(kind, e.getKind());
            return e;
        }
    }
}
