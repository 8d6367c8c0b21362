package com.wasteland.state;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.Assert.*;

public class JsonFilePlayerStoreTest {

    private static final String WALLET = "9xQeWvG816bUx9EPjHmaT23yvVM2ZWbrrpZb9PusVFin";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path directory;

    @Before
    public void setUp() throws Exception {
        directory = folder.newFolder("players").toPath();
    }

    @Test
    public void testPlayer_SurvivesRestart() {
        JsonFilePlayerStore store = new JsonFilePlayerStore(directory);
        InventoryItem helmet = TestItems.armor("scav_helmet", ItemCategory.HEAD, 5);
        Instant lastClaim = Instant.parse("2024-06-01T15:00:00Z");
        store.withPlayer(WALLET, p -> {
            p.addCaps(84);
            p.addExperience(36);
            p.adjustReputation(Faction.BROTHERHOOD, 6);
            p.addItem(TestItems.material("scrap_metal"));
            p.addItem(helmet);
            p.equip(EquipmentSlot.HEAD, helmet);
            p.setLastClaim(lastClaim);
            return null;
        });

        JsonFilePlayerStore reopened = new JsonFilePlayerStore(directory);
        PlayerSummary summary = reopened.find(WALLET).orElseThrow();

        assertEquals(84, summary.caps());
        assertEquals(36, summary.experience());
        assertEquals(Integer.valueOf(6), summary.reputation().get(Faction.BROTHERHOOD));
        assertEquals(2, summary.inventoryCount());
        assertEquals("scav_helmet", summary.gear().get(EquipmentSlot.HEAD).getId());
        assertNull(summary.gear().get(EquipmentSlot.WEAPON));

        reopened.withPlayer(WALLET, p -> {
            assertEquals(lastClaim, p.getLastClaim());
            assertEquals(5, p.getInventory().get(1).getStats().defense());
            // Gear points at the inventory's own instance again
            assertSame(p.getInventory().get(1), p.getEquipped(EquipmentSlot.HEAD).orElseThrow());
            return null;
        });
    }

    @Test
    public void testFind_UnknownWallet_Empty() {
        JsonFilePlayerStore store = new JsonFilePlayerStore(directory);
        assertFalse(store.find("nobody").isPresent());
    }

    @Test
    public void testFileName_IsHashedWallet() {
        JsonFilePlayerStore store = new JsonFilePlayerStore(directory);
        store.withPlayer(WALLET, Player::getLevel);

        Path path = store.pathFor(WALLET);
        assertTrue(Files.exists(path));
        assertEquals(directory, path.getParent());
        assertFalse(path.getFileName().toString().contains(WALLET));
    }

    @Test
    public void testUnreadableRecord_FailsAndKeepsFile() throws Exception {
        JsonFilePlayerStore store = new JsonFilePlayerStore(directory);
        store.withPlayer(WALLET, p -> {
            p.addCaps(500);
            return null;
        });
        Path path = store.pathFor(WALLET);
        JsonObject record = JsonParser.parseString(Files.readString(path, StandardCharsets.UTF_8)).getAsJsonObject();
        JsonObject broken = new JsonObject();
        broken.addProperty("id", "half_written");
        record.getAsJsonArray("inventory").add(broken);
        String damaged = record.toString();
        Files.writeString(path, damaged, StandardCharsets.UTF_8);

        JsonFilePlayerStore reopened = new JsonFilePlayerStore(directory);
        try {
            reopened.withPlayer(WALLET, Player::getCaps);
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("Unreadable player record"));
        }

        assertEquals(damaged, Files.readString(path, StandardCharsets.UTF_8));
        assertEquals(0, reopened.size());
    }

    @Test(expected = IllegalStateException.class)
    public void testRecordForOtherWallet_Refused() throws Exception {
        JsonFilePlayerStore store = new JsonFilePlayerStore(directory);
        store.withPlayer("other-wallet", Player::getLevel);
        Files.copy(store.pathFor("other-wallet"), store.pathFor(WALLET));

        new JsonFilePlayerStore(directory).find(WALLET);
    }

    @Test
    public void testFind_DoesNotRewriteFile() throws Exception {
        JsonFilePlayerStore store = new JsonFilePlayerStore(directory);
        store.withPlayer(WALLET, p -> {
            p.addCaps(42);
            return null;
        });
        Path path = store.pathFor(WALLET);
        String padded = Files.readString(path, StandardCharsets.UTF_8) + "\n\n";
        Files.writeString(path, padded, StandardCharsets.UTF_8);

        JsonFilePlayerStore reopened = new JsonFilePlayerStore(directory);
        assertEquals(42, reopened.find(WALLET).orElseThrow().caps());
        assertEquals(42, reopened.find(WALLET).orElseThrow().caps());

        assertEquals(padded, Files.readString(path, StandardCharsets.UTF_8));
        assertEquals(1, reopened.size());
    }

    @Test
    public void testSaveFailure_Propagates() throws Exception {
        JsonFilePlayerStore store = new JsonFilePlayerStore(directory);
        Path path = store.pathFor(WALLET);
        // A directory where the temp file goes makes the write fail
        Files.createDirectory(path.resolveSibling(path.getFileName() + ".tmp"));

        try {
            store.withPlayer(WALLET, p -> {
                p.addCaps(12);
                return null;
            });
            fail("Expected UncheckedIOException");
        } catch (UncheckedIOException e) {
            assertTrue(e.getMessage().contains("Failed to save player"));
        }
        assertFalse(Files.exists(path));
    }
}
