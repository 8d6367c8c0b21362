package com.wasteland.state;

import org.junit.Before;
import org.junit.Test;

import java.util.Optional;

import static org.junit.Assert.*;

public class PlayerTest {

    private Player player;

    @Before
    public void setUp() {
        player = new Player("wallet-1");
    }

    @Test
    public void testNewPlayer_Defaults() {
        assertEquals(0, player.getCaps());
        assertEquals(1, player.getLevel());
        assertEquals(0, player.getExperience());
        assertEquals(100, player.getHealth());
        assertEquals(100, player.getMaxHealth());
        assertEquals(0, player.getInventoryCount());
        assertEquals(3, player.getReputation().size());
        assertEquals(4, player.getGear().size());
        assertTrue(player.getGear().values().stream().allMatch(item -> item == null));
    }

    @Test
    public void testChangeHealth_Clamped() {
        assertEquals(0, player.changeHealth(-500));
        assertEquals(100, player.changeHealth(500));
    }

    @Test
    public void testRemoveItems_NewestFirst() {
        InventoryItem older = TestItems.material("scrap_metal");
        InventoryItem newer = older.toBuilder().source("Vault 13").build();
        player.addItem(older);
        player.addItem(newer);

        assertEquals(1, player.removeItems("scrap_metal", 1));

        assertEquals(1, player.getInventoryCount());
        assertSame(older, player.getInventory().get(0));
    }

    @Test
    public void testRemoveItems_ReturnsCountActuallyRemoved() {
        player.addItem(TestItems.material("duct_tape"));
        assertEquals(1, player.removeItems("duct_tape", 3));
        assertEquals(0, player.removeItems("duct_tape", 1));
    }

    @Test
    public void testEquip_RequiresOwnedInstance() {
        InventoryItem helmet = TestItems.armor("scav_helmet", ItemCategory.HEAD, 5);
        try {
            player.equip(EquipmentSlot.HEAD, helmet);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertFalse(player.getEquipped(EquipmentSlot.HEAD).isPresent());
        }
    }

    @Test
    public void testReplaceItem_UpdatesGear() {
        InventoryItem rifle = TestItems.weapon("laser_rifle", Rarity.RARE);
        player.addItem(rifle);
        player.equip(EquipmentSlot.WEAPON, rifle);

        InventoryItem tokenized = rifle.withLootTokenId("token-1");
        assertTrue(player.replaceItem(rifle, tokenized));

        assertSame(tokenized, player.getInventory().get(0));
        assertEquals(Optional.of(tokenized), player.getEquipped(EquipmentSlot.WEAPON));
        assertFalse(player.replaceItem(rifle, tokenized));
    }

    @Test
    public void testSummary_IsDetachedCopy() {
        PlayerSummary summary = player.summary();
        player.addCaps(50);
        player.adjustReputation(Faction.VAULT, 3);

        assertEquals(0, summary.caps());
        assertEquals(Integer.valueOf(0), summary.reputation().get(Faction.VAULT));
    }

    @Test(expected = IllegalStateException.class)
    public void testLevelUp_WithoutExperience_Throws() {
        player.levelUp(100, 10);
    }
}
