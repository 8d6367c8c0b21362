package com.wasteland.data;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.wasteland.state.InventoryItem;
import com.wasteland.state.ItemCategory;
import com.wasteland.state.Rarity;
import com.wasteland.state.TestItems;
import com.wasteland.state.stats.ArmorStats;
import com.wasteland.state.stats.MaterialStats;
import com.wasteland.state.stats.TraitStats;
import com.wasteland.state.stats.WeaponStats;
import org.junit.Test;

import static org.junit.Assert.*;

public class ItemStatsCodecTest {

    private final Gson gson = GsonFactory.create();

    @Test
    public void testFromJson_UsesCategoryVariant() {
        JsonObject stats = JsonParser.parseString("{\"defense\": 30, \"carry\": 10, \"attack\": 99}").getAsJsonObject();

        assertEquals(new ArmorStats(30, 10), ItemStatsCodec.fromJson(ItemCategory.BODY, stats));
        assertEquals(new WeaponStats(99, false), ItemStatsCodec.fromJson(ItemCategory.WEAPON, stats));
        assertEquals(new TraitStats(0), ItemStatsCodec.fromJson(ItemCategory.ARTIFACT, stats));
    }

    @Test
    public void testFromJson_NullStatsReadAsZero() {
        assertEquals(new MaterialStats(0, 0), ItemStatsCodec.fromJson(ItemCategory.MATERIAL, null));
    }

    @Test
    public void testToJson_FlatObject() {
        JsonObject json = ItemStatsCodec.toJson(new WeaponStats(25, true));

        assertEquals(25, json.get("attack").getAsInt());
        assertTrue(json.get("energy").getAsBoolean());
        assertEquals(2, json.size());
    }

    @Test
    public void testInventoryItem_SerializedWithLowercaseIdsAndFlatStats() {
        InventoryItem rifle = TestItems.weapon("laser_rifle", Rarity.RARE).withLootTokenId("token-1");

        JsonObject json = gson.toJsonTree(rifle).getAsJsonObject();

        assertEquals("weapon", json.get("category").getAsString());
        assertEquals("rare", json.get("rarity").getAsString());
        assertEquals(25, json.getAsJsonObject("stats").get("attack").getAsInt());
        assertEquals(TestItems.CREATED.toString(), json.get("createdAt").getAsString());
        assertEquals(rifle, gson.fromJson(json, InventoryItem.class));
    }

    @Test(expected = JsonParseException.class)
    public void testInventoryItem_MissingCategory_Rejected() {
        gson.fromJson("{\"id\":\"x\",\"name\":\"x\",\"rarity\":\"common\",\"source\":\"s\","
                + "\"createdAt\":\"2024-06-01T12:00:00Z\"}", InventoryItem.class);
    }
}
