package com.wasteland.inventory;

import com.wasteland.core.EngineException;
import com.wasteland.core.MissingMaterialsException;
import com.wasteland.data.RecipeRepository;
import com.wasteland.data.model.Recipe;
import com.wasteland.state.InventoryItem;
import com.wasteland.state.Player;
import com.wasteland.state.PlayerStore;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Turns materials into new items.
 *
 * <p>A craft either consumes exactly the recipe's inputs and adds one item, or changes
 * nothing. Every input is checked before the first one is removed.
 */
@Slf4j
@Singleton
public class CraftingService {

    private final PlayerStore store;
    private final RecipeRepository recipes;
    private final EquipmentManager equipment;
    private final Clock clock;

    @Inject
    public CraftingService(PlayerStore store, RecipeRepository recipes, EquipmentManager equipment, Clock clock) {
        this.store = store;
        this.recipes = recipes;
        this.equipment = equipment;
        this.clock = clock;
    }

    /**
     * Craft a recipe for a wallet, holding the wallet's lock.
     *
     * @throws EngineException            {@code NOT_FOUND} for an unknown recipe
     * @throws MissingMaterialsException  naming the first short input
     */
    public CraftResult craft(String wallet, String recipeId) {
        Recipe recipe = recipes.getRecipe(recipeId)
                .orElseThrow(() -> EngineException.notFound("Unknown recipe"));
        return store.withPlayer(wallet, player -> craft(player, recipe));
    }

    /**
     * Craft against an already-locked player.
     */
    public CraftResult craft(Player player, Recipe recipe) {
        for (Map.Entry<String, Integer> input : recipe.requires().entrySet()) {
            int have = player.countItem(input.getKey());
            if (have < input.getValue()) {
                throw new MissingMaterialsException(input.getKey(), input.getValue() - have);
            }
        }

        long equippedBefore = equippedCount(player);
        for (Map.Entry<String, Integer> input : recipe.requires().entrySet()) {
            int removed = player.removeItems(input.getKey(), input.getValue());
            if (removed != input.getValue()) {
                // Counts were verified under the same lock
                throw new IllegalStateException("Removed " + removed + " of " + input.getValue() + " " + input.getKey());
            }
        }
        if (equippedCount(player) != equippedBefore) {
            equipment.refreshMaxHealth(player);
        }

        Instant now = clock.instant();
        InventoryItem crafted = InventoryItem.builder()
                .id(freshId(player, recipe.id(), now))
                .name(recipe.outputName())
                .category(recipe.outputCategory())
                .rarity(recipe.outputRarity())
                .stats(recipe.outputStats())
                .source(InventoryItem.SOURCE_CRAFTING)
                .createdAt(now)
                .build();
        player.addItem(crafted);

        log.info("{} crafted {}", player.getWallet(), crafted.getId());
        return new CraftResult(crafted, player.summary());
    }

    private static long equippedCount(Player player) {
        return player.getGear().values().stream().filter(Objects::nonNull).count();
    }

    private static String freshId(Player player, String recipeId, Instant now) {
        String base = recipeId + "_" + now.toEpochMilli();
        String id = base;
        for (int n = 2; player.findItem(id).isPresent(); n++) {
            id = base + "-" + n;
        }
        return id;
    }
}
