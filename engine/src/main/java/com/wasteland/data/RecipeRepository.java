package com.wasteland.data;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.wasteland.data.model.Recipe;
import com.wasteland.state.ItemCategory;
import com.wasteland.state.Rarity;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Repository of crafting recipes, loaded from {@code data/recipes.json} at startup.
 */
@Slf4j
@Singleton
public class RecipeRepository {

    public static final String DATA_FILE = "/data/recipes.json";

    private final Map<String, Recipe> recipesById;

    @Inject
    public RecipeRepository() {
        this(DATA_FILE);
    }

    public RecipeRepository(String resourcePath) {
        Gson gson = GsonFactory.create();
        this.recipesById = JsonResourceLoader.loadAndParse(gson, resourcePath, RecipeRepository::parseRecipes);
        log.info("Loaded {} recipes from {}", recipesById.size(), resourcePath);
    }

    public Optional<Recipe> getRecipe(String id) {
        return Optional.ofNullable(recipesById.get(id));
    }

    public Collection<Recipe> getAll() {
        return Collections.unmodifiableCollection(recipesById.values());
    }

    private static Map<String, Recipe> parseRecipes(JsonObject root) {
        Map<String, Recipe> result = new LinkedHashMap<>();
        for (JsonElement element : JsonResourceLoader.getRequiredArray(root, "recipes")) {
            Recipe recipe = parseRecipe(element.getAsJsonObject());
            if (result.putIfAbsent(recipe.id(), recipe) != null) {
                throw new JsonResourceLoader.JsonLoadException("Duplicate recipe id: " + recipe.id());
            }
        }
        return result;
    }

    private static Recipe parseRecipe(JsonObject obj) {
        String id = JsonResourceLoader.getRequiredString(obj, "id");
        ItemCategory category = ItemCategory.fromId(JsonResourceLoader.getRequiredString(obj, "type"));

        Map<String, Integer> requires = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> input : JsonResourceLoader.getRequiredObject(obj, "requires").entrySet()) {
            int quantity = input.getValue().getAsInt();
            if (quantity <= 0) {
                throw new JsonResourceLoader.JsonLoadException(
                        "Recipe " + id + " requires non-positive quantity of " + input.getKey());
            }
            requires.put(input.getKey(), quantity);
        }
        if (requires.isEmpty()) {
            throw new JsonResourceLoader.JsonLoadException("Recipe " + id + " has no inputs");
        }

        return Recipe.builder()
                .id(id)
                .outputName(JsonResourceLoader.getRequiredString(obj, "name"))
                .outputCategory(category)
                .outputRarity(Rarity.fromId(JsonResourceLoader.getRequiredString(obj, "rarity")))
                .outputStats(ItemStatsCodec.fromJson(category, obj.getAsJsonObject("stats")))
                .requires(requires)
                .build();
    }
}
