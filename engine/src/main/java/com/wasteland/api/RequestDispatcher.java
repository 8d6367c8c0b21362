package com.wasteland.api;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.wasteland.core.ClaimOrchestrator;
import com.wasteland.core.ClaimRequest;
import com.wasteland.core.CooldownActiveException;
import com.wasteland.core.EngineException;
import com.wasteland.core.ErrorKind;
import com.wasteland.core.MissingMaterialsException;
import com.wasteland.core.OutOfRangeException;
import com.wasteland.data.GsonFactory;
import com.wasteland.data.model.Coordinate;
import com.wasteland.events.EventSchedule;
import com.wasteland.inventory.CraftingService;
import com.wasteland.inventory.EquipmentManager;
import com.wasteland.progression.ReputationService;
import com.wasteland.state.PlayerStore;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.List;
import java.util.Locale;

/**
 * Maps JSON requests onto engine operations.
 *
 * <p>Routes:
 * <pre>
 * GET  /player/{wallet}      full player record
 * GET  /balance/{wallet}     {wallet, caps}
 * GET  /inventory/{wallet}   {inventory, gear}
 * POST /equip                {wallet, itemId}
 * POST /craft                {wallet, recipeId}
 * GET  /factions/{wallet}    reputation per faction
 * POST /factions/adjust      {wallet, faction, delta}
 * GET  /events               {active, nextCheckAt}
 * POST /claim-survival       {wallet, locationId, lat?, lng?, eventName?}
 * </pre>
 *
 * <p>Refused requests are answered with the {@link EngineException}'s status and an
 * {@code {"error": ...}} body, except that equip and craft report unknown items and recipes
 * as 400. Anything unexpected is logged and answered with 500.
 */
@Slf4j
@Singleton
public class RequestDispatcher {

    private static final Splitter PATH_SPLITTER = Splitter.on('/').omitEmptyStrings().trimResults();

    private final Gson gson = GsonFactory.builder().serializeNulls().create();

    private final PlayerStore store;
    private final ClaimOrchestrator claims;
    private final EquipmentManager equipment;
    private final CraftingService crafting;
    private final ReputationService reputation;
    private final EventSchedule events;

    @Inject
    public RequestDispatcher(PlayerStore store,
                             ClaimOrchestrator claims,
                             EquipmentManager equipment,
                             CraftingService crafting,
                             ReputationService reputation,
                             EventSchedule events) {
        this.store = store;
        this.claims = claims;
        this.equipment = equipment;
        this.crafting = crafting;
        this.reputation = reputation;
        this.events = events;
    }

    /**
     * Handle one request.
     *
     * @param method HTTP method, case-insensitive
     * @param path   request path; a query string is ignored
     * @param body   request body for POST routes, may be null
     */
    public ApiResponse dispatch(String method, String path, @Nullable JsonObject body) {
        JsonObject payload = body == null ? new JsonObject() : body;
        try {
            return route(Strings.nullToEmpty(method).toUpperCase(Locale.ROOT), segments(path), payload);
        } catch (CooldownActiveException e) {
            ApiResponse response = refused(e);
            response.body().getAsJsonObject().addProperty("remainingMs", e.getRemaining().toMillis());
            return response;
        } catch (OutOfRangeException e) {
            ApiResponse response = refused(e);
            JsonObject json = response.body().getAsJsonObject();
            json.addProperty("distanceM", Math.round(e.getDistanceMeters()));
            json.addProperty("allowedM", e.getAllowedMeters());
            return response;
        } catch (MissingMaterialsException e) {
            ApiResponse response = refused(e);
            JsonObject json = response.body().getAsJsonObject();
            json.addProperty("material", e.getMaterialId());
            json.addProperty("shortfall", e.getShortfall());
            return response;
        } catch (EngineException e) {
            return refused(e);
        } catch (RuntimeException e) {
            log.error("Unhandled failure for {} {}", method, path, e);
            return ApiResponse.error(ApiResponse.INTERNAL_ERROR, "Internal error");
        }
    }

    private ApiResponse route(String method, List<String> segments, JsonObject body) {
        if (segments.isEmpty()) {
            return notFound();
        }
        String resource = segments.get(0);

        if (method.equals("GET")) {
            if (segments.size() == 1 && resource.equals("events")) {
                return ApiResponse.ok(gson.toJsonTree(events.current()));
            }
            if (segments.size() != 2) {
                return notFound();
            }
            String wallet = segments.get(1);
            switch (resource) {
                case "player":
                    return ApiResponse.ok(store.withPlayer(wallet, gson::toJsonTree));
                case "balance":
                    return ApiResponse.ok(store.withPlayer(wallet, player -> {
                        JsonObject json = new JsonObject();
                        json.addProperty("wallet", player.getWallet());
                        json.addProperty("caps", player.getCaps());
                        return json;
                    }));
                case "inventory":
                    return ApiResponse.ok(store.withPlayer(wallet, player -> {
                        JsonObject json = new JsonObject();
                        json.add("inventory", gson.toJsonTree(player.getInventory()));
                        json.add("gear", gson.toJsonTree(player.getGear()));
                        return json;
                    }));
                case "factions":
                    return ApiResponse.ok(gson.toJsonTree(reputation.reputation(wallet)));
                default:
                    return notFound();
            }
        }

        if (method.equals("POST")) {
            String route = String.join("/", segments);
            switch (route) {
                case "equip": {
                    String wallet = string(body, "wallet");
                    String itemId = string(body, "itemId");
                    if (wallet == null || itemId == null) {
                        throw EngineException.validation("Missing wallet or itemId");
                    }
                    try {
                        return ApiResponse.ok(gson.toJsonTree(equipment.equip(wallet, itemId)));
                    } catch (EngineException e) {
                        return inventoryRefusal(e);
                    }
                }
                case "craft": {
                    String wallet = string(body, "wallet");
                    String recipeId = string(body, "recipeId");
                    if (wallet == null || recipeId == null) {
                        throw EngineException.validation("Missing wallet or recipeId");
                    }
                    try {
                        return ApiResponse.ok(gson.toJsonTree(crafting.craft(wallet, recipeId)));
                    } catch (EngineException e) {
                        return inventoryRefusal(e);
                    }
                }
                case "factions/adjust":
                    return adjustFaction(body);
                case "claim-survival":
                    return ApiResponse.ok(gson.toJsonTree(claims.claim(claimRequest(body))));
                default:
                    return notFound();
            }
        }
        return notFound();
    }

    private ApiResponse adjustFaction(JsonObject body) {
        String wallet = string(body, "wallet");
        if (wallet == null) {
            throw EngineException.validation("Missing wallet");
        }
        String faction = string(body, "faction");
        int delta = 0;
        if (body.has("delta") && !body.get("delta").isJsonNull()) {
            try {
                delta = body.get("delta").getAsInt();
            } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
                throw EngineException.validation("Invalid delta");
            }
        }
        int value = reputation.adjust(wallet, faction, delta);
        JsonObject json = new JsonObject();
        json.addProperty("faction", faction);
        json.addProperty("value", value);
        return ApiResponse.ok(json);
    }

    private static ClaimRequest claimRequest(JsonObject body) {
        Coordinate coordinate = null;
        if (isPresent(body, "lat") && isPresent(body, "lng")) {
            try {
                coordinate = new Coordinate(body.get("lat").getAsDouble(), body.get("lng").getAsDouble());
            } catch (IllegalArgumentException | UnsupportedOperationException | IllegalStateException e) {
                throw EngineException.validation("Invalid coordinate");
            }
        }
        return ClaimRequest.builder()
                .wallet(string(body, "wallet"))
                .locationId(string(body, "locationId"))
                .coordinate(coordinate)
                .eventName(string(body, "eventName"))
                .build();
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static List<String> segments(String path) {
        String clean = Strings.nullToEmpty(path);
        int query = clean.indexOf('?');
        if (query >= 0) {
            clean = clean.substring(0, query);
        }
        return PATH_SPLITTER.splitToList(clean);
    }

    private static boolean isPresent(JsonObject body, String key) {
        return body.has(key) && !body.get(key).isJsonNull();
    }

    /**
     * String field, or null when missing, JSON null or empty.
     */
    @Nullable
    private static String string(JsonObject body, String key) {
        if (!isPresent(body, key)) {
            return null;
        }
        JsonElement element = body.get(key);
        if (!element.isJsonPrimitive()) {
            return null;
        }
        return Strings.emptyToNull(element.getAsString());
    }

    /**
     * Equip and craft answer every refusal with 400, unknown items and recipes included.
     */
    private static ApiResponse inventoryRefusal(EngineException e) {
        if (e.getKind() != ErrorKind.NOT_FOUND) {
            throw e;
        }
        return ApiResponse.error(ErrorKind.VALIDATION.getHttpStatus(), e.getMessage());
    }

    private static ApiResponse refused(EngineException e) {
        return ApiResponse.error(e.getKind().getHttpStatus(), e.getMessage());
    }

    private static ApiResponse notFound() {
        return ApiResponse.error(ApiResponse.NOT_FOUND, "Not found");
    }
}
