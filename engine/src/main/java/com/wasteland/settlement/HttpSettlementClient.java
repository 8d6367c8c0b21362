package com.wasteland.settlement;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.wasteland.data.GsonFactory;
import com.wasteland.state.InventoryItem;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Settlement through a mint relay service over HTTP.
 *
 * <p>The relay owns the signing keys and chain access. This client posts JSON to
 * {@code <base>/mint/caps} and {@code <base>/mint/loot} and reads back
 * {@code {"transactionId": ...}} or {@code {"tokenId": ...}}.
 */
@Slf4j
public class HttpSettlementClient implements SettlementClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String USER_AGENT = "Wasteland-Engine/1.0";

    private final OkHttpClient httpClient;
    private final String baseUrl;
    private final Gson gson;

    public HttpSettlementClient(String baseUrl, Duration timeout) {
        this(new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    Request outgoing = chain.request();
                    Request request = outgoing.newBuilder()
                            .header("User-Agent", USER_AGENT)
                            .header("Accept", "application/json")
                            .build();
                    return chain.proceed(request);
                })
                .callTimeout(timeout)
                .build(), baseUrl);
    }

    /**
     * Constructor for testing with a preconfigured client.
     */
    public HttpSettlementClient(OkHttpClient httpClient, String baseUrl) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.gson = GsonFactory.create();
        log.info("HttpSettlementClient targeting {}", this.baseUrl);
    }

    @Override
    public String mintCaps(String wallet, long amount) throws SettlementException {
        JsonObject body = new JsonObject();
        body.addProperty("wallet", wallet);
        body.addProperty("amount", amount);
        JsonObject response = post("/mint/caps", body);
        return requiredString(response, "transactionId");
    }

    @Override
    public Optional<String> mintLootToken(String wallet, InventoryItem item) throws SettlementException {
        if (!item.getRarity().isTopTier()) {
            return Optional.empty();
        }
        JsonObject body = new JsonObject();
        body.addProperty("wallet", wallet);
        body.addProperty("itemId", item.getId());
        body.addProperty("name", item.getName());
        body.addProperty("rarity", item.getRarity().getId());
        JsonObject response = post("/mint/loot", body);
        return Optional.of(requiredString(response, "tokenId"));
    }

    @Override
    public boolean isSimulated() {
        return false;
    }

    private JsonObject post(String path, JsonObject body) throws SettlementException {
        Request request = new Request.Builder()
                .url(baseUrl + path)
                .post(RequestBody.create(gson.toJson(body), JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new SettlementException("Mint failed", "HTTP " + response.code() + " " + text);
            }
            JsonObject json = gson.fromJson(text, JsonObject.class);
            if (json == null) {
                throw new SettlementException("Mint failed", "Empty response from " + path);
            }
            return json;
        } catch (IOException e) {
            throw new SettlementException("Mint failed", e.toString(), e);
        } catch (JsonParseException e) {
            throw new SettlementException("Mint failed", "Malformed response: " + e.getMessage(), e);
        }
    }

    private static String requiredString(JsonObject json, String field) throws SettlementException {
        JsonElement value = json.get(field);
        if (value == null || value.isJsonNull()) {
            throw new SettlementException("Mint failed", "Response missing " + field);
        }
        return value.getAsString();
    }
}
