package com.wasteland.core;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.wasteland.api.ApiResponse;
import com.wasteland.api.RequestDispatcher;
import com.wasteland.config.EngineConfig;
import com.wasteland.data.GsonFactory;
import com.wasteland.util.IoExecutor;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Command-line entry point.
 *
 * <p>Reads one JSON request per line from stdin and writes one JSON response per line to stdout:
 * <pre>
 * in:  {"method": "POST", "path": "/claim-survival", "body": {"wallet": "w1", "locationId": "vault13"}}
 * out: {"status": 200, "body": {...}}
 * </pre>
 * Logging goes to stderr.
 */
@Slf4j
public final class WastelandApplication {

    private final RequestDispatcher dispatcher;
    private final Gson gson = GsonFactory.builder().serializeNulls().create();

    WastelandApplication(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public static void main(String[] args) throws IOException {
        EngineConfig config = EngineConfig.load();
        Injector injector = Guice.createInjector(new EngineModule(config));
        log.info("Wasteland engine started | simulate mint: {}", !config.isRemoteSettlement());

        WastelandApplication app = new WastelandApplication(injector.getInstance(RequestDispatcher.class));
        try {
            app.run(new InputStreamReader(System.in, StandardCharsets.UTF_8),
                    new PrintStream(System.out, true, StandardCharsets.UTF_8));
        } finally {
            injector.getInstance(IoExecutor.class).shutdown();
        }
    }

    /**
     * Serve requests until the input ends.
     */
    void run(Reader input, PrintStream output) throws IOException {
        BufferedReader reader = new BufferedReader(input);
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            output.println(gson.toJson(toJson(handle(line))));
        }
    }

    ApiResponse handle(String line) {
        String method;
        String path;
        JsonElement body;
        try {
            JsonObject request = JsonParser.parseString(line).getAsJsonObject();
            method = request.has("method") ? request.get("method").getAsString() : "GET";
            path = request.has("path") ? request.get("path").getAsString() : "";
            body = request.get("body");
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            log.debug("Malformed request line: {}", line);
            return ApiResponse.error(400, "Malformed request");
        }
        return dispatcher.dispatch(method, path, body != null && body.isJsonObject() ? body.getAsJsonObject() : null);
    }

    private static JsonObject toJson(ApiResponse response) {
        JsonObject json = new JsonObject();
        json.addProperty("status", response.status());
        json.add("body", response.body());
        return json;
    }
}
