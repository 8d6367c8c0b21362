package com.wasteland.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Engine settings.
 *
 * <p>Values resolve in this order, later sources winning:
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>{@code /wasteland.properties} on the classpath</li>
 *   <li>environment variables</li>
 * </ol>
 *
 * <p>Keys are shared between the properties file and the environment:
 * {@code COOLDOWN_MS}, {@code CLAIM_RADIUS_M}, {@code SIMULATE_MINT}, {@code SETTLEMENT_URL},
 * {@code SETTLEMENT_TIMEOUT_MS}, {@code MAX_HEALTH_POLICY}, {@code PLAYER_STORE_DIR}.
 */
@Slf4j
@Value
@Builder(toBuilder = true)
public class EngineConfig {

    public static final String PROPERTIES_RESOURCE = "/wasteland.properties";

    public static final String KEY_COOLDOWN_MS = "COOLDOWN_MS";
    public static final String KEY_CLAIM_RADIUS_M = "CLAIM_RADIUS_M";
    public static final String KEY_SIMULATE_MINT = "SIMULATE_MINT";
    public static final String KEY_SETTLEMENT_URL = "SETTLEMENT_URL";
    public static final String KEY_SETTLEMENT_TIMEOUT_MS = "SETTLEMENT_TIMEOUT_MS";
    public static final String KEY_MAX_HEALTH_POLICY = "MAX_HEALTH_POLICY";
    public static final String KEY_PLAYER_STORE_DIR = "PLAYER_STORE_DIR";

    /**
     * Minimum time between two claims by the same wallet.
     */
    @Builder.Default
    Duration claimCooldown = Duration.ofHours(1);

    /**
     * Geofence radius for locations that do not declare their own.
     */
    @Builder.Default
    double defaultRadiusMeters = 150;

    /**
     * When set, settlement never leaves the process.
     */
    @Builder.Default
    boolean simulateMint = true;

    /**
     * Base URL of the mint relay. Empty when only simulated settlement is available.
     */
    @Builder.Default
    String settlementUrl = "";

    /**
     * Upper bound on a single settlement call.
     */
    @Builder.Default
    Duration settlementTimeout = Duration.ofSeconds(5);

    @Builder.Default
    MaxHealthPolicy maxHealthPolicy = MaxHealthPolicy.LAST_EQUIPPED;

    /**
     * Directory for persisted player records. Empty keeps players in memory only.
     */
    @Builder.Default
    String playerStoreDir = "";

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Load configuration from the classpath properties file and the process environment.
     */
    public static EngineConfig load() {
        return load(loadProperties(), System.getenv());
    }

    /**
     * Resolve configuration from explicit sources. Environment entries override properties.
     *
     * @param properties values from the properties file (may be empty)
     * @param environment environment variables
     * @return resolved configuration
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static EngineConfig load(Properties properties, Map<String, String> environment) {
        EngineConfigBuilder builder = builder();

        String cooldown = lookup(KEY_COOLDOWN_MS, properties, environment);
        if (cooldown != null) {
            builder.claimCooldown(Duration.ofMillis(parseLong(KEY_COOLDOWN_MS, cooldown)));
        }

        String radius = lookup(KEY_CLAIM_RADIUS_M, properties, environment);
        if (radius != null) {
            builder.defaultRadiusMeters(parseDouble(KEY_CLAIM_RADIUS_M, radius));
        }

        String simulate = lookup(KEY_SIMULATE_MINT, properties, environment);
        if (simulate != null) {
            builder.simulateMint(Boolean.parseBoolean(simulate.trim()));
        }

        String url = lookup(KEY_SETTLEMENT_URL, properties, environment);
        if (url != null) {
            builder.settlementUrl(url.trim());
        }

        String timeout = lookup(KEY_SETTLEMENT_TIMEOUT_MS, properties, environment);
        if (timeout != null) {
            builder.settlementTimeout(Duration.ofMillis(parseLong(KEY_SETTLEMENT_TIMEOUT_MS, timeout)));
        }

        String policy = lookup(KEY_MAX_HEALTH_POLICY, properties, environment);
        if (policy != null) {
            try {
                builder.maxHealthPolicy(MaxHealthPolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid " + KEY_MAX_HEALTH_POLICY + ": " + policy, e);
            }
        }

        String storeDir = lookup(KEY_PLAYER_STORE_DIR, properties, environment);
        if (storeDir != null) {
            builder.playerStoreDir(storeDir.trim());
        }

        EngineConfig config = builder.build();
        config.validate();
        return config;
    }

    /**
     * Whether settlement calls go to the remote relay.
     */
    public boolean isRemoteSettlement() {
        return !simulateMint && !settlementUrl.isEmpty();
    }

    private void validate() {
        if (claimCooldown.isNegative()) {
            throw new IllegalArgumentException(KEY_COOLDOWN_MS + " must not be negative");
        }
        if (defaultRadiusMeters <= 0) {
            throw new IllegalArgumentException(KEY_CLAIM_RADIUS_M + " must be positive");
        }
        if (settlementTimeout.isZero() || settlementTimeout.isNegative()) {
            throw new IllegalArgumentException(KEY_SETTLEMENT_TIMEOUT_MS + " must be positive");
        }
    }

    private static String lookup(String key, Properties properties, Map<String, String> environment) {
        String value = environment.get(key);
        if (value == null || value.isBlank()) {
            value = properties.getProperty(key);
        }
        return value == null || value.isBlank() ? null : value;
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + ": " + value, e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + ": " + value, e);
        }
    }

    private static Properties loadProperties() {
        Properties properties = new Properties();
        try (InputStream is = EngineConfig.class.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (is == null) {
                log.debug("No {} on classpath, using defaults", PROPERTIES_RESOURCE);
                return properties;
            }
            properties.load(new InputStreamReader(is, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", PROPERTIES_RESOURCE, e.getMessage());
        }
        return properties;
    }
}
