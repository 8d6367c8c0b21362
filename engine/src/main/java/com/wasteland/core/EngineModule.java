package com.wasteland.core;

import com.google.common.base.Strings;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.wasteland.config.EngineConfig;
import com.wasteland.settlement.HttpSettlementClient;
import com.wasteland.settlement.SettlementClient;
import com.wasteland.settlement.SimulatedSettlementClient;
import com.wasteland.state.InMemoryPlayerStore;
import com.wasteland.state.JsonFilePlayerStore;
import com.wasteland.state.PlayerStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Guice module for the engine.
 *
 * <p>Services carry their own {@code @Singleton} annotations; this module binds the
 * configuration and picks implementations for the store and settlement client.
 */
@Slf4j
public class EngineModule extends AbstractModule {

    private final EngineConfig config;

    public EngineModule(EngineConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(EngineConfig.class).toInstance(config);
        bind(Clock.class).toInstance(Clock.systemUTC());
    }

    @Provides
    @Singleton
    public PlayerStore providePlayerStore() {
        if (Strings.isNullOrEmpty(config.getPlayerStoreDir())) {
            log.info("Players are kept in memory only");
            return new InMemoryPlayerStore();
        }
        return new JsonFilePlayerStore(Paths.get(config.getPlayerStoreDir()));
    }

    @Provides
    @Singleton
    public SettlementClient provideSettlementClient() {
        if (config.isRemoteSettlement()) {
            return new HttpSettlementClient(config.getSettlementUrl(), config.getSettlementTimeout());
        }
        if (!config.isSimulateMint()) {
            log.warn("{} is off but no {} is configured; settlement stays simulated",
                    EngineConfig.KEY_SIMULATE_MINT, EngineConfig.KEY_SETTLEMENT_URL);
        }
        return new SimulatedSettlementClient();
    }
}
