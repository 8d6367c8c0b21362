package com.wasteland.settlement;

import com.wasteland.state.InventoryItem;

import java.util.Optional;

/**
 * Settlement that never leaves the process and always succeeds.
 */
public class SimulatedSettlementClient implements SettlementClient {

    public static final String SIMULATED_TX = "SIMULATED_TX";
    public static final String SIMULATED_TOKEN = "SIMULATED_NFT";

    @Override
    public String mintCaps(String wallet, long amount) {
        return SIMULATED_TX;
    }

    @Override
    public Optional<String> mintLootToken(String wallet, InventoryItem item) {
        if (!item.getRarity().isTopTier()) {
            return Optional.empty();
        }
        return Optional.of(SIMULATED_TOKEN);
    }

    @Override
    public boolean isSimulated() {
        return true;
    }
}
