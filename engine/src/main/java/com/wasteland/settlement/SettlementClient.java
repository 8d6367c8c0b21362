package com.wasteland.settlement;

import com.wasteland.state.InventoryItem;

import java.util.Optional;

/**
 * Records earned rewards on the external system of record.
 */
public interface SettlementClient {

    /**
     * Mint caps to a wallet.
     *
     * @return the transaction id
     * @throws SettlementException if the mint did not go through
     */
    String mintCaps(String wallet, long amount) throws SettlementException;

    /**
     * Mint a representational token for a loot item.
     *
     * @return the token id, or empty if the item's rarity does not qualify
     * @throws SettlementException if the mint did not go through
     */
    Optional<String> mintLootToken(String wallet, InventoryItem item) throws SettlementException;

    /**
     * Whether this client only fabricates receipts.
     */
    boolean isSimulated();
}
