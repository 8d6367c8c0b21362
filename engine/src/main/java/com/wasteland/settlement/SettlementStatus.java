package com.wasteland.settlement;

/**
 * How a settlement attempt ended.
 */
public enum SettlementStatus {

    /**
     * Recorded remotely.
     */
    SETTLED,

    /**
     * Simulation mode; a synthetic receipt was returned.
     */
    SIMULATED,

    /**
     * Nothing to settle (e.g. loot below rare).
     */
    NOT_REQUIRED,

    /**
     * The remote side rejected the call or could not be reached.
     */
    FAILED,

    /**
     * No answer within the configured timeout. The remote side may still complete it.
     */
    TIMEOUT;

    /**
     * Whether a reconciliation job should look at this attempt again.
     */
    public boolean needsReconciliation() {
        return this == FAILED || this == TIMEOUT;
    }
}
