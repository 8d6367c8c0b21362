package com.wasteland.settlement;

import javax.annotation.Nullable;

/**
 * Result of one settlement attempt, reported to the caller as advisory information.
 * A failed settlement never undoes the local reward.
 *
 * @param status        how the attempt ended
 * @param transactionId transaction or token id when settled or simulated
 * @param error         short failure description
 * @param detail        diagnostic text for failures
 * @param amount        caps the attempt covered (0 for loot tokens)
 */
public record SettlementOutcome(
        SettlementStatus status,
        @Nullable String transactionId,
        @Nullable String error,
        @Nullable String detail,
        long amount
) {
    public static SettlementOutcome settled(String transactionId, long amount) {
        return new SettlementOutcome(SettlementStatus.SETTLED, transactionId, null, null, amount);
    }

    public static SettlementOutcome simulated(String transactionId, long amount) {
        return new SettlementOutcome(SettlementStatus.SIMULATED, transactionId, null, null, amount);
    }

    public static SettlementOutcome notRequired() {
        return new SettlementOutcome(SettlementStatus.NOT_REQUIRED, null, null, null, 0);
    }

    public static SettlementOutcome failed(String error, String detail, long amount) {
        return new SettlementOutcome(SettlementStatus.FAILED, null, error, detail, amount);
    }

    public static SettlementOutcome timedOut(long timeoutMs, long amount) {
        return new SettlementOutcome(SettlementStatus.TIMEOUT, null, "Settlement timeout",
                "No response within " + timeoutMs + "ms", amount);
    }

    public boolean isSuccessful() {
        return status == SettlementStatus.SETTLED || status == SettlementStatus.SIMULATED;
    }
}
