package com.wasteland.settlement;

import com.google.common.collect.EvictingQueue;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Settlements that failed or timed out, kept so a reconciliation job can retry them
 * with the recorded amounts. Nothing here retries on its own. The queue is bounded and
 * drops its oldest entries once full.
 */
@Slf4j
@Singleton
public class PendingSettlements {

    /**
     * What the failed attempt was trying to settle.
     */
    public enum Kind {
        CAPS,
        LOOT_TOKEN
    }

    /**
     * One settlement awaiting reconciliation.
     *
     * @param wallet     the player
     * @param kind       caps mint or loot token mint
     * @param amount     caps to mint (0 for loot tokens)
     * @param itemId     loot item id for token mints
     * @param outcome    the failed attempt
     * @param recordedAt when the failure was recorded
     */
    public record Entry(
            String wallet,
            Kind kind,
            long amount,
            @Nullable String itemId,
            SettlementOutcome outcome,
            Instant recordedAt
    ) {
    }

    public static final int DEFAULT_CAPACITY = 10_000;

    private final EvictingQueue<Entry> entries;

    @Inject
    public PendingSettlements() {
        this(DEFAULT_CAPACITY);
    }

    public PendingSettlements(int capacity) {
        this.entries = EvictingQueue.create(capacity);
    }

    /**
     * Queue a failed settlement. Once the queue is full the oldest entry is dropped.
     */
    public synchronized void record(Entry entry) {
        if (entries.remainingCapacity() == 0) {
            Entry dropped = entries.peek();
            log.error("Reconciliation queue full, dropping {} for {} ({}) recorded at {}",
                    dropped.kind(), dropped.wallet(), dropped.amount(), dropped.recordedAt());
        }
        entries.add(entry);
        log.warn("Settlement {} for {} ({}) queued for reconciliation: {} {}",
                entry.kind(), entry.wallet(), entry.amount(), entry.outcome().status(), entry.outcome().detail());
    }

    /**
     * Remove and return everything queued so far, oldest first.
     */
    public synchronized List<Entry> drain() {
        List<Entry> drained = new ArrayList<>(entries);
        entries.clear();
        return drained;
    }

    public synchronized int size() {
        return entries.size();
    }
}
