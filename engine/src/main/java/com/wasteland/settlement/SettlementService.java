package com.wasteland.settlement;

import com.wasteland.config.EngineConfig;
import com.wasteland.state.InventoryItem;
import com.wasteland.util.IoExecutor;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs settlement calls off the request thread with a time limit and turns every failure
 * into an advisory {@link SettlementOutcome}.
 *
 * <p>Failed and timed-out attempts are queued in {@link PendingSettlements}.
 */
@Slf4j
@Singleton
public class SettlementService {

    private final SettlementClient client;
    private final IoExecutor ioExecutor;
    private final PendingSettlements pending;
    private final Duration timeout;
    private final Clock clock;

    @Inject
    public SettlementService(SettlementClient client, IoExecutor ioExecutor, PendingSettlements pending,
                             EngineConfig config, Clock clock) {
        this(client, ioExecutor, pending, config.getSettlementTimeout(), clock);
    }

    public SettlementService(SettlementClient client, IoExecutor ioExecutor, PendingSettlements pending,
                             Duration timeout, Clock clock) {
        this.client = client;
        this.ioExecutor = ioExecutor;
        this.pending = pending;
        this.timeout = timeout;
        this.clock = clock;
        log.info("SettlementService using {} settlement, timeout {}ms",
                client.isSimulated() ? "simulated" : "remote", timeout.toMillis());
    }

    /**
     * Mint earned caps for a wallet.
     */
    public SettlementOutcome settleCaps(String wallet, long amount) {
        if (client.isSimulated()) {
            try {
                return SettlementOutcome.simulated(client.mintCaps(wallet, amount), amount);
            } catch (SettlementException e) {
                return failed(wallet, PendingSettlements.Kind.CAPS, amount, null,
                        SettlementOutcome.failed(e.getMessage(), e.getDetail(), amount));
            }
        }

        SettlementOutcome outcome = call(() -> SettlementOutcome.settled(client.mintCaps(wallet, amount), amount), amount);
        if (outcome.status().needsReconciliation()) {
            return failed(wallet, PendingSettlements.Kind.CAPS, amount, null, outcome);
        }
        return outcome;
    }

    /**
     * Mint a token for a loot item when its rarity qualifies.
     */
    public SettlementOutcome mintLootToken(String wallet, InventoryItem item) {
        if (!item.getRarity().isTopTier()) {
            return SettlementOutcome.notRequired();
        }

        SettlementOutcome outcome = call(() -> {
            Optional<String> token = client.mintLootToken(wallet, item);
            if (token.isEmpty()) {
                return SettlementOutcome.notRequired();
            }
            return client.isSimulated()
                    ? SettlementOutcome.simulated(token.get(), 0)
                    : SettlementOutcome.settled(token.get(), 0);
        }, 0);

        if (outcome.status().needsReconciliation()) {
            return failed(wallet, PendingSettlements.Kind.LOOT_TOKEN, 0, item.getId(), outcome);
        }
        return outcome;
    }

    private SettlementOutcome call(Callable<SettlementOutcome> task, long amount) {
        Future<SettlementOutcome> future = ioExecutor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.debug("Settlement timed out, {} queued I/O tasks", ioExecutor.getQueueSize());
            return SettlementOutcome.timedOut(timeout.toMillis(), amount);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SettlementException se) {
                return SettlementOutcome.failed(se.getMessage(), se.getDetail(), amount);
            }
            log.error("Unexpected settlement failure", cause);
            return SettlementOutcome.failed("Mint failed", String.valueOf(cause), amount);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return SettlementOutcome.failed("Mint failed", "Interrupted while waiting for settlement", amount);
        }
    }

    private SettlementOutcome failed(String wallet, PendingSettlements.Kind kind, long amount, String itemId,
                                     SettlementOutcome outcome) {
        pending.record(new PendingSettlements.Entry(wallet, kind, amount, itemId, outcome, clock.instant()));
        return outcome;
    }
}
