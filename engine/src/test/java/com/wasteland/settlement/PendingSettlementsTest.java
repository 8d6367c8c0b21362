package com.wasteland.settlement;

import org.junit.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.Assert.*;

public class PendingSettlementsTest {

    private static final Instant NOW = Instant.parse("2024-06-01T15:00:00Z");

    @Test
    public void testRecord_PastCapacity_DropsOldest() {
        PendingSettlements pending = new PendingSettlements(2);

        pending.record(entry("wallet-1", 12));
        pending.record(entry("wallet-2", 24));
        pending.record(entry("wallet-3", 36));

        assertEquals(2, pending.size());
        List<PendingSettlements.Entry> drained = pending.drain();
        assertEquals("wallet-2", drained.get(0).wallet());
        assertEquals("wallet-3", drained.get(1).wallet());
        assertEquals(36, drained.get(1).amount());
    }

    @Test
    public void testDrain_EmptiesQueueOldestFirst() {
        PendingSettlements pending = new PendingSettlements();
        pending.record(entry("wallet-1", 12));
        pending.record(entry("wallet-1", 18));

        List<PendingSettlements.Entry> drained = pending.drain();

        assertEquals(2, drained.size());
        assertEquals(12, drained.get(0).amount());
        assertEquals(0, pending.size());
        assertTrue(pending.drain().isEmpty());
    }

    private static PendingSettlements.Entry entry(String wallet, long amount) {
        return new PendingSettlements.Entry(wallet, PendingSettlements.Kind.CAPS, amount, null,
                SettlementOutcome.timedOut(5000, amount), NOW);
    }
}
