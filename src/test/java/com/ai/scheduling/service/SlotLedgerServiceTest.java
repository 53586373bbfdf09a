package com.ai.scheduling.service;

import com.ai.scheduling.entity.AvailableSlot;
import com.ai.scheduling.support.BookingTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SlotLedgerServiceTest extends BookingTestSupport {

    @Autowired
    private SlotLedgerService slotLedgerService;

    @Test
    void claim_succeedsOnceThenReportsHeld() {
        assertTrue(slotLedgerService.claim(slot.getId()));
        assertEquals(AvailableSlot.Status.HELD, slotStatus(slot.getId()));

        assertFalse(slotLedgerService.claim(slot.getId()));
        assertEquals(AvailableSlot.Status.HELD, slotStatus(slot.getId()));
    }

    @Test
    void claim_unknownSlotReturnsFalse() {
        assertFalse(slotLedgerService.claim(999_999L));
        assertFalse(slotLedgerService.claim(null));
    }

    @Test
    void release_isIdempotentAndMakesSlotClaimableAgain() {
        assertTrue(slotLedgerService.claim(slot.getId()));

        slotLedgerService.release(slot.getId());
        slotLedgerService.release(slot.getId());
        assertEquals(AvailableSlot.Status.AVAILABLE, slotStatus(slot.getId()));

        assertTrue(slotLedgerService.claim(slot.getId()));
    }

    @Test
    void release_onAvailableSlotIsNoOp() {
        slotLedgerService.release(slot.getId());
        assertEquals(AvailableSlot.Status.AVAILABLE, slotStatus(slot.getId()));
    }

    @Test
    void concurrentClaims_exactlyOneWins() throws Exception {
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return slotLedgerService.claim(slot.getId());
                }));
            }
            start.countDown();

            int wins = 0;
            for (Future<Boolean> f : futures) {
                if (f.get(30, TimeUnit.SECONDS)) wins++;
            }
            assertEquals(1, wins);
            assertEquals(AvailableSlot.Status.HELD, slotStatus(slot.getId()));
        } finally {
            pool.shutdownNow();
        }
    }
}
