package com.ai.scheduling.service;

import com.ai.scheduling.entity.AvailableSlot;
import com.ai.scheduling.repository.AvailableSlotRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Claim and release of availability slots.
 * The database row is the only source of truth; both operations are a single conditional
 * UPDATE and join the caller's transaction when there is one.
 */
@Service
@RequiredArgsConstructor
public class SlotLedgerService {

    private static final Logger log = LoggerFactory.getLogger(SlotLedgerService.class);

    private final AvailableSlotRepository slotRepository;

    /**
     * AVAILABLE -> HELD. Returns {@code false} without touching anything when the slot is
     * already held or unknown. Of two concurrent claims on one slot exactly one returns true.
     */
    @Transactional
    public boolean claim(Long slotId) {
        if (slotId == null) return false;
        int updated = slotRepository.claim(slotId, AvailableSlot.Status.AVAILABLE, AvailableSlot.Status.HELD);
        if (updated == 1) {
            log.debug("Slot {} claimed", slotId);
            return true;
        }
        log.warn("Slot {} could not be claimed (already held or missing)", slotId);
        return false;
    }

    /**
     * HELD -> AVAILABLE. Idempotent.
     */
    @Transactional
    public void release(Long slotId) {
        if (slotId == null) return;
        int updated = slotRepository.release(slotId, AvailableSlot.Status.AVAILABLE);
        if (updated == 0) {
            log.debug("Slot {} was already available", slotId);
        } else {
            log.debug("Slot {} released", slotId);
        }
    }
}
