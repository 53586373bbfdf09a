package com.ai.scheduling.service;

import com.ai.scheduling.dto.BookingError;
import com.ai.scheduling.dto.BookingResult;
import com.ai.scheduling.entity.Appointment;
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

class BookingConcurrencyTest extends BookingTestSupport {

    private static final int CALLERS = 8;

    @Autowired
    private BookingService bookingService;

    @Test
    void concurrentBookingsOfOneSlot_produceExactlyOneAppointment() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(CALLERS);
        CountDownLatch start = new CountDownLatch(1);
        List<BookingResult> results = new ArrayList<>();
        try {
            List<Future<BookingResult>> futures = new ArrayList<>();
            for (int i = 0; i < CALLERS; i++) {
                String cpf = String.format("%011d", 10_000_000_000L + i);
                futures.add(pool.submit(() -> {
                    start.await();
                    return bookingService.book(mariaRequest(slot.getId()).nationalId(cpf).build());
                }));
            }
            start.countDown();
            for (Future<BookingResult> f : futures) {
                results.add(f.get(60, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        long confirmed = results.stream().filter(BookingResult::success).count();
        long unavailable = results.stream().filter(r -> r.error() == BookingError.SLOT_UNAVAILABLE).count();
        assertEquals(1, confirmed, () -> "results: " + results);
        assertEquals(CALLERS - 1, unavailable, () -> "results: " + results);

        assertEquals(1, appointmentRepository.countBySlotIdAndStatus(slot.getId(), Appointment.Status.CONFIRMED));
        assertEquals(1, appointmentRepository.countBySlotId(slot.getId()));
        assertEquals(AvailableSlot.Status.HELD, slotStatus(slot.getId()));
        // losers' patient rows roll back with their unit of work
        assertEquals(1, patientRepository.count());
    }

    @Test
    void concurrentBookingsOfDifferentSlots_allSucceed() throws Exception {
        List<Long> slotIds = new ArrayList<>();
        slotIds.add(slot.getId());
        for (int i = 1; i < CALLERS; i++) {
            slotIds.add(createSlot(doctor, slot.getSlotDate(), slot.getStartTime().plusMinutes(30L * i)).getId());
        }

        ExecutorService pool = Executors.newFixedThreadPool(CALLERS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<BookingResult>> futures = new ArrayList<>();
            for (int i = 0; i < CALLERS; i++) {
                Long slotId = slotIds.get(i);
                String cpf = String.format("%011d", 20_000_000_000L + i);
                futures.add(pool.submit(() -> {
                    start.await();
                    return bookingService.book(mariaRequest(slotId).nationalId(cpf).build());
                }));
            }
            start.countDown();
            for (Future<BookingResult> f : futures) {
                BookingResult result = f.get(60, TimeUnit.SECONDS);
                assertTrue(result.success(), result.message());
            }
        } finally {
            pool.shutdownNow();
        }

        for (Long slotId : slotIds) {
            assertEquals(AvailableSlot.Status.HELD, slotStatus(slotId));
        }
    }

    @Test
    void concurrentFirstBookingsOfOnePatient_createOnePatientRow() throws Exception {
        List<Long> slotIds = new ArrayList<>();
        slotIds.add(slot.getId());
        for (int i = 1; i < CALLERS; i++) {
            slotIds.add(createSlot(doctor, slot.getSlotDate(), slot.getStartTime().plusMinutes(30L * i)).getId());
        }

        ExecutorService pool = Executors.newFixedThreadPool(CALLERS);
        CountDownLatch start = new CountDownLatch(1);
        List<BookingResult> results = new ArrayList<>();
        try {
            List<Future<BookingResult>> futures = new ArrayList<>();
            for (Long slotId : slotIds) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return bookingService.book(mariaRequest(slotId).build());
                }));
            }
            start.countDown();
            for (Future<BookingResult> f : futures) {
                results.add(f.get(60, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertTrue(results.stream().allMatch(BookingResult::success), () -> "results: " + results);
        assertEquals(1, patientRepository.count());
        Long patientId = patientRepository.findByNationalId(MARIA_CPF).orElseThrow().getId();
        for (Long slotId : slotIds) {
            assertEquals(AvailableSlot.Status.HELD, slotStatus(slotId));
        }
        assertEquals(CALLERS, appointmentRepository.count());
        assertTrue(appointmentRepository.findAll().stream()
                .allMatch(a -> a.getPatient().getId().equals(patientId)));
    }
}
