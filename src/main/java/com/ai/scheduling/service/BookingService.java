package com.ai.scheduling.service;

import com.ai.scheduling.dto.BookingError;
import com.ai.scheduling.dto.BookingRequest;
import com.ai.scheduling.dto.BookingResult;
import com.ai.scheduling.dto.PatientProfile;
import com.ai.scheduling.entity.Appointment;
import com.ai.scheduling.entity.AvailableSlot;
import com.ai.scheduling.entity.InsuranceType;
import com.ai.scheduling.repository.AppointmentRepository;
import com.ai.scheduling.repository.AvailableSlotRepository;
import com.ai.scheduling.repository.PatientRepository;
import com.ai.scheduling.utils.PatientDataValidator;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Books and cancels appointments. Each call is one unit of work: patient resolution, slot
 * claim and appointment insert commit together or not at all.
 * Never throws; every outcome, storage failures included, comes back as a {@link BookingResult}.
 */
@Service
public class BookingService {

    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    /** Re-runs let a lost patient-insert race resolve through the lookup path. */
    private static final int MAX_ATTEMPTS = 5;
    private static final long RETRY_BACKOFF_MILLIS = 50;

    private final PatientIdentityService patientIdentityService;
    private final SlotLedgerService slotLedgerService;
    private final AvailableSlotRepository slotRepository;
    private final PatientRepository patientRepository;
    private final AppointmentRepository appointmentRepository;
    private final TransactionTemplate transactionTemplate;

    public BookingService(PatientIdentityService patientIdentityService,
                          SlotLedgerService slotLedgerService,
                          AvailableSlotRepository slotRepository,
                          PatientRepository patientRepository,
                          AppointmentRepository appointmentRepository,
                          PlatformTransactionManager transactionManager,
                          @Value("${scheduling.booking.transaction-timeout-seconds:5}") int timeoutSeconds) {
        this.patientIdentityService = patientIdentityService;
        this.slotLedgerService = slotLedgerService;
        this.slotRepository = slotRepository;
        this.patientRepository = patientRepository;
        this.appointmentRepository = appointmentRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.transactionTemplate.setTimeout(timeoutSeconds);
    }

    // =========================================================
    // BOOK
    // =========================================================
    public BookingResult book(BookingRequest request) {
        if (request == null) {
            return BookingResult.invalid("Booking request is required.");
        }
        if (request.doctorId() == null || request.slotId() == null || StringUtils.isBlank(request.clinicId())) {
            log.warn("Rejected booking: missing doctor/slot/clinic reference");
            return BookingResult.invalid("Doctor, slot and clinic are required.");
        }
        if (!PatientDataValidator.isValidNationalId(request.nationalId())) {
            log.warn("Rejected booking: invalid national id");
            return BookingResult.invalid("Invalid CPF: expected "
                    + PatientDataValidator.NATIONAL_ID_LENGTH + " digits.");
        }
        Optional<LocalDate> dateOfBirth = PatientDataValidator.parseDateOfBirth(request.dateOfBirth());
        if (dateOfBirth.isEmpty()) {
            log.warn("Rejected booking: invalid date of birth '{}'", request.dateOfBirth());
            return BookingResult.invalid("Invalid date of birth. Use DD/MM/YYYY or YYYY-MM-DD.");
        }
        if (!PatientDataValidator.isValidName(request.patientName())) {
            log.warn("Rejected booking: patient name too short");
            return BookingResult.invalid("Patient name is missing or incomplete.");
        }

        String nationalId = PatientDataValidator.normalizeNationalId(request.nationalId());
        InsuranceType insuranceType = InsuranceType.fromValue(request.insuranceType());
        PatientProfile profile = new PatientProfile(
                request.patientName(),
                dateOfBirth.get(),
                request.email(),
                request.phone(),
                insuranceType
        );

        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status ->
                        bookInTransaction(status, request, nationalId, profile, insuranceType));
            } catch (PatientInsertConflict e) {
                if (attempt >= MAX_ATTEMPTS) {
                    return storageFailure("book slot " + request.slotId(), e.getCause());
                }
                log.warn("Patient insert conflict while booking slot {} (attempt {}), retrying: {}",
                        request.slotId(), attempt, e.getMessage());
                try {
                    Thread.sleep(RETRY_BACKOFF_MILLIS * attempt);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    return storageFailure("book slot " + request.slotId(), e.getCause());
                }
            } catch (RuntimeException e) {
                return storageFailure("book slot " + request.slotId(), e);
            }
        }
    }

    private BookingResult bookInTransaction(TransactionStatus status,
                                            BookingRequest request,
                                            String nationalId,
                                            PatientProfile profile,
                                            InsuranceType insuranceType) {
        Long slotId = request.slotId();
        AvailableSlot slot = slotRepository.findById(slotId).orElse(null);
        if (slot == null) {
            log.warn("Slot not found: {}", slotId);
            return BookingResult.slotUnavailable("This time slot is no longer available.");
        }
        if (!Objects.equals(slot.getDoctor().getId(), request.doctorId())
                || !Objects.equals(slot.getClinic().getId(), request.clinicId().trim())) {
            log.warn("Slot {} does not belong to doctor {} at clinic {}",
                    slotId, request.doctorId(), request.clinicId());
            status.setRollbackOnly();
            return BookingResult.invalid("Slot does not belong to the given doctor and clinic.");
        }

        Long patientId;
        try {
            patientId = patientIdentityService.resolve(nationalId, profile);
        } catch (DataAccessException e) {
            // another unit of work inserted the same national id first
            throw new PatientInsertConflict(e);
        }

        if (!slotLedgerService.claim(slotId)) {
            status.setRollbackOnly();
            return BookingResult.slotUnavailable("This time slot is no longer available.");
        }

        Appointment appointment = Appointment.builder()
                .patient(patientRepository.getReferenceById(patientId))
                .doctor(slot.getDoctor())
                .clinic(slot.getClinic())
                .slot(slot)
                .appointmentDateTime(LocalDateTime.of(slot.getSlotDate(), slot.getStartTime()))
                .insuranceType(insuranceType)
                .insurancePlanId(request.insurancePlanId())
                .notes(StringUtils.trimToNull(request.notes()))
                .status(Appointment.Status.CONFIRMED)
                .build();
        appointment = appointmentRepository.save(appointment);

        log.info("Booked appointment: id={} patientId={} doctorId={} slotId={} at {}",
                appointment.getId(), patientId, request.doctorId(), slotId,
                appointment.getAppointmentDateTime());
        return BookingResult.success(appointment.getId(), "Appointment confirmed. ID: " + appointment.getId());
    }

    // =========================================================
    // CANCEL
    // =========================================================
    public BookingResult cancel(Long appointmentId, String reason) {
        if (appointmentId == null) {
            return BookingResult.invalid("Appointment id is required.");
        }
        String normalizedReason = StringUtils.truncate(StringUtils.trimToNull(reason), Appointment.REASON_MAX_LENGTH);
        try {
            return transactionTemplate.execute(status -> cancelInTransaction(appointmentId, normalizedReason));
        } catch (RuntimeException e) {
            return storageFailure("cancel appointment " + appointmentId, e);
        }
    }

    private BookingResult cancelInTransaction(Long appointmentId, String reason) {
        Appointment appointment = appointmentRepository.findByIdForUpdate(appointmentId).orElse(null);
        if (appointment == null) {
            log.warn("Appointment {} not found", appointmentId);
            return BookingResult.notFound("Appointment not found.");
        }
        if (appointment.getStatus() == Appointment.Status.CANCELLED) {
            log.warn("Appointment {} already cancelled", appointmentId);
            return BookingResult.failure(BookingError.ALREADY_CANCELLED, "Appointment already cancelled.");
        }

        appointment.setStatus(Appointment.Status.CANCELLED);
        appointment.setCancelledAt(Instant.now());
        appointment.setCancellationReason(reason);
        appointmentRepository.save(appointment);

        slotLedgerService.release(appointment.getSlot().getId());

        log.info("Cancelled appointment {} (slot {})", appointmentId, appointment.getSlot().getId());
        return BookingResult.success(appointmentId, "Appointment cancelled.");
    }

    /**
     * Covers the {@link DataAccessException} and {@link TransactionException} hierarchies
     * (constraint violations, timeouts, lost connections) and anything else thrown inside the
     * unit of work. The transaction template has already rolled back by the time this runs.
     */
    private BookingResult storageFailure(String operation, Throwable e) {
        log.error("Storage failure during {}, transaction rolled back", operation, e);
        String cause = e instanceof DataAccessException
                ? ((DataAccessException) e).getMostSpecificCause().getMessage()
                : e.getMessage();
        return BookingResult.failure(BookingError.STORAGE_ERROR, "Storage error: " + cause);
    }

    /**
     * The patient insert failed, normally on the unique national id. Depending on the store the
     * loser sees a duplicate key (after the winner commits) or a concurrent-update error (while
     * the winner is still open), so the unit of work is re-run after a short pause.
     */
    private static final class PatientInsertConflict extends RuntimeException {

        PatientInsertConflict(DataAccessException cause) {
            super(cause.getMostSpecificCause().getMessage(), cause);
        }
    }
}
