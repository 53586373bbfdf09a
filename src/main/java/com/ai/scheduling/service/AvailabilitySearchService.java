package com.ai.scheduling.service;

import com.ai.scheduling.dto.SlotAvailability;
import com.ai.scheduling.entity.AvailableSlot;
import com.ai.scheduling.entity.Clinic;
import com.ai.scheduling.entity.Doctor;
import com.ai.scheduling.repository.AvailableSlotRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * Open slots for a specialty, from today on, earliest first.
 * Matching is a case-insensitive substring test on the doctor's specialty, nothing smarter.
 */
@Service
public class AvailabilitySearchService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilitySearchService.class);

    private final AvailableSlotRepository slotRepository;
    private final int pageSize;

    public AvailabilitySearchService(AvailableSlotRepository slotRepository,
                                     @Value("${scheduling.search.page-size:20}") int pageSize) {
        this.slotRepository = slotRepository;
        this.pageSize = pageSize;
    }

    @Transactional(readOnly = true)
    public List<SlotAvailability> search(String specialty) {
        String term = StringUtils.trimToNull(specialty);
        if (term == null) {
            log.warn("Empty specialty, nothing to search");
            return List.of();
        }

        List<SlotAvailability> results = slotRepository
                .searchBySpecialty(escapeLike(term), AvailableSlot.Status.AVAILABLE, LocalDate.now(), PageRequest.of(0, pageSize))
                .stream()
                .map(AvailabilitySearchService::toAvailability)
                .toList();

        if (results.isEmpty()) {
            log.warn("No availability found for '{}'", term);
        } else {
            log.info("Found {} open slot(s) for '{}'", results.size(), term);
        }
        return results;
    }

    /** Makes {@code %} and {@code _} in user input match literally. */
    static String escapeLike(String term) {
        return term.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }

    private static SlotAvailability toAvailability(AvailableSlot slot) {
        Doctor doctor = slot.getDoctor();
        Clinic clinic = slot.getClinic();
        return SlotAvailability.builder()
                .clinicId(clinic.getId())
                .clinicName(clinic.getLegalName())
                .clinicAddress(clinic.getAddress())
                .city(clinic.getCity())
                .state(clinic.getState())
                .clinicPhone(clinic.getPhone())
                .doctorId(doctor.getId())
                .doctorName(doctor.getName())
                .specialty(doctor.getSpecialty())
                .consultationPrice(doctor.getConsultationPrice())
                .slotId(slot.getId())
                .date(slot.getSlotDate())
                .time(slot.getStartTime())
                .build();
    }
}
