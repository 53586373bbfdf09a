package com.ai.scheduling.service;

import com.ai.scheduling.dto.PatientProfile;
import com.ai.scheduling.entity.InsuranceType;
import com.ai.scheduling.entity.Patient;
import com.ai.scheduling.repository.PatientRepository;
import com.ai.scheduling.utils.PatientDataValidator;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Maps a CPF to a patient row, creating it on first sight.
 * First write wins: an existing patient is never updated from a later profile.
 */
@Service
@RequiredArgsConstructor
public class PatientIdentityService {

    private static final Logger log = LoggerFactory.getLogger(PatientIdentityService.class);

    private final PatientRepository patientRepository;

    @Transactional
    public Long resolve(String nationalId, PatientProfile profile) {
        String key = PatientDataValidator.normalizeNationalId(nationalId);
        Optional<Patient> existing = lookup(key);
        if (existing.isPresent()) {
            log.info("Existing patient found: id={}", existing.get().getId());
            return existing.get().getId();
        }

        Patient patient = Patient.builder()
                .nationalId(key)
                .name(StringUtils.trim(profile.name()))
                .dateOfBirth(profile.dateOfBirth())
                .email(StringUtils.defaultIfBlank(profile.email(), placeholderEmail(key)))
                .phone(StringUtils.defaultString(StringUtils.trimToNull(profile.phone())))
                .insuranceType(profile.insuranceType() != null ? profile.insuranceType() : InsuranceType.PRIVATE_PAY)
                .build();
        // unique national_id makes a concurrent duplicate fail here
        patient = patientRepository.save(patient);
        log.info("Created patient: id={} insuranceType={}", patient.getId(), patient.getInsuranceType());
        return patient.getId();
    }

    /**
     * A malformed key never matches a row; it is reported as a miss rather than queried.
     */
    @Transactional(readOnly = true)
    public Optional<Patient> lookup(String nationalId) {
        if (!PatientDataValidator.isValidNationalId(nationalId)) {
            return Optional.empty();
        }
        return patientRepository.findByNationalId(PatientDataValidator.normalizeNationalId(nationalId));
    }

    static String placeholderEmail(String nationalId) {
        return "patient_" + nationalId + "@clinic.local";
    }
}
