package com.ai.scheduling.dto;

import com.ai.scheduling.entity.InsuranceType;

import java.time.LocalDate;

/**
 * Profile fields used only when a patient is created for the first time.
 */
public record PatientProfile(String name,
                             LocalDate dateOfBirth,
                             String email,
                             String phone,
                             InsuranceType insuranceType) {
}
