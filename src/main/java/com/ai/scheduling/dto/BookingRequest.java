package com.ai.scheduling.dto;

import lombok.Builder;

/**
 * Raw booking input as received from a caller. Validated and normalized by
 * {@link com.ai.scheduling.service.BookingService#book(BookingRequest)}.
 *
 * @param nationalId  patient CPF, with or without {@code .}/{@code -} formatting
 * @param dateOfBirth {@code dd/MM/yyyy} or {@code yyyy-MM-dd}
 * @param insuranceType {@code PRIVATE_PAY} or {@code HEALTH_PLAN}; anything else means private pay
 */
@Builder
public record BookingRequest(
        String patientName,
        String nationalId,
        String dateOfBirth,
        String email,
        String phone,
        String insuranceType,
        Long insurancePlanId,
        Long doctorId,
        Long slotId,
        String clinicId,
        String notes
) {
}
