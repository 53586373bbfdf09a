package com.ai.scheduling.dto;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

@Builder
public record SlotAvailability(
        String clinicId,
        String clinicName,
        String clinicAddress,
        String city,
        String state,
        String clinicPhone,
        Long doctorId,
        String doctorName,
        String specialty,
        BigDecimal consultationPrice,
        Long slotId,
        LocalDate date,
        LocalTime time
) {
}
