package com.ai.scheduling.dto;

import com.ai.scheduling.entity.Appointment;
import com.ai.scheduling.entity.InsuranceType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;

@Builder
public record AppointmentDetails(
        Long id,
        Long patientId,
        Long doctorId,
        String clinicId,
        Long slotId,
        Appointment.Status status,
        LocalDateTime appointmentDateTime,
        String patientName,
        String patientNationalId,
        String patientEmail,
        String patientPhone,
        String doctorName,
        String specialty,
        BigDecimal consultationPrice,
        String clinicName,
        String clinicPhone,
        String clinicAddress,
        String clinicCity,
        InsuranceType insuranceType,
        Long insurancePlanId,
        String notes,
        Instant createdAt,
        Instant confirmedAt,
        Instant cancelledAt,
        String cancellationReason
) {
}
