package com.ai.scheduling.service;

import com.ai.scheduling.dto.AppointmentDetails;
import com.ai.scheduling.entity.Appointment;
import com.ai.scheduling.repository.AppointmentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class AppointmentQueryService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentQueryService.class);

    private final AppointmentRepository appointmentRepository;

    @Transactional(readOnly = true)
    public Optional<AppointmentDetails> getById(Long appointmentId) {
        if (appointmentId == null) return Optional.empty();

        Optional<AppointmentDetails> details = appointmentRepository.findDetailedById(appointmentId)
                .map(AppointmentQueryService::toDetails);
        if (details.isEmpty()) {
            log.warn("Appointment {} not found", appointmentId);
        }
        return details;
    }

    private static AppointmentDetails toDetails(Appointment a) {
        return AppointmentDetails.builder()
                .id(a.getId())
                .patientId(a.getPatient().getId())
                .doctorId(a.getDoctor().getId())
                .clinicId(a.getClinic().getId())
                .slotId(a.getSlot().getId())
                .status(a.getStatus())
                .appointmentDateTime(a.getAppointmentDateTime())
                .patientName(a.getPatient().getName())
                .patientNationalId(a.getPatient().getNationalId())
                .patientEmail(a.getPatient().getEmail())
                .patientPhone(a.getPatient().getPhone())
                .doctorName(a.getDoctor().getName())
                .specialty(a.getDoctor().getSpecialty())
                .consultationPrice(a.getDoctor().getConsultationPrice())
                .clinicName(a.getClinic().getLegalName())
                .clinicPhone(a.getClinic().getPhone())
                .clinicAddress(a.getClinic().getAddress())
                .clinicCity(a.getClinic().getCity())
                .insuranceType(a.getInsuranceType())
                .insurancePlanId(a.getInsurancePlanId())
                .notes(a.getNotes())
                .createdAt(a.getCreatedAt())
                .confirmedAt(a.getConfirmedAt())
                .cancelledAt(a.getCancelledAt())
                .cancellationReason(a.getCancellationReason())
                .build();
    }
}
