package com.ai.scheduling.repository;

import com.ai.scheduling.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.util.Optional;

public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Appointment a WHERE a.id = :id")
    Optional<Appointment> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT a FROM Appointment a "
            + "JOIN FETCH a.patient JOIN FETCH a.doctor JOIN FETCH a.clinic JOIN FETCH a.slot "
            + "WHERE a.id = :id")
    Optional<Appointment> findDetailedById(@Param("id") Long id);

    long countBySlotId(Long slotId);

    long countBySlotIdAndStatus(Long slotId, Appointment.Status status);
}
