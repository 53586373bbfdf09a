package com.ai.scheduling.repository;

import com.ai.scheduling.entity.AvailableSlot;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface AvailableSlotRepository extends JpaRepository<AvailableSlot, Long> {

    /**
     * Conditional AVAILABLE -> HELD transition. Returns the affected-row count: 1 when this
     * caller won the slot, 0 when it is already held or does not exist.
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE AvailableSlot s SET s.status = :held, s.version = s.version + 1 "
            + "WHERE s.id = :id AND s.status = :available")
    int claim(@Param("id") Long id,
              @Param("available") AvailableSlot.Status available,
              @Param("held") AvailableSlot.Status held);

    /**
     * HELD -> AVAILABLE. Matches nothing when the slot is already available.
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE AvailableSlot s SET s.status = :available, s.version = s.version + 1 "
            + "WHERE s.id = :id AND s.status <> :available")
    int release(@Param("id") Long id, @Param("available") AvailableSlot.Status available);

    /**
     * {@code specialty} must already be escaped for LIKE with {@code !} as the escape character.
     */
    @Query("SELECT s FROM AvailableSlot s JOIN FETCH s.doctor d JOIN FETCH s.clinic c "
            + "WHERE LOWER(d.specialty) LIKE LOWER(CONCAT('%', :specialty, '%')) ESCAPE '!' "
            + "AND s.status = :status AND s.slotDate >= :from "
            + "ORDER BY s.slotDate ASC, s.startTime ASC")
    List<AvailableSlot> searchBySpecialty(@Param("specialty") String specialty,
                                          @Param("status") AvailableSlot.Status status,
                                          @Param("from") LocalDate from,
                                          Pageable pageable);
}
