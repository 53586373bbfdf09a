package com.ai.scheduling.repository;

import com.ai.scheduling.entity.Patient;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PatientRepository extends JpaRepository<Patient, Long> {

    Optional<Patient> findByNationalId(String nationalId);

    long countByNationalId(String nationalId);
}
