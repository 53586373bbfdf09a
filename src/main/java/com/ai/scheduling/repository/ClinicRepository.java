package com.ai.scheduling.repository;

import com.ai.scheduling.entity.Clinic;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ClinicRepository extends JpaRepository<Clinic, String> {
}
