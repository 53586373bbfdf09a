package com.ai.scheduling.seeder;

import com.ai.scheduling.entity.AvailableSlot;
import com.ai.scheduling.entity.Clinic;
import com.ai.scheduling.entity.Doctor;
import com.ai.scheduling.repository.AvailableSlotRepository;
import com.ai.scheduling.repository.ClinicRepository;
import com.ai.scheduling.repository.DoctorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Demo clinics, doctors and 30-minute slots for the next 7 days. Skips when clinics exist.
 */
@Configuration
@ConditionalOnProperty(name = "scheduling.seed.enabled", havingValue = "true")
public class DataSeeder {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);
    private static final int DAYS_AHEAD = 7;
    private static final int SLOT_MINUTES = 30;

    @Bean
    CommandLineRunner seedData(ClinicRepository clinicRepo, DoctorRepository doctorRepo, AvailableSlotRepository slotRepo) {
        return args -> {
            if (clinicRepo.count() > 0) {
                log.info("Clinics already seeded, skipping");
                return;
            }

            Clinic central = clinicRepo.save(Clinic.builder()
                    .id("C1")
                    .legalName("Clinica Central Ltda")
                    .address("Av. Paulista, 1000")
                    .city("Sao Paulo")
                    .state("SP")
                    .phone("1133334444")
                    .build());
            Clinic norte = clinicRepo.save(Clinic.builder()
                    .id("C2")
                    .legalName("Clinica Zona Norte")
                    .address("Rua Voluntarios da Patria, 200")
                    .city("Sao Paulo")
                    .state("SP")
                    .phone("1122225555")
                    .build());

            List<Doctor> doctors = doctorRepo.saveAll(List.of(
                    doctor("Dra. Ana Souza", "Cardiology", "350.00", central),
                    doctor("Dr. Bruno Lima", "Dermatology", "280.00", central),
                    doctor("Dra. Carla Mendes", "Pediatrics", "250.00", norte),
                    doctor("Dr. Diego Rocha", "Cardiology", "300.00", norte)
            ));

            List<AvailableSlot> slots = new ArrayList<>();
            LocalDate today = LocalDate.now();
            for (int d = 0; d < DAYS_AHEAD; d++) {
                LocalDate date = today.plusDays(d);
                if (date.getDayOfWeek() == DayOfWeek.SUNDAY) continue;
                for (Doctor doctor : doctors) {
                    for (LocalTime t = LocalTime.of(9, 0); t.isBefore(LocalTime.of(12, 0)); t = t.plusMinutes(SLOT_MINUTES)) {
                        slots.add(AvailableSlot.builder()
                                .doctor(doctor)
                                .clinic(doctor.getClinic())
                                .slotDate(date)
                                .startTime(t)
                                .status(AvailableSlot.Status.AVAILABLE)
                                .build());
                    }
                }
            }
            slotRepo.saveAll(slots);
            log.info("Seeded 2 clinics, {} doctors and {} slots for {} days", doctors.size(), slots.size(), DAYS_AHEAD);
        };
    }

    private static Doctor doctor(String name, String specialty, String price, Clinic clinic) {
        return Doctor.builder()
                .name(name)
                .specialty(specialty)
                .consultationPrice(new BigDecimal(price))
                .clinic(clinic)
                .build();
    }
}
