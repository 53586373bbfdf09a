package com.ai.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "clinics")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Clinic {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "legal_name", nullable = false, length = 150)
    private String legalName;

    @Column(length = 200)
    private String address;

    @Column(length = 80)
    private String city;

    @Column(length = 2)
    private String state;

    @Column(length = 20)
    private String phone;
}
