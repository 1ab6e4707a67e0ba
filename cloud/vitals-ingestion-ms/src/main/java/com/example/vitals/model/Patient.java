package com.example.vitals.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import java.time.LocalDate;

@Entity
@Table(name = "patients")
public class Patient extends PanacheEntityBase {

    @Id
    @Column(name = "id")
    public String id;

    @Column(name = "name", nullable = false)
    public String name;

    @Column(name = "dob")
    public LocalDate dateOfBirth;

    @Column(name = "assigned_doctor_id")
    public String assignedDoctorId;

    public static Patient placeholder(String id) {
        Patient patient = new Patient();
        patient.id = id;
        patient.name = "Patient " + id;
        return patient;
    }
}
