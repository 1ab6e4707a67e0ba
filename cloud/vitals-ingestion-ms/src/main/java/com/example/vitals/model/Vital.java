package com.example.vitals.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import java.time.Instant;

/**
 * A single point-in-time observation. Rows are only ever inserted by the
 * ingestion pipeline and are never updated afterwards.
 */
@Entity
@Table(
    name = "vitals",
    indexes = {
        @Index(name = "ix_vitals_patient_id", columnList = "patient_id"),
        @Index(name = "ix_vitals_recorded_at", columnList = "recorded_at"),
    }
)
public class Vital extends PanacheEntityBase {

    @Id
    @Column(name = "id")
    public String id;

    @Column(name = "patient_id", nullable = false)
    public String patientId;

    @Column(name = "recorded_at", nullable = false)
    public Instant recordedAt;

    @Column(name = "heart_rate")
    public Integer heartRate;

    @Column(name = "bp_systolic")
    public Integer bpSystolic;

    @Column(name = "bp_diastolic")
    public Integer bpDiastolic;

    @Column(name = "spo2")
    public Integer spo2;

    @Column(name = "temperature")
    public Double temperature;

    @Column(name = "device_id", nullable = false)
    public String deviceId;
}
