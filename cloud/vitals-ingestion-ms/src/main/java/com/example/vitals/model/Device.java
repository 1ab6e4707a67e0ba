package com.example.vitals.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "devices")
public class Device extends PanacheEntityBase {

    public static final String STATUS_ACTIVE = "active";

    @Id
    @Column(name = "id")
    public String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "device_type", nullable = false)
    public DeviceType type;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "patient_id", nullable = false)
    public Patient patient;

    @Column(name = "registered_at", nullable = false)
    public Instant registeredAt;

    @Column(name = "status", nullable = false)
    public String status = STATUS_ACTIVE;

    @Column(name = "api_key", nullable = false, unique = true)
    public String apiKey;
}
