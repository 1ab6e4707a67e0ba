package com.example.vitals.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(
    name = "idempotency_records",
    indexes = @Index(name = "ix_idempotency_device_id", columnList = "device_id")
)
public class IdempotencyRecord extends PanacheEntity {

    @Column(name = "device_id", nullable = false)
    public String deviceId;

    // device id and client token joined with ':'
    @Column(name = "idem_key", nullable = false, unique = true, length = 2 * Identifiers.MAX_LENGTH + 1)
    public String idemKey;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public static String compositeKey(String deviceId, String token) {
        return deviceId + ":" + token;
    }
}
