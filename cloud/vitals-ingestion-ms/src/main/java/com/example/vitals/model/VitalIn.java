package com.example.vitals.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;

public class VitalIn {

    @NotNull
    @JsonDeserialize(using = IsoOffsetDateTimeDeserializer.class)
    public OffsetDateTime timestamp;

    @NotBlank
    @Size(max = Identifiers.MAX_LENGTH)
    public String deviceId;

    public Integer heartRate;

    @Valid
    public BloodPressure bp;

    public Integer spo2;

    public Double temp;

    @Size(max = Identifiers.MAX_LENGTH)
    public String idempotencyKey; // used only when no Idempotency-Key header is sent
}
