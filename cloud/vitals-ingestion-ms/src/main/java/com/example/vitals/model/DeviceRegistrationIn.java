package com.example.vitals.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class DeviceRegistrationIn {

    @NotBlank
    @Size(max = Identifiers.MAX_LENGTH)
    public String deviceId;

    @NotBlank
    @DeviceTypeCode
    public String type;

    @NotBlank
    @Size(max = Identifiers.MAX_LENGTH)
    public String patientId;
}
