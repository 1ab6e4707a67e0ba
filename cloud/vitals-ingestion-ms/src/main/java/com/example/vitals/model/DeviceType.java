package com.example.vitals.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

public enum DeviceType {
    HEART_RATE("hr"),
    BLOOD_PRESSURE("bp"),
    OXYGEN_SATURATION("spo2"),
    TEMPERATURE("temp"),
    MULTI_SENSOR("multi");

    private final String code;

    DeviceType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<DeviceType> fromCode(String code) {
        return Arrays.stream(values())
            .filter(t -> t.code.equals(code))
            .findFirst();
    }

    public static String codes() {
        return Arrays.stream(values())
            .map(DeviceType::code)
            .collect(Collectors.joining(", "));
    }
}
