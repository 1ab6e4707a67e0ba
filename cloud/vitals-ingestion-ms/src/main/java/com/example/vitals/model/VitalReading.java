package com.example.vitals.model;

import java.time.Instant;

public class VitalReading {
    public Instant timestamp;
    public Integer heartRate;
    public BloodPressure bp;
    public Integer spo2;
    public Double temp;
    public String deviceId;

    public static VitalReading from(Vital v) {
        VitalReading out = new VitalReading();
        out.timestamp = v.recordedAt;
        out.heartRate = v.heartRate;
        out.bp = BloodPressure.of(v.bpSystolic, v.bpDiastolic);
        out.spo2 = v.spo2;
        out.temp = v.temperature;
        out.deviceId = v.deviceId;
        return out;
    }
}
