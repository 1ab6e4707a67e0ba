package com.example.vitals.model;

public class DeviceRegistrationOut {
    public String deviceId;
    public String apiKey;
    public String status; // registered / already_registered
}
