package com.example.vitals.processing;

public final class Registration {

    private final String deviceId;
    private final String apiKey;
    private final boolean alreadyExisted;

    Registration(String deviceId, String apiKey, boolean alreadyExisted) {
        this.deviceId = deviceId;
        this.apiKey = apiKey;
        this.alreadyExisted = alreadyExisted;
    }

    public String deviceId() {
        return deviceId;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean alreadyExisted() {
        return alreadyExisted;
    }

    public String status() {
        return alreadyExisted ? "already_registered" : "registered";
    }
}
