package com.example.vitals.model;

public final class Identifiers {

    // device ids, patient ids and idempotency tokens
    public static final int MAX_LENGTH = 255;

    private Identifiers() {}
}
