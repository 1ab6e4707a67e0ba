package com.example.vitals.web;

final class Headers {
    static final String API_KEY = "X-API-Key";
    static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    private Headers() {}
}
