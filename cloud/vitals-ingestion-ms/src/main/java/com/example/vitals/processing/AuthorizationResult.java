package com.example.vitals.processing;

import com.example.vitals.errors.ErrorCode;

public enum AuthorizationResult {
    MASTER_KEY(null),
    DEVICE_KEY(null),
    MISSING(ErrorCode.MISSING_API_KEY),
    INVALID(ErrorCode.INVALID_API_KEY);

    private final ErrorCode failure;

    AuthorizationResult(ErrorCode failure) {
        this.failure = failure;
    }

    public boolean isAuthorized() {
        return failure == null;
    }

    public ErrorCode failure() {
        return failure;
    }
}
