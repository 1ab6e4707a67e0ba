package com.example.vitals.errors;

public enum ErrorCode {
    MISSING_API_KEY("missing_api_key", 401),
    INVALID_API_KEY("invalid_api_key", 401),
    VALIDATION_ERROR("validation_error", 400),
    NOT_FOUND("not_found", 404),
    BAD_REQUEST("bad_request", 400);

    private final String code;
    private final int httpStatus;

    ErrorCode(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
