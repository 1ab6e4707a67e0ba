package com.example.vitals.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    public String code;
    public String message;
    public Object details;

    public static ErrorResponse of(String code, String message, Object details) {
        ErrorResponse out = new ErrorResponse();
        out.code = code;
        out.message = message;
        out.details = details;
        return out;
    }
}
