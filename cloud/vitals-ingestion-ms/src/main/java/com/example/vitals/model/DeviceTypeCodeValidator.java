package com.example.vitals.model;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class DeviceTypeCodeValidator implements ConstraintValidator<DeviceTypeCode, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || value.isBlank() || DeviceType.fromCode(value).isPresent();
    }
}
