package com.example.vitals.model;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.*;

/** The value must be one of the {@link DeviceType} codes; {@code null} passes. */
@Documented
@Constraint(validatedBy = DeviceTypeCodeValidator.class)
@Target({ ElementType.FIELD, ElementType.PARAMETER })
@Retention(RetentionPolicy.RUNTIME)
public @interface DeviceTypeCode {
    String message() default "Must be one of: hr, bp, spo2, temp, multi.";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
