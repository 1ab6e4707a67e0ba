package com.example.vitals.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public class BloodPressure {

    @NotNull
    @Min(0)
    @Max(300)
    public Integer systolic;

    @NotNull
    @Min(0)
    @Max(200)
    public Integer diastolic;

    public static BloodPressure of(Integer systolic, Integer diastolic) {
        if (systolic == null || diastolic == null) return null;
        BloodPressure bp = new BloodPressure();
        bp.systolic = systolic;
        bp.diastolic = diastolic;
        return bp;
    }
}
