package com.mqol.teamservice.api;

import com.mqol.teamservice.domain.BaselineMeasurements;
import com.mqol.teamservice.domain.BloodPressure;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.time.Instant;

/**
 * Body of baseline create and update. Like {@link PatientRequest} it carries no team id, and no
 * patient id either: both come from the URL.
 */
public record BaselineRequest(
        @NotNull Instant dateRecorded,
        @Positive @DecimalMax("300") Double height,
        @Positive @DecimalMax("1000") Double weight,
        BloodPressureRequest bloodPressure,
        @Min(20) @Max(300) Integer heartRate,
        @DecimalMin("30") @DecimalMax("45") Double temperature,
        @Min(0) @Max(100) Integer oxygenSat,
        @Positive @DecimalMax("1000") Double bloodSugar,
        @Size(max = 2000) String notes) {

    /** Both readings are required once blood pressure is given; ranges are checked by {@link BloodPressure}. */
    public record BloodPressureRequest(Integer systolic, Integer diastolic) {
    }

    BaselineMeasurements toMeasurements() {
        return new BaselineMeasurements(dateRecorded, height, weight, toBloodPressure(bloodPressure), heartRate,
                temperature, oxygenSat, bloodSugar, notes);
    }

    private static BloodPressure toBloodPressure(BloodPressureRequest request) {
        if (request == null) {
            return null;
        }
        if (request.systolic() == null || request.diastolic() == null) {
            throw new IllegalArgumentException("bloodPressure needs both systolic and diastolic");
        }
        return new BloodPressure(request.systolic(), request.diastolic());
    }
}
