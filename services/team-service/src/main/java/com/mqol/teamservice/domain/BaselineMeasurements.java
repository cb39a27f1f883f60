package com.mqol.teamservice.domain;

import java.time.Instant;

/**
 * The caller-editable part of a patient baseline. Every measurement is optional; units are
 * centimetres, kilograms, beats per minute, degrees Celsius, percent and mg/dL.
 */
public record BaselineMeasurements(
        Instant dateRecorded,
        Double height,
        Double weight,
        BloodPressure bloodPressure,
        Integer heartRate,
        Double temperature,
        Integer oxygenSat,
        Double bloodSugar,
        String notes) {

    public BaselineMeasurements {
        if (dateRecorded == null) {
            throw new IllegalArgumentException("dateRecorded must not be null");
        }
        if (notes != null) {
            notes = notes.isBlank() ? null : notes.strip();
        }
    }
}
