package com.mqol.teamservice.domain;

/**
 * Blood pressure in mmHg.
 */
public record BloodPressure(int systolic, int diastolic) {

    public BloodPressure {
        if (systolic < 50 || systolic > 300) {
            throw new IllegalArgumentException("systolic pressure must be between 50 and 300");
        }
        if (diastolic < 30 || diastolic > 200) {
            throw new IllegalArgumentException("diastolic pressure must be between 30 and 200");
        }
    }
}
