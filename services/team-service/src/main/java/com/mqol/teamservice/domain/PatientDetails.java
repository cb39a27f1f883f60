package com.mqol.teamservice.domain;

/**
 * The caller-editable fields of a patient. Carries no team id: the team always comes from the
 * scope.
 */
public record PatientDetails(String firstName, String lastName, String mobile, String gender) {

    public PatientDetails {
        if (firstName == null || firstName.isBlank()) {
            throw new IllegalArgumentException("firstName must not be blank");
        }
        if (lastName == null || lastName.isBlank()) {
            throw new IllegalArgumentException("lastName must not be blank");
        }
        firstName = firstName.strip();
        lastName = lastName.strip();
    }
}
