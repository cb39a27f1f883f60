package com.mqol.teamservice.api;

import com.mqol.teamservice.domain.PatientDetails;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of patient create and update. There is deliberately no team id field: the team always
 * comes from the URL and the caller's membership.
 */
public record PatientRequest(
        @NotBlank @Size(max = 100) String firstName,
        @NotBlank @Size(max = 100) String lastName,
        @Size(max = 32) String mobile,
        @Size(max = 32) String gender) {

    PatientDetails toDetails() {
        return new PatientDetails(firstName, lastName, mobile, gender);
    }
}
