package com.mqol.teamservice.api;

import com.mqol.teamservice.domain.Patient;
import java.time.Instant;

public record PatientResponse(
        String id,
        String teamId,
        String firstName,
        String lastName,
        String mobile,
        String gender,
        String createdBy,
        String updatedBy,
        Instant createdAt,
        Instant updatedAt) {

    static PatientResponse from(Patient p) {
        return new PatientResponse(p.id(), p.teamId(), p.firstName(), p.lastName(), p.mobile(),
                p.gender(), p.createdBy(), p.updatedBy(), p.createdAt(), p.updatedAt());
    }
}
