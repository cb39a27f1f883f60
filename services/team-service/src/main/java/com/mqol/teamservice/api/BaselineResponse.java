package com.mqol.teamservice.api;

import com.mqol.teamservice.domain.BaselineMeasurements;
import com.mqol.teamservice.domain.BloodPressure;
import com.mqol.teamservice.domain.PatientBaseline;
import java.time.Instant;

public record BaselineResponse(
        String id,
        String teamId,
        String patientId,
        Instant dateRecorded,
        Double height,
        Double weight,
        BloodPressure bloodPressure,
        Integer heartRate,
        Double temperature,
        Integer oxygenSat,
        Double bloodSugar,
        String notes,
        String createdBy,
        String updatedBy,
        Instant createdAt,
        Instant updatedAt) {

    static BaselineResponse from(PatientBaseline b) {
        BaselineMeasurements m = b.measurements();
        return new BaselineResponse(b.id(), b.teamId(), b.patientId(), m.dateRecorded(), m.height(), m.weight(),
                m.bloodPressure(), m.heartRate(), m.temperature(), m.oxygenSat(), m.bloodSugar(), m.notes(),
                b.createdBy(), b.updatedBy(), b.createdAt(), b.updatedAt());
    }
}
