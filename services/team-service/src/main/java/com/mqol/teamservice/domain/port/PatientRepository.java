package com.mqol.teamservice.domain.port;

import com.mqol.access.TeamScope;
import com.mqol.teamservice.domain.Patient;
import com.mqol.teamservice.domain.PatientDetails;
import com.mqol.teamservice.domain.PatientPage;

import java.time.Instant;
import java.util.Optional;

/**
 * Patient storage. Every method filters on the scope's team and ignores soft-deleted rows.
 */
public interface PatientRepository {

    Patient insert(TeamScope scope, String id, PatientDetails details, Instant now);

    Optional<Patient> find(TeamScope scope, String patientId);

    /**
     * Case-insensitive match on first name, last name or mobile; newest first.
     */
    PatientPage search(TeamScope scope, String search, int limit, int offset);

    int update(TeamScope scope, String patientId, PatientDetails details, Instant now);

    int softDelete(TeamScope scope, String patientId, String reason, Instant now, Instant retentionUntil);
}
