package com.mqol.teamservice.api;

import com.mqol.access.AccessDecision;
import com.mqol.access.Action;
import com.mqol.access.Resource;
import com.mqol.teamservice.domain.Actor;
import com.mqol.teamservice.domain.service.PatientService;
import com.mqol.teamservice.infrastructure.web.CurrentActor;
import com.mqol.teamservice.infrastructure.web.TeamAccessGuard;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/teams/{slug}/patients")
public class PatientController {

    private final TeamAccessGuard guard;
    private final PatientService patients;

    public PatientController(TeamAccessGuard guard, PatientService patients) {
        this.guard = guard;
        this.patients = patients;
    }

    @GetMapping
    public PatientPageResponse list(
            @CurrentActor Actor actor, @PathVariable String slug,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        AccessDecision decision = guard.require(actor, slug, Resource.TEAM_PATIENT, Action.READ);
        return PatientPageResponse.from(patients.list(decision, search, limit, offset));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public PatientResponse create(
            @CurrentActor Actor actor, @PathVariable String slug,
            @Valid @RequestBody PatientRequest request) {
        AccessDecision decision = guard.require(actor, slug, Resource.TEAM_PATIENT, Action.CREATE);
        return PatientResponse.from(patients.create(decision, request.toDetails()));
    }

    @GetMapping("/{patientId}")
    public PatientResponse get(
            @CurrentActor Actor actor, @PathVariable String slug, @PathVariable String patientId) {
        AccessDecision decision = guard.require(actor, slug, Resource.TEAM_PATIENT, Action.READ);
        return PatientResponse.from(patients.get(decision, patientId));
    }

    @PutMapping("/{patientId}")
    public PatientResponse update(
            @CurrentActor Actor actor, @PathVariable String slug, @PathVariable String patientId,
            @Valid @RequestBody PatientRequest request) {
        AccessDecision decision = guard.require(actor, slug, Resource.TEAM_PATIENT, Action.UPDATE);
        return PatientResponse.from(patients.update(decision, patientId, request.toDetails()));
    }

    @DeleteMapping("/{patientId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void softDelete(
            @CurrentActor Actor actor, @PathVariable String slug, @PathVariable String patientId,
            @Valid @RequestBody(required = false) DeletePatientRequest request) {
        AccessDecision decision = guard.require(actor, slug, Resource.TEAM_PATIENT, Action.DELETE);
        patients.softDelete(decision, patientId, request == null ? null : request.deletionReason());
    }
}
