package com.mqol.teamservice.api;

import com.mqol.access.AccessDecision;
import com.mqol.access.Action;
import com.mqol.access.Resource;
import com.mqol.teamservice.domain.Actor;
import com.mqol.teamservice.domain.service.PatientBaselineService;
import com.mqol.teamservice.infrastructure.web.CurrentActor;
import com.mqol.teamservice.infrastructure.web.TeamAccessGuard;
import jakarta.validation.Valid;
import java.time.Instant;
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
@RequestMapping("/api/v1/teams/{slug}/patients/{patientId}/baselines")
public class PatientBaselineController {

    private final TeamAccessGuard guard;
    private final PatientBaselineService baselines;

    public PatientBaselineController(TeamAccessGuard guard, PatientBaselineService baselines) {
        this.guard = guard;
        this.baselines = baselines;
    }

    @GetMapping
    public BaselinePageResponse list(
            @CurrentActor Actor actor, @PathVariable String slug, @PathVariable String patientId,
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        AccessDecision decision = guard.require(actor, slug, Resource.TEAM_PATIENT_BASELINE, Action.READ);
        return BaselinePageResponse.from(baselines.list(decision, patientId, from, to, limit, offset));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public BaselineResponse create(
            @CurrentActor Actor actor, @PathVariable String slug, @PathVariable String patientId,
            @Valid @RequestBody BaselineRequest request) {
        AccessDecision decision = guard.require(actor, slug, Resource.TEAM_PATIENT_BASELINE, Action.CREATE);
        return BaselineResponse.from(baselines.create(decision, patientId, request.toMeasurements()));
    }

    @GetMapping("/{baselineId}")
    public BaselineResponse get(
            @CurrentActor Actor actor, @PathVariable String slug, @PathVariable String patientId,
            @PathVariable String baselineId) {
        AccessDecision decision = guard.require(actor, slug, Resource.TEAM_PATIENT_BASELINE, Action.READ);
        return BaselineResponse.from(baselines.get(decision, patientId, baselineId));
    }

    @PutMapping("/{baselineId}")
    public BaselineResponse update(
            @CurrentActor Actor actor, @PathVariable String slug, @PathVariable String patientId,
            @PathVariable String baselineId, @Valid @RequestBody BaselineRequest request) {
        AccessDecision decision = guard.require(actor, slug, Resource.TEAM_PATIENT_BASELINE, Action.UPDATE);
        return BaselineResponse.from(baselines.update(decision, patientId, baselineId, request.toMeasurements()));
    }

    @DeleteMapping("/{baselineId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void archive(
            @CurrentActor Actor actor, @PathVariable String slug, @PathVariable String patientId,
            @PathVariable String baselineId, @Valid @RequestBody(required = false) DeletePatientRequest request) {
        AccessDecision decision = guard.require(actor, slug, Resource.TEAM_PATIENT_BASELINE, Action.DELETE);
        baselines.archive(decision, patientId, baselineId, request == null ? null : request.deletionReason());
    }
}
