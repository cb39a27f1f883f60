package com.mqol.teamservice.api;

import com.mqol.access.AccessDecision;
import com.mqol.access.Action;
import com.mqol.access.Resource;
import com.mqol.teamservice.domain.Actor;
import com.mqol.teamservice.domain.service.TeamService;
import com.mqol.teamservice.infrastructure.web.CurrentActor;
import com.mqol.teamservice.infrastructure.web.TeamAccessGuard;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Team endpoints. Every handler addressing an existing team goes through
 * {@link TeamAccessGuard} before calling the service.
 */
@RestController
@RequestMapping("/api/v1/teams")
public class TeamController {

    private final TeamAccessGuard guard;
    private final TeamService teams;

    public TeamController(TeamAccessGuard guard, TeamService teams) {
        this.guard = guard;
        this.teams = teams;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TeamResponse create(@CurrentActor Actor actor, @Valid @RequestBody CreateTeamRequest request) {
        return TeamResponse.from(teams.create(actor, request.name(), request.slug()));
    }

    @GetMapping
    public List<TeamSummaryResponse> list(@CurrentActor Actor actor) {
        return teams.listForActor(actor).stream().map(TeamSummaryResponse::from).toList();
    }

    @GetMapping("/{slug}")
    public TeamResponse get(@CurrentActor Actor actor, @PathVariable String slug) {
        AccessDecision decision = guard.require(actor, slug, Resource.TEAM, Action.READ);
        return TeamResponse.from(teams.get(decision));
    }

    @PutMapping("/{slug}")
    public TeamResponse update(
            @CurrentActor Actor actor, @PathVariable String slug,
            @Valid @RequestBody UpdateTeamRequest request) {
        AccessDecision decision = guard.require(actor, slug, Resource.TEAM, Action.UPDATE);
        return TeamResponse.from(teams.update(decision, request.name(), request.features()));
    }

    @DeleteMapping("/{slug}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@CurrentActor Actor actor, @PathVariable String slug) {
        teams.delete(guard.require(actor, slug, Resource.TEAM, Action.DELETE));
    }

    @GetMapping("/{slug}/permissions")
    public PermissionsResponse permissions(@CurrentActor Actor actor, @PathVariable String slug) {
        AccessDecision decision = guard.require(actor, slug, Resource.TEAM, Action.READ);
        return PermissionsResponse.from(decision.scope().role(), teams.permissions(decision));
    }
}
