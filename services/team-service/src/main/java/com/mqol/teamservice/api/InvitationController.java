package com.mqol.teamservice.api;

import com.mqol.access.AccessDecision;
import com.mqol.access.Action;
import com.mqol.access.Resource;
import com.mqol.teamservice.domain.Actor;
import com.mqol.teamservice.domain.service.InvitationService;
import com.mqol.teamservice.infrastructure.web.CurrentActor;
import com.mqol.teamservice.infrastructure.web.TeamAccessGuard;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Team invitations, plus acceptance by token. Acceptance is not team-scoped: the token alone
 * names the team, so it needs only an authenticated actor.
 */
@RestController
@RequestMapping("/api/v1")
public class InvitationController {

    private final TeamAccessGuard guard;
    private final InvitationService invitations;

    public InvitationController(TeamAccessGuard guard, InvitationService invitations) {
        this.guard = guard;
        this.invitations = invitations;
    }

    @PostMapping("/teams/{slug}/invitations")
    @ResponseStatus(HttpStatus.CREATED)
    public InvitationResponse create(
            @CurrentActor Actor actor, @PathVariable String slug,
            @Valid @RequestBody CreateInvitationRequest request) {
        AccessDecision decision = guard.require(actor, slug, Resource.TEAM_INVITATION, Action.CREATE);
        return InvitationResponse.from(
                invitations.create(decision, request.email(), Roles.parse(request.role())));
    }

    @GetMapping("/teams/{slug}/invitations")
    public List<InvitationResponse> list(@CurrentActor Actor actor, @PathVariable String slug) {
        AccessDecision decision = guard.require(actor, slug, Resource.TEAM_INVITATION, Action.READ);
        return invitations.list(decision).stream().map(InvitationResponse::from).toList();
    }

    @DeleteMapping("/teams/{slug}/invitations/{invitationId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(
            @CurrentActor Actor actor, @PathVariable String slug, @PathVariable String invitationId) {
        invitations.delete(guard.require(actor, slug, Resource.TEAM_INVITATION, Action.DELETE), invitationId);
    }

    @PostMapping("/invitations/{token}/accept")
    public AcceptedInvitationResponse accept(@CurrentActor Actor actor, @PathVariable String token) {
        return AcceptedInvitationResponse.from(invitations.accept(actor, token));
    }
}
