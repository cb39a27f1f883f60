package com.mqol.teamservice.api;

import com.mqol.access.AccessDecision;
import com.mqol.access.Action;
import com.mqol.access.Resource;
import com.mqol.teamservice.domain.Actor;
import com.mqol.teamservice.domain.service.MemberService;
import com.mqol.teamservice.infrastructure.web.CurrentActor;
import com.mqol.teamservice.infrastructure.web.TeamAccessGuard;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/teams/{slug}/members")
public class MemberController {

    private final TeamAccessGuard guard;
    private final MemberService members;

    public MemberController(TeamAccessGuard guard, MemberService members) {
        this.guard = guard;
        this.members = members;
    }

    @GetMapping
    public List<MemberResponse> list(@CurrentActor Actor actor, @PathVariable String slug) {
        AccessDecision decision = guard.require(actor, slug, Resource.TEAM_MEMBER, Action.READ);
        return members.list(decision).stream().map(MemberResponse::from).toList();
    }

    @PatchMapping("/{userId}")
    public MemberResponse updateRole(
            @CurrentActor Actor actor, @PathVariable String slug, @PathVariable String userId,
            @Valid @RequestBody UpdateMemberRequest request) {
        AccessDecision decision = guard.require(actor, slug, Resource.TEAM_MEMBER, Action.UPDATE);
        return MemberResponse.from(members.updateRole(decision, userId, Roles.parse(request.role())));
    }

    // Literal path; takes precedence over /{userId}
    @DeleteMapping("/me")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void leave(@CurrentActor Actor actor, @PathVariable String slug) {
        members.leave(guard.require(actor, slug, Resource.TEAM, Action.LEAVE));
    }

    @DeleteMapping("/{userId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void remove(@CurrentActor Actor actor, @PathVariable String slug, @PathVariable String userId) {
        members.remove(guard.require(actor, slug, Resource.TEAM_MEMBER, Action.DELETE), userId);
    }
}
