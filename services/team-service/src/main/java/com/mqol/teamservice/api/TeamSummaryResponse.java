package com.mqol.teamservice.api;

import com.mqol.teamservice.domain.TeamMembershipView;

/** One entry of the caller's team list, with the caller's role in that team. */
public record TeamSummaryResponse(String id, String slug, String name, String role) {

    static TeamSummaryResponse from(TeamMembershipView view) {
        return new TeamSummaryResponse(view.team().id(), view.team().slug(), view.team().name(),
                view.role().value());
    }
}
