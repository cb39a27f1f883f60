package com.mqol.teamservice.api;

import com.mqol.teamservice.domain.Team;
import java.time.Instant;
import java.util.Map;

public record TeamResponse(
        String id,
        String slug,
        String name,
        Map<String, Boolean> features,
        Instant createdAt,
        Instant updatedAt) {

    static TeamResponse from(Team team) {
        return new TeamResponse(team.id(), team.slug(), team.name(), team.features(),
                team.createdAt(), team.updatedAt());
    }
}
