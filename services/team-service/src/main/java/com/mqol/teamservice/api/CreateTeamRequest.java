package com.mqol.teamservice.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** Body of {@code POST /api/v1/teams}. The slug is derived from the name when omitted. */
public record CreateTeamRequest(@NotBlank @Size(max = 100) String name, @Size(max = 100) String slug) {
}
