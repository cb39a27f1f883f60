package com.mqol.teamservice.api;

import jakarta.validation.constraints.Size;
import java.util.Map;

/** Body of {@code PUT /api/v1/teams/{slug}}. Absent fields are left unchanged. */
public record UpdateTeamRequest(@Size(min = 1, max = 100) String name, Map<String, Boolean> features) {
}
