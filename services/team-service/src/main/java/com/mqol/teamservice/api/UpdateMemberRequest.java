package com.mqol.teamservice.api;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code PATCH /teams/{slug}/members/{userId}}: {@code owner}, {@code admin} or {@code member}. */
public record UpdateMemberRequest(@NotBlank String role) {
}
