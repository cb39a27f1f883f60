package com.mqol.teamservice.domain;

import com.mqol.access.Role;

import java.time.Instant;

/**
 * A pending invitation. The token is the credential: whoever presents it before
 * {@code expiresAt} joins the team with {@code role}.
 */
public record Invitation(
        String id,
        String teamId,
        String token,
        String email,
        Role role,
        String invitedBy,
        Instant expiresAt,
        Instant createdAt) {

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
