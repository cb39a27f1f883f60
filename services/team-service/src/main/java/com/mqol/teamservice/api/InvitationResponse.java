package com.mqol.teamservice.api;

import com.mqol.teamservice.domain.Invitation;
import java.time.Instant;

public record InvitationResponse(
        String id,
        String token,
        String email,
        String role,
        String invitedBy,
        Instant expiresAt,
        Instant createdAt) {

    static InvitationResponse from(Invitation invitation) {
        return new InvitationResponse(invitation.id(), invitation.token(), invitation.email(),
                invitation.role().value(), invitation.invitedBy(), invitation.expiresAt(),
                invitation.createdAt());
    }
}
