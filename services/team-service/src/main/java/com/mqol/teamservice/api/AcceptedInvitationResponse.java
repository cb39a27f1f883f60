package com.mqol.teamservice.api;

import com.mqol.access.AccessDecision;

/** The team joined by accepting an invitation and the role obtained there. */
public record AcceptedInvitationResponse(String teamId, String teamSlug, String role) {

    static AcceptedInvitationResponse from(AccessDecision decision) {
        var scope = decision.scope();
        return new AcceptedInvitationResponse(scope.tenantId(), scope.tenantSlug(), scope.role().value());
    }
}
