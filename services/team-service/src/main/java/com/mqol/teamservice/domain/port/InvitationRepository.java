package com.mqol.teamservice.domain.port;

import com.mqol.access.TeamScope;
import com.mqol.teamservice.domain.Invitation;

import java.util.List;
import java.util.Optional;

public interface InvitationRepository {

    Invitation insert(TeamScope scope, Invitation invitation);

    List<Invitation> findAll(TeamScope scope);

    int delete(TeamScope scope, String invitationId);

    /** Token lookup for acceptance; the token itself is the credential. */
    Optional<Invitation> findByToken(String token);

    int deleteByToken(String token);
}
