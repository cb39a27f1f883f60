package com.mqol.teamservice.domain.port;

import com.mqol.access.TeamScope;
import com.mqol.access.TenantDirectory;
import com.mqol.teamservice.domain.Team;
import com.mqol.teamservice.domain.TeamMembershipView;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Team storage. Also serves as the access layer's {@link TenantDirectory}.
 */
public interface TeamRepository extends TenantDirectory {

    /**
     * @throws com.mqol.teamservice.domain.ConflictException if the slug is taken
     */
    Team insert(Team team);

    Optional<Team> find(TeamScope scope);

    List<TeamMembershipView> findAllForUser(String userId);

    void update(TeamScope scope, String name, Map<String, Boolean> features);

    /** Deletes the team; memberships, invitations and patients cascade. */
    void delete(TeamScope scope);
}
