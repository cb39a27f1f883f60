package com.mqol.teamservice.domain.port;

import com.mqol.access.MembershipStore;
import com.mqol.access.Role;
import com.mqol.access.TeamScope;
import com.mqol.teamservice.domain.Member;

import java.util.List;
import java.util.Optional;

/**
 * Membership storage. Also serves as the access layer's {@link MembershipStore}.
 */
public interface MembershipRepository extends MembershipStore {

    /**
     * Adds a membership to a team the caller is creating or joining by invitation. Every other
     * write goes through a {@link TeamScope}.
     *
     * @throws com.mqol.teamservice.domain.ConflictException if the user already belongs to the team
     */
    void insert(String teamId, String userId, Role role);

    List<Member> findAll(TeamScope scope);

    Optional<Member> find(TeamScope scope, String userId);

    /**
     * Locks the team's owner rows until the current transaction ends, so that concurrent
     * demotions or removals of different owners are serialized.
     *
     * @return the user ids of the current owners
     */
    List<String> lockOwners(TeamScope scope);

    /**
     * Single-row role change. Refuses to demote the team's last owner.
     *
     * @return rows affected
     */
    int updateRole(TeamScope scope, String userId, Role role);

    /**
     * Single-row removal. Refuses to remove the team's last owner.
     *
     * @return rows affected
     */
    int delete(TeamScope scope, String userId);
}
