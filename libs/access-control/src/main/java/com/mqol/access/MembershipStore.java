package com.mqol.access;

import java.util.Optional;

/**
 * Read access to memberships. Lookups must hit the current row, never a cached copy, so that
 * role changes and removals take effect on the next decision.
 */
public interface MembershipStore {

    Optional<Membership> find(String tenantId, String actorId);
}
