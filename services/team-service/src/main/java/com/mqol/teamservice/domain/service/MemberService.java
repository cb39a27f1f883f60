package com.mqol.teamservice.domain.service;

import com.mqol.access.AccessDecision;
import com.mqol.access.Role;
import com.mqol.access.TeamScope;
import com.mqol.audit.AuditAction;
import com.mqol.teamservice.domain.Member;
import com.mqol.teamservice.domain.MembershipRuleException;
import com.mqol.teamservice.domain.RecordNotFoundException;
import com.mqol.teamservice.domain.port.MembershipRepository;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Membership rules on top of the permission matrix:
 *
 * <ul>
 *   <li>only an OWNER may grant OWNER or change an OWNER's membership
 *   <li>a team always keeps at least one OWNER
 * </ul>
 *
 * Violations raise {@link MembershipRuleException}. Every write locks the team's owner rows first,
 * so concurrent changes to different owners cannot leave a team without one.
 */
@Service
public class MemberService {

    private static final Logger log = LoggerFactory.getLogger(MemberService.class);

    static final String LAST_OWNER = "A team must keep at least one owner";

    private final MembershipRepository memberships;
    private final AuditTrail audit;

    public MemberService(MembershipRepository memberships, AuditTrail audit) {
        this.memberships = memberships;
        this.audit = audit;
    }

    public List<Member> list(AccessDecision decision) {
        return memberships.findAll(decision.scope());
    }

    @Transactional
    public Member updateRole(AccessDecision decision, String userId, Role role) {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        TeamScope scope = decision.scope();
        memberships.lockOwners(scope);
        Member target = existing(scope, userId);
        if (role == Role.OWNER || target.role() == Role.OWNER) {
            requireOwner(scope, "Only an owner can grant or change the owner role");
        }
        if (target.role() == role) {
            return target;
        }

        if (memberships.updateRole(scope, userId, role) == 0) {
            throw lastOwnerOrGone(scope, userId);
        }
        log.info("Member role changed: team={} user={} {} -> {} by={}",
                scope.tenantId(), userId, target.role().value(), role.value(), scope.actorId());
        audit.record(decision, AuditAction.MEMBER_UPDATE,
                Map.of("userId", userId, "fromRole", target.role().value(), "toRole", role.value()));
        return existing(scope, userId);
    }

    @Transactional
    public void remove(AccessDecision decision, String userId) {
        TeamScope scope = decision.scope();
        memberships.lockOwners(scope);
        Member target = existing(scope, userId);
        if (target.role() == Role.OWNER) {
            requireOwner(scope, "Only an owner can remove an owner");
        }
        if (memberships.delete(scope, userId) == 0) {
            throw lastOwnerOrGone(scope, userId);
        }
        log.info("Member removed: team={} user={} by={}", scope.tenantId(), userId, scope.actorId());
        audit.record(decision, AuditAction.MEMBER_REMOVE,
                Map.of("userId", userId, "role", target.role().value()));
    }

    /**
     * Removes the actor's own membership.
     */
    @Transactional
    public void leave(AccessDecision decision) {
        TeamScope scope = decision.scope();
        memberships.lockOwners(scope);
        if (memberships.delete(scope, scope.actorId()) == 0) {
            throw lastOwnerOrGone(scope, scope.actorId());
        }
        log.info("Member left: team={} user={}", scope.tenantId(), scope.actorId());
        audit.record(decision, AuditAction.MEMBER_LEAVE, Map.of("role", scope.role().value()));
    }

    private Member existing(TeamScope scope, String userId) {
        return memberships.find(scope, userId).orElseThrow(() -> new RecordNotFoundException("Member"));
    }

    private static void requireOwner(TeamScope scope, String message) {
        if (scope.role() != Role.OWNER) {
            throw new MembershipRuleException(message);
        }
    }

    // A guarded write touched no row: the last owner was protected, or the member vanished meanwhile.
    private RuntimeException lastOwnerOrGone(TeamScope scope, String userId) {
        return memberships.find(scope, userId).isPresent()
                ? new MembershipRuleException(LAST_OWNER)
                : new RecordNotFoundException("Member");
    }
}
