package com.mqol.teamservice.domain.service;

import com.mqol.access.AccessDecision;
import com.mqol.access.AccessDecisionService;
import com.mqol.access.Action;
import com.mqol.access.Resource;
import com.mqol.access.Role;
import com.mqol.access.TeamScope;
import com.mqol.access.TenantIdentifier;
import com.mqol.audit.AuditAction;
import com.mqol.teamservice.config.TeamServiceProperties;
import com.mqol.teamservice.domain.Actor;
import com.mqol.teamservice.domain.ConflictException;
import com.mqol.teamservice.domain.Invitation;
import com.mqol.teamservice.domain.MembershipRuleException;
import com.mqol.teamservice.domain.RecordNotFoundException;
import com.mqol.teamservice.domain.port.InvitationRepository;
import com.mqol.teamservice.domain.port.MembershipRepository;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Invitations: a random token that lets its bearer join a team with a preset role until it
 * expires.
 */
@Service
public class InvitationService {

    private static final Logger log = LoggerFactory.getLogger(InvitationService.class);

    private static final int TOKEN_BYTES = 32;

    private final InvitationRepository invitations;
    private final MembershipRepository memberships;
    private final AccessDecisionService decisions;
    private final AuditTrail audit;
    private final TeamServiceProperties properties;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public InvitationService(
            InvitationRepository invitations,
            MembershipRepository memberships,
            AccessDecisionService decisions,
            AuditTrail audit,
            TeamServiceProperties properties,
            Clock clock) {
        this.invitations = invitations;
        this.memberships = memberships;
        this.decisions = decisions;
        this.audit = audit;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws MembershipRuleException if a non-owner invites someone as OWNER
     */
    public Invitation create(AccessDecision decision, String email, Role role) {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        TeamScope scope = decision.scope();
        if (role == Role.OWNER && scope.role() != Role.OWNER) {
            throw new MembershipRuleException("Only an owner can invite an owner");
        }
        Instant now = clock.instant();
        Invitation invitation = invitations.insert(scope, new Invitation(
                UUID.randomUUID().toString(), scope.tenantId(), newToken(), email, role,
                scope.actorId(), now.plus(properties.invitationTtl()), now));

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("invitationId", invitation.id());
        metadata.put("role", role.value());
        metadata.put("email", email);
        audit.record(decision, AuditAction.INVITATION_CREATE, metadata);
        return invitation;
    }

    public List<Invitation> list(AccessDecision decision) {
        return invitations.findAll(decision.scope());
    }

    public void delete(AccessDecision decision, String invitationId) {
        if (invitations.delete(decision.scope(), invitationId) == 0) {
            throw new RecordNotFoundException("Invitation");
        }
        audit.record(decision, AuditAction.INVITATION_DELETE, Map.of("invitationId", invitationId));
    }

    /**
     * Joins the invitation's team with its role and consumes the invitation.
     *
     * @return the allow decision for the new membership
     * @throws RecordNotFoundException if the token is unknown or expired
     * @throws ConflictException if the actor already belongs to the team
     */
    @Transactional
    public AccessDecision accept(Actor actor, String token) {
        Invitation invitation = invitations.findByToken(token)
                .filter(i -> !i.isExpired(clock.instant()))
                .orElseThrow(() -> new RecordNotFoundException("Invitation"));
        if (memberships.find(invitation.teamId(), actor.id()).isPresent()) {
            throw new ConflictException("User is already a member of this team");
        }

        memberships.insert(invitation.teamId(), actor.id(), invitation.role());
        invitations.deleteByToken(token);
        log.info("Invitation accepted: team={} user={} role={}",
                invitation.teamId(), actor.id(), invitation.role().value());

        AccessDecision decision = decisions.decide(actor.id(), TenantIdentifier.byId(invitation.teamId()),
                Resource.TEAM, Action.READ);
        audit.record(decision, AuditAction.INVITATION_ACCEPT,
                Map.of("invitationId", invitation.id(), "role", invitation.role().value()));
        return decision;
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
