package com.mqol.teamservice.domain.service;

import com.mqol.access.AccessDecision;
import com.mqol.access.AccessDecisionService;
import com.mqol.access.Action;
import com.mqol.access.PermissionMatrix;
import com.mqol.access.Resource;
import com.mqol.access.Role;
import com.mqol.access.TeamScope;
import com.mqol.access.TenantIdentifier;
import com.mqol.audit.AuditAction;
import com.mqol.teamservice.config.TeamServiceProperties;
import com.mqol.teamservice.domain.Actor;
import com.mqol.teamservice.domain.FeatureDisabledException;
import com.mqol.teamservice.domain.RecordNotFoundException;
import com.mqol.teamservice.domain.Slugs;
import com.mqol.teamservice.domain.Team;
import com.mqol.teamservice.domain.TeamMembershipView;
import com.mqol.teamservice.domain.port.MembershipRepository;
import com.mqol.teamservice.domain.port.TeamRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Team lifecycle: creation (with the creator as OWNER), listing, settings and deletion.
 */
@Service
public class TeamService {

    private static final Logger log = LoggerFactory.getLogger(TeamService.class);

    /** Length of {@code team_features.feature}. */
    static final int MAX_FEATURE_LENGTH = 100;

    private final TeamRepository teams;
    private final MembershipRepository memberships;
    private final AccessDecisionService decisions;
    private final PermissionMatrix matrix;
    private final AuditTrail audit;
    private final TeamServiceProperties properties;
    private final Clock clock;

    public TeamService(
            TeamRepository teams,
            MembershipRepository memberships,
            AccessDecisionService decisions,
            PermissionMatrix matrix,
            AuditTrail audit,
            TeamServiceProperties properties,
            Clock clock) {
        this.teams = teams;
        this.memberships = memberships;
        this.decisions = decisions;
        this.matrix = matrix;
        this.audit = audit;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Creates a team and makes the actor its OWNER in one transaction.
     *
     * @param slug optional; derived from the name when null
     * @throws com.mqol.teamservice.domain.ConflictException if the slug is taken
     */
    @Transactional
    public Team create(Actor actor, String name, String slug) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        String resolvedSlug = slug == null || slug.isBlank() ? Slugs.fromName(name) : Slugs.requireValid(slug);
        Instant now = clock.instant();

        Team team = teams.insert(new Team(UUID.randomUUID().toString(), resolvedSlug, name.strip(),
                Map.of(), now, now));
        memberships.insert(team.id(), actor.id(), Role.OWNER);
        log.info("Team created: id={} slug={} owner={}", team.id(), team.slug(), actor.id());

        AccessDecision decision = decisions.decide(actor.id(), TenantIdentifier.byId(team.id()),
                Resource.TEAM, Action.UPDATE);
        audit.record(decision, AuditAction.TEAM_CREATE, Map.of("slug", team.slug(), "name", team.name()));
        return team;
    }

    public List<TeamMembershipView> listForActor(Actor actor) {
        return teams.findAllForUser(actor.id());
    }

    public Team get(AccessDecision decision) {
        return teams.find(decision.scope()).orElseThrow(() -> new RecordNotFoundException("Team"));
    }

    /**
     * Renames the team and/or sets feature flags. The slug and id never change.
     *
     * @throws IllegalArgumentException for a blank name, a blank or over-long feature name, or a
     *     feature without a value
     */
    @Transactional
    public Team update(AccessDecision decision, String name, Map<String, Boolean> features) {
        if (name != null && name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (features != null) {
            features.forEach(TeamService::requireValidFeature);
        }
        TeamScope scope = decision.scope();
        teams.update(scope, name == null ? null : name.strip(), features);

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (name != null) {
            metadata.put("name", name.strip());
        }
        if (features != null) {
            metadata.put("features", features);
        }
        audit.record(decision, AuditAction.TEAM_UPDATE, metadata);
        return get(decision);
    }

    /**
     * @throws FeatureDisabledException unless team deletion is enabled for the deployment
     */
    @Transactional
    public void delete(AccessDecision decision) {
        if (!properties.teamDeletionEnabled()) {
            throw new FeatureDisabledException("team-deletion");
        }
        TeamScope scope = decision.scope();
        teams.delete(scope);
        log.info("Team deleted: id={} by={}", scope.tenantId(), scope.actorId());
        audit.record(decision, AuditAction.TEAM_DELETE, Map.of("slug", scope.tenantSlug()));
    }

    /**
     * The actor's allowed actions per resource in this team.
     */
    public Map<Resource, Set<Action>> permissions(AccessDecision decision) {
        return matrix.permissionsFor(decision.scope().role());
    }

    private static void requireValidFeature(String feature, Boolean enabled) {
        if (feature == null || feature.isBlank() || feature.length() > MAX_FEATURE_LENGTH) {
            throw new IllegalArgumentException(
                    "feature names must be between 1 and " + MAX_FEATURE_LENGTH + " characters");
        }
        if (enabled == null) {
            throw new IllegalArgumentException("feature '%s' must be true or false".formatted(feature));
        }
    }
}
