package com.mqol.teamservice.infrastructure.web;

import com.mqol.access.AccessDecision;
import com.mqol.access.AccessDecisionService;
import com.mqol.access.Action;
import com.mqol.access.Resource;
import com.mqol.access.TenantIdentifier;
import com.mqol.observability.CorrelationContextHolder;
import com.mqol.observability.MetricFactory;
import com.mqol.observability.SpanHelper;
import com.mqol.teamservice.domain.Actor;
import io.micrometer.core.instrument.Timer;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * The single entry point team-scoped handlers use before touching any data.
 *
 * <p>Resolves the team by slug, decides, and either returns the allow decision (whose
 * {@link AccessDecision#scope()} the domain services need) or throws
 * {@link com.mqol.access.AccessDeniedException}. Unknown teams surface as
 * {@link com.mqol.access.TenantNotFoundException}. Each decision runs in an {@value #SPAN_NAME}
 * span and is timed by the {@value #TIMER_NAME} timer.
 */
@Component
public class TeamAccessGuard {

    static final String SPAN_NAME = "access.decide";
    static final String TIMER_NAME = "access.decide.duration";

    private final AccessDecisionService decisions;
    private final SpanHelper spans;
    private final MetricFactory metrics;

    public TeamAccessGuard(AccessDecisionService decisions, SpanHelper spans, MetricFactory metrics) {
        this.decisions = decisions;
        this.spans = spans;
        this.metrics = metrics;
    }

    public AccessDecision require(Actor actor, String teamSlug, Resource resource, Action action) {
        Map<String, String> attributes = Map.of(
                "access.resource", resource.key(),
                "access.action", action.value(),
                "team.slug", teamSlug);
        Timer timer = metrics.timer(TIMER_NAME, "Time to resolve the team and decide access",
                "resource", resource.key(), "action", action.value());
        AccessDecision decision = timer.record(() -> spans.inSpan(SPAN_NAME, attributes,
                () -> decisions.decide(actor.id(), TenantIdentifier.bySlug(teamSlug), resource, action)));
        CorrelationContextHolder.update(ctx -> ctx.withTenant(decision.tenant().id()));
        decision.requireAllowed();
        return decision;
    }
}
