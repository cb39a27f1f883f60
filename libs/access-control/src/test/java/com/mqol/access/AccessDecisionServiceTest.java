package com.mqol.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mqol.access.testing.InMemoryTeams;
import com.mqol.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AccessDecisionService")
class AccessDecisionServiceTest {

    private static final TenantIdentifier ACME = TenantIdentifier.bySlug("acme");
    private static final TenantIdentifier BETA = TenantIdentifier.bySlug("beta");

    private InMemoryTeams teams;
    private SimpleMeterRegistry registry;
    private AccessDecisionService service;

    @BeforeEach
    void setUp() {
        teams = new InMemoryTeams();
        teams.addTeam("t-acme", "acme");
        teams.addTeam("t-beta", "beta");
        teams.addMember("t-acme", "U", Role.OWNER);
        teams.addMember("t-beta", "U", Role.MEMBER);
        teams.addMember("t-acme", "W", Role.MEMBER);

        registry = new SimpleMeterRegistry();
        service = new AccessDecisionService(
                DefaultPermissions.matrix(),
                new MembershipResolver(teams, teams),
                new MetricFactory(registry, "team-service"));
    }

    @Nested
    @DisplayName("decisions")
    class Decisions {

        @Test
        @DisplayName("owner may update team settings")
        void ownerUpdatesSettings() {
            AccessDecision decision = service.decide("U", ACME, Resource.TEAM, Action.UPDATE);

            assertThat(decision.isAllowed()).isTrue();
            assertThat(decision.tenant().id()).isEqualTo("t-acme");
            assertThat(decision.role()).contains(Role.OWNER);
            assertThat(decision.scope().tenantId()).isEqualTo("t-acme");
            assertThat(decision.scope().actorId()).isEqualTo("U");
        }

        @Test
        @DisplayName("a non-member is denied with NOT_A_MEMBER")
        void nonMember() {
            AccessDecision decision = service.decide("V", ACME, Resource.TEAM_MEMBER, Action.READ);

            assertThat(decision.isAllowed()).isFalse();
            assertThat(decision.reason()).contains(DenyReason.NOT_A_MEMBER);
            assertThat(decision.role()).isEmpty();
        }

        @Test
        @DisplayName("a member cannot update billing")
        void memberBilling() {
            AccessDecision decision = service.decide("W", ACME, Resource.TEAM_PAYMENTS, Action.UPDATE);

            assertThat(decision.reason()).contains(DenyReason.INSUFFICIENT_ROLE);
            assertThat(decision.role()).contains(Role.MEMBER);
        }

        @Test
        @DisplayName("an unknown slug throws TenantNotFoundException")
        void unknownTenant() {
            assertThatThrownBy(() -> service.decide("U", TenantIdentifier.bySlug("ghost-team"),
                    Resource.TEAM_MEMBER, Action.READ))
                    .isInstanceOf(TenantNotFoundException.class);
        }

        @Test
        @DisplayName("roles are per tenant, not per actor")
        void rolePerTenant() {
            AccessDecision decision = service.decide("U", BETA, Resource.TEAM, Action.UPDATE);

            assertThat(decision.reason()).contains(DenyReason.INSUFFICIENT_ROLE);
            assertThat(decision.role()).contains(Role.MEMBER);
        }

        @Test
        @DisplayName("removal takes effect on the next decision")
        void removal() {
            assertThat(service.decide("W", ACME, Resource.TEAM, Action.READ).isAllowed()).isTrue();

            teams.removeMember("t-acme", "W");

            for (Resource resource : Resource.values()) {
                for (Action action : resource.actions()) {
                    assertThat(service.decide("W", ACME, resource, action).reason())
                            .contains(DenyReason.NOT_A_MEMBER);
                }
            }
        }

        @Test
        @DisplayName("a downgrade takes effect on the next decision")
        void downgrade() {
            teams.addMember("t-acme", "A", Role.ADMIN);
            assertThat(service.decide("A", ACME, Resource.TEAM_MEMBER, Action.DELETE).isAllowed()).isTrue();

            teams.changeRole("t-acme", "A", Role.MEMBER);

            assertThat(service.decide("A", ACME, Resource.TEAM_MEMBER, Action.DELETE).reason())
                    .contains(DenyReason.INSUFFICIENT_ROLE);
        }

        @Test
        @DisplayName("repeated calls give the same answer")
        void idempotent() {
            AccessDecision first = service.decide("W", ACME, Resource.TEAM_PATIENT, Action.DELETE);
            AccessDecision second = service.decide("W", ACME, Resource.TEAM_PATIENT, Action.DELETE);

            assertThat(second.isAllowed()).isEqualTo(first.isAllowed());
            assertThat(second.reason()).isEqualTo(first.reason());
        }

        @Test
        @DisplayName("id and slug identify the same tenant")
        void idAndSlug() {
            AccessDecision bySlug = service.decide("U", ACME, Resource.TEAM, Action.READ);
            AccessDecision byId = service.decide("U", TenantIdentifier.byId("t-acme"), Resource.TEAM, Action.READ);

            assertThat(byId.scope()).isEqualTo(bySlug.scope());
        }
    }

    @Nested
    @DisplayName("denied decisions")
    class Denied {

        @Test
        @DisplayName("have no team scope")
        void noScope() {
            AccessDecision decision = service.decide("V", ACME, Resource.TEAM, Action.READ);

            assertThatThrownBy(decision::scope).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("requireAllowed() raises AccessDeniedException carrying the reason")
        void requireAllowed() {
            AccessDecision decision = service.decide("W", ACME, Resource.TEAM, Action.DELETE);

            assertThatThrownBy(decision::requireAllowed)
                    .isInstanceOfSatisfying(AccessDeniedException.class, e -> {
                        assertThat(e.reason()).isEqualTo(DenyReason.INSUFFICIENT_ROLE);
                        assertThat(e.decision()).isSameAs(decision);
                    })
                    .hasMessageContaining("insufficient_role");
        }
    }

    @Nested
    @DisplayName("metrics")
    class Metrics {

        @Test
        @DisplayName("counts decisions by outcome and reason")
        void countsDecisions() {
            service.decide("U", ACME, Resource.TEAM, Action.READ);
            service.decide("V", ACME, Resource.TEAM, Action.READ);
            service.decide("V", ACME, Resource.TEAM, Action.READ);

            assertThat(registry.get(AccessDecisionService.METRIC_DECISIONS)
                    .tag("outcome", "allow").counter().count()).isEqualTo(1.0);
            assertThat(registry.get(AccessDecisionService.METRIC_DECISIONS)
                    .tag("outcome", "deny").tag("reason", "not_a_member")
                    .counter().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("tags every decision with the service name")
        void serviceTag() {
            service.decide("U", ACME, Resource.TEAM, Action.READ);

            assertThat(registry.get(AccessDecisionService.METRIC_DECISIONS)
                    .tag(MetricFactory.TAG_SERVICE, "team-service").counter().count()).isEqualTo(1.0);
        }
    }
}
