package com.mqol.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MembershipResolver")
class MembershipResolverTest {

    private static final Tenant ACME = new Tenant("t-acme", "acme", "Acme", Map.of());

    private TenantDirectory tenants;
    private MembershipStore memberships;
    private MembershipResolver resolver;

    @BeforeEach
    void setUp() {
        tenants = mock(TenantDirectory.class);
        memberships = mock(MembershipStore.class);
        when(tenants.find(any())).thenCallRealMethod();
        resolver = new MembershipResolver(tenants, memberships);
    }

    @Nested
    @DisplayName("resolve()")
    class Resolve {

        @Test
        @DisplayName("returns the membership when one exists")
        void member() {
            when(tenants.findBySlug("acme")).thenReturn(Optional.of(ACME));
            when(memberships.find("t-acme", "u-1"))
                    .thenReturn(Optional.of(new Membership("u-1", "t-acme", Role.ADMIN)));

            MembershipResolution resolution = resolver.resolve("u-1", TenantIdentifier.bySlug("acme"));

            assertThat(resolution.isMember()).isTrue();
            assertThat(resolution.role()).contains(Role.ADMIN);
            assertThat(resolution.tenant()).isEqualTo(ACME);
        }

        @Test
        @DisplayName("returns not-a-member instead of throwing")
        void notAMember() {
            when(tenants.findById("t-acme")).thenReturn(Optional.of(ACME));
            when(memberships.find("t-acme", "u-2")).thenReturn(Optional.empty());

            MembershipResolution resolution = resolver.resolve("u-2", TenantIdentifier.byId("t-acme"));

            assertThat(resolution.isMember()).isFalse();
            assertThat(resolution.membership()).isEmpty();
            assertThat(resolution.tenant().id()).isEqualTo("t-acme");
        }

        @Test
        @DisplayName("throws TenantNotFoundException for an unknown slug without touching memberships")
        void unknownTenant() {
            when(tenants.findBySlug("ghost-team")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> resolver.resolve("u-1", TenantIdentifier.bySlug("ghost-team")))
                    .isInstanceOf(TenantNotFoundException.class)
                    .hasMessageContaining("ghost-team");
            verify(memberships, never()).find(anyString(), anyString());
        }

        @Test
        @DisplayName("rejects a blank actor id")
        void blankActor() {
            assertThatThrownBy(() -> resolver.resolve(" ", TenantIdentifier.bySlug("acme")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("TenantIdentifier")
    class Identifier {

        @Test
        @DisplayName("rejects blank values")
        void rejectsBlank() {
            assertThatThrownBy(() -> TenantIdentifier.bySlug(""))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> TenantIdentifier.byId(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
