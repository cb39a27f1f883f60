package com.mqol.teamservice.config;

import com.mqol.access.AccessDecisionService;
import com.mqol.access.DefaultPermissions;
import com.mqol.access.MembershipResolver;
import com.mqol.access.PermissionMatrix;
import com.mqol.observability.MetricFactory;
import com.mqol.teamservice.domain.port.MembershipRepository;
import com.mqol.teamservice.domain.port.TeamRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the permission matrix and the decision service once at start-up.
 *
 * <p>An incomplete matrix throws {@link com.mqol.access.ConfigurationGapException} here, which
 * aborts context start-up.
 */
@Configuration
public class AccessControlConfig {

    @Bean
    public PermissionMatrix permissionMatrix() {
        return DefaultPermissions.matrix();
    }

    @Bean
    public MembershipResolver membershipResolver(TeamRepository teams, MembershipRepository memberships) {
        return new MembershipResolver(teams, memberships);
    }

    @Bean
    public AccessDecisionService accessDecisionService(
            PermissionMatrix matrix, MembershipResolver resolver, MetricFactory metrics) {
        return new AccessDecisionService(matrix, resolver, metrics);
    }
}
