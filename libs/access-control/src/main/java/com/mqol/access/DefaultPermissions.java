package com.mqol.access;

import static com.mqol.access.Action.CREATE;
import static com.mqol.access.Action.LEAVE;
import static com.mqol.access.Action.READ;
import static com.mqol.access.Action.UPDATE;
import static com.mqol.access.Role.ADMIN;
import static com.mqol.access.Role.MEMBER;
import static com.mqol.access.Role.OWNER;

/**
 * The platform's standard role table.
 * <p>
 * OWNER is granted every action of every resource, ADMIN everything except deleting the team
 * and managing billing, MEMBER may read the team and work with patient records.
 */
public final class DefaultPermissions {

    private DefaultPermissions() {
        // utility class
    }

    public static PermissionMatrix matrix() {
        PermissionMatrix.Builder builder = PermissionMatrix.builder();
        for (Resource resource : Resource.values()) {
            builder.allowAll(OWNER, resource);
        }

        builder.only(ADMIN, Resource.TEAM, READ, UPDATE, LEAVE)
                .allowAll(ADMIN, Resource.TEAM_MEMBER)
                .allowAll(ADMIN, Resource.TEAM_INVITATION)
                .allowAll(ADMIN, Resource.TEAM_SSO)
                .allowAll(ADMIN, Resource.TEAM_DSYNC)
                .allowAll(ADMIN, Resource.TEAM_AUDIT_LOG)
                .allowAll(ADMIN, Resource.TEAM_WEBHOOK)
                .only(ADMIN, Resource.TEAM_PAYMENTS, READ)
                .allowAll(ADMIN, Resource.TEAM_API_KEY)
                .allowAll(ADMIN, Resource.TEAM_PATIENT)
                .allowAll(ADMIN, Resource.TEAM_PATIENT_BASELINE);

        builder.only(MEMBER, Resource.TEAM, READ, LEAVE)
                .only(MEMBER, Resource.TEAM_MEMBER, READ)
                .denyAll(MEMBER, Resource.TEAM_INVITATION)
                .denyAll(MEMBER, Resource.TEAM_SSO)
                .denyAll(MEMBER, Resource.TEAM_DSYNC)
                .denyAll(MEMBER, Resource.TEAM_AUDIT_LOG)
                .denyAll(MEMBER, Resource.TEAM_WEBHOOK)
                .denyAll(MEMBER, Resource.TEAM_PAYMENTS)
                .denyAll(MEMBER, Resource.TEAM_API_KEY)
                .only(MEMBER, Resource.TEAM_PATIENT, CREATE, READ, UPDATE)
                .only(MEMBER, Resource.TEAM_PATIENT_BASELINE, CREATE, READ, UPDATE);

        return builder.build();
    }
}
