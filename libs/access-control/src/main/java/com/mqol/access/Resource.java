package com.mqol.access;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static com.mqol.access.Action.CREATE;
import static com.mqol.access.Action.DELETE;
import static com.mqol.access.Action.LEAVE;
import static com.mqol.access.Action.READ;
import static com.mqol.access.Action.UPDATE;

/**
 * Categories of team-scoped data subject to access control.
 * <p>
 * The set is closed: adding a resource means adding a constant here, which in turn forces an
 * explicit entry for every role in the permission matrix (see {@link PermissionMatrix.Builder}).
 * Keys match the names the web client uses (e.g. {@code team_patient}).
 */
public enum Resource {

    TEAM("team", EnumSet.of(READ, UPDATE, DELETE, LEAVE)),
    TEAM_MEMBER("team_member", EnumSet.of(READ, UPDATE, DELETE)),
    TEAM_INVITATION("team_invitation", EnumSet.of(CREATE, READ, DELETE)),
    TEAM_SSO("team_sso", EnumSet.of(CREATE, READ, UPDATE, DELETE)),
    TEAM_DSYNC("team_dsync", EnumSet.of(CREATE, READ, UPDATE, DELETE)),
    TEAM_AUDIT_LOG("team_audit_log", EnumSet.of(READ)),
    TEAM_WEBHOOK("team_webhook", EnumSet.of(CREATE, READ, UPDATE, DELETE)),
    TEAM_PAYMENTS("team_payments", EnumSet.of(CREATE, READ, UPDATE)),
    TEAM_API_KEY("team_api_key", EnumSet.of(CREATE, READ, DELETE)),
    TEAM_PATIENT("team_patient", EnumSet.of(CREATE, READ, UPDATE, DELETE)),
    TEAM_PATIENT_BASELINE("team_patient_baseline", EnumSet.of(CREATE, READ, UPDATE, DELETE));

    private final String key;
    private final Set<Action> actions;

    Resource(String key, EnumSet<Action> actions) {
        this.key = key;
        this.actions = Collections.unmodifiableSet(actions);
    }

    public String key() {
        return key;
    }

    /** The actions that are meaningful for this resource. */
    public Set<Action> actions() {
        return actions;
    }

    public boolean supports(Action action) {
        return actions.contains(action);
    }
}
