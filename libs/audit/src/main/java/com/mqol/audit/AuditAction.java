package com.mqol.audit;

import com.mqol.access.Resource;

import java.util.Optional;

/**
 * Every audited operation, with its CRUD letter and the resource it touches.
 * <p>
 * The {@code value} is the canonical name written to the audit trail (e.g. "patient.view").
 */
public enum AuditAction {

    // ---- Team ----
    TEAM_CREATE("team.create", 'c', Resource.TEAM),
    TEAM_UPDATE("team.update", 'u', Resource.TEAM),
    TEAM_DELETE("team.delete", 'd', Resource.TEAM),

    // ---- Members ----
    MEMBER_UPDATE("member.update", 'u', Resource.TEAM_MEMBER),
    MEMBER_REMOVE("member.remove", 'd', Resource.TEAM_MEMBER),
    MEMBER_LEAVE("member.leave", 'd', Resource.TEAM),

    // ---- Invitations ----
    INVITATION_CREATE("invitation.create", 'c', Resource.TEAM_INVITATION),
    INVITATION_DELETE("invitation.delete", 'd', Resource.TEAM_INVITATION),
    INVITATION_ACCEPT("invitation.accept", 'c', Resource.TEAM_MEMBER),

    // ---- Patients ----
    PATIENT_CREATE("patient.create", 'c', Resource.TEAM_PATIENT),
    PATIENT_VIEW("patient.view", 'r', Resource.TEAM_PATIENT),
    PATIENT_UPDATE("patient.update", 'u', Resource.TEAM_PATIENT),
    PATIENT_SOFT_DELETE("patient.soft_delete", 'd', Resource.TEAM_PATIENT),

    // ---- Patient baselines ----
    PATIENT_BASELINE_CREATE("patient_baseline.create", 'c', Resource.TEAM_PATIENT_BASELINE),
    PATIENT_BASELINE_VIEW("patient_baseline.view", 'r', Resource.TEAM_PATIENT_BASELINE),
    PATIENT_BASELINE_UPDATE("patient_baseline.update", 'u', Resource.TEAM_PATIENT_BASELINE),
    PATIENT_BASELINE_ARCHIVE("patient_baseline.archive", 'd', Resource.TEAM_PATIENT_BASELINE);

    private final String value;
    private final char crud;
    private final Resource resource;

    AuditAction(String value, char crud, Resource resource) {
        this.value = value;
        this.crud = crud;
        this.resource = resource;
    }

    public String value() {
        return value;
    }

    /** One of {@code c}, {@code r}, {@code u}, {@code d}. */
    public char crud() {
        return crud;
    }

    public Resource resource() {
        return resource;
    }

    public static Optional<AuditAction> fromString(String value) {
        for (AuditAction action : values()) {
            if (action.value.equals(value)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }

    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
