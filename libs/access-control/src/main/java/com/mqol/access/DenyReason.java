package com.mqol.access;

/** Why an {@link AccessDecision} denied. */
public enum DenyReason {
    NOT_A_MEMBER("not_a_member"),
    INSUFFICIENT_ROLE("insufficient_role");

    private final String code;

    DenyReason(String code) {
        this.code = code;
    }

    /** Stable code used in logs and metric tags. */
    public String code() {
        return code;
    }
}
