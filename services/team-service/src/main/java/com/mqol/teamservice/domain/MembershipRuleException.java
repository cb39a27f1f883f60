package com.mqol.teamservice.domain;

/**
 * Thrown when a membership change breaks an ownership rule: only an owner may grant or change the
 * owner role, and a team always keeps at least one owner.
 */
public class MembershipRuleException extends RuntimeException {

    public MembershipRuleException(String message) {
        super(message);
    }
}
