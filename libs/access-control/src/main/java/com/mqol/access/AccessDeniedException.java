package com.mqol.access;

/**
 * Raised by callers that need a {@link TeamScope} from a denied decision. The decision
 * function itself never throws this; it returns the denial.
 */
public class AccessDeniedException extends RuntimeException {

    private final AccessDecision decision;

    public AccessDeniedException(AccessDecision decision) {
        super("Access denied (%s): actor '%s' %s %s in tenant '%s'".formatted(
                decision.reason().map(DenyReason::code).orElse("unknown"),
                decision.actorId(),
                decision.action().value(),
                decision.resource().key(),
                decision.tenant().id()));
        this.decision = decision;
    }

    public AccessDecision decision() {
        return decision;
    }

    public DenyReason reason() {
        return decision.reason().orElseThrow();
    }
}
