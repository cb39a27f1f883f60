package com.mqol.teamservice.domain.service;

import com.mqol.access.AccessDecision;
import com.mqol.audit.AuditAction;
import com.mqol.audit.AuditEventFactory;
import com.mqol.audit.AuditPublisher;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Records audited operations. Publication is asynchronous and never fails the caller.
 */
@Component
public class AuditTrail {

    private final AuditEventFactory events;
    private final AuditPublisher publisher;

    public AuditTrail(AuditEventFactory events, AuditPublisher publisher) {
        this.events = events;
        this.publisher = publisher;
    }

    public void record(AccessDecision decision, AuditAction action, Map<String, ?> metadata) {
        publisher.publish(events.fromDecision(decision, action, metadata));
    }
}
