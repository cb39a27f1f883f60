package com.mqol.audit;

/**
 * Destination for audit events. Called from the publisher's worker thread, never from the
 * request thread. Implementations may throw; the publisher logs and counts the failure.
 */
public interface AuditSink {

    void write(AuditEvent event);
}
