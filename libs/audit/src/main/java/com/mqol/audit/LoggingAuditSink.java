package com.mqol.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each event as a JSON line to the {@code AUDIT} logger. Shipping that logger's output
 * is the log pipeline's job.
 */
public final class LoggingAuditSink implements AuditSink {

    public static final String LOGGER_NAME = "AUDIT";

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void write(AuditEvent event) {
        audit.info(AuditEventSerializer.serialize(event));
    }
}
