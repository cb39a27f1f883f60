package com.mqol.teamservice.config;

import com.mqol.audit.AuditEventFactory;
import com.mqol.audit.AuditPublisher;
import com.mqol.audit.AuditSink;
import com.mqol.audit.LoggingAuditSink;
import com.mqol.observability.MetricFactory;
import com.mqol.observability.SensitiveDataRedactor;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AuditConfig {

    @Bean
    public AuditEventFactory auditEventFactory(
            AuditProperties audit, TeamServiceProperties service, SensitiveDataRedactor redactor, Clock clock) {
        String producer = audit.producer() == null || audit.producer().isBlank()
                ? service.name()
                : audit.producer();
        return new AuditEventFactory(producer, redactor, clock);
    }

    @Bean
    public AuditSink auditSink() {
        return new LoggingAuditSink();
    }

    @Bean(destroyMethod = "close")
    public AuditPublisher auditPublisher(AuditSink sink, MetricFactory metrics, AuditProperties properties) {
        return new AuditPublisher(sink, metrics, properties.enabled(), properties.queueCapacity());
    }
}
