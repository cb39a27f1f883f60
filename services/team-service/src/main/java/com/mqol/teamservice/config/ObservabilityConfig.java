package com.mqol.teamservice.config;

import com.mqol.observability.MetricFactory;
import com.mqol.observability.SensitiveDataRedactor;
import com.mqol.observability.SpanHelper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics, tracing and redaction beans shared by the access, audit and domain layers.
 *
 * <p>Tracing uses whatever {@link OpenTelemetry} is registered globally (the Java agent in
 * deployed environments, a no-op otherwise).
 */
@Configuration
public class ObservabilityConfig {

    public static final String INSTRUMENTATION_SCOPE = "com.mqol.teamservice";

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, TeamServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public OpenTelemetry openTelemetry() {
        return GlobalOpenTelemetry.get();
    }

    @Bean
    public SpanHelper spanHelper(OpenTelemetry openTelemetry) {
        return new SpanHelper(openTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }
}
