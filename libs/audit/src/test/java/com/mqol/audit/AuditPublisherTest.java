package com.mqol.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.mqol.audit.testing.InMemoryAuditSink;
import com.mqol.observability.CorrelationContext;
import com.mqol.observability.CorrelationContextHolder;
import com.mqol.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("AuditPublisher")
class AuditPublisherTest {

    private SimpleMeterRegistry registry;
    private MetricFactory metrics;
    private AuditPublisher publisher;

    private static AuditEvent event(String action) {
        return new AuditEvent("e-" + action, action, "u", "team", "u-1", "t-1",
                Instant.now(), "corr-1", "team-service", Map.of());
    }

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MetricFactory(registry, "team-service");
    }

    @AfterEach
    void tearDown() {
        if (publisher != null) {
            publisher.close();
        }
        CorrelationContextHolder.clear();
    }

    private double failed(String reason) {
        var counter = registry.find(AuditPublisher.METRIC_FAILED).tag("reason", reason).counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Test
    @DisplayName("delivers events to the sink asynchronously")
    void delivers() {
        InMemoryAuditSink sink = new InMemoryAuditSink();
        publisher = new AuditPublisher(sink, metrics, true, 10);

        publisher.publish(event("team.update"));

        assertThat(sink.await("team.update", 2, TimeUnit.SECONDS)).isPresent();
    }

    @Test
    @DisplayName("carries the correlation context to the worker thread")
    void carriesContext() throws InterruptedException {
        CountDownLatch written = new CountDownLatch(1);
        String[] seen = new String[1];
        publisher = new AuditPublisher(e -> {
            seen[0] = MDC.get(CorrelationContext.MDC_CORRELATION_ID);
            written.countDown();
        }, metrics, true, 10);
        CorrelationContextHolder.set(CorrelationContext.of("corr-worker"));

        publisher.publish(event("team.update"));

        assertThat(written.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seen[0]).isEqualTo("corr-worker");
    }

    @Test
    @DisplayName("a failing sink never reaches the caller and is counted")
    void sinkFailure() throws InterruptedException {
        AuditSink sink = mock(AuditSink.class);
        doThrow(new IllegalStateException("disk full")).when(sink).write(any());
        publisher = new AuditPublisher(sink, metrics, true, 10);

        assertThatCode(() -> publisher.publish(event("team.update"))).doesNotThrowAnyException();
        publisher.close();

        assertThat(failed("sink_error")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("drops invalid events")
    void dropsInvalid() {
        InMemoryAuditSink sink = new InMemoryAuditSink();
        publisher = new AuditPublisher(sink, metrics, true, 10);

        publisher.publish(event("not.an.action"));
        publisher.close();

        assertThat(sink.events()).isEmpty();
        assertThat(failed("invalid")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("drops events when the queue is full instead of blocking")
    void fullQueue() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        publisher = new AuditPublisher(e -> {
            started.countDown();
            try {
                release.await(2, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, metrics, true, 1);

        publisher.publish(event("team.update"));
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        publisher.publish(event("team.update"));
        publisher.publish(event("team.update"));
        release.countDown();

        assertThat(failed("rejected")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("does nothing when disabled")
    void disabled() {
        InMemoryAuditSink sink = new InMemoryAuditSink();
        publisher = new AuditPublisher(sink, metrics, false, 10);

        publisher.publish(event("team.update"));
        publisher.close();

        assertThat(sink.events()).isEmpty();
        assertThat(publisher.enabled()).isFalse();
    }
}
