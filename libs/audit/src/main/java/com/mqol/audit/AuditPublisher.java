package com.mqol.audit;

import com.mqol.observability.CorrelationContext;
import com.mqol.observability.CorrelationContextHolder;
import com.mqol.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fire-and-forget publication of audit events.
 * <p>
 * Events are handed to a single worker thread through a bounded queue. {@link #publish} never
 * blocks and never throws: invalid events, a full queue and sink failures are logged and counted
 * on {@code audit.events.failed}, and the caller's operation carries on.
 */
public final class AuditPublisher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AuditPublisher.class);

    public static final String METRIC_PUBLISHED = "audit.events.published";
    public static final String METRIC_FAILED = "audit.events.failed";

    private final AuditSink sink;
    private final MetricFactory metrics;
    private final boolean enabled;
    private final ThreadPoolExecutor executor;

    public AuditPublisher(AuditSink sink, MetricFactory metrics, boolean enabled, int queueCapacity) {
        if (sink == null || metrics == null) {
            throw new IllegalArgumentException("sink and metrics must not be null");
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1");
        }
        this.sink = sink;
        this.metrics = metrics;
        this.enabled = enabled;
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                runnable -> {
                    Thread thread = new Thread(runnable, "audit-publisher");
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Queues the event for the sink. Returns immediately.
     */
    public void publish(AuditEvent event) {
        if (!enabled) {
            return;
        }
        ValidationResult validation = AuditEventValidator.validate(event);
        if (!validation.valid()) {
            log.warn("Dropping invalid audit event: {}", validation.errors());
            failed("invalid");
            return;
        }

        CorrelationContext context = CorrelationContextHolder.get().orElse(null);
        try {
            executor.execute(() -> deliver(event, context));
        } catch (RejectedExecutionException e) {
            log.warn("Audit queue full or closed, dropping event {} ({})", event.eventId(), event.action());
            failed("rejected");
        }
    }

    public boolean enabled() {
        return enabled;
    }

    /**
     * Stops accepting events and waits briefly for queued ones to reach the sink.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Audit publisher did not drain within 5s, {} event(s) dropped",
                        executor.getQueue().size());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void deliver(AuditEvent event, CorrelationContext context) {
        Runnable write = () -> {
            try {
                sink.write(event);
                metrics.increment(METRIC_PUBLISHED, "action", event.action());
            } catch (RuntimeException e) {
                log.warn("Audit sink failed for event {} ({}): {}",
                        event.eventId(), event.action(), e.getMessage(), e);
                failed("sink_error");
            }
        };
        if (context != null) {
            CorrelationContextHolder.runWithContext(context, write);
        } else {
            write.run();
        }
    }

    private void failed(String reason) {
        metrics.increment(METRIC_FAILED, "reason", reason);
    }
}
