package com.mqol.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Uses {@link InMemorySpanExporter} directly rather than the JUnit extension so spans are
 * collected reliably from nested test classes.
 */
@DisplayName("SpanHelper")
class SpanHelperTest {

    private InMemorySpanExporter spanExporter;
    private SpanHelper spanHelper;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        OpenTelemetrySdk sdk = OpenTelemetrySdk.builder().setTracerProvider(tracerProvider).build();
        spanHelper = new SpanHelper(sdk.getTracer("test-tracer"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
        spanExporter.reset();
    }

    @Test
    @DisplayName("should reject null tracer")
    void shouldRejectNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tracer");
    }

    @Nested
    @DisplayName("inSpan")
    class InSpan {

        @Test
        @DisplayName("should return the result and end the span with OK")
        void shouldReturnResult() {
            String result = spanHelper.inSpan("access.decide", () -> "allow");

            assertThat(result).isEqualTo("allow");
            List<SpanData> spans = spanExporter.getFinishedSpanItems();
            assertThat(spans).hasSize(1);
            assertThat(spans.get(0).getName()).isEqualTo("access.decide");
            assertThat(spans.get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
        }

        @Test
        @DisplayName("should attach explicit attributes and correlation context")
        void shouldAttachAttributes() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", null, "u-1", "team-1"));

            spanHelper.inSpan("access.decide", Map.of("access.resource", "team_patient"), () -> 1);

            SpanData span = spanExporter.getFinishedSpanItems().get(0);
            assertThat(span.getAttributes().get(AttributeKey.stringKey("access.resource")))
                    .isEqualTo("team_patient");
            assertThat(span.getAttributes().get(AttributeKey.stringKey("correlation.id")))
                    .isEqualTo("corr-1");
            assertThat(span.getAttributes().get(AttributeKey.stringKey("actor.id")))
                    .isEqualTo("u-1");
            assertThat(span.getAttributes().get(AttributeKey.stringKey("tenant.id")))
                    .isEqualTo("team-1");
        }

        @Test
        @DisplayName("should record the exception and rethrow it")
        void shouldRecordException() {
            assertThatThrownBy(() -> spanHelper.inSpan("access.decide", () -> {
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

            SpanData span = spanExporter.getFinishedSpanItems().get(0);
            assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
            assertThat(span.getEvents()).anyMatch(e -> e.getName().equals("exception"));
        }
    }
}
