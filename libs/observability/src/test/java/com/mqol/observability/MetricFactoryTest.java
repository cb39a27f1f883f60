package com.mqol.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "team-service");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank service name")
        void shouldRejectBlankServiceName() {
            assertThatThrownBy(() -> new MetricFactory(registry, "  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }
    }

    @Nested
    @DisplayName("Counters")
    class Counters {

        @Test
        @DisplayName("should tag counters with the service name and extra tags")
        void shouldTagCounters() {
            Counter counter = factory.counter("access.decisions", "decisions", "outcome", "allow");
            counter.increment();

            Counter found = registry.find("access.decisions")
                    .tags("service", "team-service", "outcome", "allow")
                    .counter();
            assertThat(found).isNotNull();
            assertThat(found.count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("increment should reuse the same registered counter")
        void incrementReusesCounter() {
            factory.increment("patient.created");
            factory.increment("patient.created");

            assertThat(registry.get("patient.created").counter().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("should reject an odd number of tag values")
        void shouldRejectOddTags() {
            assertThatThrownBy(() -> factory.increment("x", "only-key"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("timer should record durations")
    void timerRecords() {
        Timer timer = factory.timer("audit.publish", "publish latency");
        timer.record(Duration.ofMillis(5));

        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.getId().getTag("service")).isEqualTo("team-service");
    }
}
