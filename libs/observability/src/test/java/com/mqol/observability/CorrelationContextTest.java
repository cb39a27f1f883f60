package com.mqol.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CorrelationContext")
class CorrelationContextTest {

    @Test
    @DisplayName("should reject a blank correlation id")
    void shouldRejectBlankCorrelationId() {
        assertThatThrownBy(() -> CorrelationContext.of(" "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
        assertThatThrownBy(() -> new CorrelationContext(null, "r", "a", "t"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("withActor and withTenant return enriched copies")
    void copiesAreIndependent() {
        var base = new CorrelationContext("c-1", "r-1", null, null);

        var enriched = base.withActor("u-1").withTenant("team-1");

        assertThat(enriched).isEqualTo(new CorrelationContext("c-1", "r-1", "u-1", "team-1"));
        assertThat(base.actorId()).isNull();
        assertThat(base.tenantId()).isNull();
    }
}
