package com.mqol.audit;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AuditEventValidator")
class AuditEventValidatorTest {

    private static AuditEvent event(String action, String crud, String actorId, String tenantId) {
        return new AuditEvent("e-1", action, crud, "team_patient", actorId, tenantId,
                Instant.now(), "corr-1", "team-service", Map.of());
    }

    @Test
    @DisplayName("a complete event passes")
    void valid() {
        ValidationResult result = AuditEventValidator.validate(event("patient.view", "r", "u-1", "t-1"));

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Nested
    @DisplayName("invalid events")
    class Invalid {

        @Test
        @DisplayName("missing actor and tenant are both reported")
        void reportsAllErrors() {
            ValidationResult result = AuditEventValidator.validate(event("patient.view", "r", null, " "));

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).hasSize(2)
                    .anyMatch(e -> e.contains("actorId"))
                    .anyMatch(e -> e.contains("tenantId"));
        }

        @Test
        @DisplayName("unknown action is rejected")
        void unknownAction() {
            ValidationResult result = AuditEventValidator.validate(event("patient.export", "r", "u", "t"));

            assertThat(result.errors()).anyMatch(e -> e.contains("patient.export"));
        }

        @Test
        @DisplayName("crud must be a single CRUD letter")
        void badCrud() {
            ValidationResult result = AuditEventValidator.validate(event("patient.view", "x", "u", "t"));

            assertThat(result.errors()).anyMatch(e -> e.contains("crud"));
        }

        @Test
        @DisplayName("null event is invalid")
        void nullEvent() {
            assertThat(AuditEventValidator.validate(null).valid()).isFalse();
        }
    }

    @Test
    @DisplayName("every audit action round-trips through its name and has a CRUD letter")
    void actionsAreConsistent() {
        for (AuditAction action : AuditAction.values()) {
            assertThat(AuditAction.fromString(action.value())).contains(action);
            assertThat("crud").contains(String.valueOf(action.crud()));
        }
    }
}
