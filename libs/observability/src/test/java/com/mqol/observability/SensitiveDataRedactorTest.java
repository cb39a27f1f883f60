package com.mqol.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Nested
    @DisplayName("Default patterns")
    class DefaultPatterns {

        @Test
        @DisplayName("should redact credentials")
        void shouldRedactCredentials() {
            Map<String, Object> result = redactor.redact(Map.of(
                    "invitationToken", "tok-123",
                    "apiKey", "AKIA",
                    "password", "s3cr3t"));

            assertThat(result.values()).containsOnly(SensitiveDataRedactor.REDACTED);
        }

        @Test
        @DisplayName("should redact patient contact details")
        void shouldRedactContactDetails() {
            Map<String, Object> result = redactor.redact(Map.of(
                    "mobile", "+44 7700 900000",
                    "inviteeEmail", "jo@example.com"));

            assertThat(result.get("mobile")).isEqualTo(SensitiveDataRedactor.REDACTED);
            assertThat(result.get("inviteeEmail")).isEqualTo(SensitiveDataRedactor.REDACTED);
        }

        @Test
        @DisplayName("should preserve non-sensitive fields and key order")
        void shouldPreserveOthers() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("patientId", "p-1");
            data.put("Mobile", "123");
            data.put("role", "admin");

            Map<String, Object> result = redactor.redact(data);

            assertThat(result.keySet()).containsExactly("patientId", "Mobile", "role");
            assertThat(result.get("patientId")).isEqualTo("p-1");
            assertThat(result.get("Mobile")).isEqualTo(SensitiveDataRedactor.REDACTED);
            assertThat(result.get("role")).isEqualTo("admin");
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("should return empty map for null or empty input")
        void shouldReturnEmpty() {
            assertThat(redactor.redact(null)).isEmpty();
            assertThat(redactor.redact(Map.of())).isEmpty();
        }

        @Test
        @DisplayName("isSensitive should be false for null")
        void nullFieldName() {
            assertThat(redactor.isSensitive(null)).isFalse();
        }

        @Test
        @DisplayName("custom patterns replace the defaults")
        void customPatterns() {
            var custom = new SensitiveDataRedactor(Set.of("nhsnumber"));

            assertThat(custom.isSensitive("nhsNumber")).isTrue();
            assertThat(custom.isSensitive("password")).isFalse();
        }

        @Test
        @DisplayName("should reject an empty pattern set")
        void rejectsEmptyPatterns() {
            assertThatThrownBy(() -> new SensitiveDataRedactor(Set.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
