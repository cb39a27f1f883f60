package com.mqol.teamservice.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("Slugs")
class SlugsTest {

    @Test
    @DisplayName("derives a lower-case hyphenated slug from a name")
    void fromName() {
        assertThat(Slugs.fromName("Acme Clinic  (North)")).isEqualTo("acme-clinic-north");
        assertThat(Slugs.fromName("Café Zürich")).isEqualTo("cafe-zurich");
    }

    @Test
    @DisplayName("name without any letter or digit has no slug")
    void fromNameWithoutAlphanumerics() {
        assertThatThrownBy(() -> Slugs.fromName("!!!")).isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Acme", "acme_team", "-acme", "acme-", "a", "acme--team"})
    @DisplayName("rejects malformed explicit slugs")
    void rejectsInvalid(String slug) {
        assertThatThrownBy(() -> Slugs.requireValid(slug)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("accepts a well-formed slug unchanged")
    void acceptsValid() {
        assertThat(Slugs.requireValid("acme-2")).isEqualTo("acme-2");
    }
}
