package com.hyperdesk.vmrequest.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("VmName")
class VmNameTest {

    @ParameterizedTest
    @ValueSource(strings = {"web", "web-01", "a1b", "db-primary-2"})
    @DisplayName("accepts hostname-safe names")
    void acceptsValidNames(String raw) {
        assertThat(new VmName(raw).value()).isEqualTo(raw);
    }

    @ParameterizedTest
    @ValueSource(strings = {"ab", "Web-01", "-web", "web-", "web_01", "web 01", "web.01"})
    @DisplayName("rejects names that are too short or contain illegal characters")
    void rejectsInvalidNames(String raw) {
        assertThatThrownBy(() -> new VmName(raw)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("rejects consecutive hyphens")
    void rejectsConsecutiveHyphens() {
        assertThatThrownBy(() -> new VmName("web--01"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("consecutive hyphens");
    }

    @Test
    @DisplayName("accepts exactly 63 characters and rejects 64")
    void enforcesMaximumLength() {
        assertThat(new VmName("a".repeat(63)).value()).hasSize(63);
        assertThatThrownBy(() -> new VmName("a".repeat(64)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("63");
    }

    @Test
    @DisplayName("of() trims surrounding whitespace before validating")
    void ofTrims() {
        assertThat(VmName.of("  web-01 ")).isEqualTo(new VmName("web-01"));
    }

    @Test
    @DisplayName("rejects null")
    void rejectsNull() {
        assertThatThrownBy(() -> VmName.of(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
