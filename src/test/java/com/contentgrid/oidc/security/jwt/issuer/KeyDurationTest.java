package com.contentgrid.oidc.security.jwt.issuer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class KeyDurationTest {

    @Test
    void parses_simple_format_and_keeps_text() {
        var duration = KeyDuration.parse("rotation_period", "6h");

        assertThat(duration.getDuration()).isEqualTo(Duration.ofHours(6));
        assertThat(duration.getText()).isEqualTo("6h");
        assertThat(duration).hasToString("6h");
    }

    @Test
    void parses_plain_numbers_as_seconds() {
        assertThat(KeyDuration.parse("rotation_period", "90").getDuration()).isEqualTo(Duration.ofSeconds(90));
    }

    @Test
    void parses_iso8601() {
        assertThat(KeyDuration.parse("verification_ttl", "PT30M").getDuration()).isEqualTo(Duration.ofMinutes(30));
    }

    @ParameterizedTest
    @ValueSource(strings = {"six hours", "6 hours", "h6", "1h30", "1x30m", "PT1H30"})
    void rejects_unparseable_text(String text) {
        assertThatThrownBy(() -> KeyDuration.parse("rotation_period", text))
                .isInstanceOf(InvalidKeyConfigurationException.class)
                .hasMessage("unable to parse provided rotation_period of: " + text);
    }

    @ParameterizedTest
    @CsvSource({
            "1h30m, PT1H30M",
            "1.5h, PT1H30M",
            "2h45m30s, PT2H45M30S",
            "1m500ms, PT1M0.5S",
            ".5s, PT0.5S",
            "1d12h, PT36H",
    })
    void parses_unit_sequences_and_keeps_text(String text, Duration expected) {
        var duration = KeyDuration.parse("rotation_period", text);

        assertThat(duration.getDuration()).isEqualTo(expected);
        assertThat(duration.getText()).isEqualTo(text);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "40000000000000000s",
            "9223372036854775807s",
            "99999999999999999999s",
            "36501d",
            "1000000h1s",
            "PT9999999H"
    })
    void rejects_durations_longer_than_the_maximum(String text) {
        assertThatThrownBy(() -> KeyDuration.parse("rotation_period", text))
                .isInstanceOf(InvalidKeyConfigurationException.class)
                .hasMessageContaining("rotation_period must not exceed");
    }

    @Test
    void accepts_the_maximum() {
        assertThat(KeyDuration.parse("verification_ttl", "36500d").getDuration())
                .isEqualTo(KeyDuration.MAX_DURATION);
    }

    @ParameterizedTest
    @ValueSource(strings = {"0s", "-1h", "0", "0h0m"})
    void rejects_non_positive_durations(String text) {
        assertThatThrownBy(() -> KeyDuration.parse("verification_ttl", text))
                .isInstanceOf(InvalidKeyConfigurationException.class)
                .hasMessageContaining("verification_ttl must be a positive duration");
    }

    @Test
    void rejects_blank_text() {
        assertThatThrownBy(() -> KeyDuration.parse("rotation_period", "  "))
                .isInstanceOf(InvalidKeyConfigurationException.class)
                .hasMessage("rotation_period must not be empty");
    }
}
