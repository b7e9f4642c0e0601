package com.servicehealth.analytics.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigValuesTest {

    @Test
    void parsePositiveInt() {
        assertThat(ConfigValues.parsePositiveInt("48", 24, "hours")).isEqualTo(48);
        assertThat(ConfigValues.parsePositiveInt(" 12 ", 24, "hours")).isEqualTo(12);
        assertThat(ConfigValues.parsePositiveInt("6.5", 24, "hours")).isEqualTo(6);
    }

    @Test
    void parsePositiveIntFallsBackOnInvalidInput() {
        assertThat(ConfigValues.parsePositiveInt(null, 24, "hours")).isEqualTo(24);
        assertThat(ConfigValues.parsePositiveInt("", 24, "hours")).isEqualTo(24);
        assertThat(ConfigValues.parsePositiveInt("soon", 24, "hours")).isEqualTo(24);
        assertThat(ConfigValues.parsePositiveInt("0", 24, "hours")).isEqualTo(24);
        assertThat(ConfigValues.parsePositiveInt("-5", 24, "hours")).isEqualTo(24);
        assertThat(ConfigValues.parsePositiveInt("99999999999", 24, "hours")).isEqualTo(24);
    }

    @Test
    void numericBounds() {
        assertThat(ConfigValues.positiveOrDefault(5, 1, "n")).isEqualTo(5);
        assertThat(ConfigValues.positiveOrDefault(0, 1, "n")).isEqualTo(1);
        assertThat(ConfigValues.nonNegativeOrDefault(0, 1, "n")).isZero();
        assertThat(ConfigValues.nonNegativeOrDefault(-1, 1, "n")).isEqualTo(1);
        assertThat(ConfigValues.positiveOrDefault(2.5, 2.0, "t")).isEqualTo(2.5);
        assertThat(ConfigValues.positiveOrDefault(Double.POSITIVE_INFINITY, 2.0, "t")).isEqualTo(2.0);
        assertThat(ConfigValues.positiveOrDefault(-0.5, 2.0, "t")).isEqualTo(2.0);
    }

    @Test
    void durationBounds() {
        Duration fallback = Duration.ofHours(1);

        assertThat(ConfigValues.positiveOrDefault(Duration.ofMinutes(5), fallback, "d")).isEqualTo(Duration.ofMinutes(5));
        assertThat(ConfigValues.positiveOrDefault(Duration.ZERO, fallback, "d")).isEqualTo(fallback);
        assertThat(ConfigValues.positiveOrDefault((Duration) null, fallback, "d")).isEqualTo(fallback);
        assertThat(ConfigValues.nonNegativeOrDefault(Duration.ZERO, fallback, "d")).isZero();
        assertThat(ConfigValues.nonNegativeOrDefault(Duration.ofSeconds(-1), fallback, "d")).isEqualTo(fallback);
    }
}
