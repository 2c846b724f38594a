package com.libragraph.keeper.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class DurationsTest {

    @Test
    void shouldParseSingleUnits() {
        assertThat(Durations.parse("10s")).isEqualTo(Duration.ofSeconds(10));
        assertThat(Durations.parse("500ms")).isEqualTo(Duration.ofMillis(500));
        assertThat(Durations.parse("2h")).isEqualTo(Duration.ofHours(2));
        assertThat(Durations.parse("750us")).isEqualTo(Duration.ofNanos(750_000));
    }

    @Test
    void shouldParseCompoundAndFractionalValues() {
        assertThat(Durations.parse("1m30s")).isEqualTo(Duration.ofSeconds(90));
        assertThat(Durations.parse("1.5h")).isEqualTo(Duration.ofMinutes(90));
        assertThat(Durations.parse("-2s")).isEqualTo(Duration.ofSeconds(-2));
    }

    @Test
    void shouldParseZeroWithoutUnit() {
        assertThat(Durations.parse("0")).isEqualTo(Duration.ZERO);
    }

    @Test
    void shouldAcceptIso8601() {
        assertThat(Durations.parse("PT10S")).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void shouldRejectMalformedInput() {
        assertThatIllegalArgumentException().isThrownBy(() -> Durations.parse("10"));
        assertThatIllegalArgumentException().isThrownBy(() -> Durations.parse("ten seconds"));
        assertThatIllegalArgumentException().isThrownBy(() -> Durations.parse(""));
        assertThatIllegalArgumentException().isThrownBy(() -> Durations.parse("ms"));
    }

    @Test
    void shouldRejectValuesBeyondDurationRange() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> Durations.parse("99999999999h"))
                .withMessageContaining("overflow");
        assertThatIllegalArgumentException().isThrownBy(() -> Durations.parse("-99999999999h"));
    }

    @Test
    void shouldFormatLikeItParses() {
        assertThat(Durations.format(Duration.ZERO)).isEqualTo("0s");
        assertThat(Durations.format(Duration.ofSeconds(10))).isEqualTo("10s");
        assertThat(Durations.format(Duration.ofSeconds(90))).isEqualTo("1m30s");
        assertThat(Durations.format(Duration.ofMinutes(1))).isEqualTo("1m0s");
        assertThat(Durations.format(Duration.ofHours(1))).isEqualTo("1h0m0s");
        assertThat(Durations.format(Duration.ofMillis(1500))).isEqualTo("1.5s");
        assertThat(Durations.format(Duration.ofMillis(250))).isEqualTo("250ms");
        assertThat(Durations.format(Duration.ofSeconds(-3))).isEqualTo("-3s");
    }
}
