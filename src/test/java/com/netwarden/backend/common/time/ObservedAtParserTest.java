package com.netwarden.backend.common.time;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ObservedAtParserTest {

    @Test
    void epoch_seconds_and_millis_are_both_accepted() {
        assertThat(ObservedAtParser.parse("1700000000")).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
        assertThat(ObservedAtParser.parse("1700000000123")).isEqualTo(Instant.ofEpochMilli(1_700_000_000_123L));
    }

    @Test
    void iso_variants_are_parsed_as_utc() {
        assertThat(ObservedAtParser.parse("2024-03-01T10:15:30Z")).isEqualTo(Instant.parse("2024-03-01T10:15:30Z"));
        assertThat(ObservedAtParser.parse("2024-03-01T13:15:30+03:00")).isEqualTo(Instant.parse("2024-03-01T10:15:30Z"));
        // 沒時區 → 當 UTC
        assertThat(ObservedAtParser.parse("2024-03-01T10:15:30")).isEqualTo(Instant.parse("2024-03-01T10:15:30Z"));
        // 空白分隔
        assertThat(ObservedAtParser.parse("2024-03-01 10:15:30")).isEqualTo(Instant.parse("2024-03-01T10:15:30Z"));
    }

    @Test
    void garbage_returns_null() {
        assertThat(ObservedAtParser.parse(null)).isNull();
        assertThat(ObservedAtParser.parse("")).isNull();
        assertThat(ObservedAtParser.parse("yesterday")).isNull();
        assertThat(ObservedAtParser.parse("-5")).isNull();
    }
}
