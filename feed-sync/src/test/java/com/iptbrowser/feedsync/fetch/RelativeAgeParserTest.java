package com.iptbrowser.feedsync.fetch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class RelativeAgeParserTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 12, 0);

    @Test
    @DisplayName("resolves each unit against the reference time")
    void resolvesUnits() {
        assertThat(RelativeAgeParser.resolve("3 minutes ago", NOW)).isEqualTo(NOW.minusMinutes(3));
        assertThat(RelativeAgeParser.resolve("10.9 hours ago", NOW)).isEqualTo(NOW.minusSeconds(39_240));
        assertThat(RelativeAgeParser.resolve("1.2 days ago", NOW)).isEqualTo(NOW.minusSeconds(103_680));
        assertThat(RelativeAgeParser.resolve("1 week ago", NOW)).isEqualTo(NOW.minusDays(7));
        assertThat(RelativeAgeParser.resolve("2 months ago", NOW)).isEqualTo(NOW.minusDays(60));
    }

    @Test
    @DisplayName("finds the age inside surrounding text, case-insensitively")
    void findsInText() {
        assertThat(RelativeAgeParser.find("FreeLeech | 4.0 Hours Ago by someone")).contains("4.0 Hours Ago");
        assertThat(RelativeAgeParser.resolve("uploaded 4.0 Hours Ago", NOW)).isEqualTo(NOW.minusHours(4));
    }

    @Test
    @DisplayName("text without an age resolves to now")
    void unknownText() {
        assertThat(RelativeAgeParser.find("yesterday")).isEmpty();
        assertThat(RelativeAgeParser.resolve("yesterday", NOW)).isEqualTo(NOW);
        assertThat(RelativeAgeParser.resolve(null, NOW)).isEqualTo(NOW);
    }
}
