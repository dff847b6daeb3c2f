package com.awardhub.backend.modules.notification;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.OffsetDateTime;

import com.awardhub.backend.modules.notification.application.TimeSinceFormatter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TimeSinceFormatterTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T10:00:00Z");

    @ParameterizedTest
    @CsvSource({
            "30, 0 minutes",
            "60, 1 minute",
            "7500, '2 hours, 5 minutes'",
            "183900, '2 days, 3 hours'",
            "622800, 1 week",
            "34560000, '1 year, 1 month'"
    })
    void rendersAtMostTwoAdjacentUnits(long secondsAgo, String expected) {
        assertThat(TimeSinceFormatter.format(NOW.minusSeconds(secondsAgo), NOW)).isEqualTo(expected);
    }

    @Test
    void missingTimestampRendersNothing() {
        assertThat(TimeSinceFormatter.format(null, NOW)).isNull();
    }
}
