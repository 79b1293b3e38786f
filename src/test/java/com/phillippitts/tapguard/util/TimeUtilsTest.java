package com.phillippitts.tapguard.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void describesDurationsCompactly() {
        assertThat(TimeUtils.describe(Duration.ZERO)).isEqualTo("0s");
        assertThat(TimeUtils.describe(null)).isEqualTo("0s");
        assertThat(TimeUtils.describe(Duration.ofSeconds(45))).isEqualTo("45s");
        assertThat(TimeUtils.describe(Duration.ofSeconds(125))).isEqualTo("2m 05s");
        assertThat(TimeUtils.describe(Duration.ofSeconds(3930))).isEqualTo("1h 05m 30s");
    }

    @Test
    void elapsedMillisIsNonNegative() {
        assertThat(TimeUtils.elapsedMillis(System.nanoTime())).isGreaterThanOrEqualTo(0L);
    }
}
