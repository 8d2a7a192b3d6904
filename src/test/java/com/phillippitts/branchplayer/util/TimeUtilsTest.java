package com.phillippitts.branchplayer.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void convertsSecondsToMillis() {
        assertThat(TimeUtils.secondsToMillis(1.5)).isEqualTo(1500L);
        assertThat(TimeUtils.secondsToMillis(0.0004)).isZero();
        assertThat(TimeUtils.secondsToMillis(0.0006)).isEqualTo(1L);
    }

    @Test
    void nonPositiveOrNaNSecondsAreZero() {
        assertThat(TimeUtils.secondsToMillis(-2.0)).isZero();
        assertThat(TimeUtils.secondsToMillis(Double.NaN)).isZero();
    }

    @Test
    void elapsedSecondsIsNonNegative() {
        long start = System.nanoTime();

        assertThat(TimeUtils.elapsedSeconds(start)).isGreaterThanOrEqualTo(0.0);
    }
}
