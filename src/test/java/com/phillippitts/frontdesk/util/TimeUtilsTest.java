package com.phillippitts.frontdesk.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeUtilsTest {

    @Test
    void nanosToMillisTruncates() {
        assertThat(TimeUtils.nanosToMillis(1_999_999L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
    }

    @Test
    void elapsedMillisIsNonNegative() {
        long start = System.nanoTime();
        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(0L);
    }

    @Test
    void playoutOfOneCarrierChunkIsTwentyMillis() {
        assertThat(TimeUtils.playoutNanos(160, 8000)).isEqualTo(20_000_000L);
        assertThat(TimeUtils.playoutNanos(8000, 8000)).isEqualTo(1_000_000_000L);
    }

    @Test
    void playoutRejectsNonPositiveRate() {
        assertThatThrownBy(() -> TimeUtils.playoutNanos(160, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
