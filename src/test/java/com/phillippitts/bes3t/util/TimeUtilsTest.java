package com.phillippitts.bes3t.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldConvertNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(1_000_000L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(5_500_000L)).isEqualTo(5L);
        assertThat(TimeUtils.nanosToMillis(999_999L)).isZero();
    }

    @Test
    void shouldMeasureElapsedMillis() {
        long start = System.nanoTime() - 3 * TimeUtils.NANOS_PER_MILLI;

        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(3L);
    }
}
