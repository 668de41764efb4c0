package com.phillippitts.bes3t.service.decode;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SignalStatisticsTest {

    @Test
    void rampScoresLow() {
        double[] ramp = new double[10];
        for (int i = 0; i < ramp.length; i++) {
            ramp[i] = i;
        }

        assertThat(SignalStatistics.smoothness(ramp, 1000)).isCloseTo(1.0 / 9.0, within(1e-12));
    }

    @Test
    void alternatingSignalScoresOne() {
        assertThat(SignalStatistics.smoothness(new double[] {0, 1, 0, 1, 0}, 1000)).isEqualTo(1.0);
    }

    @Test
    void degenerateInputsScoreZero() {
        assertThat(SignalStatistics.smoothness(new double[0], 1000)).isZero();
        assertThat(SignalStatistics.smoothness(new double[] {5}, 1000)).isZero();
        assertThat(SignalStatistics.smoothness(new double[] {3, 3, 3}, 1000)).isZero();
    }

    @Test
    void onlyTheLeadingWindowIsScored() {
        assertThat(SignalStatistics.smoothness(new double[] {0, 1, 2, 100, -50}, 3)).isEqualTo(0.5);
    }

    @Test
    void maxAbsPropagatesNaN() {
        assertThat(SignalStatistics.maxAbs(new double[] {-7, 3})).isEqualTo(7);
        assertThat(SignalStatistics.maxAbs(new double[] {1, Double.NaN})).isNaN();
        assertThat(SignalStatistics.maxAbs(new double[0])).isZero();
    }

    @Test
    void plausibleMagnitudeIsFiniteAndBounded() {
        assertThat(SignalStatistics.isPlausibleMagnitude(1e19, 1e20)).isTrue();
        assertThat(SignalStatistics.isPlausibleMagnitude(1e21, 1e20)).isFalse();
        assertThat(SignalStatistics.isPlausibleMagnitude(Double.POSITIVE_INFINITY, 1e20)).isFalse();
        assertThat(SignalStatistics.isPlausibleMagnitude(Double.NaN, 1e20)).isFalse();
    }
}
