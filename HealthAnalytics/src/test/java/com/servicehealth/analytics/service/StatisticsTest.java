package com.servicehealth.analytics.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StatisticsTest {

    @Test
    void standardDeviationOfEmptyAndSingleValueIsZero() {
        assertThat(Statistics.standardDeviation(List.of())).isZero();
        assertThat(Statistics.standardDeviation(List.of(42.0))).isZero();
    }

    @Test
    void standardDeviationUsesSampleDenominator() {
        assertThat(Statistics.standardDeviation(List.of(1.0, 2.0, 3.0, 4.0, 5.0)))
            .isCloseTo(1.5811, within(1e-4));
    }

    @Test
    void meanOfEmptyListIsZero() {
        assertThat(Statistics.mean(List.of())).isZero();
        assertThat(Statistics.mean(List.of(2.0, 4.0, 9.0))).isEqualTo(5.0);
    }

    @Test
    void leastSquaresRecoversPerfectLine() {
        double[] xs = new double[10];
        double[] ys = new double[10];
        for (int i = 0; i < xs.length; i++) {
            xs[i] = i;
            ys[i] = 2 * i + 1;
        }

        Statistics.LinearFit fit = Statistics.leastSquares(xs, ys);

        assertThat(fit.slope()).isCloseTo(2.0, within(1e-9));
        assertThat(fit.intercept()).isCloseTo(1.0, within(1e-9));
        assertThat(fit.valueAt(20)).isCloseTo(41.0, within(1e-9));
    }

    @Test
    void leastSquaresWithConstantXHasZeroSlope() {
        Statistics.LinearFit fit = Statistics.leastSquares(new double[]{3, 3, 3}, new double[]{1, 2, 6});

        assertThat(fit.slope()).isZero();
        assertThat(fit.intercept()).isEqualTo(3.0);
    }

    @Test
    void leastSquaresWithSinglePointIsFlat() {
        Statistics.LinearFit fit = Statistics.leastSquares(new double[]{4}, new double[]{7});

        assertThat(fit.slope()).isZero();
        assertThat(fit.valueAt(100)).isEqualTo(7.0);
    }

    @Test
    void leastSquaresOfNoisyLine() {
        Statistics.LinearFit fit = Statistics.leastSquares(
            new double[]{0, 1, 2, 3, 4}, new double[]{1, 3, 2, 5, 4});

        assertThat(fit.slope()).isCloseTo(0.8, within(1e-9));
        assertThat(fit.intercept()).isCloseTo(1.4, within(1e-9));
    }

    @Test
    void leastSquaresRejectsMismatchedInput() {
        assertThatThrownBy(() -> Statistics.leastSquares(new double[]{1, 2}, new double[]{1}))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
