package com.realtimeanalytics.core.aggregation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Percentiles}.
 */
class PercentilesTest {

    @Test
    @DisplayName("Should pick nearest-rank values from five samples")
    void shouldComputeOnFiveValues() {
        double[] values = { 10, 20, 30, 40, 50 };

        assertThat(Percentiles.nearestRank(values, 0.50)).isEqualTo(30);
        assertThat(Percentiles.nearestRank(values, 0.95)).isEqualTo(50);
        assertThat(Percentiles.nearestRank(values, 0.99)).isEqualTo(50);
    }

    @Test
    @DisplayName("Should pick nearest-rank values from ten samples")
    void shouldComputeOnTenValues() {
        double[] values = { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 };

        assertThat(Percentiles.nearestRank(values, 0.50)).isEqualTo(5);
        assertThat(Percentiles.nearestRank(values, 0.90)).isEqualTo(9);
        assertThat(Percentiles.nearestRank(values, 0.95)).isEqualTo(10);
    }

    @Test
    @DisplayName("Should match half-even rounding of p × (n − 1) on the documented examples")
    void shouldAgreeWithHalfEvenRankOnExamples() {
        double[][] inputs = {
                { 10, 20, 30, 40, 50 },
                { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 }
        };
        double[][] percentiles = {
                { 0.50, 0.95, 0.99 },
                { 0.50, 0.90, 0.95 }
        };

        for (int i = 0; i < inputs.length; i++) {
            double[] values = inputs[i];
            for (double p : percentiles[i]) {
                int index = (int) Math.rint(p * (values.length - 1));
                assertThat(Percentiles.nearestRank(values, p)).isEqualTo(values[index]);
            }
        }
    }

    @Test
    @DisplayName("Should return the only value for every percentile")
    void shouldHandleSingleValue() {
        double[] values = { 42 };

        assertThat(Percentiles.nearestRank(values, 0.0)).isEqualTo(42);
        assertThat(Percentiles.nearestRank(values, 0.5)).isEqualTo(42);
        assertThat(Percentiles.nearestRank(values, 1.0)).isEqualTo(42);
    }

    @Test
    @DisplayName("Should not round up exact ranks because of floating point error")
    void shouldAbsorbRepresentationError() {
        double[] values = new double[100];
        for (int i = 0; i < values.length; i++) {
            values[i] = i + 1;
        }

        assertThat(Percentiles.nearestRank(values, 0.07)).isEqualTo(7);
    }

    @Test
    @DisplayName("Should reject empty input and out-of-range percentiles")
    void shouldRejectInvalidInput() {
        assertThatThrownBy(() -> Percentiles.nearestRank(new double[0], 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Percentiles.nearestRank(new double[] { 1 }, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Percentiles.nearestRank(new double[] { 1 }, Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
