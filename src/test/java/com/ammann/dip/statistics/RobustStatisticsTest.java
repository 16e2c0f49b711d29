/* (C)2026 */
package com.ammann.dip.statistics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("RobustStatistics")
class RobustStatisticsTest {

    @Test
    void medianOfOddAndEvenLengths() {
        assertThat(RobustStatistics.median(new double[] {3, 1, 2})).isEqualTo(2.0);
        assertThat(RobustStatistics.median(new double[] {4, 1, 3, 2})).isEqualTo(2.5);
        assertThat(RobustStatistics.median(new double[0])).isNaN();
    }

    @Test
    void medianDoesNotModifyInput() {
        double[] values = {3, 1, 2};

        RobustStatistics.median(values);

        assertThat(values).containsExactly(3, 1, 2);
    }

    @Test
    void trimmedMeanDropsOneSampleFromEachEndForShortInputs() {
        // sorted 3,4,4,5,5,5,5 -> trims 3 and one 5
        double value = RobustStatistics.trimmedMean(new double[] {5, 5, 4, 3, 4, 5, 5});

        assertThat(value).isCloseTo(4.6, within(1e-12));
    }

    @Test
    void trimmedMeanIgnoresSingleOutlier() {
        double value = RobustStatistics.trimmedMean(new double[] {1, 2, 3, 4, 1000});

        assertThat(value).isEqualTo(3.0);
    }

    @Test
    void trimmedMeanFallsBackToMeanBelowThreeSamples() {
        assertThat(RobustStatistics.trimmedMean(new double[] {1, 4})).isEqualTo(2.5);
        assertThat(RobustStatistics.trimmedMean(new double[0])).isEqualTo(0.0);
    }

    @Test
    void trimmedMeanFallsBackToMeanWhenTrimRemovesEverything() {
        double value = RobustStatistics.trimmedMean(new double[] {1, 2, 6}, 0.7);

        assertThat(value).isEqualTo(3.0);
    }

    @Test
    void madAroundMedian() {
        // median 3, deviations 2,0,1,1,6 -> 1
        assertThat(RobustStatistics.mad(new double[] {1, 3, 2, 4, 9})).isEqualTo(1.0);
        assertThat(RobustStatistics.mad(new double[0])).isEqualTo(0.0);
    }

    @Test
    void quantileInterpolatesLinearly() {
        double[] values = {1, 2, 3, 4};

        assertThat(RobustStatistics.quantile(values, 0.0)).isEqualTo(1.0);
        assertThat(RobustStatistics.quantile(values, 1.0)).isEqualTo(4.0);
        assertThat(RobustStatistics.quantile(values, 0.25)).isCloseTo(1.75, within(1e-12));
        assertThat(RobustStatistics.quantile(values, 0.5)).isCloseTo(2.5, within(1e-12));
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.1})
    void quantileRejectsProbabilitiesOutsideUnitInterval(double q) {
        assertThatThrownBy(() -> RobustStatistics.quantile(new double[] {1, 2}, q))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Quantile");
    }

    @Test
    void robustScaleUsesMadWhenPositive() {
        double scale = RobustStatistics.robustScale(new double[] {1, 3, 2, 4, 9}, 2.0);

        assertThat(scale).isEqualTo(1.0);
    }

    @Test
    void robustScaleFallsBackToInterquartileRange() {
        // MAD around 1 is zero, IQR is 3 - 1
        double[] values = {1, 1, 1, 1, 1, 3, 3, 3, 3};

        double scale = RobustStatistics.robustScale(values, 1.0);

        assertThat(scale).isCloseTo(2.0 / RobustStatistics.IQR_TO_MAD, within(1e-12));
    }

    @Test
    void robustScaleFallsBackToMeanAbsoluteDeviation() {
        // MAD and IQR both zero, mean 1.8
        double scale = RobustStatistics.robustScale(new double[] {1, 1, 1, 1, 5}, 1.0);

        assertThat(scale).isCloseTo(1.28, within(1e-12));
    }

    @Test
    void robustScaleIsNeverZero() {
        assertThat(RobustStatistics.robustScale(new double[] {2, 2, 2, 2}, 2.0))
                .isEqualTo(RobustStatistics.MIN_SCALE);
        assertThat(RobustStatistics.robustScale(new double[0], 0.0)).isEqualTo(RobustStatistics.MIN_SCALE);
    }

    @Test
    void globalScaleFallsBackToRangeThenFloor() {
        assertThat(RobustStatistics.globalScale(new double[] {0, 0, 0, 0, 6})).isEqualTo(1.0);
        assertThat(RobustStatistics.globalScale(new double[] {5, 5, 5})).isEqualTo(RobustStatistics.MIN_SCALE);
    }

    @Test
    void movingMedianRemovesIsolatedSpikes() {
        double[] smoothed = RobustStatistics.movingMedian(new double[] {1, 2, 100, 3, 4}, 3);

        assertThat(smoothed).containsExactly(1, 2, 3, 4, 4);
    }

    @Test
    void movingMedianClampsAtEdges() {
        double[] smoothed = RobustStatistics.movingMedian(new double[] {1, 9, 2, 8, 3}, 3);

        assertThat(smoothed).containsExactly(1, 2, 8, 3, 3);
    }

    @Test
    void movingMedianWithUnitWindowReturnsCopy() {
        double[] values = {1, 2, 3};

        double[] smoothed = RobustStatistics.movingMedian(values, 1);

        assertThat(smoothed).containsExactly(1, 2, 3).isNotSameAs(values);
    }

    @Test
    void statisticsAreInvariantToSampleOrder() {
        double[] values = {4, 8, 15, 16, 23, 42, 7};
        double[] shuffled = {42, 7, 16, 4, 23, 8, 15};

        assertThat(RobustStatistics.median(shuffled)).isEqualTo(RobustStatistics.median(values));
        assertThat(RobustStatistics.trimmedMean(shuffled)).isEqualTo(RobustStatistics.trimmedMean(values));
        assertThat(RobustStatistics.mad(shuffled)).isEqualTo(RobustStatistics.mad(values));
    }
}
