package com.ammann.dip.service;

import com.ammann.dip.enumeration.RejectionReason;
import com.ammann.dip.model.DetectionOptions;
import com.ammann.dip.model.DipClassification;
import com.ammann.dip.model.DipMetrics;
import com.ammann.dip.support.SeriesFixtures;
import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link DipClassifierService}.
 *
 * <p>Covers the accepted reference dip, ongoing dips at the end of the data, each
 * rejection path, and the invariants every returned metric set must satisfy.
 */
class DipClassifierServiceTest
{

    private static final double[] NO_RECOVERY = {
            5, 5.1, 4.9, 5, 5.05, 4.95, 5, 2, 1.8, 1.9, 2, 2.1, 1.9, 2, 2.05, 1.95, 2, 2.1, 1.9, 2, 2.05, 1.95
    };

    private final DipClassifierService classifier = new DipClassifierService();

    @Test
    void acceptsSymmetricDip()
    {
        DipClassification result = classifier.detectDip(SeriesFixtures.SINGLE_DIP, 3, 4);
        DipMetrics m = result.metrics();

        assertThat(result.dip()).isTrue();
        assertThat(m.segMin()).isEqualTo(2.5);
        assertThat(m.segMinIndex()).isEqualTo(4);
        assertThat(m.depth()).isEqualTo(m.baseline() - 2.5).isPositive();
        assertThat(m.baseline()).isCloseTo(4.6, within(1e-9));
        assertThat(m.recovered()).isTrue();
        assertThat(m.ongoing()).isFalse();
        assertThat(m.reason()).isNull();
        assertThat(m.confidence()).isBetween(0.0, 1.0);
    }

    @Test
    void reportsBlendWeightFromSeriesLength()
    {
        DipMetrics m = classifier.detectDip(SeriesFixtures.SINGLE_DIP, 3, 4).metrics();

        assertThat(m.alpha()).isCloseTo(1 - Math.exp(-9 / 200.0), within(1e-12));
    }

    @Test
    void ongoingDipCountsAsRecovered()
    {
        DipClassification result = classifier.detectDip(SeriesFixtures.ONGOING_DESCENT, 3, 5);

        assertThat(result.dip()).isTrue();
        assertThat(result.metrics().ongoing()).isTrue();
        assertThat(result.metrics().recovered()).isTrue();
        assertThat(result.metrics().baseline()).isEqualTo(5.0);
        assertThat(result.metrics().depth()).isEqualTo(3.0);
    }

    @Test
    void rejectsSegmentNarrowerThanMinWidth()
    {
        DipClassification result = classifier.detectDip(SeriesFixtures.SINGLE_DIP, 4, 4);

        assertThat(result.dip()).isFalse();
        assertThat(result.metrics().reason()).isEqualTo(RejectionReason.WIDTH_BELOW_MIN);
        assertThat(result.metrics().confidence()).isZero();
        assertThat(result.metrics().depth()).isNaN();
    }

    @Test
    void rejectsShallowSegment()
    {
        DipClassification result = classifier.detectDip(SeriesFixtures.SINGLE_DIP, 3, 4,
                DetectionOptions.defaults().withK(100));

        assertThat(result.dip()).isFalse();
        assertThat(result.metrics().reason()).isEqualTo(RejectionReason.DEPTH_BELOW_THRESHOLD);
        assertThat(result.metrics().depth()).isLessThan(result.metrics().depthThreshold());
    }

    @Test
    void absoluteDepthFloorRaisesThreshold()
    {
        DetectionOptions options = new DetectionOptions(50, 50, 2, 0.25, 5.0, true, 200);

        DipClassification result = classifier.detectDip(SeriesFixtures.SINGLE_DIP, 3, 4, options);

        assertThat(result.dip()).isFalse();
        assertThat(result.metrics().depthThreshold()).isEqualTo(5.0);
    }

    @Test
    void rejectsDipWithoutRecovery()
    {
        DipClassification result = classifier.detectDip(NO_RECOVERY, 7, 9);

        assertThat(result.dip()).isFalse();
        assertThat(result.metrics().recovered()).isFalse();
        assertThat(result.metrics().reason()).isEqualTo(RejectionReason.NO_RECOVERY);
        assertThat(result.metrics().depth()).isGreaterThanOrEqualTo(result.metrics().depthThreshold());
    }

    @Test
    void acceptsUnrecoveredDipWhenRecoveryNotRequired()
    {
        DipClassification result = classifier.detectDip(NO_RECOVERY, 7, 9,
                DetectionOptions.defaults().withRequireRecovery(false));

        assertThat(result.dip()).isTrue();
        assertThat(result.metrics().reason()).isNull();
    }

    @ParameterizedTest
    @CsvSource({"-1,3", "3,9", "5,4"})
    void rejectsInvalidBounds(int start, int end)
    {
        assertThatThrownBy(() -> classifier.detectDip(SeriesFixtures.SINGLE_DIP, start, end))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid segment bounds");
    }

    @Test
    void verdictIsMonotonicInK()
    {
        boolean rejected = false;
        for (int step = 0; step <= 40; step++) {
            double k = step * 0.5;
            boolean dip = classifier.detectDip(SeriesFixtures.SINGLE_DIP, 3, 4,
                    DetectionOptions.defaults().withK(k)).dip();
            if (rejected) {
                assertThat(dip).as("k=%s", k).isFalse();
            }
            rejected |= !dip;
        }
        assertThat(rejected).isTrue();
    }

    @Test
    void everySegmentSatisfiesMetricInvariants()
    {
        double[] series = SeriesFixtures.TWO_DIPS;
        for (int start = 0; start < series.length; start++) {
            for (int end = start; end < series.length; end++) {
                DipClassification result = classifier.detectDip(series, start, end);
                DipMetrics m = result.metrics();

                assertThat(m.confidence()).isBetween(0.0, 1.0);
                assertThat(m.width()).isEqualTo(end - start + 1);
                if (m.reason() == RejectionReason.WIDTH_BELOW_MIN) {
                    continue;
                }
                assertThat(m.depth()).isCloseTo(m.baseline() - m.segMin(), within(1e-12));
                assertThat(m.segMinIndex()).isBetween(start, end);
                assertThat(m.depthThreshold()).isGreaterThanOrEqualTo(0.0);
                assertThat(result.dip()).isEqualTo(m.depth() >= m.depthThreshold() && m.recovered());
            }
        }
    }

    @Test
    void classificationIsDeterministicAndLeavesInputUntouched()
    {
        double[] series = SeriesFixtures.TWO_DIPS.clone();

        DipClassification first = classifier.detectDip(series, 12, 14);
        DipClassification second = classifier.detectDip(series, 12, 14);

        assertThat(second).isEqualTo(first);
        assertThat(series).containsExactly(SeriesFixtures.TWO_DIPS);
    }

    @Test
    void zeroThresholdMakesDepthRatioUnbounded()
    {
        assertThat(DipClassifierService.depthRatio(1.0, 0.0)).isInfinite();
        assertThat(DipClassifierService.depthRatio(0.0, 0.0)).isZero();
        assertThat(DipClassifierService.depthRatio(3.0, 1.5)).isEqualTo(2.0);
    }

    @Test
    void confidenceIsBounded()
    {
        assertThat(DipClassifierService.confidence(0, 0, 0, 1, 1)).isZero();
        assertThat(DipClassifierService.confidence(-5, -5, -5, 1, 1)).isZero();
        assertThat(DipClassifierService.confidence(100, 100, 100, 1, 1)).isEqualTo(1.0);
        assertThat(DipClassifierService.confidence(1, 1, 1, 1, 1))
                .isCloseTo(Math.tanh(1.0 / 3.0) * 1.2, within(1e-9));
    }

    // =========================================================================
    // Recovery tiers
    // =========================================================================

    @Test
    void deepDipRecoveringSlowlyIsAccepted()
    {
        double[] series = concat(alternating(20), repeat(0, 3), repeat(0.2, 5), repeat(4.0, 5));

        DipClassification result = classifier.detectDip(series, 40, 42);
        DipMetrics m = result.metrics();

        assertThat(m.baseline()).isCloseTo(9.325, within(1e-9));
        assertThat(m.localMad()).isCloseTo(0.875, within(1e-9));
        assertThat(m.depth() / m.depthThreshold()).isGreaterThan(DipClassifierService.RELAXED_RECOVERY_RATIO);
        // nothing after the dip comes within one MAD of the baseline
        for (int i = 43; i < series.length; i++) {
            assertThat(Math.abs(series[i] - m.baseline())).isGreaterThan(m.localMad());
        }
        assertThat(m.recovered()).isTrue();
        assertThat(result.dip()).isTrue();
    }

    @Test
    void gradualClimbRecoversModerateDip()
    {
        double[] series = concat(alternating(20), repeat(0, 3), repeat(0.2, 5), repeat(4.0, 5));

        DipClassification result = classifier.detectDip(series, 40, 42, DetectionOptions.defaults().withK(5));
        DipMetrics m = result.metrics();

        assertThat(m.depth() / m.depthThreshold())
                .isGreaterThan(1.0)
                .isLessThanOrEqualTo(DipClassifierService.EXTENDED_RECOVERY_RATIO);
        assertThat(m.recovered()).isTrue();
        assertThat(result.dip()).isTrue();
    }

    @Test
    void deepDipMayRecoverWithinTwicePostWindow()
    {
        double[] series = concat(alternating(10), repeat(5, 3), repeat(6, 3), alternating(3));
        DetectionOptions shortPost = new DetectionOptions(50, 3, 2, 0.25, 0.0, true, 200);

        DipClassification deep = classifier.detectDip(series, 20, 22, shortPost);
        DipClassification moderate = classifier.detectDip(series, 20, 22, shortPost.withK(6));

        assertThat(deep.metrics().depth() / deep.metrics().depthThreshold())
                .isGreaterThan(DipClassifierService.EXTENDED_RECOVERY_RATIO);
        assertThat(deep.dip()).isTrue();
        assertThat(moderate.dip()).isFalse();
        assertThat(moderate.metrics().reason()).isEqualTo(RejectionReason.NO_RECOVERY);
    }

    @Test
    void veryDeepDipToleratesOneMadFromBaseline()
    {
        double[] series = concat(alternating(10), repeat(5, 3), repeat(6, 5), new double[] {9.65},
                new double[] {10, 10.2, 10, 10.2, 10});
        DetectionOptions shortPost = new DetectionOptions(50, 3, 2, 0.25, 0.0, true, 200);

        DipClassification veryDeep = classifier.detectDip(series, 20, 22, shortPost);
        DipClassification deep = classifier.detectDip(series, 20, 22, shortPost.withK(3.5));

        DipMetrics m = veryDeep.metrics();
        double distance = Math.abs(9.65 - m.baseline());
        assertThat(distance).isGreaterThan(0.5 * m.localMad()).isLessThanOrEqualTo(m.localMad());
        assertThat(m.depth() / m.depthThreshold()).isGreaterThan(DipClassifierService.RELAXED_RECOVERY_RATIO);
        assertThat(veryDeep.dip()).isTrue();

        assertThat(deep.metrics().depth() / deep.metrics().depthThreshold())
                .isGreaterThan(DipClassifierService.EXTENDED_RECOVERY_RATIO)
                .isLessThanOrEqualTo(DipClassifierService.RELAXED_RECOVERY_RATIO);
        assertThat(deep.dip()).isFalse();
        assertThat(deep.metrics().reason()).isEqualTo(RejectionReason.NO_RECOVERY);
    }

    // =========================================================================
    // Baseline context
    // =========================================================================

    @Test
    void smallContextWidensToSeriesWithoutSegment()
    {
        double[] series = concat(repeat(10, 10), new double[] {12, 12, 5, 5, 12, 12}, repeat(10, 10));

        DipMetrics narrow = classifier.detectDip(series, 12, 13,
                new DetectionOptions(2, 2, 2, 0.25, 0.0, true, 200)).metrics();
        DipMetrics wide = classifier.detectDip(series, 12, 13,
                new DetectionOptions(3, 3, 2, 0.25, 0.0, true, 200)).metrics();

        assertThat(narrow.localMedian()).isCloseTo(10.2, within(1e-9));
        assertThat(wide.localMedian()).isCloseTo(11.5, within(1e-9));
    }

    @Test
    void tinySeriesUsesWholeSeriesAsContext()
    {
        double[] series = {5, 1, 1, 5};

        DipMetrics m = classifier.detectDip(series, 1, 2).metrics();

        assertThat(m.localMedian()).isEqualTo(3.0);
        assertThat(m.globalMedian()).isEqualTo(5.0);
    }

    @Test
    void higherLocalLevelIsUsedAsBaseline()
    {
        double[] series = concat(repeat(2, 20), new double[] {10, 10.2, 10, 10.2, 10, 4, 4, 10, 10.2, 10, 10.2, 10},
                repeat(2, 20));

        DipMetrics m = classifier.detectDip(series, 25, 26, new DetectionOptions(5, 5, 2, 0.25, 0.0, true, 200))
                .metrics();

        assertThat(m.ongoing()).isFalse();
        assertThat(m.localMedian()).isCloseTo(10.075, within(1e-9));
        assertThat(m.globalMedian()).isEqualTo(3.0);
        assertThat(m.baseline()).isEqualTo(m.localMedian());
        assertThat(m.baseline()).isGreaterThan(m.alpha() * m.globalMedian() + (1 - m.alpha()) * m.localMedian());
    }

    private static double[] alternating(int pairs)
    {
        double[] x = new double[2 * pairs];
        for (int i = 0; i < x.length; i++) {
            x[i] = i % 2 == 0 ? 10 : 10.2;
        }
        return x;
    }

    private static double[] repeat(double value, int count)
    {
        double[] x = new double[count];
        Arrays.fill(x, value);
        return x;
    }

    private static double[] concat(double[]... parts)
    {
        return Arrays.stream(parts).flatMapToDouble(Arrays::stream).toArray();
    }
}
