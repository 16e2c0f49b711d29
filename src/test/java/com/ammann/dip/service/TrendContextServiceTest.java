package com.ammann.dip.service;

import com.ammann.dip.enumeration.TrendDirection;
import com.ammann.dip.service.TrendContextService.HybridTrendContext;
import com.ammann.dip.service.TrendContextService.MovingAverageTrend;
import com.ammann.dip.service.TrendContextService.SlopeTrend;
import com.ammann.dip.support.SeriesFixtures;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TrendContextServiceTest
{

    private final TrendContextService service = new TrendContextService();

    @Test
    void risingSeriesIsUptrend()
    {
        double[] series = SeriesFixtures.ramp(1, 1, 100);

        HybridTrendContext context = service.hybridTrend(series, 99);

        assertThat(context.finalTrend()).isEqualTo(TrendDirection.UPTREND);
        assertThat(context.combinedScore()).isEqualTo(1.0);
        assertThat(context.movingAverage().trendScore()).isEqualTo(1.0);
        assertThat(context.movingAverage().movingAverages())
                .containsEntry(20, 90.5)
                .containsEntry(50, 75.5)
                .containsEntry(200, 50.5);
        // slope 1 over a mean level of 74.5
        assertThat(context.slope().slopePctPerBar()).isCloseTo(100.0 / 74.5, within(1e-9));
    }

    @Test
    void fallingSeriesIsDowntrend()
    {
        double[] series = SeriesFixtures.ramp(100, -1, 100);

        HybridTrendContext context = service.hybridTrend(series, 99);

        assertThat(context.finalTrend()).isEqualTo(TrendDirection.DOWNTREND);
        assertThat(context.combinedScore()).isEqualTo(-1.0);
    }

    @Test
    void crashAfterRallyIsMixed()
    {
        double[] series = Arrays.copyOf(SeriesFixtures.ramp(1, 1, 60), 61);
        series[60] = 0;

        HybridTrendContext context = service.hybridTrend(series, 60);

        assertThat(context.movingAverage().trend()).isEqualTo(TrendDirection.DOWNTREND);
        assertThat(context.slope().trend()).isEqualTo(TrendDirection.UPTREND);
        assertThat(context.finalTrend()).isEqualTo(TrendDirection.MIXED);
        assertThat(context.combinedScore()).isZero();
    }

    @Test
    void slopeNeedsFullLookback()
    {
        SlopeTrend slope = service.slopeTrend(SeriesFixtures.ramp(1, 1, 100), 10, 50);

        assertThat(slope.trend()).isEqualTo(TrendDirection.INSUFFICIENT_DATA);
        assertThat(slope.slopePctPerBar()).isNull();
    }

    @Test
    void singleSampleLookbackIsNeutral()
    {
        SlopeTrend slope = service.slopeTrend(SeriesFixtures.ramp(1, 1, 100), 10, 1);

        assertThat(slope.trend()).isEqualTo(TrendDirection.NEUTRAL);
        assertThat(slope.slopePctPerBar()).isEqualTo(0.0);
    }

    @Test
    void flatSeriesHasNoMovingAverageVotes()
    {
        MovingAverageTrend trend = service.movingAverageTrend(SeriesFixtures.constant(5, 30), 29, List.of(5, 10));

        assertThat(trend.trend()).isEqualTo(TrendDirection.MIXED);
        assertThat(trend.trendScore()).isZero();
        assertThat(trend.movingAverages().keySet()).containsExactly(5, 10);
    }

    @Test
    void rejectsIndexOutsideSeriesAndNonPositivePeriods()
    {
        double[] series = SeriesFixtures.ramp(1, 1, 10);

        assertThatThrownBy(() -> service.hybridTrend(series, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.movingAverageTrend(series, 5, List.of(0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
