package com.ammann.dip.service;

import com.ammann.dip.enumeration.TrendDirection;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes the trend a series was in when it reached a dip.
 *
 * <p>Two methods are combined:
 * <ul>
 *   <li>moving averages: the sample at the dip votes up or down against the trailing
 *   mean of each configured period</li>
 *   <li>slope: sign of the least-squares slope over the samples before the dip</li>
 * </ul>
 * The hybrid verdict is the common direction when both agree and {@code MIXED} otherwise.
 */
@ApplicationScoped
public class TrendContextService
{

    private static final Logger LOG = Logger.getLogger(TrendContextService.class);

    public static final List<Integer> DEFAULT_MA_PERIODS = List.of(20, 50, 200);
    public static final int DEFAULT_LOOKBACK = 50;

    /**
     * Hybrid trend context with the default periods (20, 50, 200) and a 50-sample lookback.
     */
    public HybridTrendContext hybridTrend(double[] series, int dipIndex)
    {
        return hybridTrend(series, dipIndex, DEFAULT_MA_PERIODS, DEFAULT_LOOKBACK);
    }

    /**
     * Combines the moving-average and slope methods.
     *
     * @param series    samples, not modified
     * @param dipIndex  index of the dip minimum
     * @param maPeriods moving-average periods
     * @param lookback  samples before the dip used for the slope
     * @return both partial results and the combined verdict
     */
    public HybridTrendContext hybridTrend(double[] series, int dipIndex, List<Integer> maPeriods, int lookback)
    {
        validateIndex(series, dipIndex);
        MovingAverageTrend maTrend = movingAverageTrend(series, dipIndex, maPeriods);
        SlopeTrend slopeTrend = slopeTrend(series, dipIndex, lookback);

        TrendDirection finalTrend = maTrend.trend() == slopeTrend.trend() ? maTrend.trend() : TrendDirection.MIXED;
        double combinedScore = (maTrend.trend().getSign() + slopeTrend.trend().getSign()) / 2.0;

        LOG.debugf("Trend at index %d: ma=%s slope=%s final=%s", dipIndex, maTrend.trend(), slopeTrend.trend(), finalTrend);
        return new HybridTrendContext(finalTrend, combinedScore, maTrend, slopeTrend);
    }

    /**
     * Votes the sample at {@code dipIndex} against the trailing mean of each period.
     * Samples equal to a mean do not vote.
     */
    public MovingAverageTrend movingAverageTrend(double[] series, int dipIndex, List<Integer> maPeriods)
    {
        validateIndex(series, dipIndex);
        Map<Integer, Double> averages = new LinkedHashMap<>();
        int up = 0;
        int down = 0;

        for (int period : maPeriods) {
            if (period <= 0) {
                throw new IllegalArgumentException("Moving average period must be positive, got " + period);
            }
            double average = trailingMean(series, dipIndex, period);
            averages.put(period, average);
            double current = series[dipIndex];
            if (current > average) {
                up++;
            } else if (current < average) {
                down++;
            }
        }

        int votes = up + down;
        TrendDirection trend = TrendDirection.MIXED;
        double score = 0.0;
        if (votes > 0) {
            if (up > down) trend = TrendDirection.UPTREND;
            else if (down > up) trend = TrendDirection.DOWNTREND;
            score = (up - down) / (double) Math.max(1, votes);
        }
        return new MovingAverageTrend(trend, score, averages);
    }

    /**
     * Least-squares slope of the {@code lookback} samples before {@code dipIndex}.
     * Returns {@code INSUFFICIENT_DATA} when fewer samples precede the dip.
     */
    public SlopeTrend slopeTrend(double[] series, int dipIndex, int lookback)
    {
        if (series.length == 0 || dipIndex <= 0 || dipIndex - lookback < 0) {
            return new SlopeTrend(TrendDirection.INSUFFICIENT_DATA, null);
        }

        int start = dipIndex - lookback;
        int count = dipIndex - start;
        if (count < 2) {
            return new SlopeTrend(TrendDirection.NEUTRAL, 0.0);
        }

        double meanX = (count - 1) / 2.0;
        double meanY = 0.0;
        for (int i = start; i < dipIndex; i++) {
            meanY += series[i];
        }
        meanY /= count;

        double numerator = 0.0;
        double denominator = 0.0;
        for (int i = 0; i < count; i++) {
            double dx = i - meanX;
            numerator += dx * (series[start + i] - meanY);
            denominator += dx * dx;
        }
        double slope = denominator == 0 ? 0.0 : numerator / denominator;
        double slopePct = meanY != 0 ? slope / meanY * 100.0 : 0.0;

        TrendDirection trend = TrendDirection.NEUTRAL;
        if (slope > 0) trend = TrendDirection.UPTREND;
        else if (slope < 0) trend = TrendDirection.DOWNTREND;
        return new SlopeTrend(trend, slopePct);
    }

    private static double trailingMean(double[] series, int endIndex, int period)
    {
        int from = Math.max(0, endIndex - period + 1);
        double sum = 0.0;
        for (int i = from; i <= endIndex; i++) {
            sum += series[i];
        }
        return sum / (endIndex - from + 1);
    }

    private static void validateIndex(double[] series, int dipIndex)
    {
        if (dipIndex < 0 || dipIndex >= series.length) {
            throw new IllegalArgumentException(String.format(
                    "Dip index %d outside series of length %d", dipIndex, series.length));
        }
    }

    /**
     * Moving-average verdict.
     *
     * @param trend          UPTREND, DOWNTREND or MIXED
     * @param trendScore     (up - down) / votes, in [-1, 1]
     * @param movingAverages trailing mean per period, in period order
     */
    public record MovingAverageTrend(TrendDirection trend, double trendScore, Map<Integer, Double> movingAverages)
    {
        public MovingAverageTrend
        {
            movingAverages = Collections.unmodifiableMap(new LinkedHashMap<>(movingAverages));
        }
    }

    /**
     * Slope verdict.
     *
     * @param trend           UPTREND, DOWNTREND, NEUTRAL or INSUFFICIENT_DATA
     * @param slopePctPerBar  slope relative to the mean level in percent per sample,
     *                        {@code null} without enough data
     */
    public record SlopeTrend(TrendDirection trend, Double slopePctPerBar)
    {
    }

    /**
     * Combined trend context.
     *
     * @param finalTrend    common direction of both methods, MIXED when they disagree
     * @param combinedScore mean of both directions mapped to -1, 0 and 1
     */
    public record HybridTrendContext(
            TrendDirection finalTrend,
            double combinedScore,
            MovingAverageTrend movingAverage,
            SlopeTrend slope
    )
    {
    }
}
