/* (C)2026 */
package com.ammann.dip.service;

import com.ammann.dip.enumeration.TimeInterval;
import com.ammann.dip.model.DipMetrics;
import com.ammann.dip.model.DiscoveryOptions;
import com.ammann.dip.statistics.SeriesEdge;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import org.jboss.logging.Logger;

/**
 * Dip discovery over long series using a sliding window.
 *
 * <p>Baselines computed over several years of data wash out dips that are obvious
 * within a few months. This service runs {@link DipDiscoveryService} on every window
 * of {@code windowSize} samples and merges the per-window results into one list with
 * global indices.
 */
@ApplicationScoped
public class RollingDipDiscoveryService {

    private static final Logger LOG = Logger.getLogger(RollingDipDiscoveryService.class);

    public static final int DEFAULT_WINDOW_SIZE = TimeInterval.SIX_MONTHS.getDays();
    static final int MIN_WINDOW_SIZE = 5;
    static final int DEFAULT_GAP_TOLERANCE = 2;

    private static final double PREFER_DEEPER_FACTOR = 1.05;
    private static final double SIMILAR_DEPTH = 0.1;
    private static final double SIMILAR_DEPTH_BOOST = 1.05;
    private static final double HIT_BOOST_STEP = 0.02;
    private static final double HIT_BOOST_CAP = 0.1;

    private final DipDiscoveryService discoveryService;

    @Inject
    public RollingDipDiscoveryService(DipDiscoveryService discoveryService) {
        this.discoveryService = discoveryService;
    }

    /**
     * Picks direct or rolling discovery depending on how many trading days the series covers.
     *
     * @param series       samples, not modified
     * @param intervalDays trading days covered by the series
     * @param options      discovery parameters
     * @return dips with global indices, ongoing flags relative to the full series
     */
    public List<DipMetrics> findDipsForInterval(double[] series, int intervalDays, DiscoveryOptions options) {
        if (intervalDays > DEFAULT_WINDOW_SIZE) {
            return findDipsRolling(series, options, DEFAULT_WINDOW_SIZE, 1);
        }
        return normalizeOngoing(discoveryService.findAllDips(series, options), series.length);
    }

    /** Same as {@link #findDipsForInterval(double[], int, DiscoveryOptions)} for a named interval. */
    public List<DipMetrics> findDipsForInterval(double[] series, TimeInterval interval, DiscoveryOptions options) {
        return findDipsForInterval(series, interval.getDays(), options);
    }

    /**
     * Runs discovery on each window of {@code windowSize} samples, advancing by
     * {@code stride}, and merges the results.
     *
     * @param series     samples, not modified
     * @param options    discovery parameters applied to every window
     * @param windowSize window length; at least 5 samples are used
     * @param stride     step between windows; at least 1
     * @return merged dips sorted by confidence then depth, both descending
     */
    public List<DipMetrics> findDipsRolling(double[] series, DiscoveryOptions options, int windowSize, int stride) {
        int n = series.length;
        if (n == 0) {
            return List.of();
        }
        if (n <= windowSize) {
            return normalizeOngoing(discoveryService.findAllDips(series, options), n);
        }

        int step = Math.max(1, stride);
        int window = Math.max(MIN_WINDOW_SIZE, windowSize);
        List<DipMetrics> all = new ArrayList<>();
        int windows = 0;

        for (int offset = 0; offset <= n - window; offset += step) {
            double[] slice = Arrays.copyOfRange(series, offset, offset + window);
            for (DipMetrics dip : discoveryService.findAllDips(slice, options)) {
                all.add(dip.shiftedBy(offset));
            }
            windows++;
        }

        LOG.debugf("Rolling discovery: %d windows of %d samples produced %d raw dips", windows, window, all.size());
        if (all.isEmpty()) {
            return List.of();
        }
        return mergeAcrossWindows(all, n, DEFAULT_GAP_TOLERANCE);
    }

    /**
     * Merges overlapping or nearly adjacent dips found in different windows.
     *
     * <p>Overlapping dips are combined into one envelope covering both. The metrics of
     * a dip more than 5 % deeper replace the current ones; otherwise the current metrics
     * stay and a dip of similar depth (within 10 %) raises confidence by 5 %. Every
     * corroborating window adds a further boost of {@code min(0.1, 0.02 * hits)}.
     */
    List<DipMetrics> mergeAcrossWindows(List<DipMetrics> dips, int seriesLength, int gapTolerance) {
        if (dips.size() == 1) {
            return List.of(finish(dips.get(0), scalesOf(dips.get(0)), seriesLength));
        }

        List<DipMetrics> sorted = new ArrayList<>(dips);
        sorted.sort(Comparator.comparingInt(DipMetrics::start));

        List<DipMetrics> merged = new ArrayList<>();
        DipMetrics current = sorted.get(0);
        TreeSet<Integer> scales = scalesOf(current);
        int windowHits = 1;

        for (DipMetrics next : sorted.subList(1, sorted.size())) {
            if (next.start() > current.end() + gapTolerance) {
                merged.add(finish(current, scales, seriesLength));
                current = next;
                scales = scalesOf(next);
                windowHits = 1;
                continue;
            }

            int envelopeStart = Math.min(current.start(), next.start());
            int envelopeEnd = Math.max(current.end(), next.end());
            boolean preferNext = next.depth() > current.depth() * PREFER_DEEPER_FACTOR;

            if (preferNext) {
                current = next.withBounds(envelopeStart, envelopeEnd);
            } else {
                current = current.withBounds(envelopeStart, envelopeEnd);
                double relative = Math.abs(next.depth() - current.depth()) / Math.max(1e-9, current.depth());
                if (relative < SIMILAR_DEPTH) {
                    current = current.withConfidence(Math.min(1.0, current.confidence() * SIMILAR_DEPTH_BOOST));
                }
            }

            scales.addAll(scalesOf(next));
            windowHits++;
            double boost = 1.0 + Math.min(HIT_BOOST_CAP, HIT_BOOST_STEP * windowHits);
            current = current.withConfidence(Math.min(1.0, current.confidence() * boost));
        }
        merged.add(finish(current, scales, seriesLength));

        merged.sort(Comparator.comparingDouble(DipMetrics::confidence)
                .thenComparingDouble(DipMetrics::depth)
                .reversed());
        return merged;
    }

    private List<DipMetrics> normalizeOngoing(List<DipMetrics> dips, int seriesLength) {
        return dips.stream()
                .map(d -> d.withOngoing(SeriesEdge.isLiveEdge(d.end(), seriesLength)))
                .toList();
    }

    private DipMetrics finish(DipMetrics dip, TreeSet<Integer> scales, int seriesLength) {
        return dip.withBounds(dip.start(), dip.end())
                .withOngoing(SeriesEdge.isLiveEdge(dip.end(), seriesLength))
                .withScaleSummary(List.copyOf(scales), dip.confidence());
    }

    private static TreeSet<Integer> scalesOf(DipMetrics dip) {
        TreeSet<Integer> scales = new TreeSet<>();
        if (dip.scaleList() != null && !dip.scaleList().isEmpty()) {
            scales.addAll(dip.scaleList());
        } else if (dip.scaleFactor() != null) {
            scales.add(dip.scaleFactor());
        }
        return scales;
    }
}
