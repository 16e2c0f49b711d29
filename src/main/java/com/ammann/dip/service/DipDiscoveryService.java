package com.ammann.dip.service;

import com.ammann.dip.model.DetectionOptions;
import com.ammann.dip.model.DipClassification;
import com.ammann.dip.model.DipMetrics;
import com.ammann.dip.model.DiscoveryOptions;
import com.ammann.dip.model.LocalMinimum;
import com.ammann.dip.model.Segment;
import com.ammann.dip.statistics.RobustStatistics;
import com.ammann.dip.statistics.SeriesEdge;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Finds every dip in a series without being told where to look.
 *
 * <p>The series is smoothed with a moving median at several scale factors so that
 * both sharp and slow dips produce a clear minimum at some scale. Each minimum is
 * expanded into a segment on the smoothed series and then classified on the raw
 * series by {@link DipClassifierService}. Accepted candidates from all scales are
 * merged where they overlap; dips confirmed at several scales get a confidence boost.
 *
 * <p>Results are ordered by confidence, highest first.
 */
@ApplicationScoped
public class DipDiscoveryService
{

    private static final Logger LOG = Logger.getLogger(DipDiscoveryService.class);

    private static final int MAX_AUTO_WINDOW = 50;
    private static final int MIN_CONTEXT = 3;
    private static final double TAIL_CONTEXT_PROMINENCE_FRACTION = 0.5;
    private static final double MERGE_DEEPER_FACTOR = 1.1;
    private static final double MERGE_SIMILAR_DEPTH = 0.1;
    private static final double MULTI_SCALE_BOOST = 0.1;

    private final LocalMinimumFinder minimumFinder;
    private final BoundaryExpander boundaryExpander;
    private final DipClassifierService classifier;

    @Inject
    public DipDiscoveryService(LocalMinimumFinder minimumFinder,
                               BoundaryExpander boundaryExpander,
                               DipClassifierService classifier)
    {
        this.minimumFinder = minimumFinder;
        this.boundaryExpander = boundaryExpander;
        this.classifier = classifier;
    }

    /**
     * Finds all dips with the default options.
     */
    public List<DipMetrics> findAllDips(double[] series)
    {
        return findAllDips(series, DiscoveryOptions.defaults());
    }

    /**
     * Finds all dips in {@code series}.
     *
     * @param series  samples, not modified
     * @param options discovery parameters
     * @return accepted dips sorted by confidence descending, at most {@code maxDips};
     *         empty when the series is shorter than {@code minWidth}
     */
    public List<DipMetrics> findAllDips(double[] series, DiscoveryOptions options)
    {
        int n = series.length;
        if (n < options.minWidth()) {
            return List.of();
        }

        long startTime = System.nanoTime();
        int preWindow = options.preWindow() != null ? options.preWindow() : autoWindow(n, options.minWidth());
        int postWindow = options.postWindow() != null ? options.postWindow() : autoWindow(n, options.minWidth());

        List<DipMetrics> candidates = new ArrayList<>();
        for (int scaleFactor : scaleFactors(n, options)) {
            candidates.addAll(candidatesAtScale(series, scaleFactor, preWindow, postWindow, options));
        }

        List<DipMetrics> merged = mergeAcrossScales(candidates);
        List<DipMetrics> ranked = merged.stream()
                .sorted(Comparator.comparingDouble(DipMetrics::confidence).reversed())
                .limit(Math.max(0, options.maxDips()))
                .toList();

        LOG.debugf("Dip discovery over %d samples: %d candidates, %d merged, %d returned in %.2fms",
                n, candidates.size(), merged.size(), ranked.size(), (System.nanoTime() - startTime) / 1_000_000.0);
        return ranked;
    }

    /**
     * Scale factors to analyse: the explicit list when given, {1} when multi-scale is
     * off, otherwise {1,2,4,8} above 200 samples, {1,2,4} above 50 and {1} below.
     */
    static List<Integer> scaleFactors(int n, DiscoveryOptions options)
    {
        if (!options.multiScale()) {
            return List.of(1);
        }
        if (options.scaleFactors() != null && !options.scaleFactors().isEmpty()) {
            return options.scaleFactors();
        }
        if (n > 200) {
            return List.of(1, 2, 4, 8);
        }
        if (n > 50) {
            return List.of(1, 2, 4);
        }
        return List.of(1);
    }

    /** Context window used when none is configured: a quarter of the series, within [minWidth, 50]. */
    static int autoWindow(int n, int minWidth)
    {
        return Math.max(minWidth, Math.min(MAX_AUTO_WINDOW, n / 4));
    }

    /** Minimum width required at a scale; coarser scales demand wider dips. */
    static int scaledMinWidth(int minWidth, int scaleFactor)
    {
        return Math.max(minWidth, (int) Math.round(minWidth * Math.sqrt(scaleFactor)));
    }

    private List<DipMetrics> candidatesAtScale(double[] series, int scaleFactor, int preWindow, int postWindow,
                                               DiscoveryOptions options)
    {
        int n = series.length;
        int window = Math.max(1, options.smoothingWindow() * scaleFactor);
        double[] smoothed = window > 1 ? RobustStatistics.movingMedian(series, window) : series;

        double globalMad = RobustStatistics.globalScale(smoothed);
        double minProminence = options.minProminenceFactor() / Math.sqrt(scaleFactor) * globalMad;
        int proximityRange = Math.min(10 * scaleFactor, n / 4);

        List<LocalMinimum> minima = minimumFinder.findLocalMinima(smoothed, minProminence, proximityRange);
        DetectionOptions detection = options.toDetectionOptions(
                preWindow, postWindow, scaledMinWidth(options.minWidth(), scaleFactor));

        List<DipMetrics> accepted = new ArrayList<>();
        for (LocalMinimum minimum : minima) {
            double baseline = RobustStatistics.median(baselineContext(smoothed, minimum, preWindow, postWindow));
            Segment segment = boundaryExpander.expand(smoothed, minimum.index(), baseline);

            DipClassification classification = classifier.detectDip(series, segment.start(), segment.end(), detection);
            if (classification.dip()) {
                accepted.add(classification.metrics().withScaleFactor(scaleFactor));
            }
        }

        LOG.debugf("Scale %d (window %d): %d minima, %d accepted (minProminence=%.4g)",
                scaleFactor, window, minima.size(), accepted.size(), minProminence);
        return accepted;
    }

    /**
     * Samples around a minimum used for its local baseline. Tail minima look back twice
     * the pre window and keep only samples still well above the minimum, so a partial
     * descent does not drag the baseline down.
     */
    private double[] baselineContext(double[] smoothed, LocalMinimum minimum, int preWindow, int postWindow)
    {
        int n = smoothed.length;
        int index = minimum.index();
        double[] context;

        if (SeriesEdge.isTailMinimum(index, n)) {
            context = Arrays.copyOfRange(smoothed, Math.max(0, index - 2 * preWindow), index);
            if (context.length > MIN_CONTEXT) {
                double level = minimum.value() + TAIL_CONTEXT_PROMINENCE_FRACTION * minimum.prominence();
                double[] stable = Arrays.stream(context, 0, context.length - 1)
                        .filter(v -> v >= level)
                        .toArray();
                if (stable.length >= MIN_CONTEXT) {
                    context = stable;
                }
            }
        } else {
            double[] before = Arrays.copyOfRange(smoothed, Math.max(0, index - preWindow), index);
            double[] after = Arrays.copyOfRange(smoothed, index + 1, Math.max(index + 1, Math.min(n, index + postWindow)));
            context = Arrays.copyOf(before, before.length + after.length);
            System.arraycopy(after, 0, context, before.length, after.length);
        }

        if (context.length < MIN_CONTEXT) {
            context = smoothed;
        }
        return context;
    }

    /**
     * Merges overlapping candidates detected at different scales.
     *
     * <p>Candidates are swept in start order. An overlapping candidate more than 10 %
     * deeper replaces the current one; one within 10 % of its depth counts as a
     * confirmation at its scale; anything else is dropped. Each finished dip records
     * its distinct confirming scales and, when there is more than one, its confidence
     * is raised by 10 % per additional scale, capped at 1.
     */
    List<DipMetrics> mergeAcrossScales(List<DipMetrics> candidates)
    {
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<DipMetrics> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingInt(DipMetrics::start));

        List<DipMetrics> merged = new ArrayList<>();
        DipMetrics current = sorted.get(0);
        TreeSet<Integer> scales = new TreeSet<>();
        scales.add(current.scaleFactor());

        for (DipMetrics next : sorted.subList(1, sorted.size())) {
            int gapTolerance = Math.max(2,
                    (int) Math.round(2 * Math.sqrt(Math.max(current.scaleFactor(), next.scaleFactor()))));

            if (next.start() > current.end() + gapTolerance) {
                merged.add(finish(current, scales));
                current = next;
                scales = new TreeSet<>();
                scales.add(next.scaleFactor());
                continue;
            }

            if (next.depth() > current.depth() * MERGE_DEEPER_FACTOR) {
                current = next;
                scales = new TreeSet<>();
                scales.add(next.scaleFactor());
            } else if (current.depth() > 0
                    && Math.abs(next.depth() - current.depth()) / current.depth() < MERGE_SIMILAR_DEPTH) {
                scales.add(next.scaleFactor());
            }
        }
        merged.add(finish(current, scales));
        return merged;
    }

    private DipMetrics finish(DipMetrics dip, TreeSet<Integer> scales)
    {
        double confidence = dip.confidence();
        if (scales.size() > 1) {
            confidence = Math.min(1.0, confidence * (1.0 + MULTI_SCALE_BOOST * (scales.size() - 1)));
        }
        return dip.withScaleSummary(List.copyOf(scales), confidence);
    }
}
