package com.ammann.dip.service;

import com.ammann.dip.model.LocalMinimum;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds prominence-qualified local minima in a series.
 *
 * <p>Flat bottoms are collapsed to their midpoint. Prominence is measured against the
 * highest samples found up to {@code proximityRange} positions beyond the immediate
 * neighbours on each side, so the search radius follows the noise scale the caller is
 * working at.
 *
 * <p>A strictly descending tail is reported as a minimum at the last index even though
 * no rise after it has been observed yet.
 */
@ApplicationScoped
public class LocalMinimumFinder
{

    private static final Logger LOG = Logger.getLogger(LocalMinimumFinder.class);

    static final int DEFAULT_PROXIMITY_RANGE = 10;

    /**
     * Finds local minima whose prominence is at least {@code minProminence}.
     *
     * @param series         samples, not modified
     * @param minProminence  prominence floor
     * @param proximityRange how far beyond the neighbours to look for bounding maxima
     * @return minima in ascending index order, the synthetic tail minimum (if any) last
     */
    public List<LocalMinimum> findLocalMinima(double[] series, double minProminence, int proximityRange)
    {
        int n = series.length;
        List<LocalMinimum> minima = new ArrayList<>();
        if (n < 3) {
            return minima;
        }

        int i = 1;
        while (i < n - 1) {
            if (series[i] > series[i - 1] || series[i] > series[i + 1]) {
                i++;
                continue;
            }

            int j = i;
            while (j < n - 1 && series[j + 1] == series[i]) {
                j++;
            }

            if (isPlateauMinimum(series, i, j)) {
                int minIndex = (i + j) / 2;
                double prominence = plateauProminence(series, i, j, minIndex, proximityRange);
                if (prominence >= minProminence) {
                    minima.add(new LocalMinimum(minIndex, series[minIndex], prominence));
                }
            }
            i = j + 1;
        }

        addOngoingTailMinimum(series, minProminence, proximityRange, minima);

        LOG.debugf("Found %d local minima (minProminence=%.4g, proximityRange=%d) in %d samples",
                minima.size(), minProminence, proximityRange, n);
        return minima;
    }

    /** Default neighbour search radius of 10 samples. */
    public List<LocalMinimum> findLocalMinima(double[] series, double minProminence)
    {
        return findLocalMinima(series, minProminence, DEFAULT_PROXIMITY_RANGE);
    }

    /**
     * A plateau {@code [i, j]} is a minimum when it is strictly below at least one
     * existing side and not above either.
     */
    private boolean isPlateauMinimum(double[] x, int i, int j)
    {
        int last = x.length - 1;
        boolean belowLeft = x[i] < x[i - 1];
        if (belowLeft && (j == last || x[i] < x[j + 1])) {
            return true;
        }
        if (j == last) {
            return false;
        }
        return x[i] <= x[i - 1] && x[i] <= x[j + 1] && (belowLeft || x[i] < x[j + 1]);
    }

    private double plateauProminence(double[] x, int i, int j, int minIndex, int proximityRange)
    {
        int n = x.length;
        double leftHigher = x[i - 1];
        double rightHigher = j < n - 1 ? x[j + 1] : x[minIndex];

        for (int k = Math.max(0, i - proximityRange); k < i; k++) {
            leftHigher = Math.max(leftHigher, x[k]);
        }
        for (int k = j + 1; k < Math.min(n, j + proximityRange + 1); k++) {
            rightHigher = Math.max(rightHigher, x[k]);
        }
        return Math.min(leftHigher, rightHigher) - x[minIndex];
    }

    private void addOngoingTailMinimum(double[] x, double minProminence, int proximityRange,
                                       List<LocalMinimum> minima)
    {
        int last = x.length - 1;
        if (!(x[last] < x[last - 1])) {
            return;
        }

        // walk back to the sample where the descent starts
        int descentStart = last - 1;
        while (descentStart > 0 && x[descentStart] < x[descentStart - 1]) {
            descentStart--;
        }

        double leftHigher = x[descentStart];
        for (int k = Math.max(0, descentStart - proximityRange); k <= descentStart; k++) {
            leftHigher = Math.max(leftHigher, x[k]);
        }

        double prominence = leftHigher - x[last];
        boolean alreadyCaptured = minima.stream().anyMatch(m -> m.index() == last);
        if (prominence >= minProminence && !alreadyCaptured) {
            LOG.debugf("Ongoing descent from index %d to tail, prominence %.4g",
                    Integer.valueOf(descentStart), Double.valueOf(prominence));
            minima.add(new LocalMinimum(last, x[last], prominence));
        }
    }
}
