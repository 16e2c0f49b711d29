/* (C)2026 */
package com.ammann.dip.statistics;

/**
 * Decides whether a position sits at the live edge of a series, i.e. close enough
 * to the last sample that a recovery after it cannot have been observed yet.
 *
 * <p>Every component that treats tail positions specially goes through
 * {@link #withinTail(int, int, int)}.
 */
public final class SeriesEdge {

    /** Samples after a segment's end below which the segment counts as ongoing. */
    public static final int ONGOING_TOLERANCE = 2;

    /** Samples after a minimum below which discovery treats it as a tail minimum. */
    public static final int TAIL_MINIMUM_TOLERANCE = 1;

    private SeriesEdge() {}

    /**
     * Returns {@code true} when at most {@code tolerance} samples follow {@code index}
     * in a series of {@code length} samples.
     */
    public static boolean withinTail(int index, int length, int tolerance) {
        return index >= length - 1 - tolerance;
    }

    /** Segment end within two samples of the end of the data. */
    public static boolean isLiveEdge(int end, int length) {
        return withinTail(end, length, ONGOING_TOLERANCE);
    }

    /** Minimum located on one of the last two samples. */
    public static boolean isTailMinimum(int index, int length) {
        return withinTail(index, length, TAIL_MINIMUM_TOLERANCE);
    }
}
