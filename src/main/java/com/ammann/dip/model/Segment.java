/* (C)2026 */
package com.ammann.dip.model;

/**
 * Closed index interval {@code [start, end]} over a series.
 *
 * @param start first index, inclusive
 * @param end   last index, inclusive
 */
public record Segment(int start, int end) {

    public Segment {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(
                    String.format("Invalid segment [%d, %d]", start, end));
        }
    }

    /** Number of samples covered, {@code end - start + 1}. */
    public int width() {
        return end - start + 1;
    }

    /** Returns {@code true} when {@code index} lies inside the segment. */
    public boolean contains(int index) {
        return index >= start && index <= end;
    }
}
