package com.ammann.dip.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Human-readable label for the smoothing scale at which a dip was detected.
 *
 * <p>Scale factor 1 detects fast dips, 2 medium ones, anything coarser slow ones.
 */
public enum DetectionScale
{
    FAST("fast"),
    MEDIUM("medium"),
    SLOW("slow");

    private final String code;

    DetectionScale(String code) {
        this.code = code;
    }

    /**
     * Returns the label for a smoothing scale factor.
     *
     * @param scaleFactor smoothing window multiplier (1 or more)
     * @return {@link #FAST} for 1, {@link #MEDIUM} up to 2, {@link #SLOW} above
     */
    public static DetectionScale forScaleFactor(int scaleFactor) {
        if (scaleFactor == 1) return FAST;
        if (scaleFactor <= 2) return MEDIUM;
        return SLOW;
    }

    @JsonValue
    public String getCode() { return code; }
}
