package com.ammann.dip.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a classified segment was not accepted as a dip.
 */
public enum RejectionReason
{
    /** Segment is narrower than the configured minimum width. */
    WIDTH_BELOW_MIN("width_below_min"),
    /** Depth below baseline does not reach the depth threshold. */
    DEPTH_BELOW_THRESHOLD("depth_below_threshold"),
    /** Signal does not return near the baseline after the segment. */
    NO_RECOVERY("no_recovery");

    private final String code;

    RejectionReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() { return code; }
}
