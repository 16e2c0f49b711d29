/* (C)2026 */
package com.ammann.dip.enumeration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Look-back periods a series can cover, expressed in trading days.
 *
 * <p>Used to pick between direct and rolling-window discovery: periods longer than
 * {@link #SIX_MONTHS} are scanned with a sliding window.
 */
public enum TimeInterval {
    FIVE_YEARS("5y", "5 Years", 1250),
    THREE_YEARS("3y", "3 Years", 750),
    TWELVE_MONTHS("12m", "12 Months", 250),
    SIX_MONTHS("6m", "6 Months", 125),
    THREE_MONTHS("3m", "3 Months", 65),
    ONE_MONTH("1m", "1 Month", 20),
    ONE_WEEK("1w", "1 Week", 5);

    private final String code;
    private final String label;
    private final int days;

    TimeInterval(String code, String label, int days) {
        this.code = code;
        this.label = label;
        this.days = days;
    }

    /**
     * Resolves an interval from its short code (for example {@code "6m"}).
     *
     * @throws IllegalArgumentException if the code is unknown
     */
    @JsonCreator
    public static TimeInterval fromCode(String code) {
        for (TimeInterval interval : values()) {
            if (interval.code.equalsIgnoreCase(code)) {
                return interval;
            }
        }
        throw new IllegalArgumentException("Unknown time interval: " + code);
    }

    @JsonValue
    public String getCode() { return code; }

    public String getLabel() { return label; }

    public int getDays() { return days; }
}
