package com.ammann.dip.enumeration;

/**
 * Direction of the trend leading into a dip.
 *
 * <p>{@link #NEUTRAL} and {@link #INSUFFICIENT_DATA} are only produced by the slope
 * method, {@link #MIXED} only by the moving-average and hybrid methods.
 */
public enum TrendDirection
{
    UPTREND(1),
    DOWNTREND(-1),
    MIXED(0),
    NEUTRAL(0),
    INSUFFICIENT_DATA(0);

    private final int sign;

    TrendDirection(int sign) {
        this.sign = sign;
    }

    /** Direction mapped to -1, 0 or 1. */
    public int getSign() { return sign; }
}
