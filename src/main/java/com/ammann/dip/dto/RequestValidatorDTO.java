/* (C)2026 */
package com.ammann.dip.dto;

import com.ammann.dip.exception.ValidationException;
import java.util.List;

/**
 * Validation utility for request payloads.
 *
 * <p>Enforces hard limits to prevent:
 * <ul>
 *   <li>Non-numeric or non-finite samples reaching the engine</li>
 *   <li>Memory exhaustion and long computations from oversized series</li>
 *   <li>Meaningless option values (negative windows, zero widths)</li>
 * </ul>
 */
public class RequestValidatorDTO {

    private RequestValidatorDTO() {}

    /**
     * Converts the request series to an array.
     *
     * @param series    request samples
     * @param maxLength largest accepted series
     * @return the samples as {@code double[]}
     * @throws ValidationException if the series is missing, empty, too long, or contains
     *                             null or non-finite samples
     */
    public static double[] toSeries(List<Double> series, int maxLength) {
        if (series == null || series.isEmpty()) {
            throw ValidationException.insufficientData("series samples", 1, 0);
        }
        if (series.size() > maxLength) {
            throw ValidationException.invalidParameter("series", series.size() + " samples", "at most " + maxLength);
        }
        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) {
            Double value = series.get(i);
            if (value == null || !Double.isFinite(value)) {
                throw ValidationException.invalidParameter("series[" + i + "]", value, "finite number");
            }
            values[i] = value;
        }
        return values;
    }

    /**
     * Checks that {@code [start, end]} is a valid segment of a series of {@code length} samples.
     */
    public static void validateSegment(Integer start, Integer end, int length) {
        if (start == null || end == null) {
            throw ValidationException.invalidParameter("start/end", "null", "segment indices");
        }
        if (start < 0 || end >= length || end < start) {
            throw ValidationException.invalidSegment(start, end, length);
        }
    }

    static int positive(String name, int value) {
        if (value < 1) {
            throw ValidationException.invalidParameter(name, value, "positive integer");
        }
        return value;
    }

    static int nonNegative(String name, int value) {
        if (value < 0) {
            throw ValidationException.invalidParameter(name, value, "non-negative integer");
        }
        return value;
    }

    static double nonNegative(String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw ValidationException.invalidParameter(name, value, "non-negative number");
        }
        return value;
    }
}
