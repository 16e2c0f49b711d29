/* (C)2026 */
package com.ammann.dip.model;

/**
 * A prominence-qualified local minimum of a (possibly smoothed) series.
 *
 * @param index      representative index; the midpoint for flat plateaus
 * @param value      sample value at {@code index}
 * @param prominence height of the lower bounding maximum above {@code value}
 */
public record LocalMinimum(int index, double value, double prominence) {}
