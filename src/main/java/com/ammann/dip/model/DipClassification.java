/* (C)2026 */
package com.ammann.dip.model;

/**
 * Verdict of single-segment classification together with the full metrics that
 * explain it.
 *
 * @param dip     whether the segment is accepted as a dip
 * @param metrics measurements behind the verdict, returned even when rejected
 */
public record DipClassification(boolean dip, DipMetrics metrics) {}
