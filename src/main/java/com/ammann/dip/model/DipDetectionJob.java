/* (C)2026 */
package com.ammann.dip.model;

import com.ammann.dip.enumeration.TimeInterval;

/**
 * One discovery request within a batch.
 *
 * @param ticker   caller-chosen identifier echoed in the result
 * @param interval period the series covers; {@code null} runs plain discovery
 * @param series   samples, not modified
 * @param options  discovery parameters
 */
public record DipDetectionJob(String ticker, TimeInterval interval, double[] series, DiscoveryOptions options) {}
