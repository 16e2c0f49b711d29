/* (C)2026 */
package com.ammann.dip.model;

import com.ammann.dip.enumeration.TimeInterval;
import java.util.List;

/**
 * Outcome of one batch job.
 *
 * @param ticker   identifier of the job
 * @param interval period of the job, may be {@code null}
 * @param dips     dips found, empty when the job failed
 * @param error    failure message, {@code null} on success
 */
public record DipDetectionResult(String ticker, TimeInterval interval, List<DipMetrics> dips, String error) {

    public DipDetectionResult {
        dips = List.copyOf(dips);
    }

    public static DipDetectionResult success(DipDetectionJob job, List<DipMetrics> dips) {
        return new DipDetectionResult(job.ticker(), job.interval(), dips, null);
    }

    public static DipDetectionResult failure(DipDetectionJob job, String error) {
        return new DipDetectionResult(job.ticker(), job.interval(), List.of(), error);
    }

    public boolean failed() {
        return error != null;
    }
}
