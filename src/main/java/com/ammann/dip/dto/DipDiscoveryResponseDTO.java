/* (C)2026 */
package com.ammann.dip.dto;

import com.ammann.dip.model.DipMetrics;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Dips found in a series, highest confidence first")
public record DipDiscoveryResponseDTO(
        @Schema(description = "Number of dips returned") int count,
        @Schema(description = "Number of samples analysed") int seriesLength,
        @Schema(description = "Processing time in nanoseconds") long processingTimeNanos,
        @Schema(description = "Dips") List<DipMetricsDTO> dips
) {
    public static DipDiscoveryResponseDTO from(List<DipMetrics> dips, int seriesLength, long processingTimeNanos) {
        return new DipDiscoveryResponseDTO(dips.size(), seriesLength, processingTimeNanos, DipMetricsDTO.fromAll(dips));
    }
}
