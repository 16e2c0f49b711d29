/* (C)2026 */
package com.ammann.dip.dto;

import com.ammann.dip.model.DipClassification;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Verdict for one segment")
public record DipClassificationResponseDTO(
        @Schema(description = "Whether the segment is a dip") boolean dip,
        @Schema(description = "Measurements behind the verdict") DipMetricsDTO metrics,
        @Schema(description = "Processing time in nanoseconds") long processingTimeNanos
) {
    public static DipClassificationResponseDTO from(DipClassification classification, long processingTimeNanos) {
        return new DipClassificationResponseDTO(
                classification.dip(), DipMetricsDTO.from(classification.metrics()), processingTimeNanos);
    }
}
