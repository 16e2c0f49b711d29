/* (C)2026 */
package com.ammann.dip.dto;

import com.ammann.dip.enumeration.TimeInterval;
import com.ammann.dip.model.DipDetectionResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Outcome of one batch job")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchJobResultDTO(
        @Schema(description = "Job identifier") String ticker,
        @Schema(description = "Period of the job") TimeInterval interval,
        @Schema(description = "Number of dips found") int count,
        @Schema(description = "Dips found, empty when the job failed") List<DipMetricsDTO> dips,
        @Schema(description = "Failure message") String error
) {
    public static BatchJobResultDTO from(DipDetectionResult result) {
        return new BatchJobResultDTO(result.ticker(), result.interval(), result.dips().size(),
                DipMetricsDTO.fromAll(result.dips()), result.error());
    }
}
