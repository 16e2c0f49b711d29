/* (C)2026 */
package com.ammann.dip.dto;

import com.ammann.dip.model.DipDetectionResult;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Results of a batch discovery request, in request order")
public record BatchDiscoverResponseDTO(
        @Schema(description = "Number of jobs") int totalJobs,
        @Schema(description = "Number of failed jobs") int failedJobs,
        @Schema(description = "Processing time in nanoseconds") long processingTimeNanos,
        @Schema(description = "Per-job results") List<BatchJobResultDTO> results
) {
    public static BatchDiscoverResponseDTO from(List<DipDetectionResult> results, long processingTimeNanos) {
        int failed = (int) results.stream().filter(DipDetectionResult::failed).count();
        return new BatchDiscoverResponseDTO(results.size(), failed, processingTimeNanos,
                results.stream().map(BatchJobResultDTO::from).toList());
    }
}
