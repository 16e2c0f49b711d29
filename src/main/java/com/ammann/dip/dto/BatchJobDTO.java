/* (C)2026 */
package com.ammann.dip.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "One series of a batch discovery request")
public record BatchJobDTO(
        @Schema(description = "Caller-chosen identifier echoed in the result", required = true, example = "ACME")
        String ticker,

        @Schema(description = "Period the series covers; omitted runs plain discovery",
                enumeration = {"5y", "3y", "12m", "6m", "3m", "1m", "1w"})
        String interval,

        @Schema(description = "Samples of the series", required = true)
        List<Double> series,

        @Schema(description = "Discovery options")
        DiscoveryOptionsDTO options
) {}
