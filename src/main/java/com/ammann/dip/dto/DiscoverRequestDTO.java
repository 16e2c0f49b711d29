/* (C)2026 */
package com.ammann.dip.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Discover all dips in a series")
public record DiscoverRequestDTO(
        @Schema(description = "Samples of the series", required = true)
        List<Double> series,

        @Schema(description = "Discovery options")
        DiscoveryOptionsDTO options
) {}
