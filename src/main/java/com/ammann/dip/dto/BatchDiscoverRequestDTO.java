/* (C)2026 */
package com.ammann.dip.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Run discovery on several series concurrently")
public record BatchDiscoverRequestDTO(
        @Schema(description = "Jobs to run", required = true)
        List<BatchJobDTO> jobs
) {}
