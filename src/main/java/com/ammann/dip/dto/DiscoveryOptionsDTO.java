/* (C)2026 */
package com.ammann.dip.dto;

import com.ammann.dip.config.DetectionDefaults;
import com.ammann.dip.exception.ValidationException;
import com.ammann.dip.model.DiscoveryOptions;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Optional overrides for multi-scale discovery. Unset fields take the configured
 * defaults; unset context windows are derived from the series length.
 */
@Schema(description = "Dip discovery options; unset fields use configured defaults")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiscoveryOptionsDTO(
        @Schema(description = "Base moving-median window, multiplied by each scale factor", example = "3")
        Integer smoothingWindow,

        @Schema(description = "Prominence floor as a multiple of the global MAD", example = "0.3")
        Double minProminenceFactor,

        @Schema(description = "Context window before a segment; derived from series length when unset")
        Integer preWindow,

        @Schema(description = "Context window after a segment; derived from series length when unset")
        Integer postWindow,

        @Schema(description = "Minimal segment width in samples", example = "2")
        Integer minWidth,

        @Schema(description = "Depth threshold multiplier applied to the local MAD", example = "0.25")
        Double k,

        @Schema(description = "Absolute floor of the depth threshold", example = "0.0")
        Double minAbsDepth,

        @Schema(description = "Require the signal to return near the baseline after a dip")
        Boolean requireRecovery,

        @Schema(description = "Data volume controlling the global baseline weight", example = "200")
        Integer n0,

        @Schema(description = "Maximum number of dips returned", example = "50")
        Integer maxDips,

        @Schema(description = "Analyse several smoothing scales")
        Boolean multiScale,

        @Schema(description = "Explicit smoothing scale factors, for example [1, 2, 4, 8]")
        List<Integer> scaleFactors
) {
    /**
     * Resolves the effective options.
     *
     * @param dto      request options, may be {@code null}
     * @param defaults configured defaults
     * @return validated engine options
     */
    public static DiscoveryOptions resolve(DiscoveryOptionsDTO dto, DetectionDefaults defaults) {
        if (dto == null) {
            dto = new DiscoveryOptionsDTO(null, null, null, null, null, null, null, null, null, null, null, null);
        }
        if (dto.scaleFactors != null) {
            for (Integer factor : dto.scaleFactors) {
                if (factor == null) {
                    throw ValidationException.invalidParameter("scaleFactors", "null", "positive integer");
                }
                RequestValidatorDTO.positive("scaleFactors", factor);
            }
        }
        return new DiscoveryOptions(
                RequestValidatorDTO.positive("smoothingWindow",
                        DetectionOptionsDTO.valueOr(dto.smoothingWindow, defaults.getSmoothingWindow())),
                RequestValidatorDTO.nonNegative("minProminenceFactor",
                        DetectionOptionsDTO.valueOr(dto.minProminenceFactor, defaults.getMinProminenceFactor())),
                dto.preWindow != null ? RequestValidatorDTO.nonNegative("preWindow", dto.preWindow) : null,
                dto.postWindow != null ? RequestValidatorDTO.nonNegative("postWindow", dto.postWindow) : null,
                RequestValidatorDTO.positive("minWidth",
                        DetectionOptionsDTO.valueOr(dto.minWidth, defaults.getMinWidth())),
                RequestValidatorDTO.nonNegative("k", DetectionOptionsDTO.valueOr(dto.k, defaults.getK())),
                RequestValidatorDTO.nonNegative("minAbsDepth",
                        DetectionOptionsDTO.valueOr(dto.minAbsDepth, defaults.getMinAbsDepth())),
                DetectionOptionsDTO.valueOr(dto.requireRecovery, defaults.isRequireRecovery()),
                RequestValidatorDTO.positive("n0", DetectionOptionsDTO.valueOr(dto.n0, defaults.getN0())),
                RequestValidatorDTO.positive("maxDips",
                        DetectionOptionsDTO.valueOr(dto.maxDips, defaults.getMaxDips())),
                DetectionOptionsDTO.valueOr(dto.multiScale, defaults.isMultiScale()),
                dto.scaleFactors);
    }
}
