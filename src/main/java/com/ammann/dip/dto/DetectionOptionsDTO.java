/* (C)2026 */
package com.ammann.dip.dto;

import com.ammann.dip.config.DetectionDefaults;
import com.ammann.dip.model.DetectionOptions;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Optional overrides for single-segment classification. Unset fields take the
 * configured defaults.
 */
@Schema(description = "Segment classification options; unset fields use configured defaults")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetectionOptionsDTO(
        @Schema(description = "Samples before the segment used as local context", example = "50")
        Integer preWindow,

        @Schema(description = "Samples after the segment used as local context and for recovery", example = "50")
        Integer postWindow,

        @Schema(description = "Minimal segment width in samples", example = "2")
        Integer minWidth,

        @Schema(description = "Depth threshold multiplier applied to the local MAD", example = "0.25")
        Double k,

        @Schema(description = "Absolute floor of the depth threshold", example = "0.0")
        Double minAbsDepth,

        @Schema(description = "Require the signal to return near the baseline after the segment")
        Boolean requireRecovery,

        @Schema(description = "Data volume controlling the global baseline weight", example = "200")
        Integer n0
) {
    /**
     * Resolves the effective options.
     *
     * @param dto      request options, may be {@code null}
     * @param defaults configured defaults
     * @return validated engine options
     */
    public static DetectionOptions resolve(DetectionOptionsDTO dto, DetectionDefaults defaults) {
        DetectionOptionsDTO o = dto != null ? dto : new DetectionOptionsDTO(null, null, null, null, null, null, null);
        return new DetectionOptions(
                RequestValidatorDTO.nonNegative("preWindow", valueOr(o.preWindow, defaults.getPreWindow())),
                RequestValidatorDTO.nonNegative("postWindow", valueOr(o.postWindow, defaults.getPostWindow())),
                RequestValidatorDTO.positive("minWidth", valueOr(o.minWidth, defaults.getMinWidth())),
                RequestValidatorDTO.nonNegative("k", valueOr(o.k, defaults.getK())),
                RequestValidatorDTO.nonNegative("minAbsDepth", valueOr(o.minAbsDepth, defaults.getMinAbsDepth())),
                valueOr(o.requireRecovery, defaults.isRequireRecovery()),
                RequestValidatorDTO.positive("n0", valueOr(o.n0, defaults.getN0())));
    }

    static <T> T valueOr(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
