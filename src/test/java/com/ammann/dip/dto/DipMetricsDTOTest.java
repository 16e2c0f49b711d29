/* (C)2026 */
package com.ammann.dip.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.dip.enumeration.RejectionReason;
import com.ammann.dip.model.DipMetrics;
import com.ammann.dip.service.DipClassifierService;
import com.ammann.dip.support.SeriesFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class DipMetricsDTOTest {

    @Test
    void copiesMeasuredSegment() {
        DipMetrics metrics = new DipClassifierService().detectDip(SeriesFixtures.SINGLE_DIP, 3, 4).metrics();

        DipMetricsDTO dto = DipMetricsDTO.from(metrics);

        assertThat(dto.start()).isEqualTo(3);
        assertThat(dto.end()).isEqualTo(4);
        assertThat(dto.depth()).isEqualTo(metrics.depth());
        assertThat(dto.segMinIndex()).isEqualTo(4);
        assertThat(dto.dip()).isTrue();
        assertThat(dto.reason()).isNull();
    }

    @Test
    void widthGatedSegmentOmitsMeasurements() throws Exception {
        DipMetricsDTO dto = DipMetricsDTO.from(DipMetrics.widthBelowMinimum(4, 4, 2, 0.25, 0.0));

        assertThat(dto.depth()).isNull();
        assertThat(dto.baseline()).isNull();
        assertThat(dto.segMinIndex()).isNull();
        assertThat(dto.reason()).isEqualTo(RejectionReason.WIDTH_BELOW_MIN);

        String json = new ObjectMapper().writeValueAsString(dto);
        assertThat(json)
                .contains("\"reason\":\"width_below_min\"")
                .doesNotContain("NaN")
                .doesNotContain("\"depth\"");
    }
}
