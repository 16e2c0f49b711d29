/* (C)2026 */
package com.ammann.dip.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.dip.config.DetectionDefaults;
import com.ammann.dip.dto.TrendContextDTO;
import com.ammann.dip.dto.TrendRequestDTO;
import com.ammann.dip.enumeration.TrendDirection;
import com.ammann.dip.exception.ValidationException;
import com.ammann.dip.service.TrendContextService;
import com.ammann.dip.support.SeriesFixtures;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TrendResourceTest {

    private TrendResource resource;

    @BeforeEach
    void setUp() {
        resource = new TrendResource();
        resource.trendService = new TrendContextService();
        resource.defaults = new DetectionDefaults();
    }

    @Test
    void returnsHybridTrend() {
        Response response = resource.trend(
                new TrendRequestDTO(SeriesFixtures.boxed(SeriesFixtures.ramp(1, 1, 100)), 99, null, null));

        TrendContextDTO body = (TrendContextDTO) response.getEntity();
        assertThat(body.finalTrend()).isEqualTo(TrendDirection.UPTREND);
        assertThat(body.movingAverages()).containsOnlyKeys(20, 50, 200);
    }

    @Test
    void usesRequestedPeriods() {
        Response response = resource.trend(new TrendRequestDTO(
                SeriesFixtures.boxed(SeriesFixtures.ramp(1, 1, 100)), 99, List.of(5, 10), 20));

        TrendContextDTO body = (TrendContextDTO) response.getEntity();
        assertThat(body.movingAverages()).containsOnlyKeys(5, 10);
    }

    @Test
    void rejectsInvalidIndexAndPeriods() {
        List<Double> series = SeriesFixtures.boxed(SeriesFixtures.ramp(1, 1, 10));

        assertThatThrownBy(() -> resource.trend(new TrendRequestDTO(series, 10, null, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("index");
        assertThatThrownBy(() -> resource.trend(new TrendRequestDTO(series, 5, List.of(0), null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("maPeriods");
        assertThatThrownBy(() -> resource.trend(new TrendRequestDTO(series, 5, null, 0)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("lookback");
    }
}
