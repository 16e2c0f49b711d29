/* (C)2026 */
package com.ammann.dip.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.dip.model.DipMetrics;
import com.ammann.dip.model.DipClassification;
import com.ammann.dip.service.DipClassifierService;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DetectionEngineHealthCheck")
class DetectionEngineHealthCheckTest {

    @Test
    @DisplayName("should be UP when the reference dip is accepted")
    void shouldBeUpForReferenceDip() {
        DetectionEngineHealthCheck check = new DetectionEngineHealthCheck();
        check.classifier = new DipClassifierService();

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getName()).isEqualTo("dip-detection-engine");
        assertThat(response.getData()).isPresent();
        assertThat(response.getData().get()).containsEntry("reference-dip", true);
    }

    @Test
    @DisplayName("should be DOWN when the reference dip is rejected")
    void shouldBeDownWhenRejected() {
        DetectionEngineHealthCheck check = new DetectionEngineHealthCheck();
        check.classifier = mock(DipClassifierService.class);
        when(check.classifier.detectDip(any(double[].class), anyInt(), anyInt()))
                .thenReturn(new DipClassification(false, DipMetrics.widthBelowMinimum(3, 4, 2, 0.25, 0.0)));

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
    }

    @Test
    @DisplayName("should be DOWN when classification fails")
    void shouldBeDownOnFailure() {
        DetectionEngineHealthCheck check = new DetectionEngineHealthCheck();
        check.classifier = mock(DipClassifierService.class);
        when(check.classifier.detectDip(any(double[].class), anyInt(), anyInt()))
                .thenThrow(new IllegalStateException("broken"));

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData().get()).containsEntry("error", "broken");
    }
}
