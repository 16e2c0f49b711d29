/* (C)2026 */
package com.ammann.dip.health;

import com.ammann.dip.model.DipClassification;
import com.ammann.dip.service.DipClassifierService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

/**
 * Readiness check for the detection engine.
 * Classifies a fixed reference dip and expects it to be accepted.
 *
 * <p>Status semantics:
 * <ul>
 *   <li>UP: Reference segment is classified as a dip</li>
 *   <li>DOWN: Reference segment is rejected or classification fails</li>
 * </ul>
 */
@Readiness
@ApplicationScoped
public class DetectionEngineHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(DetectionEngineHealthCheck.class);

    static final double[] REFERENCE_SERIES = {5, 5, 4, 3, 2.5, 3, 4, 5, 5};
    static final int REFERENCE_START = 3;
    static final int REFERENCE_END = 4;

    @Inject DipClassifierService classifier;

    @Override
    public HealthCheckResponse call() {
        try {
            DipClassification result =
                    classifier.detectDip(REFERENCE_SERIES, REFERENCE_START, REFERENCE_END);
            return HealthCheckResponse.named("dip-detection-engine")
                    .status(result.dip())
                    .withData("reference-dip", result.dip())
                    .withData("reference-depth", String.format("%.4f", result.metrics().depth()))
                    .withData("reference-confidence", String.format("%.4f", result.metrics().confidence()))
                    .build();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Detection engine readiness check failed");
            return HealthCheckResponse.named("dip-detection-engine")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
