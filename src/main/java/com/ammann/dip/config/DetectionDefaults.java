/* (C)2026 */
package com.ammann.dip.config;

import com.ammann.dip.model.DetectionOptions;
import com.ammann.dip.model.DiscoveryOptions;
import com.ammann.dip.service.RollingDipDiscoveryService;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Configured defaults for options a request leaves unset.
 *
 * <p>Every property falls back to the documented engine default, so an empty
 * {@code application.properties} behaves exactly like the engine called directly.
 */
@ApplicationScoped
public class DetectionDefaults {

    @ConfigProperty(name = "dip.detection.pre-window", defaultValue = "50")
    int preWindow = DetectionOptions.DEFAULT_PRE_WINDOW;

    @ConfigProperty(name = "dip.detection.post-window", defaultValue = "50")
    int postWindow = DetectionOptions.DEFAULT_POST_WINDOW;

    @ConfigProperty(name = "dip.detection.min-width", defaultValue = "2")
    int minWidth = DetectionOptions.DEFAULT_MIN_WIDTH;

    @ConfigProperty(name = "dip.detection.k", defaultValue = "0.25")
    double k = DetectionOptions.DEFAULT_K;

    @ConfigProperty(name = "dip.detection.min-abs-depth", defaultValue = "0.0")
    double minAbsDepth = DetectionOptions.DEFAULT_MIN_ABS_DEPTH;

    @ConfigProperty(name = "dip.detection.require-recovery", defaultValue = "true")
    boolean requireRecovery = true;

    @ConfigProperty(name = "dip.detection.n0", defaultValue = "200")
    int n0 = DetectionOptions.DEFAULT_N0;

    @ConfigProperty(name = "dip.discovery.smoothing-window", defaultValue = "3")
    int smoothingWindow = DiscoveryOptions.DEFAULT_SMOOTHING_WINDOW;

    @ConfigProperty(name = "dip.discovery.min-prominence-factor", defaultValue = "0.3")
    double minProminenceFactor = DiscoveryOptions.DEFAULT_MIN_PROMINENCE_FACTOR;

    @ConfigProperty(name = "dip.discovery.max-dips", defaultValue = "50")
    int maxDips = DiscoveryOptions.DEFAULT_MAX_DIPS;

    @ConfigProperty(name = "dip.discovery.multi-scale", defaultValue = "true")
    boolean multiScale = true;

    @ConfigProperty(name = "dip.rolling.window-size", defaultValue = "125")
    int rollingWindowSize = RollingDipDiscoveryService.DEFAULT_WINDOW_SIZE;

    @ConfigProperty(name = "dip.rolling.stride", defaultValue = "1")
    int rollingStride = 1;

    @ConfigProperty(name = "dip.batch.max-jobs", defaultValue = "100")
    int batchMaxJobs = 100;

    @ConfigProperty(name = "dip.batch.timeout", defaultValue = "30s")
    Duration batchTimeout = Duration.ofSeconds(30);

    @ConfigProperty(name = "dip.series.max-length", defaultValue = "100000")
    int maxSeriesLength = 100_000;

    public int getPreWindow() { return preWindow; }
    public int getPostWindow() { return postWindow; }
    public int getMinWidth() { return minWidth; }
    public double getK() { return k; }
    public double getMinAbsDepth() { return minAbsDepth; }
    public boolean isRequireRecovery() { return requireRecovery; }
    public int getN0() { return n0; }
    public int getSmoothingWindow() { return smoothingWindow; }
    public double getMinProminenceFactor() { return minProminenceFactor; }
    public int getMaxDips() { return maxDips; }
    public boolean isMultiScale() { return multiScale; }
    public int getRollingWindowSize() { return rollingWindowSize; }
    public int getRollingStride() { return rollingStride; }
    public int getBatchMaxJobs() { return batchMaxJobs; }
    public Duration getBatchTimeout() { return batchTimeout; }
    public int getMaxSeriesLength() { return maxSeriesLength; }
}
