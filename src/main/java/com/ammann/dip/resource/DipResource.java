package com.ammann.dip.resource;

import com.ammann.dip.config.DetectionDefaults;
import com.ammann.dip.dto.*;
import com.ammann.dip.enumeration.TimeInterval;
import com.ammann.dip.exception.ValidationException;
import com.ammann.dip.model.DetectionOptions;
import com.ammann.dip.model.DipClassification;
import com.ammann.dip.model.DipDetectionJob;
import com.ammann.dip.model.DipDetectionResult;
import com.ammann.dip.model.DipMetrics;
import com.ammann.dip.model.DiscoveryOptions;
import com.ammann.dip.properties.ApiProperties;
import com.ammann.dip.service.DipBatchService;
import com.ammann.dip.service.DipClassifierService;
import com.ammann.dip.service.DipDiscoveryService;
import com.ammann.dip.service.RollingDipDiscoveryService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * REST resource for dip classification and discovery on caller-supplied series.
 *
 * <p>The engine is stateless: every request carries its series and the response is a
 * pure function of the request and the configured defaults.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Dip API", description = "Robust dip detection on one-dimensional series")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class DipResource {

    private static final Logger LOG = Logger.getLogger(DipResource.class);

    @Inject
    DipClassifierService classifierService;

    @Inject
    DipDiscoveryService discoveryService;

    @Inject
    RollingDipDiscoveryService rollingService;

    @Inject
    DipBatchService batchService;

    @Inject
    DetectionDefaults defaults;

    @Inject
    MeterRegistry meterRegistry;

    private Counter classifyCounter;
    private Counter discoverCounter;

    @PostConstruct
    void initMetrics() {
        classifyCounter = Counter.builder("dip_classify_requests_total")
                .description("Segment classification requests")
                .register(meterRegistry);
        discoverCounter = Counter.builder("dip_discover_requests_total")
                .description("Dip discovery requests, direct and rolling")
                .register(meterRegistry);
    }

    @POST
    @Path(ApiProperties.Dips.CLASSIFY)
    @Operation(
            summary = "Classify a segment",
            description = "Decides whether the inclusive segment [start, end] is a dip against a robust baseline"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Segment classified",
                    content = @Content(schema = @Schema(implementation = DipClassificationResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid series, segment or options"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response classify(ClassifyRequestDTO request) {
        if (request == null) {
            throw ValidationException.invalidParameter("body", "null", "classification request");
        }
        double[] series = RequestValidatorDTO.toSeries(request.series(), defaults.getMaxSeriesLength());
        RequestValidatorDTO.validateSegment(request.start(), request.end(), series.length);
        DetectionOptions options = DetectionOptionsDTO.resolve(request.options(), defaults);

        classifyCounter.increment();
        long startTime = System.nanoTime();
        DipClassification classification =
                classifierService.detectDip(series, request.start(), request.end(), options);
        long elapsed = System.nanoTime() - startTime;

        LOG.infof("Segment [%d, %d] of %d samples classified: dip=%s confidence=%.3f",
                request.start(), request.end(), series.length, classification.dip(),
                classification.metrics().confidence());
        return Response.ok(DipClassificationResponseDTO.from(classification, elapsed)).build();
    }

    @POST
    @Path(ApiProperties.Dips.DISCOVER)
    @Operation(
            summary = "Discover dips",
            description = "Finds all dips in a series with multi-scale smoothing, highest confidence first"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Discovery completed",
                    content = @Content(schema = @Schema(implementation = DipDiscoveryResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid series or options"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response discover(DiscoverRequestDTO request) {
        if (request == null) {
            throw ValidationException.invalidParameter("body", "null", "discovery request");
        }
        double[] series = RequestValidatorDTO.toSeries(request.series(), defaults.getMaxSeriesLength());
        DiscoveryOptions options = DiscoveryOptionsDTO.resolve(request.options(), defaults);

        discoverCounter.increment();
        long startTime = System.nanoTime();
        List<DipMetrics> dips = discoveryService.findAllDips(series, options);
        long elapsed = System.nanoTime() - startTime;

        LOG.infof("Dip discovery found %d dips in %d samples in %.2fms",
                dips.size(), series.length, elapsed / 1_000_000.0);
        return Response.ok(DipDiscoveryResponseDTO.from(dips, series.length, elapsed)).build();
    }

    @POST
    @Path(ApiProperties.Dips.ROLLING)
    @Operation(
            summary = "Discover dips with a sliding window",
            description = "Runs discovery on every window of a long series and merges the results. "
                    + "With an interval, periods longer than six months are scanned with a 125-sample window"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Discovery completed",
                    content = @Content(schema = @Schema(implementation = DipDiscoveryResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid series, interval or options"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response discoverRolling(RollingDiscoverRequestDTO request) {
        if (request == null) {
            throw ValidationException.invalidParameter("body", "null", "rolling discovery request");
        }
        double[] series = RequestValidatorDTO.toSeries(request.series(), defaults.getMaxSeriesLength());
        DiscoveryOptions options = DiscoveryOptionsDTO.resolve(request.options(), defaults);

        discoverCounter.increment();
        long startTime = System.nanoTime();
        List<DipMetrics> dips;
        if (request.interval() != null) {
            dips = rollingService.findDipsForInterval(series, parseInterval(request.interval()), options);
        } else {
            int windowSize = request.windowSize() != null ? request.windowSize() : defaults.getRollingWindowSize();
            int stride = request.stride() != null ? request.stride() : defaults.getRollingStride();
            if (windowSize < 1) {
                throw ValidationException.invalidParameter("windowSize", windowSize, "positive integer");
            }
            if (stride < 1) {
                throw ValidationException.invalidParameter("stride", stride, "positive integer");
            }
            dips = rollingService.findDipsRolling(series, options, windowSize, stride);
        }
        long elapsed = System.nanoTime() - startTime;

        LOG.infof("Rolling dip discovery found %d dips in %d samples in %.2fms",
                dips.size(), series.length, elapsed / 1_000_000.0);
        return Response.ok(DipDiscoveryResponseDTO.from(dips, series.length, elapsed)).build();
    }

    @POST
    @Path(ApiProperties.Dips.BATCH)
    @Operation(
            summary = "Discover dips in several series",
            description = "Runs discovery for every job concurrently. A failing job is reported in its result "
                    + "and does not affect the others"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Batch completed",
                    content = @Content(schema = @Schema(implementation = BatchDiscoverResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid jobs or too many jobs"),
            @APIResponse(responseCode = "500", description = "Batch did not complete in time")
    })
    public Response discoverBatch(BatchDiscoverRequestDTO request) {
        if (request == null || request.jobs() == null || request.jobs().isEmpty()) {
            throw ValidationException.insufficientData("batch jobs", 1, 0);
        }
        if (request.jobs().size() > defaults.getBatchMaxJobs()) {
            throw ValidationException.invalidParameter("jobs", request.jobs().size() + " jobs",
                    "at most " + defaults.getBatchMaxJobs());
        }

        List<DipDetectionJob> jobs = new ArrayList<>(request.jobs().size());
        for (BatchJobDTO job : request.jobs()) {
            if (job == null || job.ticker() == null || job.ticker().isBlank()) {
                throw ValidationException.invalidParameter("ticker", job == null ? "null" : job.ticker(),
                        "non-blank job identifier");
            }
            jobs.add(new DipDetectionJob(
                    job.ticker(),
                    job.interval() != null ? parseInterval(job.interval()) : null,
                    RequestValidatorDTO.toSeries(job.series(), defaults.getMaxSeriesLength()),
                    DiscoveryOptionsDTO.resolve(job.options(), defaults)));
        }

        long startTime = System.nanoTime();
        List<DipDetectionResult> results = batchService.process(jobs, defaults.getBatchTimeout());
        long elapsed = System.nanoTime() - startTime;

        return Response.ok(BatchDiscoverResponseDTO.from(results, elapsed)).build();
    }

    private static TimeInterval parseInterval(String code) {
        try {
            return TimeInterval.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(
                    String.format("Invalid parameter 'interval': got '%s', expected one of 5y, 3y, 12m, 6m, 3m, 1m, 1w",
                            code), e);
        }
    }
}
