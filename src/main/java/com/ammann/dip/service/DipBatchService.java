/* (C)2026 */
package com.ammann.dip.service;

import com.ammann.dip.config.ExecutorProducer;
import com.ammann.dip.exception.SomeThingWentWrongException;
import com.ammann.dip.model.DipDetectionJob;
import com.ammann.dip.model.DipDetectionResult;
import com.ammann.dip.model.DipMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.jboss.logging.Logger;

/**
 * Runs dip discovery for many independent series in parallel.
 *
 * <p>Each job is a pure computation on its own series, so jobs run concurrently on
 * the {@code dip-batch-executor}. Results are returned in submission order. A job
 * that fails yields an empty result with an error message; the other jobs of the
 * batch are unaffected.
 */
@ApplicationScoped
public class DipBatchService {

    private static final Logger LOG = Logger.getLogger(DipBatchService.class);

    private final DipDiscoveryService discoveryService;
    private final RollingDipDiscoveryService rollingService;
    private final ManagedExecutor executor;
    private final MeterRegistry meterRegistry;

    private Counter jobCounter;
    private Counter jobFailureCounter;
    private Timer batchTimer;

    @Inject
    public DipBatchService(DipDiscoveryService discoveryService,
                           RollingDipDiscoveryService rollingService,
                           @Named(ExecutorProducer.DIP_BATCH_EXECUTOR) ManagedExecutor executor,
                           MeterRegistry meterRegistry) {
        this.discoveryService = discoveryService;
        this.rollingService = rollingService;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void initMetrics() {
        jobCounter = Counter.builder("dip_batch_jobs_total")
                .description("Batch discovery jobs processed")
                .register(meterRegistry);
        jobFailureCounter = Counter.builder("dip_batch_job_failures_total")
                .description("Batch discovery jobs that failed")
                .register(meterRegistry);
        batchTimer = Timer.builder("dip_batch_duration")
                .description("Duration of a complete batch")
                .register(meterRegistry);
    }

    /**
     * Processes all jobs and waits for them to finish.
     *
     * <p>When the batch times out or the caller is interrupted, all futures are
     * cancelled: queued jobs then never start. Jobs already running are not
     * interrupted, since {@link CompletableFuture#cancel(boolean)} does not reach the
     * worker thread; they finish on the executor and their results are discarded.
     *
     * @param jobs    jobs to run
     * @param timeout maximum time to wait for the whole batch
     * @return one result per job, in the order of {@code jobs}
     * @throws SomeThingWentWrongException if the batch does not complete in time or is interrupted
     */
    public List<DipDetectionResult> process(List<DipDetectionJob> jobs, Duration timeout) {
        Timer.Sample sample = Timer.start(meterRegistry);
        List<CompletableFuture<DipDetectionResult>> futures = jobs.stream()
                .map(job -> CompletableFuture.supplyAsync(() -> runJob(job), executor))
                .toList();

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new SomeThingWentWrongException("Batch dip discovery interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            futures.forEach(f -> f.cancel(true));
            throw new SomeThingWentWrongException("Batch dip discovery did not complete", e);
        } finally {
            sample.stop(batchTimer);
        }

        List<DipDetectionResult> results = futures.stream().map(CompletableFuture::join).toList();
        long failed = results.stream().filter(DipDetectionResult::failed).count();
        LOG.infof("Batch dip discovery finished: %d jobs, %d failed", results.size(), failed);
        return results;
    }

    DipDetectionResult runJob(DipDetectionJob job) {
        jobCounter.increment();
        try {
            List<DipMetrics> dips = job.interval() != null
                    ? rollingService.findDipsForInterval(job.series(), job.interval(), job.options())
                    : discoveryService.findAllDips(job.series(), job.options());
            return DipDetectionResult.success(job, dips);
        } catch (RuntimeException e) {
            jobFailureCounter.increment();
            LOG.warnf(e, "Dip discovery failed for job %s", job.ticker());
            return DipDetectionResult.failure(job, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
