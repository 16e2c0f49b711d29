/* (C)2026 */
package com.ammann.dip.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for named ManagedExecutor instances.
 *
 * <p>Provides the "dip-batch-executor" bean used by DipBatchService to run the
 * discovery jobs of one batch request in parallel.
 */
@ApplicationScoped
public class ExecutorProducer {

    public static final String DIP_BATCH_EXECUTOR = "dip-batch-executor";

    /**
     * Produces the executor for batch dip discovery. Discovery is CPU bound, so the
     * pool is sized to the available processors.
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named(DIP_BATCH_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createDipBatchExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(Math.max(2, Runtime.getRuntime().availableProcessors()))
                .maxQueued(500)
                .propagated(ThreadContext.NONE)
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }
}
