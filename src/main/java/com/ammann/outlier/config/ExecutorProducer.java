/* (C)2026 */
package com.ammann.outlier.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for creating named ManagedExecutor instances.
 *
 * <p>Provides the "outlier-ensemble-executor" bean used by OutlierDetectionService to run
 * the ensemble voters concurrently when {@code outlier.ensemble.parallel=true}. The voters
 * are pure functions, so no context needs to be propagated. The queue is unbounded so that
 * any number of analyses can share the executor.
 */
@ApplicationScoped
public class ExecutorProducer {

    static final int ENSEMBLE_MAX_ASYNC = 4; // one slot per voting method
    static final int ENSEMBLE_MAX_QUEUED = -1; // unbounded

    /**
     * Produces a named ManagedExecutor for ensemble voting.
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named("outlier-ensemble-executor")
    @ApplicationScoped
    public ManagedExecutor createEnsembleExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(ENSEMBLE_MAX_ASYNC)
                .maxQueued(ENSEMBLE_MAX_QUEUED)
                .propagated(ThreadContext.NONE)
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }
}
