/* (C)2026 */
package com.ammann.riskscore.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the named ManagedExecutor running bootstrap iterations.
 *
 * <p>Bootstrap workers only touch in-memory data, so no thread context is propagated.
 * The queue is unbounded because the validator never submits more tasks than
 * {@code validation.bootstrap.parallelism}.
 */
@ApplicationScoped
public class ExecutorProducer {

    @ConfigProperty(name = "validation.bootstrap.parallelism", defaultValue = "4")
    int parallelism;

    @Produces
    @Named("bootstrap-executor")
    @ApplicationScoped
    public ManagedExecutor createBootstrapExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(Math.max(1, parallelism))
                .maxQueued(-1)
                .propagated(ThreadContext.NONE)
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }

    void shutdown(@Disposes @Named("bootstrap-executor") ManagedExecutor executor) {
        executor.shutdown();
    }
}
