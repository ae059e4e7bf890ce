package com.ryuqq.jobqueue.core.spi;

import java.time.Duration;

/**
 * Metrics collaborator SPI.
 *
 * <p>Fire-and-forget: implementations must never block or throw.</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public interface MetricsSink {

    /**
     * Records the outcome of one build job execution.
     *
     * @param success whether the build succeeded
     * @param duration wall-clock time from handler entry to outcome
     */
    void recordBuild(boolean success, Duration duration);

    /**
     * Records the outcome of one deploy job execution.
     *
     * @param success whether the deployment succeeded
     * @param duration wall-clock time from handler entry to outcome
     */
    void recordDeployment(boolean success, Duration duration);

    void incActiveJobs();

    void decActiveJobs();
}
