package com.ryuqq.jobqueue.core.spi;

import com.ryuqq.jobqueue.core.contract.BuildResult;
import com.ryuqq.jobqueue.core.contract.BuildSpec;
import com.ryuqq.jobqueue.core.execution.ExecutionContext;

/**
 * Container engine client SPI.
 *
 * <p>Every call receives the job's {@link ExecutionContext}. Implementations are expected
 * to observe cancellation during blocking calls; the queue never interrupts a running call.</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public interface ContainerRuntime {

    /**
     * Builds an image and streams the build log into {@link BuildSpec#logSink()}.
     *
     * <p>A build step failure may be returned as a result with {@code success=false}
     * instead of an exception.</p>
     *
     * @param spec the build description
     * @param context the job execution context
     * @return the build result
     * @throws ContainerRuntimeException if the engine call itself fails
     */
    BuildResult buildImage(BuildSpec spec, ExecutionContext context);

    /**
     * Checks whether an image is present locally.
     *
     * @param imageTag the image reference
     * @param context the job execution context
     * @return true if the image exists locally
     * @throws ContainerRuntimeException if the engine call fails
     */
    boolean imageExists(String imageTag, ExecutionContext context);

    /**
     * Pulls an image from its registry.
     *
     * @param imageTag the image reference
     * @param context the job execution context
     * @throws ContainerRuntimeException if the pull fails
     */
    void pullImage(String imageTag, ExecutionContext context);
}
