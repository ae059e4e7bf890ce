/**
 * Service Provider Interfaces for the collaborators the queue drives.
 *
 * <p>Implementations live in adapter modules; {@code jobqueue-adapter-inmemory} provides
 * reference implementations of each.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.jobqueue.core.spi.BuildStore} - build records</li>
 *   <li>{@link com.ryuqq.jobqueue.core.spi.DeployStore} - services and deployments</li>
 *   <li>{@link com.ryuqq.jobqueue.core.spi.ContainerRuntime} - image build and pull</li>
 *   <li>{@link com.ryuqq.jobqueue.core.spi.MetricsSink} - outcome metrics and active-jobs gauge</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Jobqueue Team
 */
package com.ryuqq.jobqueue.core.spi;
