/**
 * Job record model package.
 *
 * <p>Value objects and the immutable job snapshot shared between the queue controller,
 * the worker pool, the operation handlers and callers.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jobqueue.core.model.JobId} - Process-unique, time-derived job identifier</li>
 *   <li>{@link com.ryuqq.jobqueue.core.model.JobIdGenerator} - Monotonic JobId source</li>
 *   <li>{@link com.ryuqq.jobqueue.core.model.JobKind} - Selects the handler (build, deploy, ...)</li>
 *   <li>{@link com.ryuqq.jobqueue.core.model.JobPayload} - One payload shape per job kind</li>
 *   <li>{@link com.ryuqq.jobqueue.core.model.Job} - Immutable snapshot returned to callers</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Snapshots and payloads never change after creation</li>
 *   <li><strong>Typed payloads:</strong> Kind/payload mismatches are rejected at enqueue time</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Jobqueue Team
 */
package com.ryuqq.jobqueue.core.model;
