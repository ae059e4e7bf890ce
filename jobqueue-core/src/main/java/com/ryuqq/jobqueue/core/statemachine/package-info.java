/**
 * Job state machine package.
 *
 * <p>This package implements the forward-only transition rules of the job lifecycle.</p>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * QUEUED → RUNNING (worker claims the job)
 * QUEUED → FAILED (queue shutting down)
 * RUNNING → SUCCESS (handler returned normally)
 * RUNNING → FAILED (handler threw, or no handler registered)
 *
 * Forbidden:
 * - SUCCESS → * (terminal state)
 * - FAILED → * (terminal state)
 * - QUEUED → SUCCESS (running cannot be skipped)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * JobStatus status = JobStatus.QUEUED;
 * status = StateTransition.transition(status, JobStatus.RUNNING);
 * status = StateTransition.transition(status, JobStatus.SUCCESS);
 *
 * // This will throw IllegalStateException
 * StateTransition.validate(status, JobStatus.RUNNING);
 * </pre>
 *
 * @since 1.0.0
 * @author Jobqueue Team
 */
package com.ryuqq.jobqueue.core.statemachine;
