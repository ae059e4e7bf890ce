/**
 * Operation handler contract package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jobqueue.core.handler.JobHandler} - Logic bound to one job kind</li>
 *   <li>{@link com.ryuqq.jobqueue.core.handler.JobContext} - Snapshot, execution context and progress callback handed to a handler</li>
 *   <li>{@link com.ryuqq.jobqueue.core.handler.ProgressReporter} - Callback indirection into the queue controller</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Jobqueue Team
 */
package com.ryuqq.jobqueue.core.handler;
