/**
 * Cooperative cancellation package.
 *
 * <p>{@link com.ryuqq.jobqueue.core.execution.ExecutionContext} carries shutdown and
 * per-job deadline signals from the queue controller to operation handlers and to the
 * collaborators they call.</p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Cancellation never interrupts a thread; handlers poll the context between blocking calls</li>
 *   <li>A handler that ignores the context runs past its deadline, and its job finalizes only when it returns</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Jobqueue Team
 */
package com.ryuqq.jobqueue.core.execution;
