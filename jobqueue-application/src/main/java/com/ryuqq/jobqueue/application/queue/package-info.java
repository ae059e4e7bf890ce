/**
 * Caller-facing queue port.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.jobqueue.application.queue.JobQueue} - Enqueue / GetJob / ListJobs</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Jobqueue Team
 */
package com.ryuqq.jobqueue.application.queue;
