/**
 * Worker pool lifecycle port.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.jobqueue.application.runtime.QueueRuntime} - 핸들러 등록, 시작, 종료</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Jobqueue Team
 */
package com.ryuqq.jobqueue.application.runtime;
