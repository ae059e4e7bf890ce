/**
 * Contract tests every JobQueue / QueueRuntime implementation must pass.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.jobqueue.testkit.contract.AbstractJobQueueContractTest} - 시나리오 모음</li>
 *   <li>{@link com.ryuqq.jobqueue.testkit.contract.QueueUnderTest} - 구현체 팩토리 반환 타입</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Jobqueue Team
 */
package com.ryuqq.jobqueue.testkit.contract;
