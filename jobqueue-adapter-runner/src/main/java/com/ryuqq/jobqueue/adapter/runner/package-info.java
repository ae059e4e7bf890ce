/**
 * Runner Adapter Layer - JobQueue 구현체.
 *
 * <p>이 패키지는 JobQueue / QueueRuntime 포트의 인프로세스 구현체를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jobqueue.adapter.runner.QueueController} - Job 테이블 소유자 + Worker Pool</li>
 *   <li>{@link com.ryuqq.jobqueue.adapter.runner.DispatchChannel} - 크기 제한 FIFO 전송 채널</li>
 *   <li>{@link com.ryuqq.jobqueue.adapter.runner.HandlerRegistry} - JobKind별 Handler 등록부</li>
 *   <li>{@link com.ryuqq.jobqueue.adapter.runner.QueueControllerConfig} - Worker 수, 채널 크기, 실행 상한</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (QueueController)
 *   ↓ implements
 * application (JobQueue, QueueRuntime)
 *   ↓ depends on
 * core (Job, JobStatus, JobHandler, ExecutionContext)
 *   ↓ depends on
 * core/spi (MetricsSink)
 * </pre>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
package com.ryuqq.jobqueue.adapter.runner;
