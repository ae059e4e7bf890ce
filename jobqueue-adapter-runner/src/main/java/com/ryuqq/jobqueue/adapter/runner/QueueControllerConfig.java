package com.ryuqq.jobqueue.adapter.runner;

import java.time.Duration;

/**
 * QueueController 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workerCount: 동시 실행 Worker 수 (기본 2)</li>
 *   <li>dispatchCapacity: Dispatch Channel 버퍼 크기 (기본 100)</li>
 *   <li>executionTimeout: Job 1건의 실행 상한 (기본 30분)</li>
 *   <li>pollInterval: Worker의 채널 대기 및 Enqueue 재시도 간격 (기본 100ms)</li>
 * </ul>
 *
 * <p>executionTimeout은 Job별 {@code ExecutionContext}의 deadline이 됩니다.
 * Handler가 취소를 확인하지 않으면 상한을 넘겨 실행될 수 있습니다 (협조적 취소).</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 * @param workerCount Worker 수 (1 이상)
 * @param dispatchCapacity 채널 버퍼 크기 (1 이상)
 * @param executionTimeout Job 실행 상한 (양수)
 * @param pollInterval 폴링 간격 (양수)
 */
public record QueueControllerConfig(
    int workerCount,
    int dispatchCapacity,
    Duration executionTimeout,
    Duration pollInterval
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: workerCount=2, dispatchCapacity=100, executionTimeout=30분, pollInterval=100ms</p>
     */
    public QueueControllerConfig() {
        this(2, 100, Duration.ofMinutes(30), Duration.ofMillis(100));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public QueueControllerConfig {
        if (workerCount <= 0) {
            throw new IllegalArgumentException(
                "workerCount must be positive (current: " + workerCount + ")"
            );
        }
        if (dispatchCapacity <= 0) {
            throw new IllegalArgumentException(
                "dispatchCapacity must be positive (current: " + dispatchCapacity + ")"
            );
        }
        if (executionTimeout == null || executionTimeout.isZero() || executionTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "executionTimeout must be positive (current: " + executionTimeout + ")"
            );
        }
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException(
                "pollInterval must be positive (current: " + pollInterval + ")"
            );
        }
    }

    public QueueControllerConfig withWorkerCount(int workerCount) {
        return new QueueControllerConfig(workerCount, dispatchCapacity, executionTimeout, pollInterval);
    }

    public QueueControllerConfig withDispatchCapacity(int dispatchCapacity) {
        return new QueueControllerConfig(workerCount, dispatchCapacity, executionTimeout, pollInterval);
    }

    public QueueControllerConfig withExecutionTimeout(Duration executionTimeout) {
        return new QueueControllerConfig(workerCount, dispatchCapacity, executionTimeout, pollInterval);
    }

    public QueueControllerConfig withPollInterval(Duration pollInterval) {
        return new QueueControllerConfig(workerCount, dispatchCapacity, executionTimeout, pollInterval);
    }
}
