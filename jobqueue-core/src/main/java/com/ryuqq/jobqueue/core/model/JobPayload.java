package com.ryuqq.jobqueue.core.model;

/**
 * Job에 실리는 업무 데이터.
 *
 * <p>각 JobKind는 하나의 Payload 형태를 가집니다. Payload가 스스로 자신의 종류를 알고 있으므로
 * 종류와 형태가 어긋난 Job은 enqueue 시점에 거부됩니다.</p>
 *
 * <p>구현체는 불변이어야 합니다. Job 스냅샷은 Payload를 복사하지 않고 공유합니다.</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 * @see BuildPayload
 * @see DeployPayload
 */
public interface JobPayload {

    /**
     * 이 Payload를 실행할 Job 종류.
     *
     * @return JobKind
     */
    JobKind kind();
}
