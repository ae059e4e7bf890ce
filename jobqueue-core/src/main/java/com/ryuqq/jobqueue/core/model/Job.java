package com.ryuqq.jobqueue.core.model;

import com.ryuqq.jobqueue.core.statemachine.JobStatus;

import java.time.Instant;

/**
 * Job 레코드의 불변 스냅샷.
 *
 * <p>Queue Controller는 내부 Job 테이블을 독점하며, 호출자와 Handler에게는
 * 항상 이 스냅샷만 전달합니다. 스냅샷은 조회 시점의 상태이므로
 * 실제 실행 상태보다 뒤처져 있을 수 있습니다.</p>
 *
 * <p><strong>필드 규칙:</strong></p>
 * <ul>
 *   <li>createdAt: 항상 존재</li>
 *   <li>startedAt: Worker가 Job을 가져간 시점 (그 전에는 null)</li>
 *   <li>finishedAt: Handler 반환 시점 (그 전에는 null)</li>
 *   <li>error: 실패 사유, 실패가 아니면 빈 문자열</li>
 *   <li>progress: 0~100, 종료 상태에서는 항상 100</li>
 * </ul>
 *
 * @param id Job 식별자
 * @param kind Job 종류
 * @param status 현재 상태
 * @param payload 업무 데이터
 * @param error 실패 사유 (빈 문자열 가능)
 * @param createdAt 생성 시각
 * @param startedAt 실행 시작 시각 (null 가능)
 * @param finishedAt 종료 시각 (null 가능)
 * @param progress 진행률 (0~100)
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public record Job(
    JobId id,
    JobKind kind,
    JobStatus status,
    JobPayload payload,
    String error,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    int progress
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public Job {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        error = error == null ? "" : error;
    }

    /**
     * 종료 상태(SUCCESS, FAILED)인지 확인.
     *
     * @return 종료 상태이면 true
     */
    public boolean isFinished() {
        return status.isTerminal();
    }
}
