package com.ryuqq.jobqueue.core.statemachine;

/**
 * Job의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>QUEUED → RUNNING (Worker가 가져감)</li>
 *   <li>QUEUED → FAILED (종료 중인 큐에 enqueue되었거나 실행 전에 큐가 종료됨)</li>
 *   <li>RUNNING → SUCCESS (Handler 정상 반환)</li>
 *   <li>RUNNING → FAILED (Handler 예외 또는 Handler 미등록)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * QUEUED ──────────┐
 *    │             │ (shutdown)
 *    ▼ (claim)     │
 * RUNNING          │
 *    │             │
 *    ├─► SUCCESS   │
 *    │             │
 *    └─► FAILED ◄──┘
 * </pre>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public enum JobStatus {

    /**
     * 대기 중 (Dispatch Channel에 있음).
     */
    QUEUED("queued"),

    /**
     * 실행 중.
     */
    RUNNING("running"),

    /**
     * 성공.
     */
    SUCCESS("success"),

    /**
     * 실패.
     */
    FAILED("failed");

    private final String wireName;

    JobStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * API 표현에 사용하는 소문자 이름.
     *
     * @return queued, running, success, failed 중 하나
     */
    public String wireName() {
        return wireName;
    }

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(SUCCESS, FAILED)의 Job은 더 이상 변경되지 않습니다.</p>
     *
     * @return SUCCESS 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    /**
     * 소문자 이름으로 상태 조회.
     *
     * @param wireName queued, running, success, failed
     * @return JobStatus
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static JobStatus fromWireName(String wireName) {
        for (JobStatus status : values()) {
            if (status.wireName.equals(wireName)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + wireName);
    }
}
