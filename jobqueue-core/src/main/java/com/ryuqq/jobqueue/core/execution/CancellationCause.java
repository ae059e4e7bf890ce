package com.ryuqq.jobqueue.core.execution;

/**
 * ExecutionContext가 취소된 원인.
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public enum CancellationCause {

    /**
     * 큐 종료로 인한 취소.
     */
    SHUTDOWN("queue is shutting down"),

    /**
     * 실행 상한 시간 초과.
     */
    DEADLINE_EXCEEDED("deadline exceeded"),

    /**
     * 명시적 취소 (실행 종료 후 컨텍스트 정리 포함).
     */
    CANCELLED("context cancelled");

    private final String description;

    CancellationCause(String description) {
        this.description = description;
    }

    /**
     * 사람이 읽을 수 있는 설명.
     *
     * @return 설명
     */
    public String description() {
        return description;
    }
}
