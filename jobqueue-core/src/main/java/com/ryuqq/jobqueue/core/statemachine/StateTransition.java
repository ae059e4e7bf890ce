package com.ryuqq.jobqueue.core.statemachine;

/**
 * Job 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>QUEUED → RUNNING</li>
 *   <li>QUEUED → FAILED</li>
 *   <li>RUNNING → SUCCESS</li>
 *   <li>RUNNING → FAILED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(SUCCESS, FAILED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>역방향 전이 불가 (예: RUNNING → QUEUED)</li>
 *   <li>QUEUED에서 SUCCESS로 바로 갈 수 없음 (RUNNING을 건너뛸 수 없음)</li>
 * </ul>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(JobStatus from, JobStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case QUEUED -> to == JobStatus.RUNNING || to == JobStatus.FAILED;
            case RUNNING -> to == JobStatus.SUCCESS || to == JobStatus.FAILED;
            case SUCCESS, FAILED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static JobStatus transition(JobStatus current, JobStatus next) {
        validate(current, next);
        return next;
    }
}
