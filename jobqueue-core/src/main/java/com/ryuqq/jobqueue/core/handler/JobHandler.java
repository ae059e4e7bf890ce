package com.ryuqq.jobqueue.core.handler;

/**
 * JobKind 하나에 바인딩되는 실행 로직.
 *
 * <p>Worker는 Job을 가져갈 때마다 등록된 Handler를 자신의 스레드에서 동기적으로 호출합니다.
 * 한 Worker는 한 번에 하나의 Handler만 실행합니다.</p>
 *
 * <p><strong>결과 규칙:</strong></p>
 * <ul>
 *   <li>정상 반환 → Job SUCCESS</li>
 *   <li>예외 발생 → Job FAILED, 예외 메시지를 그대로 기록</li>
 * </ul>
 *
 * <p><strong>취소:</strong> Handler는 블로킹 외부 호출 사이사이에
 * {@code context.execution().isCancelled()}를 확인해야 합니다. Worker는 Handler를 강제로 중단하지 않습니다.</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * Job 실행.
     *
     * @param context Job 스냅샷, 실행 컨텍스트, 진행률 보고 경로
     * @throws Exception 실행 실패 시 (Job은 FAILED로 종료됨)
     */
    void handle(JobContext context) throws Exception;
}
