package com.ryuqq.jobqueue.core.handler;

import com.ryuqq.jobqueue.core.execution.ExecutionContext;
import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobId;
import com.ryuqq.jobqueue.core.model.JobPayload;

/**
 * {@link JobHandler}에 전달되는 실행 정보.
 *
 * <p>Job 스냅샷(실행 시작 시점), Job별 실행 컨텍스트, 진행률 보고 경로를 묶습니다.
 * Handler는 Job 테이블을 직접 참조하지 않고 이 객체를 통해서만 Queue Controller와 상호작용합니다.</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public final class JobContext {

    private final Job job;
    private final ExecutionContext execution;
    private final ProgressReporter progressReporter;

    /**
     * 생성자.
     *
     * @param job 실행 시작 시점의 Job 스냅샷
     * @param execution Job별 실행 컨텍스트
     * @param progressReporter 진행률 보고 경로
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public JobContext(Job job, ExecutionContext execution, ProgressReporter progressReporter) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        if (execution == null) {
            throw new IllegalArgumentException("execution cannot be null");
        }
        if (progressReporter == null) {
            throw new IllegalArgumentException("progressReporter cannot be null");
        }
        this.job = job;
        this.execution = execution;
        this.progressReporter = progressReporter;
    }

    public Job job() {
        return job;
    }

    public JobId jobId() {
        return job.id();
    }

    public ExecutionContext execution() {
        return execution;
    }

    public ProgressReporter progressReporter() {
        return progressReporter;
    }

    /**
     * 기대하는 타입으로 Payload 조회.
     *
     * @param type 기대 Payload 타입
     * @param <P> Payload 타입
     * @return Payload
     * @throws InvalidPayloadException Payload가 없거나 타입이 다른 경우
     */
    public <P extends JobPayload> P payload(Class<P> type) {
        JobPayload payload = job.payload();
        if (!type.isInstance(payload)) {
            String actual = payload == null ? "null" : payload.getClass().getSimpleName();
            throw new InvalidPayloadException(
                "invalid " + job.kind() + " payload: expected " + type.getSimpleName() + " but was " + actual
            );
        }
        return type.cast(payload);
    }

    /**
     * 이 Job의 진행률 갱신.
     *
     * @param percent 진행률 (0~100)
     */
    public void reportProgress(int percent) {
        progressReporter.updateProgress(job.id(), percent);
    }
}
