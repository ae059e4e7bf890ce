package com.ryuqq.jobqueue.core.handler;

import com.ryuqq.jobqueue.core.model.JobId;

/**
 * Handler가 Queue Controller에 진행률을 알리는 콜백.
 *
 * <p>구현체는 Job이 RUNNING 상태일 때만 진행률을 반영하고, 그 외에는 무시해야 합니다.
 * 값의 범위(0~100)는 호출자가 책임집니다.</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProgressReporter {

    /**
     * 진행률 갱신.
     *
     * @param jobId 대상 Job
     * @param percent 진행률 (0~100)
     */
    void updateProgress(JobId jobId, int percent);
}
