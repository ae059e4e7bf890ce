package com.ryuqq.jobqueue.application.submission;

import com.ryuqq.jobqueue.core.model.Job;

/**
 * 제출 결과: 생성된 저장소 레코드 ID와 큐에 들어간 Job.
 *
 * @param recordId 빌드 또는 배포 레코드 ID
 * @param job Enqueue 시점의 Job 스냅샷
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public record Submission(long recordId, Job job) {

    public Submission {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
    }
}
