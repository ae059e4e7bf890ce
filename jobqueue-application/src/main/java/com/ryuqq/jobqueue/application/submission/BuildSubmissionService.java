package com.ryuqq.jobqueue.application.submission;

import com.ryuqq.jobqueue.application.queue.JobQueue;
import com.ryuqq.jobqueue.core.model.BuildPayload;
import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.resource.Build;
import com.ryuqq.jobqueue.core.resource.BuildStatus;
import com.ryuqq.jobqueue.core.resource.Service;
import com.ryuqq.jobqueue.core.spi.BuildStore;
import com.ryuqq.jobqueue.core.spi.DeployStore;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * 빌드 제출.
 *
 * <p>서비스를 조회하고 {@code queued} 빌드 레코드를 만든 뒤 {@code build} Job을 Enqueue합니다.
 * 이미지 태그는 {@code <서비스 이름>:<ref>-<epoch 초>} 형식입니다.
 * 큐가 Job을 즉시 실패로 돌려주면 빌드 레코드도 {@code failed}로 갱신합니다.</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public class BuildSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(BuildSubmissionService.class);

    private final JobQueue jobQueue;
    private final DeployStore deployStore;
    private final BuildStore buildStore;
    private final Clock clock;

    public BuildSubmissionService(JobQueue jobQueue, DeployStore deployStore, BuildStore buildStore) {
        this(jobQueue, deployStore, buildStore, Clock.systemUTC());
    }

    public BuildSubmissionService(JobQueue jobQueue, DeployStore deployStore, BuildStore buildStore, Clock clock) {
        if (jobQueue == null) {
            throw new IllegalArgumentException("jobQueue cannot be null");
        }
        if (deployStore == null) {
            throw new IllegalArgumentException("deployStore cannot be null");
        }
        if (buildStore == null) {
            throw new IllegalArgumentException("buildStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.jobQueue = jobQueue;
        this.deployStore = deployStore;
        this.buildStore = buildStore;
        this.clock = clock;
    }

    /**
     * 빌드 레코드를 생성하고 빌드 Job을 Enqueue.
     *
     * @param serviceId 빌드 대상 서비스 ID
     * @param request 빌드 요청
     * @return 빌드 레코드 ID와 Job
     * @throws IllegalArgumentException request가 null인 경우
     * @throws com.ryuqq.jobqueue.core.spi.StoreException 서비스가 없거나 레코드 생성에 실패한 경우
     */
    public Submission submitBuild(long serviceId, BuildRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        Service service = deployStore.getService(serviceId);
        Instant now = clock.instant();

        Build build = buildStore.createBuild(new Build(
            0L,
            serviceId,
            request.repositoryUrl(),
            request.gitRef(),
            request.contextPath(),
            request.dockerfile(),
            service.name() + ":" + request.gitRef() + "-" + now.getEpochSecond(),
            BuildStatus.QUEUED,
            null,
            null,
            null,
            now
        ));

        Job job = jobQueue.enqueue(new BuildPayload(
            build.id(),
            build.repositoryUrl(),
            build.gitRef(),
            build.contextPath(),
            build.dockerfile(),
            build.imageTag()
        ));
        if (job.status() == JobStatus.FAILED) {
            markFailed(build.id(), job);
        }

        log.info("Build submitted: buildId={}, serviceId={}, imageTag={}, jobId={}",
            build.id(), serviceId, build.imageTag(), job.id());
        return new Submission(build.id(), job);
    }

    private void markFailed(long buildId, Job job) {
        log.warn("Build job rejected by queue: buildId={}, jobId={}, error={}", buildId, job.id(), job.error());
        try {
            buildStore.updateBuildStatus(buildId, BuildStatus.FAILED, null, null, clock.instant());
        } catch (RuntimeException e) {
            log.error("Failed to update build status: buildId={}, status={}", buildId, BuildStatus.FAILED.wireName(), e);
        }
    }
}
