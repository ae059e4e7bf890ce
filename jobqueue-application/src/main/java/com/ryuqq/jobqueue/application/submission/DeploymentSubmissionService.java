package com.ryuqq.jobqueue.application.submission;

import com.ryuqq.jobqueue.application.queue.JobQueue;
import com.ryuqq.jobqueue.core.model.DeployPayload;
import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.resource.Deployment;
import com.ryuqq.jobqueue.core.resource.DeploymentStatus;
import com.ryuqq.jobqueue.core.spi.DeployStore;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * 배포 및 롤백 제출.
 *
 * <p><strong>롤백 대상 선택:</strong></p>
 * <ul>
 *   <li>최신 배포를 제외한 이력 중 가장 최근의 success 배포</li>
 *   <li>이력이 2건 미만이면 "no previous deployment to rollback to"</li>
 *   <li>success 배포가 없으면 "no previous successful deployment found"</li>
 * </ul>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public class DeploymentSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(DeploymentSubmissionService.class);

    private final JobQueue jobQueue;
    private final DeployStore deployStore;
    private final Clock clock;

    public DeploymentSubmissionService(JobQueue jobQueue, DeployStore deployStore) {
        this(jobQueue, deployStore, Clock.systemUTC());
    }

    public DeploymentSubmissionService(JobQueue jobQueue, DeployStore deployStore, Clock clock) {
        if (jobQueue == null) {
            throw new IllegalArgumentException("jobQueue cannot be null");
        }
        if (deployStore == null) {
            throw new IllegalArgumentException("deployStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.jobQueue = jobQueue;
        this.deployStore = deployStore;
        this.clock = clock;
    }

    /**
     * 배포 레코드를 생성하고 배포 Job을 Enqueue.
     *
     * @param serviceId 대상 서비스 ID
     * @param imageTag 배포할 이미지 태그
     * @param reason 배포 사유 (null 가능)
     * @return 배포 레코드 ID와 Job
     * @throws com.ryuqq.jobqueue.core.spi.StoreException 서비스가 없거나 레코드 생성에 실패한 경우
     */
    public Submission submitDeployment(long serviceId, String imageTag, String reason) {
        deployStore.getService(serviceId);
        return enqueueDeployment(serviceId, imageTag, reason);
    }

    /**
     * 직전 성공 배포의 이미지로 롤백 배포를 Enqueue.
     *
     * @param serviceId 대상 서비스 ID
     * @return 롤백 배포 레코드 ID와 Job
     * @throws IllegalStateException 롤백할 이전 배포가 없는 경우
     * @throws com.ryuqq.jobqueue.core.spi.StoreException 서비스가 없거나 저장소 호출이 실패한 경우
     */
    public Submission rollback(long serviceId) {
        List<Deployment> history = deployStore.listDeployments(serviceId);
        if (history.size() < 2) {
            throw new IllegalStateException("no previous deployment to rollback to");
        }

        Deployment target = null;
        for (int i = 1; i < history.size(); i++) {
            if (history.get(i).status() == DeploymentStatus.SUCCESS) {
                target = history.get(i);
                break;
            }
        }
        if (target == null) {
            throw new IllegalStateException("no previous successful deployment found");
        }

        deployStore.getService(serviceId);
        log.info("Rolling back service {} to deployment {} ({})", serviceId, target.id(), target.imageTag());
        return enqueueDeployment(serviceId, target.imageTag(), "Rollback to deployment " + target.id());
    }

    private Submission enqueueDeployment(long serviceId, String imageTag, String reason) {
        Deployment deployment = deployStore.createDeployment(
            new Deployment(0L, serviceId, imageTag, DeploymentStatus.QUEUED, reason, clock.instant())
        );

        Job job = jobQueue.enqueue(new DeployPayload(deployment.id(), serviceId, deployment.imageTag()));
        if (job.status() == JobStatus.FAILED) {
            markFailed(deployment.id(), job);
        }

        log.info("Deployment submitted: deploymentId={}, serviceId={}, imageTag={}, jobId={}",
            deployment.id(), serviceId, deployment.imageTag(), job.id());
        return new Submission(deployment.id(), job);
    }

    // 큐가 즉시 거절한 Job (종료 중이거나 Enqueue가 인터럽트된 경우)
    private void markFailed(long deploymentId, Job job) {
        log.warn("Deploy job rejected by queue: deploymentId={}, jobId={}, error={}", deploymentId, job.id(), job.error());
        try {
            deployStore.updateDeploymentStatus(deploymentId, DeploymentStatus.FAILED, job.error());
        } catch (RuntimeException e) {
            log.error("Failed to update deployment status: deploymentId={}, status={}",
                deploymentId, DeploymentStatus.FAILED.wireName(), e);
        }
    }
}
