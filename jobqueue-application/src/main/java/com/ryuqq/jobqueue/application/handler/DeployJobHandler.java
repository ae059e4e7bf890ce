package com.ryuqq.jobqueue.application.handler;

import com.ryuqq.jobqueue.core.handler.JobContext;
import com.ryuqq.jobqueue.core.handler.JobHandler;
import com.ryuqq.jobqueue.core.model.DeployPayload;
import com.ryuqq.jobqueue.core.resource.DeploymentStatus;
import com.ryuqq.jobqueue.core.spi.ContainerRuntime;
import com.ryuqq.jobqueue.core.spi.DeployStore;
import com.ryuqq.jobqueue.core.spi.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * {@code deploy} Job Handler.
 *
 * <p>서비스가 실행할 이미지를 새 태그로 교체합니다.</p>
 *
 * <p><strong>처리 순서 (진행률):</strong></p>
 * <ol>
 *   <li>(10) 대상 서비스 조회, 없으면 즉시 실패</li>
 *   <li>(20) 배포 상태 deploying</li>
 *   <li>(30) 이미지 존재 확인, 없으면 pull</li>
 *   <li>(60) 서비스 이미지 참조 갱신</li>
 *   <li>(90) 배포 상태 success</li>
 *   <li>(100) 성공 메트릭 기록</li>
 * </ol>
 *
 * <p>pull 또는 서비스 갱신이 실패하면 배포 상태를 failed(사유 포함)로 기록합니다.
 * 성공 경로의 상태 갱신 실패는 로그만 남깁니다.</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public class DeployJobHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(DeployJobHandler.class);

    private final ContainerRuntime containerRuntime;
    private final DeployStore deployStore;
    private final MetricsSink metricsSink;
    private final Clock clock;

    public DeployJobHandler(ContainerRuntime containerRuntime, DeployStore deployStore, MetricsSink metricsSink) {
        this(containerRuntime, deployStore, metricsSink, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param containerRuntime 컨테이너 런타임
     * @param deployStore 서비스/배포 저장소
     * @param metricsSink 메트릭 수집기
     * @param clock 시각 제공자
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DeployJobHandler(
        ContainerRuntime containerRuntime,
        DeployStore deployStore,
        MetricsSink metricsSink,
        Clock clock
    ) {
        if (containerRuntime == null) {
            throw new IllegalArgumentException("containerRuntime cannot be null");
        }
        if (deployStore == null) {
            throw new IllegalArgumentException("deployStore cannot be null");
        }
        if (metricsSink == null) {
            throw new IllegalArgumentException("metricsSink cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.containerRuntime = containerRuntime;
        this.deployStore = deployStore;
        this.metricsSink = metricsSink;
        this.clock = clock;
    }

    @Override
    public void handle(JobContext context) {
        DeployPayload deployment = context.payload(DeployPayload.class);
        Instant deployStart = clock.instant();

        context.reportProgress(10);

        try {
            deployStore.getService(deployment.serviceId());
        } catch (RuntimeException e) {
            recordOutcome(false, deployStart);
            throw new JobExecutionException("failed to get service: " + e.getMessage(), e);
        }

        context.reportProgress(20);

        persistStatus(deployment.deploymentId(), DeploymentStatus.DEPLOYING, null);

        context.reportProgress(30);

        boolean imageExists;
        try {
            imageExists = containerRuntime.imageExists(deployment.imageTag(), context.execution());
        } catch (RuntimeException e) {
            fail(deployment, "Failed to check image existence: " + e.getMessage(), deployStart);
            throw new JobExecutionException("failed to check image existence: " + e.getMessage(), e);
        }

        if (!imageExists) {
            log.info("Pulling image for deployment: deploymentId={}, imageTag={}",
                deployment.deploymentId(), deployment.imageTag());
            try {
                containerRuntime.pullImage(deployment.imageTag(), context.execution());
            } catch (RuntimeException e) {
                fail(deployment, "Failed to pull image: " + e.getMessage(), deployStart);
                throw new JobExecutionException(
                    "failed to pull image " + deployment.imageTag() + ": " + e.getMessage(), e
                );
            }
        }

        context.reportProgress(60);

        try {
            deployStore.updateService(deployment.serviceId(), Map.of(DeployStore.FIELD_IMAGE, deployment.imageTag()));
        } catch (RuntimeException e) {
            fail(deployment, "Failed to update service: " + e.getMessage(), deployStart);
            throw new JobExecutionException("failed to update service: " + e.getMessage(), e);
        }

        context.reportProgress(90);

        persistStatus(deployment.deploymentId(), DeploymentStatus.SUCCESS, null);

        context.reportProgress(100);

        recordOutcome(true, deployStart);

        log.info("Deployment completed: deploymentId={}, serviceId={}, imageTag={}",
            deployment.deploymentId(), deployment.serviceId(), deployment.imageTag());
    }

    private void fail(DeployPayload deployment, String reason, Instant deployStart) {
        persistStatus(deployment.deploymentId(), DeploymentStatus.FAILED, reason);
        recordOutcome(false, deployStart);
    }

    private void recordOutcome(boolean success, Instant deployStart) {
        metricsSink.recordDeployment(success, Duration.between(deployStart, clock.instant()));
    }

    private void persistStatus(long deploymentId, DeploymentStatus status, String reason) {
        try {
            deployStore.updateDeploymentStatus(deploymentId, status, reason);
        } catch (RuntimeException e) {
            log.error("Failed to update deployment status: deploymentId={}, status={}",
                deploymentId, status.wireName(), e);
        }
    }
}
