package com.ryuqq.jobqueue.application.handler;

import com.ryuqq.jobqueue.core.contract.BuildResult;
import com.ryuqq.jobqueue.core.contract.BuildSpec;
import com.ryuqq.jobqueue.core.handler.JobContext;
import com.ryuqq.jobqueue.core.handler.JobHandler;
import com.ryuqq.jobqueue.core.model.BuildPayload;
import com.ryuqq.jobqueue.core.resource.BuildStatus;
import com.ryuqq.jobqueue.core.spi.BuildStore;
import com.ryuqq.jobqueue.core.spi.ContainerRuntime;
import com.ryuqq.jobqueue.core.spi.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * {@code build} Job Handler.
 *
 * <p>컨테이너 런타임으로 이미지를 빌드하고, 빌드 레코드 상태와 메트릭을 기록합니다.</p>
 *
 * <p><strong>진행률 체크포인트:</strong></p>
 * <pre>
 * 10  시작
 * 20  로그 파일 준비, 빌드 상태 building
 * 30  빌드 호출 직전
 * 30~90  로그 줄 수 기반 ({@link ProgressReportingOutputStream})
 * 90  빌드 반환
 * 100 Handler 반환
 * </pre>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>로그 파일 생성 실패: 빌드를 시도하지 않고 즉시 실패</li>
 *   <li>런타임 예외 또는 success=false 결과: "build failed: ..."로 실패</li>
 *   <li>빌드 레코드 상태 갱신 실패: 로그만 남기고 Job 결과에 영향 없음</li>
 * </ul>
 *
 * <p>메트릭은 빌드를 시도한 실행마다 정확히 한 번 기록됩니다.</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public class BuildJobHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(BuildJobHandler.class);

    private final ContainerRuntime containerRuntime;
    private final BuildStore buildStore;
    private final MetricsSink metricsSink;
    private final BuildHandlerConfig config;
    private final Clock clock;

    public BuildJobHandler(
        ContainerRuntime containerRuntime,
        BuildStore buildStore,
        MetricsSink metricsSink,
        BuildHandlerConfig config
    ) {
        this(containerRuntime, buildStore, metricsSink, config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param containerRuntime 컨테이너 런타임
     * @param buildStore 빌드 레코드 저장소
     * @param metricsSink 메트릭 수집기
     * @param config Handler 설정
     * @param clock 시각 제공자
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public BuildJobHandler(
        ContainerRuntime containerRuntime,
        BuildStore buildStore,
        MetricsSink metricsSink,
        BuildHandlerConfig config,
        Clock clock
    ) {
        if (containerRuntime == null) {
            throw new IllegalArgumentException("containerRuntime cannot be null");
        }
        if (buildStore == null) {
            throw new IllegalArgumentException("buildStore cannot be null");
        }
        if (metricsSink == null) {
            throw new IllegalArgumentException("metricsSink cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.containerRuntime = containerRuntime;
        this.buildStore = buildStore;
        this.metricsSink = metricsSink;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void handle(JobContext context) throws IOException {
        BuildPayload build = context.payload(BuildPayload.class);
        Instant handlerStart = clock.instant();

        context.reportProgress(10);

        Path logPath = config.logDirectory().toAbsolutePath().resolve("build_" + build.buildId() + ".log");
        try (OutputStream logFile = openLogFile(logPath)) {
            persistStatus(build.buildId(), BuildStatus.BUILDING, logPath.toString(), handlerStart, null);

            context.reportProgress(20);

            ProgressReportingOutputStream logSink = new ProgressReportingOutputStream(
                logFile, context.progressReporter(), context.jobId(), 30, 90, config.estimatedLogLines()
            );
            BuildSpec spec = new BuildSpec(
                build.repositoryUrl(),
                build.gitRef(),
                build.contextPath(),
                build.dockerfile(),
                build.imageTag(),
                logSink
            );

            context.reportProgress(30);

            BuildResult result = null;
            RuntimeException buildError = null;
            try {
                result = containerRuntime.buildImage(spec, context.execution());
            } catch (RuntimeException e) {
                buildError = e;
            }
            Instant buildEnd = clock.instant();

            context.reportProgress(90);

            boolean success = buildError == null && result != null && result.success();
            metricsSink.recordBuild(success, Duration.between(handlerStart, buildEnd));
            persistStatus(build.buildId(), success ? BuildStatus.SUCCESS : BuildStatus.FAILED,
                logPath.toString(), null, buildEnd);

            context.reportProgress(100);

            if (buildError != null) {
                throw new JobExecutionException("build failed: " + buildError.getMessage(), buildError);
            }
            if (!success) {
                String detail = result == null ? "no result returned" : result.error();
                throw new JobExecutionException("build failed: " + detail);
            }

            log.info("Build completed: buildId={}, imageTag={}, duration={}ms",
                build.buildId(), build.imageTag(), result.duration().toMillis());
        }
    }

    private OutputStream openLogFile(Path logPath) {
        try {
            Files.createDirectories(logPath.getParent());
            return Files.newOutputStream(logPath);
        } catch (IOException e) {
            throw new JobExecutionException("failed to create log file: " + e.getMessage(), e);
        }
    }

    private void persistStatus(long buildId, BuildStatus status, String logPath, Instant startedAt, Instant finishedAt) {
        try {
            buildStore.updateBuildStatus(buildId, status, logPath, startedAt, finishedAt);
        } catch (RuntimeException e) {
            log.error("Failed to update build status: buildId={}, status={}", buildId, status.wireName(), e);
        }
    }
}
