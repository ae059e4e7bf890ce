package com.ryuqq.jobqueue.adapter.inmemory.runtime;

import com.ryuqq.jobqueue.core.contract.BuildResult;
import com.ryuqq.jobqueue.core.contract.BuildSpec;
import com.ryuqq.jobqueue.core.execution.CancellationCause;
import com.ryuqq.jobqueue.core.execution.ExecutionContext;
import com.ryuqq.jobqueue.core.spi.ContainerRuntime;
import com.ryuqq.jobqueue.core.spi.ContainerRuntimeException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 스크립트 가능한 인메모리 {@link ContainerRuntime}.
 *
 * <p>실제 컨테이너 엔진 없이 빌드/pull 흐름을 재현합니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>buildImage: {@code buildLogLines}줄의 로그를 logSink에 쓰고, 성공 시 이미지를 로컬 이미지로 등록</li>
 *   <li>줄 사이 {@code lineDelay}만큼 취소를 기다리며 대기, 취소되면 {@link ContainerRuntimeException}</li>
 *   <li>{@link #failBuild(String, String)}로 지정한 태그는 success=false 결과 반환</li>
 *   <li>pullImage: {@link #failPull(String, String)}로 지정한 태그는 예외, 그 외에는 로컬 이미지로 등록</li>
 * </ul>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public class InMemoryContainerRuntime implements ContainerRuntime {

    private final Set<String> localImages = ConcurrentHashMap.newKeySet();
    private final Map<String, String> buildFailures = new ConcurrentHashMap<>();
    private final Map<String, String> pullFailures = new ConcurrentHashMap<>();
    private final AtomicInteger buildCount = new AtomicInteger();
    private final AtomicInteger pullCount = new AtomicInteger();

    private volatile int buildLogLines = 10;
    private volatile Duration lineDelay = Duration.ZERO;

    public InMemoryContainerRuntime withBuildLogLines(int buildLogLines) {
        if (buildLogLines < 0) {
            throw new IllegalArgumentException("buildLogLines cannot be negative (current: " + buildLogLines + ")");
        }
        this.buildLogLines = buildLogLines;
        return this;
    }

    public InMemoryContainerRuntime withLineDelay(Duration lineDelay) {
        if (lineDelay == null || lineDelay.isNegative()) {
            throw new IllegalArgumentException("lineDelay cannot be null or negative");
        }
        this.lineDelay = lineDelay;
        return this;
    }

    public void addLocalImage(String imageTag) {
        localImages.add(imageTag);
    }

    public void failBuild(String imageTag, String error) {
        buildFailures.put(imageTag, error);
    }

    public void failPull(String imageTag, String error) {
        pullFailures.put(imageTag, error);
    }

    @Override
    public BuildResult buildImage(BuildSpec spec, ExecutionContext context) {
        buildCount.incrementAndGet();
        Instant start = Instant.now();

        for (int line = 1; line <= buildLogLines; line++) {
            awaitLineDelay(context);
            Optional<CancellationCause> cancelled = context.cancellationCause();
            if (cancelled.isPresent()) {
                throw new ContainerRuntimeException("build cancelled: " + cancelled.get().description());
            }
            writeLine(spec, "Step " + line + "/" + buildLogLines + " : building " + spec.imageTag());
        }

        Duration duration = Duration.between(start, Instant.now());
        String failure = buildFailures.get(spec.imageTag());
        if (failure != null) {
            return BuildResult.failed(spec.imageTag(), duration, failure);
        }
        localImages.add(spec.imageTag());
        return BuildResult.succeeded(spec.imageTag(), duration);
    }

    @Override
    public boolean imageExists(String imageTag, ExecutionContext context) {
        return localImages.contains(imageTag);
    }

    @Override
    public void pullImage(String imageTag, ExecutionContext context) {
        pullCount.incrementAndGet();
        String failure = pullFailures.get(imageTag);
        if (failure != null) {
            throw new ContainerRuntimeException(failure);
        }
        localImages.add(imageTag);
    }

    public boolean hasLocalImage(String imageTag) {
        return localImages.contains(imageTag);
    }

    public int buildCount() {
        return buildCount.get();
    }

    public int pullCount() {
        return pullCount.get();
    }

    private void awaitLineDelay(ExecutionContext context) {
        if (lineDelay.isZero()) {
            return;
        }
        try {
            context.awaitCancellation(lineDelay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContainerRuntimeException("build interrupted", e);
        }
    }

    private void writeLine(BuildSpec spec, String line) {
        try {
            spec.logSink().write((line + "\n").getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ContainerRuntimeException("failed to write build log: " + e.getMessage(), e);
        }
    }
}
