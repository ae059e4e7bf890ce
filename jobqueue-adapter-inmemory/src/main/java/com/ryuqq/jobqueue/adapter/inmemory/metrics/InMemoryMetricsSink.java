package com.ryuqq.jobqueue.adapter.inmemory.metrics;

import com.ryuqq.jobqueue.core.spi.MetricsSink;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 카운터 기반 {@link MetricsSink}.
 *
 * <p>테스트에서 기록 횟수와 active jobs 게이지를 검증하는 용도입니다.
 * 모든 기록은 lock-free이며 호출자를 블로킹하지 않습니다.</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public class InMemoryMetricsSink implements MetricsSink {

    private final AtomicInteger buildSuccesses = new AtomicInteger();
    private final AtomicInteger buildFailures = new AtomicInteger();
    private final AtomicInteger deploymentSuccesses = new AtomicInteger();
    private final AtomicInteger deploymentFailures = new AtomicInteger();
    private final AtomicLong totalBuildNanos = new AtomicLong();
    private final AtomicLong totalDeploymentNanos = new AtomicLong();
    private final AtomicInteger activeJobs = new AtomicInteger();

    @Override
    public void recordBuild(boolean success, Duration duration) {
        (success ? buildSuccesses : buildFailures).incrementAndGet();
        totalBuildNanos.addAndGet(duration == null ? 0 : duration.toNanos());
    }

    @Override
    public void recordDeployment(boolean success, Duration duration) {
        (success ? deploymentSuccesses : deploymentFailures).incrementAndGet();
        totalDeploymentNanos.addAndGet(duration == null ? 0 : duration.toNanos());
    }

    @Override
    public void incActiveJobs() {
        activeJobs.incrementAndGet();
    }

    @Override
    public void decActiveJobs() {
        activeJobs.decrementAndGet();
    }

    public int buildSuccesses() {
        return buildSuccesses.get();
    }

    public int buildFailures() {
        return buildFailures.get();
    }

    public int deploymentSuccesses() {
        return deploymentSuccesses.get();
    }

    public int deploymentFailures() {
        return deploymentFailures.get();
    }

    public Duration totalBuildTime() {
        return Duration.ofNanos(totalBuildNanos.get());
    }

    public Duration totalDeploymentTime() {
        return Duration.ofNanos(totalDeploymentNanos.get());
    }

    /**
     * 현재 active jobs 게이지 값.
     *
     * @return Dispatch Channel에 들어갔으나 아직 종료되지 않은 Job 수
     */
    public int activeJobs() {
        return activeJobs.get();
    }
}
