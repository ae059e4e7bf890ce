package com.ryuqq.jobqueue.core.spi.noop;

import com.ryuqq.jobqueue.core.spi.MetricsSink;

import java.time.Duration;

/**
 * 아무것도 기록하지 않는 {@link MetricsSink}.
 *
 * <p>메트릭 수집이 필요 없는 환경이나 테스트에서 사용합니다.</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public final class NoOpMetricsSink implements MetricsSink {

    public static final NoOpMetricsSink INSTANCE = new NoOpMetricsSink();

    private NoOpMetricsSink() {
    }

    @Override
    public void recordBuild(boolean success, Duration duration) {
    }

    @Override
    public void recordDeployment(boolean success, Duration duration) {
    }

    @Override
    public void incActiveJobs() {
    }

    @Override
    public void decActiveJobs() {
    }
}
