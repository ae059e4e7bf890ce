package com.ryuqq.jobqueue.adapter.inmemory.metrics;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryMetricsSink 테스트.
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
class InMemoryMetricsSinkTest {

    @Test
    void 결과별_카운터와_누적_시간() {
        InMemoryMetricsSink sink = new InMemoryMetricsSink();

        sink.recordBuild(true, Duration.ofSeconds(2));
        sink.recordBuild(false, Duration.ofSeconds(1));
        sink.recordDeployment(false, Duration.ofMillis(300));

        assertThat(sink.buildSuccesses()).isEqualTo(1);
        assertThat(sink.buildFailures()).isEqualTo(1);
        assertThat(sink.totalBuildTime()).isEqualTo(Duration.ofSeconds(3));
        assertThat(sink.deploymentSuccesses()).isZero();
        assertThat(sink.deploymentFailures()).isEqualTo(1);
    }

    @Test
    void active_jobs_게이지() {
        InMemoryMetricsSink sink = new InMemoryMetricsSink();

        sink.incActiveJobs();
        sink.incActiveJobs();
        sink.decActiveJobs();

        assertThat(sink.activeJobs()).isEqualTo(1);
    }
}
