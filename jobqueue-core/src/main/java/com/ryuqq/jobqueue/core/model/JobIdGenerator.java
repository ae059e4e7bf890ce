package com.ryuqq.jobqueue.core.model;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 시각 기반 JobId 발급기.
 *
 * <p>epoch 기준 나노초 값을 식별자로 사용하되, 같은 시각에 두 번 호출되면
 * 직전 값 + 1을 발급하여 충돌을 피합니다. 따라서 발급 순서대로 값이 증가합니다.</p>
 *
 * <p><strong>동시성:</strong> thread-safe (CAS 기반)</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public final class JobIdGenerator {

    private final Clock clock;
    private final AtomicLong last = new AtomicLong(Long.MIN_VALUE);

    /**
     * 시스템 UTC 시계를 사용하는 발급기 생성.
     */
    public JobIdGenerator() {
        this(Clock.systemUTC());
    }

    /**
     * 주어진 시계를 사용하는 발급기 생성.
     *
     * @param clock 시각 제공자
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public JobIdGenerator(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * 다음 JobId 발급.
     *
     * @return 이전에 발급된 어떤 값보다 큰 JobId
     */
    public JobId next() {
        Instant now = clock.instant();
        long candidate = now.getEpochSecond() * 1_000_000_000L + now.getNano();
        long value = last.updateAndGet(previous -> Math.max(previous + 1, candidate));
        return JobId.of(Long.toString(value));
    }
}
