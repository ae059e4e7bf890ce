package com.ryuqq.jobqueue.testkit.support;

import com.ryuqq.jobqueue.core.handler.JobContext;
import com.ryuqq.jobqueue.core.handler.JobHandler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 고정 시간 동안 블로킹하며 동시 실행 수를 측정하는 Handler.
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public final class ConcurrencyTracker implements JobHandler {

    private final Duration holdTime;
    private final AtomicInteger current = new AtomicInteger();
    private final AtomicInteger max = new AtomicInteger();
    private final AtomicInteger invocations = new AtomicInteger();

    public ConcurrencyTracker(Duration holdTime) {
        if (holdTime == null || holdTime.isNegative()) {
            throw new IllegalArgumentException("holdTime cannot be null or negative");
        }
        this.holdTime = holdTime;
    }

    @Override
    public void handle(JobContext context) throws InterruptedException {
        invocations.incrementAndGet();
        int running = current.incrementAndGet();
        max.accumulateAndGet(running, Math::max);
        try {
            Thread.sleep(holdTime.toMillis());
        } finally {
            current.decrementAndGet();
        }
    }

    /**
     * 관측된 최대 동시 실행 수.
     */
    public int maxConcurrent() {
        return max.get();
    }

    public int invocations() {
        return invocations.get();
    }
}
