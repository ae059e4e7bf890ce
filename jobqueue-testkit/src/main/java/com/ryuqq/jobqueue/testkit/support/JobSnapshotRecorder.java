package com.ryuqq.jobqueue.testkit.support;

import com.ryuqq.jobqueue.application.queue.JobQueue;
import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobId;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 일정 간격으로 {@link JobQueue#listJobs()}를 샘플링하여 Job별 관측 이력을 기록.
 *
 * <p>상태 전이 방향, 진행률 단조성, 동시 running 수 같은 시간에 걸친 성질을 검증할 때 사용합니다.
 * 같은 스냅샷이 연속으로 관측되면 한 번만 기록합니다.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * try (JobSnapshotRecorder recorder = JobSnapshotRecorder.start(queue, Duration.ofMillis(2))) {
 *     // enqueue, await ...
 * }
 * assertThat(recorder.backwardTransitions()).isEmpty();
 * </pre>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public final class JobSnapshotRecorder implements AutoCloseable {

    private final JobQueue queue;
    private final Duration interval;
    private final Map<JobId, List<Job>> history = new ConcurrentHashMap<>();
    private final AtomicInteger maxRunning = new AtomicInteger();
    private final Thread sampler;

    private volatile boolean running = true;

    private JobSnapshotRecorder(JobQueue queue, Duration interval) {
        this.queue = queue;
        this.interval = interval;
        this.sampler = new Thread(this::sampleLoop, "job-snapshot-recorder");
        this.sampler.setDaemon(true);
    }

    /**
     * 샘플링 시작.
     *
     * @param queue 관측 대상
     * @param interval 샘플링 간격
     * @return 시작된 recorder
     */
    public static JobSnapshotRecorder start(JobQueue queue, Duration interval) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("interval cannot be null or negative");
        }
        JobSnapshotRecorder recorder = new JobSnapshotRecorder(queue, interval);
        recorder.sampler.start();
        return recorder;
    }

    /**
     * 샘플링을 멈추고 마지막으로 한 번 더 기록.
     */
    @Override
    public void close() {
        running = false;
        try {
            sampler.join(5_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        sampleOnce();
    }

    /**
     * Job별 관측 이력 (관측 순서).
     */
    public Map<JobId, List<Job>> history() {
        Map<JobId, List<Job>> copy = new LinkedHashMap<>();
        history.forEach((id, snapshots) -> {
            synchronized (snapshots) {
                copy.put(id, List.copyOf(snapshots));
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    /**
     * 한 샘플에서 관측된 running Job 수의 최댓값.
     */
    public int maxRunningObserved() {
        return maxRunning.get();
    }

    /**
     * 상태가 역방향으로 바뀐 관측 (queued ← running ← success/failed).
     *
     * @return 위반 설명 목록 (없으면 빈 목록)
     */
    public List<String> backwardTransitions() {
        List<String> violations = new ArrayList<>();
        history().forEach((id, snapshots) -> {
            for (int i = 1; i < snapshots.size(); i++) {
                JobStatus before = snapshots.get(i - 1).status();
                JobStatus after = snapshots.get(i).status();
                if (rank(after) < rank(before) || (before.isTerminal() && after != before)) {
                    violations.add(id.getValue() + ": " + before.wireName() + " -> " + after.wireName());
                }
            }
        });
        return violations;
    }

    /**
     * 같은 실행 안에서 진행률이 감소한 관측.
     *
     * @return 위반 설명 목록 (없으면 빈 목록)
     */
    public List<String> progressRegressions() {
        List<String> violations = new ArrayList<>();
        history().forEach((id, snapshots) -> {
            for (int i = 1; i < snapshots.size(); i++) {
                int before = snapshots.get(i - 1).progress();
                int after = snapshots.get(i).progress();
                if (after < before) {
                    violations.add(id.getValue() + ": " + before + " -> " + after);
                }
            }
        });
        return violations;
    }

    /**
     * 진행률 100과 종료 상태가 일치하지 않는 관측.
     *
     * @return 위반 설명 목록 (없으면 빈 목록)
     */
    public List<String> progressTerminalMismatches() {
        List<String> violations = new ArrayList<>();
        history().forEach((id, snapshots) -> {
            for (Job snapshot : snapshots) {
                if ((snapshot.progress() == 100) != snapshot.isFinished()) {
                    violations.add(id.getValue() + ": " + snapshot.status().wireName() + " with progress " + snapshot.progress());
                }
            }
        });
        return violations;
    }

    private void sampleLoop() {
        while (running) {
            sampleOnce();
            try {
                Thread.sleep(Math.max(1, interval.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void sampleOnce() {
        List<Job> snapshots = queue.listJobs();
        int runningNow = 0;
        for (Job job : snapshots) {
            if (job.status() == JobStatus.RUNNING) {
                runningNow++;
            }
            List<Job> jobHistory = history.computeIfAbsent(job.id(), id -> new ArrayList<>());
            synchronized (jobHistory) {
                if (jobHistory.isEmpty() || !jobHistory.get(jobHistory.size() - 1).equals(job)) {
                    jobHistory.add(job);
                }
            }
        }
        maxRunning.accumulateAndGet(runningNow, Math::max);
    }

    private static int rank(JobStatus status) {
        switch (status) {
            case QUEUED:
                return 0;
            case RUNNING:
                return 1;
            default:
                return 2;
        }
    }
}
