package com.ryuqq.jobqueue.adapter.runner;

import com.ryuqq.jobqueue.application.queue.JobQueue;
import com.ryuqq.jobqueue.application.runtime.QueueRuntime;
import com.ryuqq.jobqueue.core.execution.CancellationCause;
import com.ryuqq.jobqueue.core.execution.ExecutionContext;
import com.ryuqq.jobqueue.core.handler.JobContext;
import com.ryuqq.jobqueue.core.handler.JobHandler;
import com.ryuqq.jobqueue.core.handler.ProgressReporter;
import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobId;
import com.ryuqq.jobqueue.core.model.JobIdGenerator;
import com.ryuqq.jobqueue.core.model.JobKind;
import com.ryuqq.jobqueue.core.model.JobPayload;
import com.ryuqq.jobqueue.core.spi.MetricsSink;
import com.ryuqq.jobqueue.core.spi.noop.NoOpMetricsSink;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;
import com.ryuqq.jobqueue.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 인프로세스 Job Queue Controller (Worker Pool 포함).
 *
 * <p>Job 테이블의 유일한 소유자이자 작성자입니다. 호출자와 Handler는 불변 스냅샷만 받습니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * enqueue(kind, payload)
 *   ↓  Job 생성 (queued) → 테이블 저장 → Dispatch Channel 전송
 * worker (workerCount개)
 *   ↓  claim: queued → running, startedAt, progress=0
 *   ↓  Handler 조회 (없으면 failed: "no handler registered ...")
 *   ↓  root context에서 executionTimeout 상한의 Job context 파생
 *   ↓  handler.handle(JobContext)  (같은 Worker 스레드에서 동기 실행, Exception/Error 모두 포착)
 * finishJob
 *   ↓  finishedAt, progress=100, success 또는 failed(예외 메시지)
 * </pre>
 *
 * <p><strong>종료 (stop):</strong></p>
 * <ol>
 *   <li>이후 claim 거부, root context 취소 ({@link CancellationCause#SHUTDOWN})</li>
 *   <li>Dispatch Channel 닫기</li>
 *   <li>실행 중인 Handler가 모두 반환할 때까지 대기 (인터럽트하지 않음)</li>
 *   <li>채널에 남은 Job을 "queue is shutting down"으로 failed 처리</li>
 * </ol>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>Job 테이블은 단일 ReadWriteLock으로 보호, lock 안에서는 map 갱신만 수행</li>
 *   <li>로그, 메트릭, Handler 호출은 lock 밖에서 수행</li>
 *   <li>Worker 1개는 한 번에 Job 1건만 실행</li>
 * </ul>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public final class QueueController implements JobQueue, QueueRuntime, ProgressReporter {

    private static final Logger log = LoggerFactory.getLogger(QueueController.class);

    static final String SHUTDOWN_REASON = CancellationCause.SHUTDOWN.description();

    private final QueueControllerConfig config;
    private final MetricsSink metricsSink;
    private final Clock clock;
    private final JobIdGenerator idGenerator;
    private final HandlerRegistry handlerRegistry = new HandlerRegistry();
    private final DispatchChannel channel;
    private final ExecutionContext rootContext;

    private final Map<JobId, Job> jobs = new HashMap<>();
    private final ReadWriteLock tableLock = new ReentrantReadWriteLock();

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private volatile boolean stopping;
    private volatile ExecutorService workerExecutor;

    public QueueController(QueueControllerConfig config) {
        this(config, NoOpMetricsSink.INSTANCE);
    }

    public QueueController(QueueControllerConfig config, MetricsSink metricsSink) {
        this(config, metricsSink, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param config Controller 설정
     * @param metricsSink 메트릭 수집기
     * @param clock 시각 제공자 (Job 타임스탬프, ID, 실행 상한 계산)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public QueueController(QueueControllerConfig config, MetricsSink metricsSink, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (metricsSink == null) {
            throw new IllegalArgumentException("metricsSink cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.metricsSink = metricsSink;
        this.clock = clock;
        this.idGenerator = new JobIdGenerator(clock);
        this.channel = new DispatchChannel(config.dispatchCapacity());
        this.rootContext = ExecutionContext.root(clock);
    }

    // ========== QueueRuntime ==========

    @Override
    public void registerHandler(JobKind kind, JobHandler handler) {
        handlerRegistry.register(kind, handler)
            .ifPresent(previous -> log.warn("Handler for job kind {} replaced", kind));
    }

    @Override
    public void start() {
        if (stopRequested.get()) {
            throw new IllegalStateException("QueueController has been stopped");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("QueueController already started");
        }
        log.info("Starting job queue: workers={}, handlers={}", config.workerCount(), handlerRegistry.kinds());

        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(config.workerCount(), runnable -> {
            Thread thread = new Thread(runnable, "jobqueue-worker-" + threadIndex.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        for (int workerId = 0; workerId < config.workerCount(); workerId++) {
            int id = workerId;
            executor.execute(() -> runWorker(id));
        }
        workerExecutor = executor;
    }

    @Override
    public void stop() {
        if (!stopRequested.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping job queue");

        tableLock.writeLock().lock();
        try {
            stopping = true;
        } finally {
            tableLock.writeLock().unlock();
        }
        rootContext.cancel(CancellationCause.SHUTDOWN);
        channel.close();

        ExecutorService executor = workerExecutor;
        if (executor != null) {
            executor.shutdown();
            awaitWorkers(executor);
        }

        List<JobId> undispatched = channel.drain();
        for (JobId jobId : undispatched) {
            finishJob(jobId, SHUTDOWN_REASON);
        }
        log.info("Job queue stopped: {} undispatched jobs failed", undispatched.size());
    }

    // ========== JobQueue ==========

    @Override
    public Job enqueue(JobKind kind, JobPayload payload) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (payload != null && !payload.kind().equals(kind)) {
            throw new IllegalArgumentException(
                "payload of kind " + payload.kind() + " cannot be enqueued as " + kind
            );
        }

        Job job = new Job(idGenerator.next(), kind, JobStatus.QUEUED, payload, "", clock.instant(), null, null, 0);
        tableLock.writeLock().lock();
        try {
            jobs.put(job.id(), job);
        } finally {
            tableLock.writeLock().unlock();
        }
        metricsSink.incActiveJobs();

        Optional<String> rejection = dispatch(job.id());
        if (rejection.isPresent()) {
            log.warn("Job rejected: jobId={}, kind={}, reason={}", job.id(), kind, rejection.get());
            finishJob(job.id(), rejection.get());
            return getJob(job.id()).orElse(job);
        }

        log.info("Job enqueued: jobId={}, kind={}", job.id(), kind);
        return job;
    }

    @Override
    public Optional<Job> getJob(JobId jobId) {
        tableLock.readLock().lock();
        try {
            return Optional.ofNullable(jobs.get(jobId));
        } finally {
            tableLock.readLock().unlock();
        }
    }

    @Override
    public List<Job> listJobs(JobStatus statusFilter) {
        tableLock.readLock().lock();
        try {
            List<Job> result = new ArrayList<>();
            for (Job job : jobs.values()) {
                if (statusFilter == null || job.status() == statusFilter) {
                    result.add(job);
                }
            }
            return result;
        } finally {
            tableLock.readLock().unlock();
        }
    }

    // ========== ProgressReporter ==========

    /**
     * running 상태인 Job의 진행률 갱신. 그 외 상태에서는 무시됩니다.
     *
     * <p>값을 보정하지 않습니다. 0~100 범위는 호출자가 보장합니다.</p>
     */
    @Override
    public void updateProgress(JobId jobId, int percent) {
        tableLock.writeLock().lock();
        try {
            Job current = jobs.get(jobId);
            if (current != null && current.status() == JobStatus.RUNNING) {
                jobs.put(jobId, new Job(current.id(), current.kind(), current.status(), current.payload(),
                    current.error(), current.createdAt(), current.startedAt(), current.finishedAt(), percent));
            }
        } finally {
            tableLock.writeLock().unlock();
        }
    }

    // ========== Worker ==========

    private void runWorker(int workerId) {
        log.info("Worker {} started", workerId);
        try {
            while (!rootContext.isCancelled()) {
                JobId jobId = channel.poll(config.pollInterval());
                if (jobId == null) {
                    if (channel.isClosed()) {
                        break;
                    }
                    continue;
                }
                processJob(workerId, jobId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            log.info("Worker {} stopped", workerId);
        }
    }

    private void processJob(int workerId, JobId jobId) {
        Optional<Job> claimed = claim(jobId);
        if (claimed.isEmpty()) {
            finishJob(jobId, SHUTDOWN_REASON);
            return;
        }
        Job job = claimed.get();
        log.info("Processing job: workerId={}, jobId={}, kind={}", workerId, jobId, job.kind());

        Optional<JobHandler> handler = handlerRegistry.find(job.kind());
        if (handler.isEmpty()) {
            finishJob(jobId, "no handler registered for job kind: " + job.kind());
            return;
        }

        String error = null;
        try (ExecutionContext execution = rootContext.withTimeout(config.executionTimeout())) {
            handler.get().handle(new JobContext(job, execution, this));
        } catch (Exception e) {
            error = describe(e);
        } catch (Error e) {
            // Worker는 계속 실행, Job만 실패 처리
            log.error("Handler raised an error: jobId={}, kind={}", jobId, job.kind(), e);
            error = describe(e);
        }
        finishJob(jobId, error);
    }

    /**
     * queued → running 전이. 종료가 시작되었거나 queued가 아니면 empty.
     */
    private Optional<Job> claim(JobId jobId) {
        tableLock.writeLock().lock();
        try {
            Job current = jobs.get(jobId);
            if (stopping || current == null || current.status() != JobStatus.QUEUED) {
                return Optional.empty();
            }
            Job running = new Job(current.id(), current.kind(),
                StateTransition.transition(current.status(), JobStatus.RUNNING),
                current.payload(), "", current.createdAt(), clock.instant(), null, 0);
            jobs.put(jobId, running);
            return Optional.of(running);
        } finally {
            tableLock.writeLock().unlock();
        }
    }

    /**
     * Job 종료 처리. error가 null이면 success, 아니면 failed.
     *
     * <p>이미 종료된 Job은 변경하지 않으며 active jobs 게이지도 다시 감소시키지 않습니다.</p>
     */
    private void finishJob(JobId jobId, String error) {
        JobStatus target = error == null ? JobStatus.SUCCESS : JobStatus.FAILED;
        Job finished;
        tableLock.writeLock().lock();
        try {
            Job current = jobs.get(jobId);
            if (current == null || current.isFinished()) {
                return;
            }
            finished = new Job(current.id(), current.kind(),
                StateTransition.transition(current.status(), target),
                current.payload(), error, current.createdAt(), current.startedAt(), clock.instant(), 100);
            jobs.put(jobId, finished);
        } finally {
            tableLock.writeLock().unlock();
        }

        metricsSink.decActiveJobs();
        if (error != null) {
            log.error("Job failed: jobId={}, kind={}, error={}", jobId, finished.kind(), error);
        } else {
            Duration duration = Duration.between(finished.startedAt(), finished.finishedAt());
            log.info("Job completed: jobId={}, kind={}, duration={}ms", jobId, finished.kind(), duration.toMillis());
        }
    }

    private Optional<String> dispatch(JobId jobId) {
        try {
            while (!stopping) {
                if (channel.offer(jobId, config.pollInterval())) {
                    return Optional.empty();
                }
            }
            return Optional.of(SHUTDOWN_REASON);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.of("enqueue interrupted");
        }
    }

    private void awaitWorkers(ExecutorService executor) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    if (executor.awaitTermination(1, TimeUnit.SECONDS)) {
                        return;
                    }
                    log.info("Waiting for running jobs to return: {}", listJobs(JobStatus.RUNNING).size());
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getName();
    }

    public QueueControllerConfig config() {
        return config;
    }

    public int pendingDispatches() {
        return channel.size();
    }
}
