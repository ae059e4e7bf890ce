package com.ryuqq.jobqueue.testkit.contract;

import com.ryuqq.jobqueue.adapter.inmemory.metrics.InMemoryMetricsSink;
import com.ryuqq.jobqueue.adapter.inmemory.runtime.InMemoryContainerRuntime;
import com.ryuqq.jobqueue.adapter.inmemory.store.InMemoryBuildStore;
import com.ryuqq.jobqueue.adapter.inmemory.store.InMemoryDeployStore;
import com.ryuqq.jobqueue.application.handler.BuildHandlerConfig;
import com.ryuqq.jobqueue.application.handler.BuildJobHandler;
import com.ryuqq.jobqueue.application.handler.DeployJobHandler;
import com.ryuqq.jobqueue.application.queue.JobQueue;
import com.ryuqq.jobqueue.application.runtime.QueueRuntime;
import com.ryuqq.jobqueue.core.execution.CancellationCause;
import com.ryuqq.jobqueue.core.handler.ProgressReporter;
import com.ryuqq.jobqueue.core.model.BuildPayload;
import com.ryuqq.jobqueue.core.model.DeployPayload;
import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobId;
import com.ryuqq.jobqueue.core.model.JobKind;
import com.ryuqq.jobqueue.core.resource.Build;
import com.ryuqq.jobqueue.core.resource.BuildStatus;
import com.ryuqq.jobqueue.core.spi.MetricsSink;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;
import com.ryuqq.jobqueue.testkit.support.ConcurrencyTracker;
import com.ryuqq.jobqueue.testkit.support.JobSnapshotRecorder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for JobQueue Contract Tests.
 *
 * <p>Every implementation of {@link JobQueue} and {@link QueueRuntime} must pass these scenarios.
 * Subclasses only provide the factory method.</p>
 *
 * <p><strong>Verified properties:</strong></p>
 * <ul>
 *   <li>Status only moves forward: queued → running → success/failed</li>
 *   <li>Progress is 100 exactly when the job is finished</li>
 *   <li>Jobs without a registered handler fail with "no handler registered ..."</li>
 *   <li>A handler throwing an Error fails its job; the worker keeps running</li>
 *   <li>Progress updates are ignored unless the job is running</li>
 *   <li>stop() returns only after running handlers return; nothing runs after stop begins</li>
 *   <li>At most workerCount jobs run at the same time</li>
 *   <li>Build progress is monotonic up to 100; a deploy to a missing service fails</li>
 *   <li>A handler that ignores the execution ceiling finalizes only when it returns</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyQueueContractTest extends AbstractJobQueueContractTest {
 *     {@literal @}Override
 *     protected QueueUnderTest createQueue(int workerCount, Duration executionTimeout, MetricsSink metricsSink) {
 *         return QueueUnderTest.of(new MyQueue(workerCount, executionTimeout, metricsSink));
 *     }
 * }
 * </pre>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public abstract class AbstractJobQueueContractTest {

    protected static final Duration AWAIT_TIMEOUT = Duration.ofSeconds(10);
    protected static final Duration DEFAULT_CEILING = Duration.ofMinutes(1);
    protected static final String SHUTDOWN_REASON = "queue is shutting down";

    protected static final JobKind NOOP = JobKind.of("noop");
    protected static final JobKind FAILING = JobKind.of("failing");

    @TempDir
    protected Path tempDir;

    protected InMemoryMetricsSink metrics;

    private final List<QueueRuntime> runtimes = new ArrayList<>();

    /**
     * Creates a new, not yet started queue.
     *
     * @param workerCount number of workers
     * @param executionTimeout per-job execution ceiling
     * @param metricsSink metrics sink the queue reports the active jobs gauge to
     * @return queue under test
     */
    protected abstract QueueUnderTest createQueue(int workerCount, Duration executionTimeout, MetricsSink metricsSink);

    @BeforeEach
    public void setUpContract() {
        metrics = new InMemoryMetricsSink();
    }

    /**
     * Stops every queue created by the test.
     */
    @AfterEach
    public void tearDownContract() {
        for (QueueRuntime runtime : runtimes) {
            runtime.stop();
        }
        runtimes.clear();
    }

    // ========== Enqueue / GetJob / ListJobs ==========

    @Test
    public void testEnqueue_ReturnsQueuedSnapshot() {
        // Given
        QueueUnderTest target = newQueue(1, DEFAULT_CEILING);

        // When: nothing consumes the job before start
        Job job = target.queue().enqueue(NOOP, null);

        // Then
        assertEquals(JobStatus.QUEUED, job.status());
        assertEquals(NOOP, job.kind());
        assertEquals(0, job.progress());
        assertEquals("", job.error());
        assertNotNull(job.createdAt());
        assertNull(job.startedAt());
        assertNull(job.finishedAt());
        assertEquals(job, target.queue().getJob(job.id()).orElseThrow());
    }

    @Test
    public void testGetJob_UnknownId_ReturnsEmpty() {
        QueueUnderTest target = newQueue(1, DEFAULT_CEILING);

        assertTrue(target.queue().getJob(JobId.of("404")).isEmpty(),
            "Unknown job id should not be found");
    }

    @Test
    public void testEnqueue_PayloadOfOtherKind_Rejected() {
        QueueUnderTest target = newQueue(1, DEFAULT_CEILING);
        BuildPayload payload = new BuildPayload(1L, "https://git.example.com/shop.git", "main", ".", "Dockerfile", "shop:main");

        assertThrows(IllegalArgumentException.class, () -> target.queue().enqueue(JobKind.DEPLOY, payload));
        assertTrue(target.queue().listJobs().isEmpty(), "Rejected payload should not create a job");
    }

    @Test
    public void testListJobs_FilterByStatus() {
        // Given
        QueueUnderTest target = newQueue(2, DEFAULT_CEILING);
        target.runtime().registerHandler(NOOP, context -> { });
        target.runtime().registerHandler(FAILING, context -> {
            throw new IllegalStateException("boom");
        });
        target.runtime().start();

        // When
        target.queue().enqueue(NOOP, null);
        target.queue().enqueue(NOOP, null);
        target.queue().enqueue(FAILING, null);
        awaitAllFinished(target.queue(), 3);

        // Then
        assertEquals(3, target.queue().listJobs().size());
        assertEquals(3, target.queue().listJobs(null).size());
        assertEquals(2, target.queue().listJobs(JobStatus.SUCCESS).size());
        assertEquals(1, target.queue().listJobs(JobStatus.FAILED).size());
        assertTrue(target.queue().listJobs(JobStatus.QUEUED).isEmpty());
        assertTrue(target.queue().listJobs(JobStatus.RUNNING).isEmpty());
    }

    // ========== Lifecycle of a single job ==========

    @Test
    public void testTransitions_OnlyMoveForward() {
        // Given
        QueueUnderTest target = newQueue(2, DEFAULT_CEILING);
        target.runtime().registerHandler(NOOP, new ConcurrencyTracker(Duration.ofMillis(20)));
        target.runtime().registerHandler(FAILING, context -> {
            Thread.sleep(10);
            throw new IllegalStateException("boom");
        });
        target.runtime().start();

        // When
        try (JobSnapshotRecorder recorder = JobSnapshotRecorder.start(target.queue(), Duration.ofMillis(1))) {
            for (int i = 0; i < 6; i++) {
                target.queue().enqueue(NOOP, null);
                target.queue().enqueue(FAILING, null);
            }
            awaitAllFinished(target.queue(), 12);
            recorder.close();

            // Then
            assertEquals(List.of(), recorder.backwardTransitions());
            assertEquals(List.of(), recorder.progressTerminalMismatches());
        }
    }

    @Test
    public void testFinishedJob_HasProgress100AndTimestamps() {
        // Given
        QueueUnderTest target = newQueue(1, DEFAULT_CEILING);
        target.runtime().registerHandler(NOOP, context -> context.reportProgress(40));
        target.runtime().registerHandler(FAILING, context -> {
            throw new IllegalStateException("handler exploded");
        });
        target.runtime().start();

        // When
        Job succeeded = awaitFinished(target.queue(), target.queue().enqueue(NOOP, null).id());
        Job failed = awaitFinished(target.queue(), target.queue().enqueue(FAILING, null).id());

        // Then
        assertEquals(JobStatus.SUCCESS, succeeded.status());
        assertEquals("", succeeded.error());
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals("handler exploded", failed.error());
        for (Job job : List.of(succeeded, failed)) {
            assertEquals(100, job.progress());
            assertNotNull(job.startedAt());
            assertNotNull(job.finishedAt());
            assertFalse(job.finishedAt().isBefore(job.startedAt()));
            assertFalse(job.startedAt().isBefore(job.createdAt()));
        }
    }

    @Test
    public void testHandlerThrowsError_JobFailsAndWorkerKeepsRunning() {
        // Given: a single worker whose first handler throws an Error
        QueueUnderTest target = newQueue(1, DEFAULT_CEILING);
        target.runtime().registerHandler(FAILING, context -> {
            throw new AssertionError("bad state");
        });
        target.runtime().registerHandler(NOOP, context -> { });
        target.runtime().start();

        // When
        Job broken = target.queue().enqueue(FAILING, null);
        Job next = target.queue().enqueue(NOOP, null);

        // Then
        Job failed = awaitFinished(target.queue(), broken.id());
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals("bad state", failed.error());
        assertEquals(100, failed.progress());
        assertEquals(JobStatus.SUCCESS, awaitFinished(target.queue(), next.id()).status(),
            "Worker should keep processing after a handler Error");
        await().atMost(AWAIT_TIMEOUT).until(() -> metrics.activeJobs() == 0);
    }

    @Test
    public void testNoHandlerRegistered_JobFails() {
        // Given
        QueueUnderTest target = newQueue(1, DEFAULT_CEILING);
        target.runtime().start();

        // When
        Job job = awaitFinished(target.queue(), target.queue().enqueue(JobKind.of("unregistered"), null).id());

        // Then
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals("no handler registered for job kind: unregistered", job.error());
        assertEquals(100, job.progress());
    }

    @Test
    public void testProgressUpdate_IgnoredUnlessRunning() throws InterruptedException {
        // Given: the only worker is held by the first job
        QueueUnderTest target = newQueue(1, DEFAULT_CEILING);
        AtomicReference<ProgressReporter> reporter = new AtomicReference<>();
        CountDownLatch release = new CountDownLatch(1);
        target.runtime().registerHandler(NOOP, context -> {
            reporter.compareAndSet(null, context.progressReporter());
            context.reportProgress(40);
            release.await(AWAIT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        });
        target.runtime().start();

        Job first = target.queue().enqueue(NOOP, null);
        await().atMost(AWAIT_TIMEOUT).until(() -> progressOf(target.queue(), first.id()) == 40);
        Job second = target.queue().enqueue(NOOP, null);

        // When: the queued job is updated
        reporter.get().updateProgress(second.id(), 50);

        // Then
        Job stillQueued = target.queue().getJob(second.id()).orElseThrow();
        assertEquals(JobStatus.QUEUED, stillQueued.status());
        assertEquals(0, stillQueued.progress());

        // When: a finished job is updated
        release.countDown();
        awaitAllFinished(target.queue(), 2);
        reporter.get().updateProgress(first.id(), 10);

        // Then
        assertEquals(100, progressOf(target.queue(), first.id()));
    }

    // ========== Worker pool ==========

    @Test
    public void testWorkerPool_BoundsConcurrency() {
        // Given
        int workerCount = 3;
        int jobCount = 15;
        QueueUnderTest target = newQueue(workerCount, DEFAULT_CEILING);
        ConcurrencyTracker tracker = new ConcurrencyTracker(Duration.ofMillis(30));
        target.runtime().registerHandler(NOOP, tracker);
        target.runtime().start();

        // When
        try (JobSnapshotRecorder recorder = JobSnapshotRecorder.start(target.queue(), Duration.ofMillis(2))) {
            for (int i = 0; i < jobCount; i++) {
                target.queue().enqueue(NOOP, null);
            }
            await().atMost(AWAIT_TIMEOUT)
                .until(() -> target.queue().listJobs(JobStatus.SUCCESS).size() == jobCount);
            recorder.close();

            // Then
            assertTrue(tracker.maxConcurrent() <= workerCount,
                "Handlers ran concurrently beyond worker count: " + tracker.maxConcurrent());
            assertTrue(recorder.maxRunningObserved() <= workerCount,
                "Running jobs observed beyond worker count: " + recorder.maxRunningObserved());
            assertEquals(jobCount, tracker.invocations());
            await().atMost(AWAIT_TIMEOUT).until(() -> metrics.activeJobs() == 0);
        }
    }

    // ========== Shutdown ==========

    @Test
    public void testStop_WaitsForRunningHandler_FailsUndispatchedJobs() {
        // Given: one worker, one running handler, two jobs waiting in the channel
        QueueUnderTest target = newQueue(1, DEFAULT_CEILING);
        AtomicInteger invocations = new AtomicInteger();
        AtomicBoolean returned = new AtomicBoolean();
        AtomicReference<CancellationCause> observedCause = new AtomicReference<>();
        target.runtime().registerHandler(NOOP, context -> {
            invocations.incrementAndGet();
            context.execution().awaitCancellation(AWAIT_TIMEOUT);
            observedCause.set(context.execution().cancellationCause().orElse(null));
            Thread.sleep(100);
            returned.set(true);
        });
        target.runtime().start();

        Job first = target.queue().enqueue(NOOP, null);
        await().atMost(AWAIT_TIMEOUT).until(() -> statusOf(target.queue(), first.id()) == JobStatus.RUNNING);
        Job second = target.queue().enqueue(NOOP, null);
        Job third = target.queue().enqueue(NOOP, null);

        // When
        target.runtime().stop();

        // Then: stop returned only after the handler did
        assertTrue(returned.get(), "stop() returned before the running handler");
        assertEquals(CancellationCause.SHUTDOWN, observedCause.get());
        assertEquals(1, invocations.get(), "No job should start after stop begins");
        assertEquals(JobStatus.SUCCESS, statusOf(target.queue(), first.id()));
        for (JobId undispatched : List.of(second.id(), third.id())) {
            Job job = target.queue().getJob(undispatched).orElseThrow();
            assertEquals(JobStatus.FAILED, job.status());
            assertEquals(SHUTDOWN_REASON, job.error());
            assertNull(job.startedAt());
            assertEquals(100, job.progress());
        }
        assertTrue(target.queue().listJobs(JobStatus.RUNNING).isEmpty());
        assertTrue(target.queue().listJobs(JobStatus.QUEUED).isEmpty());
        assertEquals(0, metrics.activeJobs());
    }

    @Test
    public void testEnqueueAfterStop_FailsImmediately() {
        // Given
        QueueUnderTest target = newQueue(1, DEFAULT_CEILING);
        target.runtime().registerHandler(NOOP, context -> { });
        target.runtime().start();
        target.runtime().stop();

        // When
        Job job = target.queue().enqueue(NOOP, null);

        // Then
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(SHUTDOWN_REASON, job.error());
        assertEquals(100, job.progress());
        assertEquals(job, target.queue().getJob(job.id()).orElseThrow());
        assertEquals(0, metrics.activeJobs());
    }

    @Test
    public void testLifecycle_StopIsIdempotent_RestartRejected() {
        QueueUnderTest target = newQueue(1, DEFAULT_CEILING);
        target.runtime().start();

        assertThrows(IllegalStateException.class, () -> target.runtime().start());
        target.runtime().stop();
        assertDoesNotThrow(() -> target.runtime().stop());
        assertThrows(IllegalStateException.class, () -> target.runtime().start());
    }

    // ========== Execution ceiling ==========

    @Test
    public void testExecutionCeiling_IgnoredByHandler_FinalizesAfterReturn() throws InterruptedException {
        // Given: ceiling far below the handler's runtime
        QueueUnderTest target = newQueue(1, Duration.ofMillis(200));
        AtomicReference<CancellationCause> observedCause = new AtomicReference<>();
        target.runtime().registerHandler(JobKind.BUILD, context -> {
            Thread.sleep(800);
            observedCause.set(context.execution().cancellationCause().orElse(null));
        });
        target.runtime().start();

        // When
        Job job = target.queue().enqueue(JobKind.BUILD, null);
        await().atMost(AWAIT_TIMEOUT).until(() -> statusOf(target.queue(), job.id()) == JobStatus.RUNNING);
        Thread.sleep(300);

        // Then: past the ceiling but the handler has not returned yet
        assertEquals(JobStatus.RUNNING, statusOf(target.queue(), job.id()));

        Job finished = awaitFinished(target.queue(), job.id());
        assertEquals(JobStatus.SUCCESS, finished.status());
        assertEquals(CancellationCause.DEADLINE_EXCEEDED, observedCause.get());
    }

    // ========== Build / Deploy scenarios ==========

    @Test
    public void testBuildJob_ProgressMonotonicUntilSuccess() throws IOException {
        // Given
        QueueUnderTest target = newQueue(1, DEFAULT_CEILING);
        InMemoryBuildStore buildStore = new InMemoryBuildStore();
        InMemoryContainerRuntime containerRuntime = new InMemoryContainerRuntime()
            .withBuildLogLines(6)
            .withLineDelay(Duration.ofMillis(15));
        BuildHandlerConfig config = new BuildHandlerConfig()
            .withLogDirectory(tempDir)
            .withEstimatedLogLines(6);
        target.runtime().registerHandler(JobKind.BUILD,
            new BuildJobHandler(containerRuntime, buildStore, metrics, config));
        target.runtime().start();

        Build build = buildStore.createBuild(new Build(0L, 7L, "https://git.example.com/shop.git", "main",
            ".", "Dockerfile", "shop:main-1", BuildStatus.QUEUED, null, null, null, Instant.now()));
        BuildPayload payload = new BuildPayload(build.id(), build.repositoryUrl(), build.gitRef(),
            build.contextPath(), build.dockerfile(), build.imageTag());

        // When
        Job finished;
        try (JobSnapshotRecorder recorder = JobSnapshotRecorder.start(target.queue(), Duration.ofMillis(1))) {
            finished = awaitFinished(target.queue(), target.queue().enqueue(JobKind.BUILD, payload).id());
            recorder.close();

            // Then
            assertEquals(List.of(), recorder.progressRegressions());
        }
        assertEquals(JobStatus.SUCCESS, finished.status(), "Unexpected error: " + finished.error());
        assertEquals(100, finished.progress());

        Build stored = buildStore.findBuild(build.id()).orElseThrow();
        assertEquals(BuildStatus.SUCCESS, stored.status());
        assertNotNull(stored.finishedAt());
        Path logFile = tempDir.resolve("build_" + build.id() + ".log");
        assertEquals(logFile.toString(), stored.logPath());
        assertEquals(6, Files.readAllLines(logFile).size());
        assertTrue(containerRuntime.hasLocalImage("shop:main-1"));
        assertEquals(1, metrics.buildSuccesses());
        assertEquals(0, metrics.buildFailures());
    }

    @Test
    public void testDeployJob_MissingService_FailsWithOneFailureMetric() {
        // Given: no service registered in the store
        QueueUnderTest target = newQueue(1, DEFAULT_CEILING);
        target.runtime().registerHandler(JobKind.DEPLOY,
            new DeployJobHandler(new InMemoryContainerRuntime(), new InMemoryDeployStore(), metrics));
        target.runtime().start();

        // When
        Job finished = awaitFinished(target.queue(),
            target.queue().enqueue(JobKind.DEPLOY, new DeployPayload(1L, 99L, "shop:v2")).id());

        // Then
        assertEquals(JobStatus.FAILED, finished.status());
        assertTrue(finished.error().startsWith("failed to get service"),
            "Unexpected error: " + finished.error());
        assertEquals(1, metrics.deploymentFailures());
        assertEquals(0, metrics.deploymentSuccesses());
    }

    // ========== Helpers ==========

    /**
     * Creates a queue and registers it for teardown.
     */
    protected QueueUnderTest newQueue(int workerCount, Duration executionTimeout) {
        QueueUnderTest target = createQueue(workerCount, executionTimeout, metrics);
        runtimes.add(target.runtime());
        return target;
    }

    /**
     * Waits until the job is success or failed and returns the final snapshot.
     */
    protected Job awaitFinished(JobQueue queue, JobId jobId) {
        await().atMost(AWAIT_TIMEOUT).until(() -> queue.getJob(jobId).map(Job::isFinished).orElse(false));
        return queue.getJob(jobId).orElseThrow();
    }

    /**
     * Waits until the given number of jobs are finished.
     */
    protected void awaitAllFinished(JobQueue queue, int expected) {
        await().atMost(AWAIT_TIMEOUT).until(() ->
            queue.listJobs().stream().filter(Job::isFinished).count() == expected);
    }

    protected JobStatus statusOf(JobQueue queue, JobId jobId) {
        return queue.getJob(jobId).map(Job::status).orElseThrow();
    }

    protected int progressOf(JobQueue queue, JobId jobId) {
        return queue.getJob(jobId).map(Job::progress).orElseThrow();
    }
}
