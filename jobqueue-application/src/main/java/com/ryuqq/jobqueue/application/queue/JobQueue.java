package com.ryuqq.jobqueue.application.queue;

import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobId;
import com.ryuqq.jobqueue.core.model.JobKind;
import com.ryuqq.jobqueue.core.model.JobPayload;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;

import java.util.List;
import java.util.Optional;

/**
 * Caller-facing job queue port.
 *
 * <p>Callers enqueue work and poll job snapshots; job status and error text are the
 * only failure signal. Nothing thrown inside a handler reaches the enqueuing caller.</p>
 *
 * <p><strong>Snapshot Semantics:</strong></p>
 * <ul>
 *   <li>Every returned {@link Job} is an immutable copy taken under the table lock</li>
 *   <li>Snapshots may be stale by the time the caller inspects them</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Job job = queue.enqueue(new DeployPayload(deploymentId, serviceId, "app:v2"));
 * // poll later
 * queue.getJob(job.id()).map(Job::status);
 * </pre>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public interface JobQueue {

    /**
     * Creates a {@code queued} job and hands it to the dispatch channel.
     *
     * <p>May block briefly while the dispatch channel is full. If the queue is shutting down,
     * the job is returned already {@code failed} with reason "queue is shutting down".</p>
     *
     * @param kind the job kind selecting the handler
     * @param payload the payload, or null for kinds that carry none
     * @return snapshot of the created job
     * @throws IllegalArgumentException if kind is null or the payload belongs to another kind
     */
    Job enqueue(JobKind kind, JobPayload payload);

    /**
     * Enqueues a job whose kind is the payload's own kind.
     *
     * @param payload the payload
     * @return snapshot of the created job
     * @throws IllegalArgumentException if payload is null
     */
    default Job enqueue(JobPayload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        return enqueue(payload.kind(), payload);
    }

    /**
     * Looks up a job snapshot.
     *
     * @param jobId the job id
     * @return the snapshot, or empty if the id is unknown
     */
    Optional<Job> getJob(JobId jobId);

    /**
     * Lists job snapshots matching a status.
     *
     * <p>No ordering is guaranteed; callers needing order sort on {@link Job#createdAt()}.</p>
     *
     * @param statusFilter the status to match, or null for all jobs
     * @return matching snapshots (may be empty)
     */
    List<Job> listJobs(JobStatus statusFilter);

    /**
     * Lists all job snapshots.
     *
     * @return all snapshots
     */
    default List<Job> listJobs() {
        return listJobs(null);
    }
}
