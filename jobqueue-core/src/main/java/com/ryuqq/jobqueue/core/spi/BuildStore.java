package com.ryuqq.jobqueue.core.spi;

import com.ryuqq.jobqueue.core.resource.Build;
import com.ryuqq.jobqueue.core.resource.BuildStatus;

import java.time.Instant;
import java.util.Optional;

/**
 * Durable storage SPI for build records.
 *
 * <p>The store is authoritative for build records; the queue itself keeps no durable state.
 * Build handlers update the record status while a build job runs.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: called concurrently from several workers</li>
 *   <li>Failures are reported as {@link StoreException}</li>
 * </ul>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public interface BuildStore {

    /**
     * Persists a new build record and assigns its identifier.
     *
     * @param build the record to persist (id is ignored)
     * @return the persisted record carrying the assigned id
     * @throws StoreException if the record cannot be stored
     */
    Build createBuild(Build build);

    /**
     * Updates the status of a build record.
     *
     * <p>{@code logPath}, {@code startedAt} and {@code finishedAt} are optional;
     * a null argument leaves the stored value unchanged.</p>
     *
     * @param buildId the build id
     * @param status the new status
     * @param logPath build log file path, or null
     * @param startedAt start time, or null
     * @param finishedAt finish time, or null
     * @throws StoreException if the record does not exist or cannot be updated
     */
    void updateBuildStatus(long buildId, BuildStatus status, String logPath, Instant startedAt, Instant finishedAt);

    /**
     * Looks up a build record.
     *
     * @param buildId the build id
     * @return the record, or empty if unknown
     */
    Optional<Build> findBuild(long buildId);
}
