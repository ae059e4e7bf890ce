package com.ryuqq.jobqueue.adapter.inmemory.store;

import com.ryuqq.jobqueue.core.resource.Build;
import com.ryuqq.jobqueue.core.resource.BuildStatus;
import com.ryuqq.jobqueue.core.spi.BuildStore;
import com.ryuqq.jobqueue.core.spi.StoreException;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link BuildStore} for testing and reference purposes.
 *
 * <p>Build records live in a {@link ConcurrentHashMap}; ids are assigned from a counter starting at 1.
 * Status updates replace the record atomically via {@link ConcurrentHashMap#computeIfPresent}.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public class InMemoryBuildStore implements BuildStore {

    private final ConcurrentHashMap<Long, Build> builds = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Build createBuild(Build build) {
        if (build == null) {
            throw new IllegalArgumentException("build cannot be null");
        }
        Build stored = build.withId(sequence.incrementAndGet());
        builds.put(stored.id(), stored);
        return stored;
    }

    @Override
    public void updateBuildStatus(long buildId, BuildStatus status, String logPath, Instant startedAt, Instant finishedAt) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        Build updated = builds.computeIfPresent(buildId,
            (id, current) -> current.withStatus(status, logPath, startedAt, finishedAt));
        if (updated == null) {
            throw new StoreException("build " + buildId + " not found");
        }
    }

    @Override
    public Optional<Build> findBuild(long buildId) {
        return Optional.ofNullable(builds.get(buildId));
    }

    /**
     * 서비스별 빌드 목록 (최신순).
     *
     * @param serviceId 서비스 ID
     * @return 빌드 목록
     */
    public List<Build> listBuilds(long serviceId) {
        return builds.values().stream()
            .filter(build -> build.serviceId() == serviceId)
            .sorted(Comparator.comparingLong(Build::id).reversed())
            .collect(Collectors.toList());
    }
}
