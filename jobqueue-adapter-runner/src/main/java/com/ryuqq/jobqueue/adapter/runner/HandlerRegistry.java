package com.ryuqq.jobqueue.adapter.runner;

import com.ryuqq.jobqueue.core.handler.JobHandler;
import com.ryuqq.jobqueue.core.model.JobKind;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JobKind → JobHandler 조회 테이블.
 *
 * <p>같은 kind를 다시 등록하면 이전 Handler를 대체합니다 (last write wins).</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public final class HandlerRegistry {

    private final ConcurrentHashMap<JobKind, JobHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Handler 등록.
     *
     * @param kind Job kind
     * @param handler Handler
     * @return 대체된 이전 Handler, 없으면 empty
     * @throws IllegalArgumentException kind 또는 handler가 null인 경우
     */
    public Optional<JobHandler> register(JobKind kind, JobHandler handler) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        return Optional.ofNullable(handlers.put(kind, handler));
    }

    public Optional<JobHandler> find(JobKind kind) {
        return Optional.ofNullable(handlers.get(kind));
    }

    public Set<JobKind> kinds() {
        return Set.copyOf(handlers.keySet());
    }
}
