package com.ryuqq.jobqueue.application.runtime;

import com.ryuqq.jobqueue.core.handler.JobHandler;
import com.ryuqq.jobqueue.core.model.JobKind;

/**
 * Worker pool lifecycle.
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * registerHandler(kind, handler)  (before start)
 *   ↓
 * start()    → launches the configured number of workers
 *   ↓
 * stop()     → cancels running jobs' contexts, closes dispatch, waits for workers
 * </pre>
 *
 * <p>Registration is not guarded against concurrent use after {@link #start()};
 * callers finish registering first.</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public interface QueueRuntime {

    /**
     * Binds a kind to its handler. Re-registering a kind replaces the previous handler.
     *
     * @param kind the job kind
     * @param handler the handler
     * @throws IllegalArgumentException if kind or handler is null
     */
    void registerHandler(JobKind kind, JobHandler handler);

    /**
     * Launches the worker pool. Call once.
     *
     * @throws IllegalStateException if the runtime was already started or stopped
     */
    void start();

    /**
     * Shuts the worker pool down.
     *
     * <p>Blocks until every running handler has returned. Handlers observe shutdown
     * through their execution context; they are never interrupted.</p>
     */
    void stop();
}
