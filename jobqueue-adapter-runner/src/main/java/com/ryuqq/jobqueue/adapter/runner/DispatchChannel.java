package com.ryuqq.jobqueue.adapter.runner;

import com.ryuqq.jobqueue.core.model.JobId;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Enqueue와 Worker 사이의 bounded FIFO 채널.
 *
 * <p><strong>닫힘 규칙:</strong></p>
 * <ul>
 *   <li>{@link #close()} 이후의 offer는 항상 false</li>
 *   <li>offer는 read lock, close는 write lock을 잡으므로 close가 반환된 뒤에는 어떤 offer도 진행 중이지 않음</li>
 *   <li>닫힌 뒤에도 이미 버퍼에 있는 항목은 poll 또는 {@link #drain()}으로 꺼낼 수 있음</li>
 * </ul>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public final class DispatchChannel {

    private final ArrayBlockingQueue<JobId> buffer;
    private final ReadWriteLock closeLock = new ReentrantReadWriteLock();

    private volatile boolean closed;

    /**
     * 생성자.
     *
     * @param capacity 버퍼 크기 (1 이상)
     * @throws IllegalArgumentException capacity가 1 미만인 경우
     */
    public DispatchChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.buffer = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * 버퍼에 여유가 생길 때까지 최대 timeout 동안 대기하며 전송.
     *
     * @param jobId 전송할 JobId
     * @param timeout 최대 대기 시간
     * @return 전송했으면 true, 닫혀 있거나 시간 내 여유가 없으면 false
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean offer(JobId jobId, Duration timeout) throws InterruptedException {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        closeLock.readLock().lock();
        try {
            if (closed) {
                return false;
            }
            return buffer.offer(jobId, timeout.toNanos(), TimeUnit.NANOSECONDS);
        } finally {
            closeLock.readLock().unlock();
        }
    }

    /**
     * 최대 timeout 동안 다음 JobId를 기다림.
     *
     * @param timeout 최대 대기 시간
     * @return 다음 JobId, 시간 내 없으면 null
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public JobId poll(Duration timeout) throws InterruptedException {
        return buffer.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * 채널 닫기. 이후 전송은 모두 거부됩니다.
     */
    public void close() {
        closeLock.writeLock().lock();
        try {
            closed = true;
        } finally {
            closeLock.writeLock().unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * 버퍼에 남은 항목을 모두 꺼냄.
     *
     * @return 남아 있던 JobId (전송 순서)
     */
    public List<JobId> drain() {
        List<JobId> remaining = new ArrayList<>();
        buffer.drainTo(remaining);
        return remaining;
    }

    public int size() {
        return buffer.size();
    }
}
