package com.ryuqq.jobqueue.core.execution;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 협력적(cooperative) 취소를 위한 실행 컨텍스트.
 *
 * <p>Queue Controller는 수명 전체를 나타내는 루트 컨텍스트를 하나 가지며,
 * Worker는 Job마다 실행 상한 시간을 가진 자식 컨텍스트를 파생합니다.</p>
 *
 * <p><strong>취소 전파:</strong></p>
 * <ul>
 *   <li>부모가 취소되면 모든 자식이 같은 원인으로 취소됨</li>
 *   <li>자식의 deadline은 부모 deadline을 넘지 않음</li>
 *   <li>deadline 경과는 조회 시점에 판정됨 (별도 타이머 스레드 없음)</li>
 * </ul>
 *
 * <p><strong>주의:</strong> 취소는 선점(preemptive)이 아닙니다. 컨텍스트는 실행 중인 스레드를
 * 인터럽트하지 않으며, Handler가 블로킹 호출 사이사이에 {@link #isCancelled()} 또는
 * {@link #throwIfCancelled()}로 직접 확인해야 합니다. 확인하지 않는 Handler는
 * deadline을 넘겨서도 계속 실행됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ExecutionContext root = ExecutionContext.root();
 * try (ExecutionContext ctx = root.withTimeout(Duration.ofMinutes(30))) {
 *     while (!ctx.isCancelled()) {
 *         // 외부 호출 한 단계 수행
 *     }
 * }
 * root.cancel(CancellationCause.SHUTDOWN);
 * </pre>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public final class ExecutionContext implements AutoCloseable {

    private final ExecutionContext parent;
    private final Instant deadline;
    private final Clock clock;
    private final Object monitor = new Object();
    private final List<ExecutionContext> children = new CopyOnWriteArrayList<>();

    private volatile CancellationCause cause;

    private ExecutionContext(ExecutionContext parent, Instant deadline, Clock clock) {
        this.parent = parent;
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * deadline이 없는 루트 컨텍스트 생성.
     *
     * @return 루트 컨텍스트
     */
    public static ExecutionContext root() {
        return root(Clock.systemUTC());
    }

    /**
     * 주어진 시계를 사용하는 루트 컨텍스트 생성.
     *
     * @param clock 시각 제공자
     * @return 루트 컨텍스트
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public static ExecutionContext root(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return new ExecutionContext(null, null, clock);
    }

    /**
     * 실행 상한 시간을 가진 자식 컨텍스트 파생.
     *
     * <p>부모가 이미 취소된 상태라면 자식도 즉시 같은 원인으로 취소됩니다.</p>
     *
     * @param timeout 실행 상한 시간 (양수)
     * @return 자식 컨텍스트
     * @throws IllegalArgumentException timeout이 null이거나 양수가 아닌 경우
     */
    public ExecutionContext withTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        Instant childDeadline = clock.instant().plus(timeout);
        if (deadline != null && deadline.isBefore(childDeadline)) {
            childDeadline = deadline;
        }

        ExecutionContext child = new ExecutionContext(this, childDeadline, clock);
        children.add(child);

        CancellationCause current = currentCause();
        if (current != null) {
            child.cancel(current);
        }
        return child;
    }

    /**
     * 명시적 취소 ({@link CancellationCause#CANCELLED}).
     */
    public void cancel() {
        cancel(CancellationCause.CANCELLED);
    }

    /**
     * 주어진 원인으로 취소하고 모든 자식에게 전파.
     *
     * <p>이미 취소된 컨텍스트의 원인은 바뀌지 않습니다 (최초 원인 유지).</p>
     *
     * @param cancellationCause 취소 원인
     * @throws IllegalArgumentException cancellationCause가 null인 경우
     */
    public void cancel(CancellationCause cancellationCause) {
        if (cancellationCause == null) {
            throw new IllegalArgumentException("cancellationCause cannot be null");
        }
        synchronized (monitor) {
            if (cause != null) {
                return;
            }
            cause = cancellationCause;
            monitor.notifyAll();
        }
        for (ExecutionContext child : children) {
            child.cancel(cancellationCause);
        }
    }

    /**
     * 취소 여부 확인.
     *
     * <p>deadline이 지났다면 이 호출에서 {@link CancellationCause#DEADLINE_EXCEEDED}로 취소 처리됩니다.</p>
     *
     * @return 취소되었으면 true
     */
    public boolean isCancelled() {
        return currentCause() != null;
    }

    /**
     * 취소 원인 조회.
     *
     * @return 취소 원인, 취소되지 않았다면 empty
     */
    public Optional<CancellationCause> cancellationCause() {
        return Optional.ofNullable(currentCause());
    }

    /**
     * 취소되었다면 {@link CancellationException} 발생.
     *
     * @throws CancellationException 취소된 경우
     */
    public void throwIfCancelled() {
        CancellationCause current = currentCause();
        if (current != null) {
            throw new CancellationException("execution cancelled: " + current.description());
        }
    }

    /**
     * 실행 deadline 조회.
     *
     * @return deadline, 루트 컨텍스트는 empty
     */
    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * deadline까지 남은 시간.
     *
     * @return 남은 시간 (음수 없음), deadline이 없으면 empty
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * 취소되거나 maxWait가 지날 때까지 대기.
     *
     * <p>블로킹 외부 호출 대신 일정 시간 대기해야 하는 Handler가 사용합니다.</p>
     *
     * @param maxWait 최대 대기 시간
     * @return 대기 중 취소되었으면 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     * @throws IllegalArgumentException maxWait가 null이거나 음수인 경우
     */
    public boolean awaitCancellation(Duration maxWait) throws InterruptedException {
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait cannot be null or negative");
        }
        Instant waitUntil = clock.instant().plus(maxWait);
        synchronized (monitor) {
            while (currentCause() == null) {
                Instant wakeAt = waitUntil;
                if (deadline != null && deadline.isBefore(wakeAt)) {
                    wakeAt = deadline;
                }
                long waitMillis = Duration.between(clock.instant(), wakeAt).toMillis();
                if (waitMillis <= 0) {
                    if (!clock.instant().isBefore(waitUntil)) {
                        return currentCause() != null;
                    }
                    waitMillis = 1;
                }
                monitor.wait(waitMillis);
            }
            return true;
        }
    }

    /**
     * 컨텍스트를 정리하고 부모에서 분리.
     *
     * <p>아직 취소되지 않았다면 {@link CancellationCause#CANCELLED}로 취소됩니다.</p>
     */
    @Override
    public void close() {
        cancel(CancellationCause.CANCELLED);
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    private CancellationCause currentCause() {
        CancellationCause current = cause;
        if (current != null) {
            return current;
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            cancel(CancellationCause.DEADLINE_EXCEEDED);
            return cause;
        }
        return null;
    }
}
