package com.ryuqq.procexec.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 동적으로 늘어나는 비동기 작업 집합과 완료 장벽.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>spawn(): 작업 단위 등록 후 Executor에서 실행 시작</li>
 *   <li>await(): 등록된 모든 작업이 끝날 때까지 대기 후 첫 번째 오류 반환</li>
 * </ul>
 *
 * <p><strong>첫 번째 오류 규칙:</strong></p>
 * <ul>
 *   <li>"첫 번째"는 제출 순서가 아니라 먼저 끝난 실패 작업 기준</li>
 *   <li>단일 compareAndSet으로 한 번만 기록, 이후 오류는 버림 (디버그 로그만 남김)</li>
 *   <li>실패가 발생해도 나머지 작업을 취소하지 않음</li>
 * </ul>
 *
 * <p>await()는 한 번 호출하는 것을 전제로 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskGroup {

    private static final Logger log = LoggerFactory.getLogger(TaskGroup.class);

    private final Executor executor;
    private final AtomicInteger outstanding = new AtomicInteger(0);
    private final AtomicReference<Throwable> firstError = new AtomicReference<>();
    private final Object monitor = new Object();

    /**
     * 생성자.
     *
     * @param executor 작업 단위를 실행할 Executor
     * @throws IllegalArgumentException executor가 null인 경우
     */
    public TaskGroup(Executor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.executor = executor;
    }

    /**
     * 작업 단위 등록 및 실행 시작.
     *
     * @param work 실행할 작업
     * @throws IllegalArgumentException work가 null인 경우
     * @throws RejectedExecutionException Executor가 작업을 거부한 경우 (등록 취소됨)
     */
    public void spawn(GroupTask work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        outstanding.incrementAndGet();
        try {
            executor.execute(() -> runUnit(work));
        } catch (RejectedExecutionException e) {
            arrive();
            throw e;
        }
    }

    /**
     * 모든 작업 완료 대기.
     *
     * @return 첫 번째 오류 (없으면 empty)
     * @throws IllegalStateException 대기 중 인터럽트 발생 시 (인터럽트 플래그 복원)
     */
    public Optional<Throwable> await() {
        synchronized (monitor) {
            while (outstanding.get() > 0) {
                try {
                    monitor.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for task group", e);
                }
            }
        }
        return Optional.ofNullable(firstError.get());
    }

    /**
     * 아직 끝나지 않은 작업 수.
     *
     * @return 미완료 작업 수
     */
    public int getOutstanding() {
        return outstanding.get();
    }

    private void runUnit(GroupTask work) {
        try {
            work.run();
        } catch (Exception e) {
            recordError(e);
        } catch (Error e) {
            recordError(e);
            throw e;
        } finally {
            arrive();
        }
    }

    private void recordError(Throwable error) {
        if (!firstError.compareAndSet(null, error)) {
            log.debug("Discarding later task group error: {}", error.toString());
        }
    }

    private void arrive() {
        if (outstanding.decrementAndGet() == 0) {
            synchronized (monitor) {
                monitor.notifyAll();
            }
        }
    }
}
