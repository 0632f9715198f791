package com.ryuqq.procexec.adapter.runner;

import com.ryuqq.procexec.core.context.ExecutionContext;
import com.ryuqq.procexec.core.gate.ConcurrencyGate;
import com.ryuqq.procexec.core.gate.GateConfig;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Semaphore 기반 ConcurrencyGate 구현체.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>acquire(): 취소 확인 간격(50ms)마다 tryAcquire를 반복하는 소프트 폴링</li>
 *   <li>tryAcquire(): Semaphore.tryAcquire() 즉시 반환</li>
 *   <li>release(): 점유 카운터 감소 후 Semaphore.release()</li>
 * </ul>
 *
 * <p>점유 카운터는 슬롯을 얻은 뒤에만 증가하므로 capacity를 넘지 않으며,
 * 짝이 맞지 않는 release는 0 아래로 내려가기 전에 거부됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SemaphoreConcurrencyGate implements ConcurrencyGate {

    private static final long CANCEL_CHECK_INTERVAL_MS = 50;

    private final GateConfig config;
    private final Semaphore semaphore;
    private final AtomicInteger held = new AtomicInteger(0);

    /**
     * 생성자.
     *
     * @param config 게이트 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public SemaphoreConcurrencyGate(GateConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.semaphore = new Semaphore(config.capacity(), config.fair());
    }

    /**
     * 생성자 (비공정, capacity만 지정).
     *
     * @param capacity 최대 동시 실행 수
     * @throws IllegalArgumentException capacity가 양수가 아닌 경우
     */
    public SemaphoreConcurrencyGate(int capacity) {
        this(GateConfig.of(capacity));
    }

    @Override
    public void acquire(ExecutionContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        try {
            do {
                context.throwIfCancelled();
            } while (!semaphore.tryAcquire(CANCEL_CHECK_INTERVAL_MS, TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a gate slot", e);
        }
        held.incrementAndGet();
    }

    @Override
    public boolean tryAcquire() {
        if (!semaphore.tryAcquire()) {
            return false;
        }
        held.incrementAndGet();
        return true;
    }

    @Override
    public void release() {
        int previous = held.getAndUpdate(current -> current > 0 ? current - 1 : current);
        if (previous == 0) {
            throw new IllegalStateException("release called without a matching acquire");
        }
        semaphore.release();
    }

    @Override
    public int getCurrentConcurrency() {
        return held.get();
    }

    @Override
    public GateConfig getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return "SemaphoreConcurrencyGate{held=" + held.get() + "/" + config.capacity() + "}";
    }
}
