package com.ryuqq.procexec.core.context;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 실행 컨텍스트 토큰.
 *
 * <p>매니저가 소유하며 모든 게이트 획득과 프로세스 생성 호출에 명시적으로 전달됩니다.
 * 취소되면 새로운 슬롯 획득과 새로운 프로세스 생성이 거부됩니다.
 * 이미 실행 중인 프로세스는 종료시키지 않습니다.</p>
 *
 * <ul>
 *   <li>{@link #background()}: 취소할 수 없는 공유 루트 컨텍스트</li>
 *   <li>{@link #cancellable(String)}: 취소 가능한 새 컨텍스트</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutionContext {

    private static final ExecutionContext BACKGROUND = new ExecutionContext("background", false);

    private final String name;
    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private ExecutionContext(String name, boolean cancellable) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
        this.cancellable = cancellable;
    }

    /**
     * 취소할 수 없는 루트 컨텍스트.
     *
     * @return 공유 background 컨텍스트
     */
    public static ExecutionContext background() {
        return BACKGROUND;
    }

    /**
     * 취소 가능한 컨텍스트 생성.
     *
     * @param name 로깅용 이름
     * @return 새 ExecutionContext
     */
    public static ExecutionContext cancellable(String name) {
        return new ExecutionContext(name, true);
    }

    /**
     * 컨텍스트 취소.
     *
     * @return 이 호출로 취소된 경우 true, 이미 취소되어 있던 경우 false
     * @throws UnsupportedOperationException background 컨텍스트인 경우
     */
    public boolean cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("context '" + name + "' cannot be cancelled");
        }
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 취소 여부 확인.
     *
     * @throws CancellationException 취소된 경우
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("execution context '" + name + "' was cancelled");
        }
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "ExecutionContext{" + name + (cancelled.get() ? ", cancelled" : "") + '}';
    }
}
