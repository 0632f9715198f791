package com.ryuqq.procexec.adapter.runner;

import com.ryuqq.procexec.application.manager.ProcessManager;
import com.ryuqq.procexec.application.manager.TaskHandle;
import com.ryuqq.procexec.core.context.ExecutionContext;
import com.ryuqq.procexec.core.contract.ProcessTask;
import com.ryuqq.procexec.core.gate.ConcurrencyGate;
import com.ryuqq.procexec.core.outcome.ProcessOutcome;
import com.ryuqq.procexec.core.runner.ProcessRunner;
import com.ryuqq.procexec.core.statemachine.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 동시 실행 수가 제한된 프로세스 매니저 구현체.
 *
 * <p>ConcurrencyGate, ProcessRunner, TaskGroup을 조합합니다.
 * 프로세스를 무제한으로 띄우면 프로세스 생성이 멈추거나(macOS)
 * "too many open files" 오류가 발생하므로, 동시에 실행되는 프로세스 수를 parallelism 이하로 유지합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submit(task)                       호출 스레드
 *   ↓
 * gate.acquire(context)              빈 슬롯이 생길 때까지 블로킹
 *   ↓
 * group.spawn(...)                   이후 작업 스레드
 *   1. runner.run(context, command)
 *   2. gate.release()                콜백 호출 직전에 슬롯 반환
 *   3. onComplete(output, error)
 *   4. 콜백 예외 → 그룹 오류
 *
 * join()
 *   ↓
 * group.await()                      모든 콜백 반환 후 첫 번째 오류
 * </pre>
 *
 * <p><strong>작업 상태:</strong> QUEUED → ADMITTED → RUNNING → COMPLETED → CALLBACK_INVOKED → FINISHED | FAILED</p>
 *
 * <p><strong>취소:</strong> 없음. 한 번 슬롯을 얻은 작업은 끝까지 실행됩니다.
 * 실행 컨텍스트가 취소되면 이후 submit의 슬롯 획득과 프로세스 생성만 거부됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConcurrentProcessManager implements ProcessManager, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentProcessManager.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final ProcessManagerConfig config;
    private final ConcurrencyGate gate;
    private final ProcessRunner runner;
    private final SystemProcessRunner ownedRunner;
    private final ExecutionContext context;
    private final ExecutorService workerExecutor;
    private final TaskGroup group;
    private final AtomicLong taskSequence = new AtomicLong(0);

    /**
     * 생성자 (parallelism만 지정, 시스템 프로세스 실행자 사용).
     *
     * @param parallelism 동시 실행 프로세스 상한
     * @throws IllegalArgumentException parallelism이 양수가 아닌 경우
     */
    public ConcurrentProcessManager(int parallelism) {
        this(ProcessManagerConfig.ofParallelism(parallelism));
    }

    /**
     * 생성자 (시스템 프로세스 실행자, background 컨텍스트 사용).
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ConcurrentProcessManager(ProcessManagerConfig config) {
        this(config, newGate(config), new SystemProcessRunner());
    }

    /**
     * 생성자 (ProcessRunner / ExecutionContext 주입).
     *
     * @param config 설정
     * @param runner 프로세스 실행자
     * @param context 실행 컨텍스트
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ConcurrentProcessManager(ProcessManagerConfig config, ProcessRunner runner, ExecutionContext context) {
        this(config, newGate(config), runner, context);
    }

    /**
     * 생성자 (모든 의존성 주입).
     *
     * @param config 설정
     * @param gate 동시 실행 게이트
     * @param runner 프로세스 실행자
     * @param context 실행 컨텍스트
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ConcurrentProcessManager(ProcessManagerConfig config, ConcurrencyGate gate,
                                    ProcessRunner runner, ExecutionContext context) {
        this(config, gate, runner, context, null);
    }

    /**
     * 생성자 (매니저가 직접 만든 시스템 프로세스 실행자 사용, shutdown 시 함께 종료).
     */
    private ConcurrentProcessManager(ProcessManagerConfig config, ConcurrencyGate gate, SystemProcessRunner ownedRunner) {
        this(config, gate, ownedRunner, ExecutionContext.background(), ownedRunner);
    }

    private ConcurrentProcessManager(ProcessManagerConfig config, ConcurrencyGate gate, ProcessRunner runner,
                                     ExecutionContext context, SystemProcessRunner ownedRunner) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (gate == null) {
            throw new IllegalArgumentException("gate cannot be null");
        }
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }

        this.config = config;
        this.gate = gate;
        this.runner = runner;
        this.ownedRunner = ownedRunner;
        this.context = context;
        this.workerExecutor = Executors.newCachedThreadPool(new NamedThreadFactory(config.threadNamePrefix()));
        this.group = new TaskGroup(workerExecutor);
        log.debug("Process manager created: parallelism={}, context={}", config.parallelism(), context);
    }

    @Override
    public TaskHandle submit(ProcessTask task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        TaskExecution execution = new TaskExecution(taskSequence.incrementAndGet(), task.command());

        // 1. 슬롯 획득 (블로킹)
        try {
            gate.acquire(context);
        } catch (RuntimeException e) {
            execution.advance(TaskState.FAILED);
            throw e;
        }
        execution.advance(TaskState.ADMITTED);

        // 2. 비동기 실행
        try {
            group.spawn(() -> runAdmitted(execution, task));
        } catch (RejectedExecutionException e) {
            gate.release();
            execution.advance(TaskState.FAILED);
            throw new IllegalStateException("process manager is shut down", e);
        }
        return execution;
    }

    @Override
    public Optional<Throwable> join() {
        Optional<Throwable> firstError = group.await();
        log.debug("Process manager joined: {} tasks submitted, failed={}", taskSequence.get(), firstError.isPresent());
        return firstError;
    }

    /**
     * 현재 실행 중인 프로세스 수.
     *
     * @return 점유 중인 게이트 슬롯 수
     */
    public int getCurrentConcurrency() {
        return gate.getCurrentConcurrency();
    }

    public ProcessManagerConfig getConfig() {
        return config;
    }

    /**
     * 매니저 종료 (리소스 정리).
     *
     * <p>작업 스레드 풀을 graceful shutdown하여 진행 중인 작업이 완료되도록 대기합니다.
     * 매니저가 직접 만든 시스템 프로세스 실행자는 작업 스레드가 모두 끝난 뒤 함께 종료합니다.
     * 주입받은 실행자는 호출 측이 종료합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            log.warn("Worker threads did not finish within {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
            workerExecutor.shutdownNow();
        }
        if (ownedRunner != null) {
            ownedRunner.shutdown();
        }
    }

    @Override
    public void close() {
        try {
            shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerExecutor.shutdownNow();
            if (ownedRunner != null) {
                ownedRunner.close();
            }
        }
    }

    /**
     * 슬롯을 얻은 작업 실행 (작업 스레드).
     *
     * <p>프로세스가 끝나면 콜백 호출 전에 슬롯을 반환하여, 콜백이 실행되는 동안
     * 대기 중인 다음 작업이 시작될 수 있도록 합니다.</p>
     *
     * @param execution 작업 상태
     * @param task 작업
     * @throws Exception 콜백이 던진 예외 또는 실행자 예외
     */
    private void runAdmitted(TaskExecution execution, ProcessTask task) throws Exception {
        ProcessOutcome outcome;
        try {
            execution.advance(TaskState.RUNNING);
            outcome = runner.run(context, task.command());
        } catch (RuntimeException e) {
            execution.advance(TaskState.FAILED);
            throw e;
        } finally {
            gate.release();
        }
        execution.advance(TaskState.COMPLETED);

        execution.advance(TaskState.CALLBACK_INVOKED);
        try {
            task.onComplete().onComplete(outcome.output(), outcome.errorOrNull());
        } catch (Exception e) {
            execution.advance(TaskState.FAILED);
            log.debug("Callback for task {} ({}) failed: {}", execution.taskId(), task.command().executable(), e.toString());
            throw e;
        }
        execution.advance(TaskState.FINISHED);
    }

    private static ConcurrencyGate newGate(ProcessManagerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new SemaphoreConcurrencyGate(config.toGateConfig());
    }
}
