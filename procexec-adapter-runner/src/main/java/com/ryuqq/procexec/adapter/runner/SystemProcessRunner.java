package com.ryuqq.procexec.adapter.runner;

import com.ryuqq.procexec.core.context.ExecutionContext;
import com.ryuqq.procexec.core.contract.ProcessCommand;
import com.ryuqq.procexec.core.exception.ProcessTransportException;
import com.ryuqq.procexec.core.outcome.FindingsReported;
import com.ryuqq.procexec.core.outcome.ProcessOutcome;
import com.ryuqq.procexec.core.outcome.Success;
import com.ryuqq.procexec.core.outcome.TerminatedAbnormally;
import com.ryuqq.procexec.core.outcome.TransportError;
import com.ryuqq.procexec.core.runner.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * OS 프로세스 실행자 ({@link ProcessBuilder} 기반).
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(context, command)
 *   ↓
 * 1. context 취소 확인
 * 2. ProcessBuilder.start() 실패 → TransportError
 * 3. stdout / stderr 백그라운드 수집 시작 (파이프 버퍼가 차서 멈추는 것 방지)
 * 4. stdin 전체 쓰기 → close (try-with-resources)
 *    - 쓰기 실패 + 프로세스 살아 있음 → destroyForcibly → TransportError
 *    - 쓰기 실패 + 프로세스 이미 종료 → 종료 상태로 분류 계속
 * 5. waitFor() + 출력 수집 실패 → TransportError
 * 6. 종료 상태 분류 (classify)
 * </pre>
 *
 * <p><strong>표준 에러:</strong> 부모 프로세스에 상속하지 않고 내부에서 캡처하여
 * 비정상 종료 메시지의 진단 정보로만 사용합니다.</p>
 *
 * <p><strong>시그널 종료 판별:</strong> JVM은 POSIX에서 시그널 N으로 종료된 프로세스의
 * 종료 코드를 128 + N으로 보고합니다. 따라서 POSIX에서는 129 ~ 192(128 + 64, Linux의 SIGRTMAX)
 * 범위의 종료 코드를 시그널 종료로 봅니다. 193 이상(예: {@code exit -1}의 255)은 일반 종료 코드입니다.</p>
 *
 * <p><strong>한계:</strong> 프로세스가 스스로 129 ~ 192 범위의 코드로 종료하면 시그널 종료와 구분할 수 없으므로,
 * 출력이 있어도 비정상 종료로 분류됩니다. 이 범위의 종료 코드로 finding을 보고하는 도구에는 맞지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SystemProcessRunner implements ProcessRunner, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SystemProcessRunner.class);

    private static final int SIGNAL_EXIT_BASE = 128;
    private static final int MAX_SIGNAL = 64;
    private static final long STDIN_FAILURE_GRACE_MS = 200;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final boolean posix;
    private final ExecutorService streamExecutor;

    /**
     * 생성자 (현재 OS 기준으로 시그널 판별 방식 결정).
     */
    public SystemProcessRunner() {
        this(!isWindows());
    }

    /**
     * 생성자 (시그널 판별 방식 지정).
     *
     * @param posix true이면 128 초과 종료 코드를 시그널 종료로 판별
     */
    SystemProcessRunner(boolean posix) {
        this.posix = posix;
        this.streamExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("procexec-stream-"));
    }

    @Override
    public ProcessOutcome run(ExecutionContext context, ProcessCommand command) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        context.throwIfCancelled();
        if (streamExecutor.isShutdown()) {
            throw new IllegalStateException("process runner is shut down");
        }

        String executable = command.executable();

        // 1. 프로세스 생성
        Process process;
        try {
            process = new ProcessBuilder(command.commandLine())
                .redirectInput(ProcessBuilder.Redirect.PIPE)
                .redirectOutput(ProcessBuilder.Redirect.PIPE)
                .redirectError(ProcessBuilder.Redirect.PIPE)
                .start();
        } catch (IOException e) {
            return transportError(executable, "could not start " + executable + " process: " + e.getMessage(), e);
        }
        log.debug("Started {} (pid {})", command, process.pid());

        // 2. 출력 수집 시작
        CompletableFuture<byte[]> stdout = drainAsync(process.getInputStream());
        CompletableFuture<byte[]> stderr = drainAsync(process.getErrorStream());

        // 3. 표준 입력 전달
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(command.standardInput());
        } catch (IOException e) {
            if (!exitedOnItsOwn(process)) {
                process.destroyForcibly();
                return transportError(executable, "could not write to stdin of " + executable + " process: " + e.getMessage(), e);
            }
            log.debug("{} exited before consuming its stdin: {}", executable, e.getMessage());
        }

        // 4. 종료 대기 및 출력 수집
        int exitCode;
        byte[] output;
        String diagnostic;
        try {
            exitCode = process.waitFor();
            output = stdout.get();
            diagnostic = new String(stderr.get(), StandardCharsets.UTF_8).strip();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return transportError(executable, "interrupted while waiting for " + executable + " process", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof UncheckedIOException ? e.getCause().getCause() : e.getCause();
            if (cause == null) {
                cause = e;
            }
            return transportError(executable, "could not read output of " + executable + " process: " + cause.getMessage(), cause);
        }

        // 5. 종료 상태 분류
        ProcessOutcome outcome = classify(executable, exitCode, output, diagnostic);
        if (outcome.isError()) {
            log.warn("{} terminated abnormally: exit code {}", executable, exitCode);
        } else {
            log.debug("{} exited with {}: {}", executable, exitCode, outcome);
        }
        return outcome;
    }

    /**
     * 실행자 종료 (리소스 정리).
     *
     * <p>출력 수집 스레드 풀을 graceful shutdown하여 진행 중인 수집이 끝나도록 대기합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        streamExecutor.shutdown();
        if (!streamExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            log.warn("Stream readers did not finish within {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
            streamExecutor.shutdownNow();
        }
    }

    @Override
    public void close() {
        try {
            shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            streamExecutor.shutdownNow();
        }
    }

    /**
     * 종료 상태 분류.
     *
     * @param executable 실행 파일 이름
     * @param exitCode 종료 코드
     * @param output 표준 출력
     * @param diagnostic 표준 에러
     * @return 분류 결과
     */
    ProcessOutcome classify(String executable, int exitCode, byte[] output, String diagnostic) {
        if (exitCode < 0 || isSignalExit(exitCode)) {
            return new TerminatedAbnormally(executable, exitCode, true, diagnostic);
        }
        if (exitCode != 0 && output.length == 0) {
            return new TerminatedAbnormally(executable, exitCode, false, diagnostic);
        }
        if (exitCode != 0) {
            // 도구가 finding을 보고한 경우
            return new FindingsReported(exitCode, output);
        }
        return new Success(output);
    }

    private boolean isSignalExit(int exitCode) {
        return posix && exitCode > SIGNAL_EXIT_BASE && exitCode <= SIGNAL_EXIT_BASE + MAX_SIGNAL;
    }

    private boolean exitedOnItsOwn(Process process) {
        try {
            return process.waitFor(STDIN_FAILURE_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private CompletableFuture<byte[]> drainAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return in.readAllBytes();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, streamExecutor);
    }

    private static TransportError transportError(String executable, String message, Throwable cause) {
        log.warn("Transport error for {}: {}", executable, message);
        return new TransportError(new ProcessTransportException(executable, message, cause));
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase().startsWith("windows");
    }
}
