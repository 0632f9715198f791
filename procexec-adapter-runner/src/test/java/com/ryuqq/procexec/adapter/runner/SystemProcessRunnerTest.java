package com.ryuqq.procexec.adapter.runner;

import com.ryuqq.procexec.core.context.ExecutionContext;
import com.ryuqq.procexec.core.contract.ProcessCommand;
import com.ryuqq.procexec.core.exception.AbnormalTerminationException;
import com.ryuqq.procexec.core.exception.ProcessTransportException;
import com.ryuqq.procexec.core.outcome.FindingsReported;
import com.ryuqq.procexec.core.outcome.ProcessOutcome;
import com.ryuqq.procexec.core.outcome.Success;
import com.ryuqq.procexec.core.outcome.TerminatedAbnormally;
import com.ryuqq.procexec.core.outcome.TransportError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SystemProcessRunner 테스트.
 *
 * <p>실제 OS 프로세스(/bin/sh, cat)를 실행하여 종료 상태 분류를 검증합니다:</p>
 * <ul>
 *   <li>0 종료 → Success</li>
 *   <li>non-zero + 출력 있음 → FindingsReported (오류 아님)</li>
 *   <li>non-zero + 출력 없음 → TerminatedAbnormally</li>
 *   <li>시그널 종료 → 출력과 무관하게 TerminatedAbnormally</li>
 *   <li>실행 파일 없음 → TransportError</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SystemProcessRunnerTest {

    private SystemProcessRunner runner;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        runner = new SystemProcessRunner();
        context = ExecutionContext.background();
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    private static ProcessCommand sh(String script, String input) {
        return ProcessCommand.of("/bin/sh", List.of("-c", script), input);
    }

    private static String text(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    // ============================================================
    // 1. 정상 종료
    // ============================================================

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void run_cat에_입력을_주면_같은_바이트가_출력됨() {
        // when
        ProcessOutcome outcome = runner.run(context, ProcessCommand.of("cat", List.of(), "hello\nworld"));

        // then
        assertThat(outcome).isInstanceOf(Success.class);
        assertThat(outcome.errorOrNull()).isNull();
        assertThat(text(outcome.output())).isEqualTo("hello\nworld");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void run_0_종료와_빈_출력은_Success() {
        // when
        ProcessOutcome outcome = runner.run(context, sh("exit 0", ""));

        // then
        assertThat(outcome).isInstanceOf(Success.class);
        assertThat(outcome.output()).isEmpty();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void run_표준_에러는_출력에_섞이지_않음() {
        // when
        ProcessOutcome outcome = runner.run(context, sh("echo out; echo err >&2", ""));

        // then
        assertThat(outcome).isInstanceOf(Success.class);
        assertThat(text(outcome.output())).isEqualTo("out\n");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void run_파이프_버퍼보다_큰_입력도_멈추지_않고_전달됨() {
        // given: 1MB 입력 (파이프 버퍼 64KB 초과)
        char[] chars = new char[1024 * 1024];
        Arrays.fill(chars, 'a');
        String input = new String(chars);

        // when
        ProcessOutcome outcome = runner.run(context, ProcessCommand.of("cat", List.of(), input));

        // then
        assertThat(outcome).isInstanceOf(Success.class);
        assertThat(outcome.output()).hasSize(input.length());
    }

    // ============================================================
    // 2. Finding 보고 (non-zero + 출력)
    // ============================================================

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void run_non_zero_종료라도_출력이_있으면_오류가_아님() {
        // when
        ProcessOutcome outcome = runner.run(context, sh("cat; exit 1", "SC2086: Double quote to prevent globbing"));

        // then
        assertThat(outcome).isInstanceOf(FindingsReported.class);
        assertThat(((FindingsReported) outcome).exitCode()).isEqualTo(1);
        assertThat(outcome.isError()).isFalse();
        assertThat(text(outcome.output())).isEqualTo("SC2086: Double quote to prevent globbing");
    }

    // ============================================================
    // 3. 비정상 종료
    // ============================================================

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void run_non_zero_종료에_출력이_없으면_비정상_종료() {
        // when
        ProcessOutcome outcome = runner.run(context, sh("echo 'invalid option' >&2; exit 2", "ignored input"));

        // then
        assertThat(outcome).isInstanceOf(TerminatedAbnormally.class);
        assertThat(outcome.errorOrNull())
            .isInstanceOf(AbnormalTerminationException.class)
            .hasMessageContaining("exited with status 2 but stdout was empty")
            .hasMessageContaining("invalid option");

        AbnormalTerminationException error = (AbnormalTerminationException) outcome.errorOrNull();
        assertThat(error.getExitCode()).isEqualTo(2);
        assertThat(error.isSignalled()).isFalse();
        assertThat(error.getDiagnostic()).isEqualTo("invalid option");
        assertThat(outcome.output()).isEmpty();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void run_시그널로_종료되면_출력이_있어도_비정상_종료() {
        // when
        ProcessOutcome outcome = runner.run(context, sh("echo partial; kill -9 $$", ""));

        // then
        assertThat(outcome).isInstanceOf(TerminatedAbnormally.class);
        TerminatedAbnormally terminated = (TerminatedAbnormally) outcome;
        assertThat(terminated.signalled()).isTrue();
        assertThat(terminated.exitCode()).isEqualTo(137);
        assertThat(outcome.errorOrNull()).hasMessageContaining("was terminated");
    }

    // ============================================================
    // 4. 전송 오류
    // ============================================================

    @Test
    void run_실행_파일이_없으면_TransportError() {
        // when
        ProcessOutcome outcome = runner.run(context, ProcessCommand.of("/nonexistent/procexec-missing-tool", List.of(), "x"));

        // then
        assertThat(outcome).isInstanceOf(TransportError.class);
        assertThat(outcome.errorOrNull())
            .isInstanceOf(ProcessTransportException.class)
            .hasMessageContaining("could not start /nonexistent/procexec-missing-tool process")
            .hasCauseInstanceOf(IOException.class);
        assertThat(outcome.output()).isEmpty();
    }

    @Test
    void run_취소된_컨텍스트면_프로세스를_만들지_않음() {
        // given
        ExecutionContext cancelled = ExecutionContext.cancellable("test");
        cancelled.cancel();

        // when & then
        assertThatThrownBy(() -> runner.run(cancelled, ProcessCommand.of("cat", List.of())))
            .isInstanceOf(CancellationException.class);
    }

    @Test
    void run_null_인자는_거부됨() {
        assertThatThrownBy(() -> runner.run(null, ProcessCommand.of("cat", List.of())))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("context cannot be null");
        assertThatThrownBy(() -> runner.run(context, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("command cannot be null");
    }

    // ============================================================
    // 5. 분류 규칙 (classify)
    // ============================================================

    @Test
    void classify_POSIX에서_129_192_범위는_시그널_종료() {
        // given
        SystemProcessRunner posixRunner = new SystemProcessRunner(true);

        // when
        ProcessOutcome outcome = posixRunner.classify("tool", 143, "out".getBytes(StandardCharsets.UTF_8), "");

        // then
        assertThat(outcome).isInstanceOf(TerminatedAbnormally.class);
        assertThat(((TerminatedAbnormally) outcome).signalled()).isTrue();
    }

    @Test
    void classify_비POSIX에서는_128_초과도_일반_종료_코드() {
        // given
        SystemProcessRunner windowsRunner = new SystemProcessRunner(false);

        // when
        ProcessOutcome outcome = windowsRunner.classify("tool", 143, "out".getBytes(StandardCharsets.UTF_8), "");

        // then
        assertThat(outcome).isInstanceOf(FindingsReported.class);
    }

    @Test
    void classify_음수_종료_코드는_시그널_종료() {
        // when
        ProcessOutcome outcome = new SystemProcessRunner(false).classify("tool", -1, new byte[0], "killed");

        // then
        assertThat(outcome).isInstanceOf(TerminatedAbnormally.class);
        assertThat(((TerminatedAbnormally) outcome).signalled()).isTrue();
        assertThat(((TerminatedAbnormally) outcome).diagnostic()).isEqualTo("killed");
    }

    @Test
    void classify_128은_일반_종료_코드로_취급() {
        // when
        ProcessOutcome outcome = new SystemProcessRunner(true).classify("tool", 128, new byte[0], "");

        // then
        assertThat(outcome).isInstanceOf(TerminatedAbnormally.class);
        assertThat(((TerminatedAbnormally) outcome).signalled()).isFalse();
    }

    @Test
    void classify_POSIX에서_192_초과는_일반_종료_코드() {
        // given
        SystemProcessRunner posixRunner = new SystemProcessRunner(true);

        // when
        ProcessOutcome withOutput = posixRunner.classify("tool", 255, "out".getBytes(StandardCharsets.UTF_8), "");
        ProcessOutcome withoutOutput = posixRunner.classify("tool", 255, new byte[0], "");
        ProcessOutcome highestSignal = posixRunner.classify("tool", 192, "out".getBytes(StandardCharsets.UTF_8), "");
        posixRunner.close();

        // then
        assertThat(withOutput).isInstanceOf(FindingsReported.class);
        assertThat(((FindingsReported) withOutput).exitCode()).isEqualTo(255);
        assertThat(withoutOutput).isInstanceOf(TerminatedAbnormally.class);
        assertThat(((TerminatedAbnormally) withoutOutput).signalled()).isFalse();
        assertThat(((TerminatedAbnormally) highestSignal).signalled()).isTrue();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void run_255로_종료하며_출력이_있으면_finding_보고() {
        // when
        ProcessOutcome outcome = runner.run(context, sh("cat; exit 255", "finding"));

        // then
        assertThat(outcome).isInstanceOf(FindingsReported.class);
        assertThat(text(outcome.output())).isEqualTo("finding");
    }

    // ============================================================
    // 6. 종료 (close)
    // ============================================================

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void close_이후_출력_수집_스레드가_남지_않음() throws InterruptedException {
        // given
        Set<Thread> before = StreamThreads.alive();
        SystemProcessRunner closing = new SystemProcessRunner();
        closing.run(context, ProcessCommand.of("cat", List.of(), "x"));

        // when
        closing.close();

        // then
        assertThat(StreamThreads.awaitNoneBeyond(before)).isEmpty();
    }

    @Test
    void close_이후_run은_거부됨() {
        // given
        runner.close();

        // when & then
        assertThatThrownBy(() -> runner.run(context, ProcessCommand.of("cat", List.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("shut down");
    }
}
