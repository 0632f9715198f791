package com.ryuqq.procexec.application.manager;

import com.ryuqq.procexec.core.contract.CompletionCallback;
import com.ryuqq.procexec.core.contract.ProcessCommand;
import com.ryuqq.procexec.core.contract.ProcessTask;
import com.ryuqq.procexec.core.exception.ProcessGroupException;

import java.util.List;
import java.util.Optional;

/**
 * 동시 실행 수가 제한된 외부 프로세스 매니저.
 *
 * <p>작업을 제출받아 게이트 슬롯을 얻은 뒤 비동기로 실행하고,
 * 프로세스 종료 시 슬롯을 반환하고 완료 콜백을 호출합니다.
 * {@link #join()}은 모든 작업의 콜백이 반환될 때까지 대기한 뒤 첫 번째 오류를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ProcessManager manager = new ConcurrentProcessManager(4);
 *
 * for (Path script : scripts) {
 *     manager.submit("shellcheck", List.of("-f", "json", "-"), Files.readString(script),
 *         (stdout, error) -&gt; {
 *             if (error != null) {
 *                 throw error;
 *             }
 *             parseFindings(script, stdout);
 *         });
 * }
 *
 * Optional&lt;Throwable&gt; firstError = manager.join();
 * </pre>
 *
 * <p><strong>순서 보장:</strong> 작업 간 완료 순서와 콜백 순서는 보장하지 않습니다.
 * join은 모든 submit의 콜백이 끝나기 전에는 반환하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ProcessManager {

    /**
     * 작업 제출.
     *
     * <p>게이트 슬롯을 얻을 때까지만 블로킹되며, 이후 실행은 비동기로 진행됩니다.</p>
     *
     * @param task 실행할 작업
     * @return 작업 핸들
     * @throws IllegalArgumentException task가 null인 경우
     * @throws java.util.concurrent.CancellationException 실행 컨텍스트가 취소된 경우
     * @throws IllegalStateException 슬롯 대기 중 인터럽트되었거나 매니저가 종료된 경우
     */
    TaskHandle submit(ProcessTask task);

    /**
     * 작업 제출 (개별 인자).
     *
     * @param executable 실행 파일 이름 또는 경로
     * @param arguments 인자 목록
     * @param input 표준 입력 문자열 (UTF-8)
     * @param onComplete 완료 콜백
     * @return 작업 핸들
     */
    default TaskHandle submit(String executable, List<String> arguments, String input, CompletionCallback onComplete) {
        return submit(ProcessTask.of(ProcessCommand.of(executable, arguments, input), onComplete));
    }

    /**
     * 모든 작업 완료 대기.
     *
     * <p>먼저 실패한 작업이 있어도 나머지 작업을 취소하지 않고 모두 끝날 때까지 기다립니다.</p>
     *
     * @return 첫 번째 오류 (모두 성공하면 empty)
     */
    Optional<Throwable> join();

    /**
     * 모든 작업 완료 대기 후 오류가 있으면 예외로 던짐.
     *
     * @throws ProcessGroupException 실패한 작업이 있는 경우 (cause = 첫 번째 오류)
     */
    default void joinOrThrow() {
        Optional<Throwable> firstError = join();
        if (firstError.isPresent()) {
            throw new ProcessGroupException(firstError.get());
        }
    }
}
