package com.ryuqq.procexec.core.contract;

import com.ryuqq.procexec.core.exception.ProcessExecutionException;

/**
 * 프로세스 종료 후 호출되는 완료 콜백.
 *
 * <p>프로세스 실행 결과를 해석하는 책임은 호출 측에 있습니다.
 * 콜백이 예외를 던지면 해당 작업은 실패로 기록되며, 그룹 join 결과로 전파됩니다.</p>
 *
 * <p><strong>인자 규칙:</strong></p>
 * <ul>
 *   <li>성공 또는 finding 보고: output = 표준 출력 전체, error = null</li>
 *   <li>비정상 종료 / 전송 오류: output = 빈 배열, error = non-null</li>
 * </ul>
 *
 * <p>콜백은 게이트 슬롯이 반환된 뒤에 호출되므로, 콜백이 오래 걸려도 다음 프로세스 실행을 막지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CompletionCallback {

    /**
     * 프로세스 결과 처리.
     *
     * @param output 표준 출력 바이트 (non-null)
     * @param error 프로세스 실행 오류 (없으면 null)
     * @throws Exception 호출 측이 결과를 실패로 판단한 경우
     */
    void onComplete(byte[] output, ProcessExecutionException error) throws Exception;
}
