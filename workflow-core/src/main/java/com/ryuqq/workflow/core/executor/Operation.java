package com.ryuqq.workflow.core.executor;

import com.ryuqq.workflow.core.outcome.Outcome;

/**
 * Executor가 보호하는 멱등 작업 단위.
 *
 * <p>한 번의 호출이 한 번의 시도입니다. 결과는 {@link Outcome}으로 분류합니다:</p>
 * <ul>
 *   <li>{@code Outcome.ok(value)}: 성공</li>
 *   <li>{@code Outcome.retry(reason)}: 재시도 가능한 실패</li>
 *   <li>{@code Outcome.fail(code, message)}: 영구 실패 (재시도 금지)</li>
 * </ul>
 *
 * <p>예외를 던지면 재시도 가능한 실패로 취급됩니다.</p>
 *
 * @param <T> 결과 값 타입
 *
 * @author Workflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Operation<T> {

    /**
     * 한 번 시도.
     *
     * @param context 현재 시도 정보
     * @return 시도 결과
     * @throws Exception 인프라 오류 (재시도 가능으로 분류)
     */
    Outcome<T> attempt(RetryContext context) throws Exception;
}
