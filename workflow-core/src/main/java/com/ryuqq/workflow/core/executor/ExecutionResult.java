package com.ryuqq.workflow.core.executor;

import java.util.List;

/**
 * Executor 실행 결과.
 *
 * <ul>
 *   <li>{@link Succeeded}: 작업 성공, 결과 값과 시도 이력 포함</li>
 *   <li>{@link Failed}: 실패, {@link ExecutionError} 포함</li>
 * </ul>
 *
 * <p>Executor는 예외를 던지지 않고 항상 이 값을 반환합니다.</p>
 *
 * @param <T> 결과 값 타입
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public sealed interface ExecutionResult<T> permits ExecutionResult.Succeeded, ExecutionResult.Failed {

    List<AttemptRecord> attempts();

    default boolean isSucceeded() {
        return this instanceof Succeeded;
    }

    /**
     * 성공 결과.
     *
     * @param value 결과 값 (null 허용)
     * @param attempts 시도 이력 (마지막 항목이 성공)
     * @param <T> 결과 값 타입
     */
    record Succeeded<T>(T value, List<AttemptRecord> attempts) implements ExecutionResult<T> {

        public Succeeded {
            attempts = attempts == null ? List.of() : List.copyOf(attempts);
        }
    }

    /**
     * 실패 결과.
     *
     * @param error 실패 상세
     * @param <T> 결과 값 타입
     */
    record Failed<T>(ExecutionError error) implements ExecutionResult<T> {

        public Failed {
            if (error == null) {
                throw new IllegalArgumentException("error cannot be null");
            }
        }

        @Override
        public List<AttemptRecord> attempts() {
            return error.attempts();
        }

        public ExecutionErrorKind kind() {
            return error.kind();
        }
    }
}
