package com.ryuqq.workflow.core.executor;

import com.ryuqq.workflow.core.protection.CircuitBreakerState;

import java.util.concurrent.CompletableFuture;

/**
 * 재시도/Circuit Breaker 실행자.
 *
 * <p>부수 효과가 있는 작업을 작업 클래스의 정책에 따라 실행합니다.
 * 작업의 의미나 결과 값은 해석하지 않고 시도, 대기, 회로 상태만 관리합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>시도 전 취소 신호, 기한, Circuit Breaker 확인</li>
 *   <li>재시도 가능한 실패 시 backoff 대기 후 재시도</li>
 *   <li>영구 실패, 시도 소진 시 전체 이력을 담은 {@link ExecutionResult.Failed} 반환</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 구현체는 thread-safe해야 하며,
 * 재시도 대기는 공유 워커 스레드를 점유하지 않아야 합니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public interface ResilientExecutor {

    /**
     * 작업을 실행하고 결과를 기다림.
     *
     * @param operationClass 작업 클래스
     * @param operation 작업
     * @param <T> 결과 값 타입
     * @return 실행 결과 (예외를 던지지 않음)
     * @throws IllegalArgumentException operationClass 또는 operation이 null인 경우
     */
    default <T> ExecutionResult<T> execute(String operationClass, Operation<T> operation) {
        return execute(operationClass, operation, CancellationSignal.none());
    }

    /**
     * 취소 가능한 작업을 실행하고 결과를 기다림.
     *
     * @param operationClass 작업 클래스
     * @param operation 작업
     * @param signal 취소 신호
     * @param <T> 결과 값 타입
     * @return 실행 결과 (예외를 던지지 않음)
     */
    <T> ExecutionResult<T> execute(String operationClass, Operation<T> operation, CancellationSignal signal);

    /**
     * 작업을 비동기로 실행.
     *
     * <p>재시도 대기 중에는 어떤 스레드도 점유하지 않습니다.</p>
     *
     * @param operationClass 작업 클래스
     * @param operation 작업
     * @param signal 취소 신호
     * @param <T> 결과 값 타입
     * @return 실행 결과 Future (예외적으로 완료되지 않음)
     */
    <T> CompletableFuture<ExecutionResult<T>> executeAsync(String operationClass, Operation<T> operation,
                                                          CancellationSignal signal);

    /**
     * 작업 클래스의 Circuit Breaker를 CLOSED로 리셋 (관리 작업).
     *
     * @param operationClass 작업 클래스
     */
    void resetCircuit(String operationClass);

    /**
     * 작업 클래스의 현재 Circuit Breaker 상태.
     *
     * @param operationClass 작업 클래스
     * @return 한 번도 사용되지 않은 클래스이면 CLOSED
     */
    CircuitBreakerState circuitState(String operationClass);

    /**
     * 작업 클래스의 실행 통계.
     *
     * @param operationClass 작업 클래스
     * @return 통계 (사용된 적 없으면 모두 0)
     */
    OperationStatistics statistics(String operationClass);
}
