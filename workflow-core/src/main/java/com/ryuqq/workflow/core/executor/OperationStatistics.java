package com.ryuqq.workflow.core.executor;

import com.ryuqq.workflow.core.protection.CircuitBreakerState;

/**
 * 작업 클래스별 실행 통계.
 *
 * @param operationClass 작업 클래스
 * @param executions 실행 요청 수
 * @param successes 성공으로 끝난 실행 수
 * @param failures 실패로 끝난 실행 수 (CIRCUIT_OPEN 포함)
 * @param attempts 실제로 작업을 호출한 총 시도 수
 * @param circuitState 현재 Circuit Breaker 상태
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record OperationStatistics(
    String operationClass,
    long executions,
    long successes,
    long failures,
    long attempts,
    CircuitBreakerState circuitState
) {

    /**
     * 성공률 (0.0 ~ 1.0).
     *
     * @return 완료된 실행이 없으면 0.0
     */
    public double successRate() {
        long finished = successes + failures;
        return finished == 0 ? 0.0 : (double) successes / finished;
    }
}
