package com.ryuqq.workflow.core.executor;

/**
 * Executor 실패 분류.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public enum ExecutionErrorKind {

    /** 작업이 영구 실패(Fail)를 반환. 재시도하지 않음. */
    FATAL,

    /** 재시도 가능한 실패가 maxAttempts까지 반복됨. */
    ATTEMPTS_EXHAUSTED,

    /** Circuit Breaker가 열려 있어 작업을 호출하지 않음. */
    CIRCUIT_OPEN,

    /** 전체 기한 초과로 남은 시도를 중단. */
    DEADLINE_EXCEEDED,

    /** 취소 신호로 새 시도를 시작하지 않음. */
    CANCELLED
}
