package com.ryuqq.workflow.core.executor;

/**
 * 시도 한 번의 컨텍스트 (휘발성, 저장하지 않음).
 *
 * @param operationId 실행 단위 식별자 (재시도 간 동일)
 * @param operationClass 작업 클래스 (예: persistence-write)
 * @param attemptNumber 현재 시도 번호 (1부터)
 * @param lastFailureType 직전 시도의 실패 분류 (첫 시도이면 null)
 * @param nextDelayMs 직전 실패 후 적용된 대기 시간 (첫 시도이면 0)
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record RetryContext(
    String operationId,
    String operationClass,
    int attemptNumber,
    FailureType lastFailureType,
    long nextDelayMs
) {

    public RetryContext {
        if (operationId == null || operationId.isBlank()) {
            throw new IllegalArgumentException("operationId cannot be null or blank");
        }
        if (operationClass == null || operationClass.isBlank()) {
            throw new IllegalArgumentException("operationClass cannot be null or blank");
        }
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be positive (current: " + attemptNumber + ")");
        }
        if (nextDelayMs < 0) {
            throw new IllegalArgumentException("nextDelayMs must be non-negative (current: " + nextDelayMs + ")");
        }
    }

    /**
     * 첫 시도 컨텍스트 생성.
     */
    public static RetryContext first(String operationId, String operationClass) {
        return new RetryContext(operationId, operationClass, 1, null, 0);
    }

    /**
     * 다음 시도 컨텍스트 생성.
     *
     * @param failureType 방금 실패한 시도의 분류
     * @param delayMs 다음 시도 전 대기 시간
     * @return 시도 번호가 1 증가한 컨텍스트
     */
    public RetryContext next(FailureType failureType, long delayMs) {
        return new RetryContext(operationId, operationClass, attemptNumber + 1, failureType, delayMs);
    }

    public boolean isFirstAttempt() {
        return attemptNumber == 1;
    }
}
