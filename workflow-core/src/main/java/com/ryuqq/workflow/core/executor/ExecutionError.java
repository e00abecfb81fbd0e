package com.ryuqq.workflow.core.executor;

import java.util.List;

/**
 * Executor 실패 상세.
 *
 * @param kind 실패 분류
 * @param operationClass 작업 클래스
 * @param message 사람이 읽을 수 있는 사유
 * @param errorCode FATAL인 경우 작업이 반환한 오류 코드 (그 외 null)
 * @param attempts 전체 시도 이력 (CIRCUIT_OPEN으로 첫 시도 전에 차단되면 빈 목록)
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record ExecutionError(
    ExecutionErrorKind kind,
    String operationClass,
    String message,
    String errorCode,
    List<AttemptRecord> attempts
) {

    public ExecutionError {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (operationClass == null || operationClass.isBlank()) {
            throw new IllegalArgumentException("operationClass cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public int attemptCount() {
        return attempts.size();
    }
}
