package com.ryuqq.workflow.core.protection;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureThreshold: OPEN으로 전이하는 연속 실패 수 (기본 5)</li>
 *   <li>recoveryTimeoutMs: OPEN 유지 시간 (기본 60000ms = 1분)</li>
 *   <li>successThreshold: HALF_OPEN에서 CLOSED로 가기 위한 연속 성공 수 (기본 3)</li>
 *   <li>monitoringWindowMs: 성공/실패 통계 윈도우 (기본 300000ms = 5분)</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 * @param failureThreshold 연속 실패 임계값 (1 이상)
 * @param recoveryTimeoutMs 복구 대기 시간 (밀리초, 0 이상)
 * @param successThreshold 연속 성공 임계값 (1 이상)
 * @param monitoringWindowMs 통계 윈도우 (밀리초, 양수)
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    long recoveryTimeoutMs,
    int successThreshold,
    long monitoringWindowMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=5, recoveryTimeoutMs=60000ms,
     * successThreshold=3, monitoringWindowMs=300000ms</p>
     */
    public CircuitBreakerConfig() {
        this(5, 60_000, 3, 300_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (recoveryTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "recoveryTimeoutMs must be non-negative (current: " + recoveryTimeoutMs + ")"
            );
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException(
                "successThreshold must be positive (current: " + successThreshold + ")"
            );
        }
        if (monitoringWindowMs <= 0) {
            throw new IllegalArgumentException(
                "monitoringWindowMs must be positive (current: " + monitoringWindowMs + ")"
            );
        }
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeoutMs, successThreshold, monitoringWindowMs);
    }

    public CircuitBreakerConfig withRecoveryTimeoutMs(long recoveryTimeoutMs) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeoutMs, successThreshold, monitoringWindowMs);
    }

    public CircuitBreakerConfig withSuccessThreshold(int successThreshold) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeoutMs, successThreshold, monitoringWindowMs);
    }

    public CircuitBreakerConfig withMonitoringWindowMs(long monitoringWindowMs) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeoutMs, successThreshold, monitoringWindowMs);
    }
}
